package com.seoanalyzer.core.observability;

import java.time.Instant;
import java.util.Map;

/** 단일 측정값 (counter는 누적값, histogram은 관측값) */
public record Metric(String name, double value, String unit, Instant timestamp, Map<String, String> labels) {}
