package com.seoanalyzer.core.observability;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** metrics 요약 + 최근 trace span 묶음 (CLI `metrics`가 JSON으로 출력) */
public record ObservabilitySnapshot(Map<String, Double> counters,
                                    Map<String, MetricsCollector.HistogramSummary> histograms,
                                    List<Span> recentTraces,
                                    long tracesOpened,
                                    long tracesClosed,
                                    Instant timestamp) {}
