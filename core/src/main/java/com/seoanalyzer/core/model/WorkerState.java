package com.seoanalyzer.core.model;

import java.util.Locale;

/** 진행률 조회에서 보이는 워커 상태 */
public enum WorkerState {
    PENDING, RUNNING, COMPLETED, FAILED;

    public String wireName() { return name().toLowerCase(Locale.ROOT); }
}
