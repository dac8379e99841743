package com.seoanalyzer.core.model;

import java.util.Locale;

/**
 * 분석 잡 상태.
 *  PENDING → ANALYZING → {COMPLETED | PARTIAL | FAILED}
 * 종결 상태에 도달하면 더 이상 바뀌지 않는다.
 */
public enum JobStatus {
    PENDING,
    ANALYZING,
    COMPLETED,
    PARTIAL,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIAL || this == FAILED;
    }

    /** 한 단계 전이만 허용. 같은 상태 재호출은 호출자(RequestTracker)가 따로 처리 */
    public boolean canAdvanceTo(JobStatus next) {
        if (next == null) return false;
        return switch (this) {
            case PENDING -> next == ANALYZING;
            case ANALYZING -> next.isTerminal();
            case COMPLETED, PARTIAL, FAILED -> false;
        };
    }

    /** 저장소/로그용 소문자 표기 */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromWire(String s) {
        if (s == null || s.isBlank()) return PENDING;
        return JobStatus.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
