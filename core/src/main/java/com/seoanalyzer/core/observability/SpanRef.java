package com.seoanalyzer.core.observability;

import java.util.Objects;

/** 자식 span을 만들 때 넘기는 부모 좌표 (traceId, spanId) */
public record SpanRef(String traceId, String spanId) {
    public SpanRef {
        Objects.requireNonNull(traceId, "traceId");
    }

    /** 부모 span 없이 trace 루트에 붙일 때 */
    public static SpanRef root(String traceId) {
        return new SpanRef(traceId, null);
    }
}
