package com.seoanalyzer.core.observability;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** 한 작업 구간. 닫힌 뒤에는 상태/소요시간이 고정된다. */
public final class Span {

    public enum Status { IN_PROGRESS, COMPLETED, ERROR }

    private final String name;
    private final String traceId;
    private final String spanId;
    private final String parentSpanId;
    private final Instant startTime;
    private final long startNanos;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    private Instant endTime;
    private Long durationMs;
    private Status status = Status.IN_PROGRESS;

    Span(String name, String traceId, String spanId, String parentSpanId, Map<String, Object> attributes) {
        this.name = name;
        this.traceId = traceId;
        this.spanId = spanId;
        this.parentSpanId = parentSpanId;
        this.startTime = Instant.now();
        this.startNanos = System.nanoTime();
        if (attributes != null) this.attributes.putAll(attributes);
    }

    synchronized void end(Status finalStatus) {
        if (status != Status.IN_PROGRESS) return;
        this.endTime = Instant.now();
        this.durationMs = Math.max(0L, (System.nanoTime() - startNanos) / 1_000_000);
        this.status = finalStatus;
    }

    public synchronized Span setAttribute(String key, Object value) {
        attributes.put(key, value);
        return this;
    }

    public SpanRef ref() { return new SpanRef(traceId, spanId); }

    public String getName() { return name; }
    public String getTraceId() { return traceId; }
    public String getSpanId() { return spanId; }
    public String getParentSpanId() { return parentSpanId; }
    public Instant getStartTime() { return startTime; }
    public synchronized Instant getEndTime() { return endTime; }
    public synchronized Long getDurationMs() { return durationMs; }
    public synchronized Status getStatus() { return status; }
    public synchronized Map<String, Object> getAttributes() { return Collections.unmodifiableMap(new LinkedHashMap<>(attributes)); }

    @Override public synchronized String toString() {
        return "Span{" + name + ", trace=" + traceId + ", id=" + spanId +
                ", parent=" + parentSpanId + ", status=" + status + ", durationMs=" + durationMs + '}';
    }
}
