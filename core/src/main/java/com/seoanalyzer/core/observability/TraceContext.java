package com.seoanalyzer.core.observability;

import java.util.Optional;

/**
 * 현재 스레드에 묶인 traceId. StructuredLog가 읽어 로그 라인에 붙인다.
 * 워커 스레드는 bind()로 호출 스레드의 traceId를 이어받는다.
 */
public final class TraceContext {
    private static final ThreadLocal<String> CURRENT = new ThreadLocal<>();

    private TraceContext() {}

    public static Optional<String> currentTraceId() {
        return Optional.ofNullable(CURRENT.get());
    }

    /** try-with-resources 로 사용. 닫으면 이전 값 복원 */
    public static Scope bind(String traceId) {
        String previous = CURRENT.get();
        if (traceId == null) CURRENT.remove(); else CURRENT.set(traceId);
        return new Scope(previous);
    }

    public static final class Scope implements AutoCloseable {
        private final String previous;
        private boolean closed;

        private Scope(String previous) { this.previous = previous; }

        @Override public void close() {
            if (closed) return;
            closed = true;
            if (previous == null) CURRENT.remove(); else CURRENT.set(previous);
        }
    }
}
