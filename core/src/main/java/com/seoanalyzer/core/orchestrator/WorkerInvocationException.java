package com.seoanalyzer.core.orchestrator;

/** 분석 워커 1개의 capability 호출 실패. 해당 워커만 실패로 기록되고 배치는 계속된다. */
public class WorkerInvocationException extends RuntimeException {
    private final String workerName;

    public WorkerInvocationException(String workerName, Throwable cause) {
        super(messageOf(cause), cause);
        this.workerName = workerName;
    }

    public String getWorkerName() { return workerName; }

    static String messageOf(Throwable t) {
        if (t == null) return "unknown error";
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }
}
