package com.seoanalyzer.core.model;

import java.util.Objects;

/** 워커 1회 호출 결과 (불변) */
public final class WorkerResult {
    private final String workerName;
    private final boolean success;
    private final String output;     // 실패 시 ""
    private final long durationMs;   // >= 0
    private final String error;      // 성공 시 null

    private WorkerResult(String workerName, boolean success, String output, long durationMs, String error) {
        this.workerName = Objects.requireNonNull(workerName, "workerName");
        this.success = success;
        this.output = (output == null ? "" : output);
        this.durationMs = Math.max(0L, durationMs);
        this.error = error;
    }

    public static WorkerResult success(String workerName, String output, long durationMs) {
        return new WorkerResult(workerName, true, output, durationMs, null);
    }

    public static WorkerResult failure(String workerName, String error, long durationMs) {
        return new WorkerResult(workerName, false, "", durationMs,
                (error == null || error.isBlank()) ? "unknown error" : error);
    }

    public String getWorkerName() { return workerName; }
    public boolean isSuccess() { return success; }
    public String getOutput() { return output; }
    public long getDurationMs() { return durationMs; }
    public String getError() { return error; }

    @Override public String toString() {
        return "WorkerResult{" + workerName + (success ? " ok" : " failed: " + error) + ", " + durationMs + "ms}";
    }
}
