package com.seoanalyzer.core.util;

import com.seoanalyzer.core.model.WorkerState;

@FunctionalInterface
public interface WorkerProgressListener {
    /**
     * @param jobId      잡 id
     * @param worker     워커 이름 (report_agent 포함)
     * @param state      RUNNING(디스패치됨) | COMPLETED | FAILED
     * @param durationMs 종료 상태일 때만 값이 있음 (그 외 null)
     */
    void onWorker(String jobId, String worker, WorkerState state, Long durationMs);

    WorkerProgressListener NONE = (j, w, s, d) -> {};
}
