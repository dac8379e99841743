package com.seoanalyzer.core.model;

import java.util.List;

/**
 * 외부 폴링 API용 읽기 전용 뷰.
 * @param currentWorker 실행 중인 첫 워커 이름, 없으면 null
 */
public record JobProgress(String jobId, JobStatus status, String currentWorker, List<WorkerProgress> perWorkerStatus) {

    public JobProgress {
        perWorkerStatus = (perWorkerStatus == null ? List.of() : List.copyOf(perWorkerStatus));
    }

    /** @param durationMs 결과가 나오기 전이면 null */
    public record WorkerProgress(String name, WorkerState status, Long durationMs) {}
}
