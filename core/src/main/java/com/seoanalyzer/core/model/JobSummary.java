package com.seoanalyzer.core.model;

import java.time.Instant;

/** 이력 조회용 요약 행 */
public record JobSummary(String id, String target, JobStatus status, Instant createdAt, Instant completedAt) {

    public static JobSummary of(AnalysisJob job) {
        return new JobSummary(job.getId(), job.getTarget(), job.getStatus(), job.getCreatedAt(), job.getCompletedAt());
    }
}
