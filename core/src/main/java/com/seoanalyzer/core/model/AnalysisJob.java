package com.seoanalyzer.core.model;

import java.time.Instant;
import java.util.Objects;

/** 잡 레코드의 불변 스냅샷. 상태 변경은 toBuilder()로 새 인스턴스를 만든다. */
public final class AnalysisJob {
    private final String id;
    private final String target;
    private final JobStatus status;
    private final Instant createdAt;
    private final Instant completedAt;   // 종결 시에만
    private final int overallScore;      // 0..100
    private final String finalReport;    // nullable
    private final String errorMessage;   // nullable

    private AnalysisJob(Builder b) {
        this.id = b.id;
        this.target = b.target;
        this.status = b.status;
        this.createdAt = (b.createdAt == null ? Instant.now() : b.createdAt);
        this.completedAt = b.completedAt;
        this.overallScore = Math.max(0, Math.min(100, b.overallScore));
        this.finalReport = b.finalReport;
        this.errorMessage = b.errorMessage;
    }

    public String getId() { return id; }
    public String getTarget() { return target; }
    public JobStatus getStatus() { return status; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getCompletedAt() { return completedAt; }
    public int getOverallScore() { return overallScore; }
    public String getFinalReport() { return finalReport; }
    public String getErrorMessage() { return errorMessage; }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .target(target)
                .status(status)
                .createdAt(createdAt)
                .completedAt(completedAt)
                .overallScore(overallScore)
                .finalReport(finalReport)
                .errorMessage(errorMessage);
    }

    @Override public String toString() {
        return "AnalysisJob{" + id + " " + status + " target=" + target + " score=" + overallScore + "}";
    }

    public static final class Builder {
        private String id;
        private String target;
        private JobStatus status = JobStatus.PENDING;
        private Instant createdAt;
        private Instant completedAt;
        private int overallScore;
        private String finalReport;
        private String errorMessage;

        public Builder id(String id) { this.id = id; return this; }
        public Builder target(String target) { this.target = target; return this; }
        public Builder status(JobStatus status) { this.status = status; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder completedAt(Instant completedAt) { this.completedAt = completedAt; return this; }
        public Builder overallScore(int overallScore) { this.overallScore = overallScore; return this; }
        public Builder finalReport(String finalReport) { this.finalReport = finalReport; return this; }
        public Builder errorMessage(String errorMessage) { this.errorMessage = errorMessage; return this; }

        public AnalysisJob build() {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(status, "status");
            return new AnalysisJob(this);
        }
    }
}
