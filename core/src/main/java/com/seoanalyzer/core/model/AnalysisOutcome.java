package com.seoanalyzer.core.model;

import com.seoanalyzer.core.score.ReportStats;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 최상위 analyze() 호출의 결과 레코드.
 * 성공 정도는 status 필드로만 전달된다 (예외를 던지지 않음).
 */
public final class AnalysisOutcome {
    private final String jobId;
    private final String target;
    private final JobStatus status;
    private final Map<String, WorkerResult> workerResults;
    private final String finalReport;
    private final int overallScore;
    private final Map<String, Integer> categoryScores;
    private final ReportStats reportStats;
    private final Path artifactPath;
    private final long totalDurationMs;
    private final String errorMessage;

    private AnalysisOutcome(Builder b) {
        this.jobId = b.jobId;
        this.target = b.target;
        this.status = b.status;
        this.workerResults = Collections.unmodifiableMap(new LinkedHashMap<>(b.workerResults));
        this.finalReport = b.finalReport;
        this.overallScore = b.overallScore;
        this.categoryScores = Collections.unmodifiableMap(new LinkedHashMap<>(b.categoryScores));
        this.reportStats = b.reportStats;
        this.artifactPath = b.artifactPath;
        this.totalDurationMs = Math.max(0L, b.totalDurationMs);
        this.errorMessage = b.errorMessage;
    }

    public String getJobId() { return jobId; }
    public String getTarget() { return target; }
    public JobStatus getStatus() { return status; }
    public Map<String, WorkerResult> getWorkerResults() { return workerResults; }
    public String getFinalReport() { return finalReport; }
    public int getOverallScore() { return overallScore; }
    public Map<String, Integer> getCategoryScores() { return categoryScores; }
    public ReportStats getReportStats() { return reportStats; }
    public Optional<Path> getArtifactPath() { return Optional.ofNullable(artifactPath); }
    public long getTotalDurationMs() { return totalDurationMs; }
    public String getErrorMessage() { return errorMessage; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String jobId;
        private String target;
        private JobStatus status = JobStatus.PENDING;
        private Map<String, WorkerResult> workerResults = Map.of();
        private String finalReport;
        private int overallScore;
        private Map<String, Integer> categoryScores = Map.of();
        private ReportStats reportStats;
        private Path artifactPath;
        private long totalDurationMs;
        private String errorMessage;

        public Builder jobId(String jobId) { this.jobId = jobId; return this; }
        public Builder target(String target) { this.target = target; return this; }
        public Builder status(JobStatus status) { this.status = status; return this; }
        public Builder workerResults(Map<String, WorkerResult> r) { this.workerResults = (r == null ? Map.of() : r); return this; }
        public Builder finalReport(String finalReport) { this.finalReport = finalReport; return this; }
        public Builder overallScore(int overallScore) { this.overallScore = overallScore; return this; }
        public Builder categoryScores(Map<String, Integer> s) { this.categoryScores = (s == null ? Map.of() : s); return this; }
        public Builder reportStats(ReportStats reportStats) { this.reportStats = reportStats; return this; }
        public Builder artifactPath(Path artifactPath) { this.artifactPath = artifactPath; return this; }
        public Builder totalDurationMs(long totalDurationMs) { this.totalDurationMs = totalDurationMs; return this; }
        public Builder errorMessage(String errorMessage) { this.errorMessage = errorMessage; return this; }

        public AnalysisOutcome build() {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(status, "status");
            return new AnalysisOutcome(this);
        }
    }
}
