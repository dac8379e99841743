package com.seoanalyzer.core.store;

import com.seoanalyzer.core.api.AnalysisStore;
import com.seoanalyzer.core.model.ActionLogEntry;
import com.seoanalyzer.core.model.AnalysisJob;
import com.seoanalyzer.core.model.JobStatus;
import com.seoanalyzer.core.model.JobSummary;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/** 프로세스 수명 동안만 유지되는 저장소 (테스트/임시 실행용) */
public final class InMemoryAnalysisStore implements AnalysisStore {

    private final Map<String, AnalysisJob> jobs = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> summaries = new ConcurrentHashMap<>();
    private final List<ActionLogEntry> actions = new CopyOnWriteArrayList<>();

    @Override
    public AnalysisJob createJob(String target) {
        Objects.requireNonNull(target, "target");
        while (true) {
            AnalysisJob job = AnalysisJob.builder().id(JobIds.next()).target(target).status(JobStatus.PENDING).build();
            // id 충돌 시 다른 id 로 재시도 (확인과 등록이 한 번에)
            if (jobs.putIfAbsent(job.getId(), job) == null) return job;
        }
    }

    @Override
    public AnalysisJob updateStatus(String jobId, JobStatus status, Map<String, Object> resultSummary,
                                    String report, String error, Integer overallScore) {
        Objects.requireNonNull(status, "status");
        AnalysisJob updated = jobs.computeIfPresent(jobId, (id, cur) -> {
            AnalysisJob.Builder b = cur.toBuilder().status(status);
            if (status.isTerminal()) b.completedAt(Instant.now());
            if (report != null) b.finalReport(report);
            if (error != null) b.errorMessage(error);
            if (overallScore != null) b.overallScore(overallScore);
            return b.build();
        });
        if (updated == null) throw new AnalysisStoreException("Unknown job: " + jobId);
        if (resultSummary != null) summaries.put(jobId, Map.copyOf(resultSummary));
        return updated;
    }

    @Override
    public void appendLog(String jobId, String worker, String action, Map<String, Object> detail, Long durationMs) {
        actions.add(new ActionLogEntry(jobId, worker, action, detail, durationMs, Instant.now()));
    }

    @Override
    public List<JobSummary> listJobs(int limit) {
        return jobs.values().stream()
                .sorted(Comparator.comparing(AnalysisJob::getCreatedAt).reversed())
                .limit(Math.max(0, limit))
                .map(JobSummary::of)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<AnalysisJob> findJob(String jobId) {
        return Optional.ofNullable(jobId == null ? null : jobs.get(jobId));
    }

    @Override
    public List<ActionLogEntry> logsFor(String jobId) {
        List<ActionLogEntry> out = new ArrayList<>();
        for (ActionLogEntry e : actions) if (Objects.equals(e.jobId(), jobId)) out.add(e);
        return out;
    }

    /** 테스트용: 마지막으로 저장된 결과 요약 */
    public Optional<Map<String, Object>> resultSummaryOf(String jobId) {
        return Optional.ofNullable(summaries.get(jobId));
    }
}
