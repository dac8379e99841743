package com.seoanalyzer.core.orchestrator;

import com.seoanalyzer.core.api.AnalysisCapability;
import com.seoanalyzer.core.api.ArtifactGenerator;
import com.seoanalyzer.core.job.RequestTracker;
import com.seoanalyzer.core.model.AnalysisJob;
import com.seoanalyzer.core.model.AnalysisOutcome;
import com.seoanalyzer.core.model.JobStatus;
import com.seoanalyzer.core.model.WorkerResult;
import com.seoanalyzer.core.model.WorkerSpec;
import com.seoanalyzer.core.observability.ObservabilityRecorder;
import com.seoanalyzer.core.observability.SpanRef;
import com.seoanalyzer.core.observability.TraceContext;
import com.seoanalyzer.core.score.ReportStats;
import com.seoanalyzer.core.score.ScoreAggregator;
import com.seoanalyzer.core.session.SessionRegistry;
import com.seoanalyzer.core.store.AnalysisStoreException;
import com.seoanalyzer.core.util.StructuredLog;
import com.seoanalyzer.core.util.UrlUtils;
import com.seoanalyzer.core.util.WorkerProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 분석 파이프라인 오케스트레이터:
 *  - create → ANALYZING → 병렬 분석(fan-out/fan-in) → 리포트 합성 → 점수 → 종결 상태
 *  - 워커/합성 실패는 잡 상태로만 반영 (COMPLETED / PARTIAL)
 *  - 그 밖의 예외는 FAILED + 메시지 그대로
 *  - analyze() 는 인자 오류 외에는 던지지 않는다. 성공 정도는 status 로만 전달
 *  - 실행 1회 = trace 1개 (열고 반드시 닫음)
 */
public final class AnalysisOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisOrchestrator.class);
    private static final StructuredLog SLOG = StructuredLog.get(AnalysisOrchestrator.class);

    static final String REPORT_FAILED_PLACEHOLDER = "Report generation failed. See individual agent results.";

    private final RequestTracker tracker;
    private final ParallelCoordinator coordinator;
    private final ReportSynthesizer synthesizer;
    private final ScoreAggregator scores;
    private final ObservabilityRecorder recorder;
    private final ArtifactGenerator artifacts;
    private final List<WorkerSpec> workers;

    /** 기본 조립: 워커 5종 + report_agent */
    public AnalysisOrchestrator(RequestTracker tracker,
                                AnalysisCapability capability,
                                SessionRegistry sessions,
                                ObservabilityRecorder recorder,
                                ArtifactGenerator artifacts) {
        this(tracker,
                new ParallelCoordinator(capability, sessions, recorder),
                new ReportSynthesizer(capability, sessions, recorder),
                new ScoreAggregator(),
                recorder,
                artifacts,
                SeoWorkers.analysisWorkers());
    }

    /** DI/테스트용 */
    public AnalysisOrchestrator(RequestTracker tracker,
                                ParallelCoordinator coordinator,
                                ReportSynthesizer synthesizer,
                                ScoreAggregator scores,
                                ObservabilityRecorder recorder,
                                ArtifactGenerator artifacts,
                                List<WorkerSpec> workers) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
        this.scores = Objects.requireNonNull(scores, "scores");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.artifacts = (artifacts != null) ? artifacts : ArtifactGenerator.NONE;
        this.workers = List.copyOf(Objects.requireNonNull(workers, "workers"));
        if (this.workers.isEmpty()) throw new IllegalArgumentException("workers must not be empty");
    }

    /* =========================
       실행 API
       ========================= */

    public AnalysisOutcome analyze(String target) {
        return analyze(target, WorkerProgressListener.NONE);
    }

    /**
     * 잡 생성부터 종결까지 한 번에 실행.
     * @throws IllegalArgumentException target 이 null/공백 (잡 생성 전)
     */
    public AnalysisOutcome analyze(String target, WorkerProgressListener listener) {
        final String url = UrlUtils.normalizeTarget(target);
        final AnalysisJob job;
        try {
            job = tracker.create(url);
        } catch (AnalysisStoreException e) {
            return failedBeforeJob(url, e);
        }
        return execute(job, listener);
    }

    /** 이미 만들어진(PENDING) 잡을 실행한다. 잡 큐(AnalysisJobService)가 사용 */
    public AnalysisOutcome execute(AnalysisJob job, WorkerProgressListener listener) {
        Objects.requireNonNull(job, "job");
        final WorkerProgressListener pl = (listener != null) ? listener : WorkerProgressListener.NONE;
        final String jobId = job.getId();
        final String url = job.getTarget();
        final long t0 = System.nanoTime();
        final String traceId = recorder.startAnalysis(url, jobId);

        Run run = new Run();
        try (TraceContext.Scope ignored = TraceContext.bind(traceId)) {
            SLOG.info("analysis-start", "jobId", jobId, "target", url, "workers", workers.size());
            try {
                tracker.transition(jobId, JobStatus.ANALYZING);
                recorder.span(SpanRef.root(traceId), "seo_analysis",
                        Map.of("jobId", jobId, "target", url), root -> {
                            runStages(run, jobId, url, root.ref(), pl);
                            return null;
                        });

                run.totalMs = elapsedMs(t0);
                AnalysisJob done = tracker.transition(jobId, run.status,
                        resultSummary(run), run.report, null, run.overallScore);
                run.status = done.getStatus();
            } catch (Exception e) {
                PipelineFatalException fatal = (e instanceof PipelineFatalException p)
                        ? p : new PipelineFatalException(WorkerInvocationException.messageOf(e), e);
                run.status = JobStatus.FAILED;
                run.error = fatal.getMessage();
                run.overallScore = null;
                run.artifact = null;
                LOG.error("[{}] Analysis failed: {}", jobId, run.error, e);
                SLOG.error("analysis-failed", fatal, "jobId", jobId);
                tracker.fail(jobId, run.error);
            }

            run.totalMs = elapsedMs(t0);
            LOG.info("[{}] Analysis complete in {}ms. Status: {}, Score: {}",
                    jobId, run.totalMs, run.status, run.overallScore == null ? 0 : run.overallScore);
            SLOG.info("analysis-done", "jobId", jobId, "status", run.status.wireName(),
                    "score", run.overallScore, "durationMs", run.totalMs);
        } finally {
            recorder.endAnalysis(traceId, elapsedMs(t0), run.status.wireName());
        }
        return toOutcome(jobId, url, run);
    }

    /* =========================
       단계
       ========================= */

    private void runStages(Run run, String jobId, String url, SpanRef root, WorkerProgressListener pl) throws Exception {
        // 1) 병렬 분석
        recorder.logAction(jobId, "orchestrator", "parallel_analysis_start", Map.of("url", url), null);
        run.results = recorder.span(root, "parallel_analysis", Map.of("workers", workers.size()),
                batch -> coordinator.runAll(url, jobId, workers, batch.ref(), pl));

        // 2) 합성 (배치가 모두 끝난 뒤 한 번)
        recorder.logAction(jobId, "orchestrator", "report_generation_start", Map.of(), null);
        WorkerResult report = synthesizer.generate(url, run.results, jobId, root, pl);

        boolean anySuccess = run.results.values().stream().anyMatch(WorkerResult::isSuccess);
        if (report.isSuccess()) {
            run.status = JobStatus.COMPLETED;
            run.report = report.getOutput();
        } else {
            run.status = JobStatus.PARTIAL;
            run.report = REPORT_FAILED_PLACEHOLDER;
        }
        run.overallScore = anySuccess ? scores.aggregateOverall(run.results.values()) : null;
        run.categoryScores = scores.categoryScores(run.report);
        run.reportStats = scores.reportStats(run.report);

        // 3) 산출물 (합성 성공 시에만, 실패해도 잡 결과는 유지)
        if (report.isSuccess()) {
            run.artifact = renderArtifact(jobId, url, run);
        }
    }

    private Path renderArtifact(String jobId, String url, Run run) {
        int score = run.overallScore == null ? 0 : run.overallScore;
        try {
            Optional<Path> p = artifacts.render(run.report, url, jobId, score);
            if (p.isPresent()) {
                LOG.info("[{}] Report artifact generated: {}", jobId, p.get());
                return p.get();
            }
            LOG.warn("[{}] Report artifact was not generated", jobId);
            return null;
        } catch (RuntimeException e) {
            LOG.warn("[{}] Report artifact failed: {}", jobId, e.toString());
            SLOG.error("artifact-failed", e, "jobId", jobId);
            return null;
        }
    }

    /** 저장소 장애로 잡을 만들지 못한 경우 (jobId 없음) */
    private AnalysisOutcome failedBeforeJob(String url, AnalysisStoreException e) {
        long t0 = System.nanoTime();
        String traceId = recorder.startAnalysis(url, "unassigned");
        String msg = WorkerInvocationException.messageOf(e);
        try (TraceContext.Scope ignored = TraceContext.bind(traceId)) {
            LOG.error("Could not create analysis request for {}: {}", url, msg, e);
            SLOG.error("analysis-failed", new PipelineFatalException(msg, e), "target", url);
        } finally {
            recorder.endAnalysis(traceId, elapsedMs(t0), JobStatus.FAILED.wireName());
        }
        return AnalysisOutcome.builder()
                .target(url)
                .status(JobStatus.FAILED)
                .errorMessage(msg)
                .totalDurationMs(elapsedMs(t0))
                .build();
    }

    /* =========================
       헬퍼
       ========================= */

    private static Map<String, Object> resultSummary(Run run) {
        Map<String, Object> agents = new LinkedHashMap<>();
        run.results.forEach((name, r) -> {
            Map<String, Object> one = new LinkedHashMap<>();
            one.put("success", r.isSuccess());
            one.put("durationMs", r.getDurationMs());
            one.put("error", r.getError());
            agents.put(name, one);
        });
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("agentResults", agents);
        summary.put("overallScore", run.overallScore == null ? 0 : run.overallScore);
        summary.put("categoryScores", run.categoryScores);
        summary.put("totalDurationMs", run.totalMs);
        if (run.artifact != null) summary.put("artifactPath", run.artifact.toString());
        return summary;
    }

    private static AnalysisOutcome toOutcome(String jobId, String url, Run run) {
        return AnalysisOutcome.builder()
                .jobId(jobId)
                .target(url)
                .status(run.status)
                .workerResults(run.results)
                .finalReport(run.report)
                .overallScore(run.overallScore == null ? 0 : run.overallScore)
                .categoryScores(run.categoryScores)
                .reportStats(run.reportStats)
                .artifactPath(run.artifact)
                .totalDurationMs(run.totalMs)
                .errorMessage(run.error)
                .build();
    }

    private static long elapsedMs(long t0) {
        return Math.max(0L, (System.nanoTime() - t0) / 1_000_000);
    }

    /** 실행 1회 동안의 가변 상태 (오케스트레이터 스레드 전용) */
    private static final class Run {
        JobStatus status = JobStatus.ANALYZING;
        Map<String, WorkerResult> results = Map.of();
        String report;
        Integer overallScore;
        Map<String, Integer> categoryScores = Map.of();
        ReportStats reportStats;
        Path artifact;
        long totalMs;
        String error;
    }
}
