package com.seoanalyzer.core.observability;

import com.seoanalyzer.core.api.AnalysisStore;
import com.seoanalyzer.core.model.ActionLogEntry;
import com.seoanalyzer.core.model.JobSummary;
import com.seoanalyzer.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * span 트리, counter/histogram, 잡별 액션 로그를 한 곳에서 기록한다.
 *  - span/metric은 인메모리(진단용)
 *  - 액션 로그는 AnalysisStore 로 위임되어 재시작 후에도 남는다
 *  - span 안에서 난 예외는 span을 ERROR로 닫고 호출자에게 그대로 다시 던진다
 */
public final class ObservabilityRecorder {

    private static final Logger LOG = LoggerFactory.getLogger(ObservabilityRecorder.class);
    private static final StructuredLog SLOG = StructuredLog.get(ObservabilityRecorder.class);

    public static final String ANALYSIS_STARTS = "analysis_starts";
    public static final String ANALYSIS_COMPLETIONS = "analysis_completions";
    public static final String ANALYSIS_DURATION = "analysis_duration";
    public static final String AGENT_STARTS = "agent_starts";
    public static final String AGENT_COMPLETIONS = "agent_completions";
    public static final String AGENT_DURATION = "agent_duration";
    public static final String PARALLEL_BATCH_DURATION = "parallel_batch_duration";

    static final String ACTION_AGENT_DONE = "analysis_complete";
    static final String ACTION_AGENT_ERROR = "analysis_error";

    private static final int RECENT_TRACES = 10;

    private final Tracer tracer;
    private final MetricsCollector metrics;
    private final AnalysisStore actionLog;

    public ObservabilityRecorder(AnalysisStore actionLog) {
        this(new Tracer(), new MetricsCollector(), actionLog);
    }

    public ObservabilityRecorder(Tracer tracer, MetricsCollector metrics, AnalysisStore actionLog) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.actionLog = Objects.requireNonNull(actionLog, "actionLog");
    }

    // ---------------- analysis (trace 단위) ----------------

    /** trace 하나를 열고 시작 카운터를 올린다. 반환값은 endAnalysis 에 그대로 넘긴다. */
    public String startAnalysis(String target, String label) {
        String traceId = tracer.startTrace("seo_analysis_" + label);
        metrics.counter(ANALYSIS_STARTS, Map.of());
        try (TraceContext.Scope ignored = TraceContext.bind(traceId)) {
            LOG.info("Starting SEO analysis for {}", target);
            SLOG.info("trace-start", "label", label);
        }
        return traceId;
    }

    public void endAnalysis(String traceId, long totalDurationMs, String status) {
        metrics.counter(ANALYSIS_COMPLETIONS, Map.of("status", status));
        metrics.histogram(ANALYSIS_DURATION, totalDurationMs, Map.of());
        try (TraceContext.Scope ignored = TraceContext.bind(traceId)) {
            LOG.info("Analysis complete in {}ms (status: {})", totalDurationMs, status);
            SLOG.info("trace-end", "status", status, "durationMs", totalDurationMs);
        }
        tracer.endTrace(traceId);
    }

    // ---------------- worker ----------------

    public void agentStart(String agent, String target, String jobId) {
        metrics.counter(AGENT_STARTS, Map.of("agent", agent));
        SLOG.info("worker-start", "agent", agent, "target", target, "jobId", jobId);
    }

    public void agentComplete(String agent, long durationMs, boolean success, String jobId) {
        String status = success ? "success" : "error";
        metrics.counter(AGENT_COMPLETIONS, Map.of("agent", agent, "status", status));
        metrics.histogram(AGENT_DURATION, durationMs, Map.of("agent", agent));
        SLOG.info(success ? "worker-done" : "worker-failed", "agent", agent, "durationMs", durationMs, "jobId", jobId);
    }

    public void batchDuration(long durationMs) {
        metrics.histogram(PARALLEL_BATCH_DURATION, durationMs, Map.of());
    }

    // ---------------- span ----------------

    public <T> T span(SpanRef parent, String name, Map<String, Object> attributes, Tracer.SpanBody<T> body) throws Exception {
        return tracer.inSpan(parent, name, attributes, body);
    }

    // ---------------- action log (durable) ----------------

    /** 저장소 실패는 AnalysisStoreException 으로 전파 (호출 단계가 처리) */
    public void logAction(String jobId, String worker, String action, Map<String, Object> detail, Long durationMs) {
        actionLog.appendLog(jobId, worker, action, detail == null ? Map.of() : detail, durationMs);
    }

    public List<ActionLogEntry> actionsFor(String jobId) {
        return actionLog.logsFor(jobId);
    }

    // ---------------- read side ----------------

    public ObservabilitySnapshot snapshot() {
        return new ObservabilitySnapshot(
                metrics.counters(),
                metrics.histograms(),
                tracer.recentTraces(RECENT_TRACES),
                tracer.tracesOpened(),
                tracer.tracesClosed(),
                Instant.now());
    }

    /**
     * 저장소에 남은 최근 잡과 액션 로그를 같은 metric 이름으로 다시 집계한다.
     * 프로세스가 새로 떠서 인메모리 지표가 비어 있어도 누적 통계를 볼 수 있다. trace 는 없다.
     */
    public ObservabilitySnapshot replayFromStore(int jobLimit) {
        MetricsCollector replay = new MetricsCollector();
        for (JobSummary job : actionLog.listJobs(jobLimit)) {
            replay.counter(ANALYSIS_STARTS, Map.of());
            if (job.status().isTerminal()) {
                replay.counter(ANALYSIS_COMPLETIONS, Map.of("status", job.status().wireName()));
                if (job.completedAt() != null) {
                    replay.histogram(ANALYSIS_DURATION,
                            Math.max(0L, Duration.between(job.createdAt(), job.completedAt()).toMillis()), Map.of());
                }
            }
            for (ActionLogEntry e : actionLog.logsFor(job.id())) {
                String status;
                if (ACTION_AGENT_DONE.equals(e.action())) status = "success";
                else if (ACTION_AGENT_ERROR.equals(e.action())) status = "error";
                else continue;
                if (e.worker() == null) continue;
                replay.counter(AGENT_COMPLETIONS, Map.of("agent", e.worker(), "status", status));
                if (e.durationMs() != null) replay.histogram(AGENT_DURATION, e.durationMs(), Map.of("agent", e.worker()));
            }
        }
        return new ObservabilitySnapshot(replay.counters(), replay.histograms(), List.of(), 0, 0, Instant.now());
    }

    public Tracer tracer() { return tracer; }
    public MetricsCollector metrics() { return metrics; }
}
