package com.seoanalyzer.core.orchestrator;

import com.seoanalyzer.core.api.AnalysisCapability;
import com.seoanalyzer.core.model.WorkerResult;
import com.seoanalyzer.core.model.WorkerSpec;
import com.seoanalyzer.core.model.WorkerState;
import com.seoanalyzer.core.observability.ObservabilityRecorder;
import com.seoanalyzer.core.observability.SpanRef;
import com.seoanalyzer.core.session.SessionHandle;
import com.seoanalyzer.core.session.SessionRegistry;
import com.seoanalyzer.core.util.StructuredLog;
import com.seoanalyzer.core.util.WorkerProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 병렬 배치가 모두 끝난 뒤 한 번만 실행되는 합성 단계.
 * 실패한 워커도 "Analysis failed: ..." 로 지시문에 포함된다.
 */
public final class ReportSynthesizer {

    private static final Logger LOG = LoggerFactory.getLogger(ReportSynthesizer.class);
    private static final StructuredLog SLOG = StructuredLog.get(ReportSynthesizer.class);

    private final SessionRegistry sessions;
    private final WorkerInvoker invoker;
    private final WorkerSpec reportWorker;

    public ReportSynthesizer(AnalysisCapability capability, SessionRegistry sessions, ObservabilityRecorder recorder) {
        this(capability, sessions, recorder, SeoWorkers.reportWorker());
    }

    public ReportSynthesizer(AnalysisCapability capability,
                             SessionRegistry sessions,
                             ObservabilityRecorder recorder,
                             WorkerSpec reportWorker) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.invoker = new WorkerInvoker(capability, recorder);
        this.reportWorker = Objects.requireNonNull(reportWorker, "reportWorker");
    }

    public WorkerResult generate(String target, Map<String, WorkerResult> results, String jobId,
                                 SpanRef parent, WorkerProgressListener listener) {
        Objects.requireNonNull(parent, "parent");
        final WorkerProgressListener pl = (listener != null) ? listener : WorkerProgressListener.NONE;
        LOG.info("[{}] Generating final report", jobId);

        String instruction = buildInstruction(target, results);
        SessionHandle session = sessions.createSession(jobId, reportWorker.name());

        ParallelCoordinator.notify(pl, jobId, reportWorker.name(), WorkerState.RUNNING, null);
        WorkerResult r = invoker.invoke(WorkerInvoker.Stage.SYNTHESIS,
                reportWorker, reportWorker.instructionFor(instruction), session, target, parent);
        ParallelCoordinator.notify(pl, jobId, reportWorker.name(),
                r.isSuccess() ? WorkerState.COMPLETED : WorkerState.FAILED, r.getDurationMs());

        if (r.isSuccess()) {
            SLOG.info("synthesis-done", "jobId", jobId, "length", r.getOutput().length(), "durationMs", r.getDurationMs());
        } else {
            SLOG.warn("synthesis-failed", "jobId", jobId, "error", r.getError());
        }
        return r;
    }

    /** 전체 배치 결과를 라벨링해 합성 지시문 하나로 만든다 */
    public String buildInstruction(String target, Map<String, WorkerResult> results) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Based on the following SEO analysis results, create a comprehensive SEO report for the website.\n\n");
        sb.append("Website analyzed: ").append(target).append("\n\n");
        sb.append("=== ANALYSIS RESULTS ===\n\n");
        if (results != null) {
            for (Map.Entry<String, WorkerResult> e : results.entrySet()) {
                WorkerResult r = e.getValue();
                sb.append("--- ").append(e.getKey().toUpperCase(Locale.ROOT)).append(" ---\n");
                if (r.isSuccess()) sb.append(r.getOutput());
                else sb.append("Analysis failed: ").append(r.getError());
                sb.append("\n\n");
            }
        }
        sb.append("""
                Create a well-formatted markdown report that includes:
                1. Executive Summary with overall score
                2. What's working well (positives)
                3. Issues found (organized by category)
                4. Prioritized recommendations
                5. Next steps

                Make the report easy to understand for non-technical users.""");
        return sb.toString();
    }
}
