package com.seoanalyzer.core.orchestrator;

import com.seoanalyzer.core.api.AnalysisCapability;
import com.seoanalyzer.core.model.OutputFragment;
import com.seoanalyzer.core.model.WorkerResult;
import com.seoanalyzer.core.model.WorkerSpec;
import com.seoanalyzer.core.observability.ObservabilityRecorder;
import com.seoanalyzer.core.observability.SpanRef;
import com.seoanalyzer.core.session.SessionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * capability 1회 호출을 span/메트릭/액션 로그로 감싸 WorkerResult 로 바꾼다.
 * capability 실패는 여기서 실패 결과로 회수된다. 실패 기록(액션 로그) 자체가
 * 저장소 장애로 실패하면 그 예외는 호출자에게 전파된다.
 */
final class WorkerInvoker {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerInvoker.class);

    enum Stage { ANALYSIS, SYNTHESIS }

    private final AnalysisCapability capability;
    private final ObservabilityRecorder recorder;

    WorkerInvoker(AnalysisCapability capability, ObservabilityRecorder recorder) {
        this.capability = Objects.requireNonNull(capability, "capability");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
    }

    WorkerResult invoke(Stage stage,
                        WorkerSpec worker,
                        String instruction,
                        SessionHandle session,
                        String target,
                        SpanRef parent) {
        final String name = worker.name();
        final String jobId = session.getJobId();
        recorder.agentStart(name, target, jobId);
        LOG.info("[{}] Starting agent: {}", jobId, name);

        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("agent", name);
        attrs.put("jobId", jobId);
        attrs.put("sessionId", session.getSessionId());

        long t0 = System.nanoTime();
        try {
            String text = recorder.span(parent, "agent_" + name, attrs, span -> {
                List<OutputFragment> fragments;
                try {
                    fragments = capability.invoke(worker, instruction, session);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw wrap(stage, name, ie);
                } catch (Exception e) {
                    throw wrap(stage, name, e);
                }
                String joined = OutputFragment.join(fragments);
                span.setAttribute("result_length", joined.length());
                return joined;
            });
            long ms = elapsedMs(t0);
            recorder.logAction(jobId, name, "analysis_complete", Map.of("result_length", text.length()), ms);
            recorder.agentComplete(name, ms, true, jobId);
            LOG.info("[{}] Agent {} completed in {}ms", jobId, name, ms);
            return WorkerResult.success(name, text, ms);
        } catch (Exception e) {
            long ms = elapsedMs(t0);
            String error = WorkerInvocationException.messageOf(e);
            LOG.warn("[{}] Agent {} failed: {}", jobId, name, error);
            // 인터럽트 상태로는 파일 채널 쓰기가 닫혀 버리므로 기록하는 동안만 플래그를 내린다
            boolean interrupted = Thread.interrupted();
            try {
                recorder.logAction(jobId, name, "analysis_error", Map.of("error", error), ms);
                recorder.agentComplete(name, ms, false, jobId);
                return WorkerResult.failure(name, error, ms);
            } finally {
                if (interrupted) Thread.currentThread().interrupt();
            }
        }
    }

    private static WorkerInvocationException wrap(Stage stage, String name, Exception cause) {
        return stage == Stage.SYNTHESIS
                ? new SynthesisException(name, cause)
                : new WorkerInvocationException(name, cause);
    }

    private static long elapsedMs(long t0) {
        return Math.max(0L, (System.nanoTime() - t0) / 1_000_000);
    }
}
