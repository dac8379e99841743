package com.seoanalyzer.core.orchestrator;

import com.seoanalyzer.core.api.AnalysisCapability;
import com.seoanalyzer.core.model.WorkerResult;
import com.seoanalyzer.core.model.WorkerSpec;
import com.seoanalyzer.core.model.WorkerState;
import com.seoanalyzer.core.observability.ObservabilityRecorder;
import com.seoanalyzer.core.observability.SpanRef;
import com.seoanalyzer.core.observability.TraceContext;
import com.seoanalyzer.core.session.SessionHandle;
import com.seoanalyzer.core.session.SessionRegistry;
import com.seoanalyzer.core.util.NamedThreadFactory;
import com.seoanalyzer.core.util.StructuredLog;
import com.seoanalyzer.core.util.WorkerProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 분석 워커 N개를 동시에 돌리고 전부 끝날 때까지 기다린다 (wait-for-all).
 *  - 워커마다 전용 세션
 *  - 한 워커의 실패는 실패 결과로만 남고 다른 워커에 영향 없음
 *  - 워커별 타임아웃은 없음 (capability 자체 타임아웃에 의존)
 *  - 실행마다 워커 수만큼의 전용 스레드풀을 만들고 끝나면 닫는다
 *  - 기다리는 도중 인터럽트되면 워커를 멈추고, 끝내지 못한 워커는 "interrupted" 실패로 채운다.
 *    인터럽트 플래그는 반환 직전에 복구된다.
 */
public final class ParallelCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(ParallelCoordinator.class);
    private static final StructuredLog SLOG = StructuredLog.get(ParallelCoordinator.class);

    static final String INTERRUPTED = "interrupted";
    static final long DEFAULT_INTERRUPT_GRACE_MS = 2_000;

    private final SessionRegistry sessions;
    private final ObservabilityRecorder recorder;
    private final WorkerInvoker invoker;
    private final long interruptGraceMs;

    public ParallelCoordinator(AnalysisCapability capability, SessionRegistry sessions, ObservabilityRecorder recorder) {
        this(capability, sessions, recorder, DEFAULT_INTERRUPT_GRACE_MS);
    }

    ParallelCoordinator(AnalysisCapability capability, SessionRegistry sessions, ObservabilityRecorder recorder,
                        long interruptGraceMs) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.invoker = new WorkerInvoker(capability, recorder);
        this.interruptGraceMs = Math.max(0L, interruptGraceMs);
    }

    /** 현재 스레드의 trace 루트 아래에 워커 span을 붙인다 */
    public Map<String, WorkerResult> runAll(String target, String jobId, List<WorkerSpec> workers) {
        SpanRef parent = SpanRef.root(TraceContext.currentTraceId().orElse("no-trace"));
        return runAll(target, jobId, workers, parent, WorkerProgressListener.NONE);
    }

    /**
     * @return 워커 이름 → 결과 (설정 순서). 결과 기록 자체가 실패한 워커는 빠질 수 있다.
     */
    public Map<String, WorkerResult> runAll(String target,
                                            String jobId,
                                            List<WorkerSpec> workers,
                                            SpanRef parent,
                                            WorkerProgressListener listener) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(parent, "parent");
        final WorkerProgressListener pl = (listener != null) ? listener : WorkerProgressListener.NONE;
        if (workers == null || workers.isEmpty()) return Map.of();

        Set<String> names = new HashSet<>();
        for (WorkerSpec w : workers) {
            if (!names.add(w.name())) throw new IllegalArgumentException("duplicate worker name: " + w.name());
        }

        LOG.info("[{}] Starting parallel analysis of {} ({} workers)", jobId, target, workers.size());
        long t0 = System.nanoTime();

        // 1) 워커별 지시문 + 세션은 디스패치 전에 모두 준비
        List<Prepared> prepared = new ArrayList<>(workers.size());
        for (WorkerSpec w : workers) {
            prepared.add(new Prepared(w, w.instructionFor(target), sessions.createSession(jobId, w.name())));
        }

        // 2) 동시 디스패치
        final int n = prepared.size();
        ExecutorService exec = new ThreadPoolExecutor(
                n, n,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("seo-worker-" + jobId));

        final String traceId = parent.traceId();
        List<Future<WorkerResult>> futures = new ArrayList<>(n);
        for (Prepared p : prepared) {
            notify(pl, jobId, p.worker().name(), WorkerState.RUNNING, null);
            futures.add(exec.submit(() -> {
                try (TraceContext.Scope ignored = TraceContext.bind(traceId)) {
                    WorkerResult r = invoker.invoke(WorkerInvoker.Stage.ANALYSIS,
                            p.worker(), p.instruction(), p.session(), target, parent);
                    notify(pl, jobId, r.getWorkerName(),
                            r.isSuccess() ? WorkerState.COMPLETED : WorkerState.FAILED, r.getDurationMs());
                    return r;
                }
            }));
        }

        // 3) fan-in: 모든 future가 끝날 때까지
        Map<String, WorkerResult> results = new LinkedHashMap<>();
        boolean interrupted = false;
        try {
            for (int i = 0; i < n; i++) {
                String name = prepared.get(i).worker().name();
                Future<WorkerResult> f = futures.get(i);
                if (!interrupted) {
                    try {
                        collect(results, f, jobId, name, pl);
                        continue;
                    } catch (InterruptedException ie) {
                        interrupted = true;
                        LOG.warn("[{}] Interrupted while waiting for agents; stopping {} unsettled of {}",
                                jobId, n - results.size(), n);
                        exec.shutdownNow();
                        awaitWorkers(exec, jobId);
                    }
                }
                // 인터럽트 이후: 이미 끝난 워커는 그 결과, 못 끝낸 워커는 "interrupted" 실패
                settleAfterInterrupt(results, f, jobId, name, t0, pl);
            }
        } finally {
            exec.shutdownNow();
            if (interrupted) Thread.currentThread().interrupt();
        }

        long batchMs = Math.max(0L, (System.nanoTime() - t0) / 1_000_000);
        recorder.batchDuration(batchMs);
        LOG.info("[{}] Parallel analysis complete. {} agents finished in {}ms", jobId, results.size(), batchMs);
        return results;
    }

    private void collect(Map<String, WorkerResult> results, Future<WorkerResult> f, String jobId,
                         String name, WorkerProgressListener pl) throws InterruptedException {
        try {
            WorkerResult r = f.get();
            results.put(r.getWorkerName(), r);
        } catch (ExecutionException e) {
            // 결과 기록(액션 로그) 실패 → 이 워커는 결과 맵에서 빠진다
            Throwable cause = (e.getCause() != null ? e.getCause() : e);
            LOG.error("[{}] Agent task {} failed with exception: {}", jobId, name, cause.toString());
            SLOG.error("task-failed", cause, "jobId", jobId, "agent", name);
            notify(pl, jobId, name, WorkerState.FAILED, null);
        } catch (CancellationException ce) {
            LOG.warn("[{}] Agent task {} was cancelled", jobId, name);
            notify(pl, jobId, name, WorkerState.FAILED, null);
        }
    }

    private void settleAfterInterrupt(Map<String, WorkerResult> results, Future<WorkerResult> f, String jobId,
                                      String name, long t0, WorkerProgressListener pl) {
        if (f.isDone() && !f.isCancelled()) {
            try {
                WorkerResult r = f.get();
                results.put(r.getWorkerName(), r);
                return;
            } catch (ExecutionException | InterruptedException e) {
                // 멈추는 도중 기록에 실패한 워커도 아래에서 interrupted 로 채운다
                LOG.warn("[{}] Agent {} ended without a usable result: {}", jobId, name, e.toString());
            }
        }
        f.cancel(true);
        long ms = Math.max(0L, (System.nanoTime() - t0) / 1_000_000);
        try {
            recorder.logAction(jobId, name, "analysis_error", Map.of("error", INTERRUPTED), ms);
        } catch (RuntimeException e) {
            LOG.error("[{}] Could not record interrupted agent {}: {}", jobId, name, e.toString());
        }
        recorder.agentComplete(name, ms, false, jobId);
        results.put(name, WorkerResult.failure(name, INTERRUPTED, ms));
        notify(pl, jobId, name, WorkerState.FAILED, ms);
    }

    /** shutdownNow 이후 워커 스레드가 인터럽트에 반응할 시간을 준다 */
    private void awaitWorkers(ExecutorService exec, String jobId) {
        try {
            if (!exec.awaitTermination(interruptGraceMs, TimeUnit.MILLISECONDS)) {
                LOG.warn("[{}] Some agents did not stop within {}ms", jobId, interruptGraceMs);
            }
        } catch (InterruptedException ie) {
            // 두 번째 인터럽트: 더 기다리지 않는다. 플래그는 runAll 이 반환 전에 복구
            LOG.warn("[{}] Interrupted again while stopping agents", jobId);
        }
    }

    static void notify(WorkerProgressListener pl, String jobId, String worker, WorkerState state, Long ms) {
        try {
            pl.onWorker(jobId, worker, state, ms);
        } catch (RuntimeException e) {
            LOG.warn("[{}] Progress listener failed for {}: {}", jobId, worker, e.toString());
        }
    }

    private record Prepared(WorkerSpec worker, String instruction, SessionHandle session) {}
}
