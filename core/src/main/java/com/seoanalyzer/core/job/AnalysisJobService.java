package com.seoanalyzer.core.job;

import com.seoanalyzer.core.model.ActionLogEntry;
import com.seoanalyzer.core.model.AnalysisJob;
import com.seoanalyzer.core.model.AnalysisOutcome;
import com.seoanalyzer.core.model.JobProgress;
import com.seoanalyzer.core.model.WorkerSpec;
import com.seoanalyzer.core.model.WorkerState;
import com.seoanalyzer.core.orchestrator.AnalysisOrchestrator;
import com.seoanalyzer.core.orchestrator.SeoWorkers;
import com.seoanalyzer.core.util.NamedThreadFactory;
import com.seoanalyzer.core.util.StructuredLog;
import com.seoanalyzer.core.util.UrlUtils;
import com.seoanalyzer.core.util.WorkerProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 잡 큐 + 폴링 API.
 *  - submit(): 잡 레코드(PENDING)를 동기로 만들고 파이프라인은 잡 스레드풀에 넣는다
 *  - progress()/outcome()/await() 로 호출자가 상태를 조회
 *  - 대기+실행 중인 잡 수는 maxQueued 로 제한 (초과 시 RejectedExecutionException)
 *  - 여기서 제한하는 것은 잡 수이지 잡 간 동시 외부 호출 수가 아니다
 *  - 끝난 잡의 진행/결과는 최근 retainFinished 건만 보관. 밀려난 잡의 진행 상태는 액션 로그로 복원
 */
public final class AnalysisJobService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisJobService.class);
    private static final StructuredLog SLOG = StructuredLog.get(AnalysisJobService.class);

    private static final String ACTION_DONE = "analysis_complete";
    private static final String ACTION_ERROR = "analysis_error";

    public static final int DEFAULT_RETAINED_FINISHED = 256;

    private final AnalysisOrchestrator orchestrator;
    private final RequestTracker tracker;
    private final List<String> workerOrder;
    private final Semaphore admission;
    private final int maxQueued;
    private final ExecutorService exec;

    private final int retainFinished;

    private final Map<String, Map<String, WorkerSlot>> progress = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<AnalysisOutcome>> outcomes = new ConcurrentHashMap<>();
    private final Deque<String> finishedOrder = new ArrayDeque<>();

    public AnalysisJobService(AnalysisOrchestrator orchestrator, RequestTracker tracker, int maxQueued) {
        this(orchestrator, tracker, maxQueued, 1, SeoWorkers.analysisWorkers(), DEFAULT_RETAINED_FINISHED);
    }

    /**
     * @param jobThreads     동시에 실행할 잡 수
     * @param workers        진행률에 보여줄 분석 워커 (report_agent 는 자동 추가)
     * @param retainFinished 결과(리포트 포함)를 메모리에 남겨 둘 끝난 잡 수
     */
    public AnalysisJobService(AnalysisOrchestrator orchestrator,
                              RequestTracker tracker,
                              int maxQueued,
                              int jobThreads,
                              List<WorkerSpec> workers,
                              int retainFinished) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.retainFinished = Math.max(0, retainFinished);
        this.maxQueued = Math.max(1, maxQueued);
        this.admission = new Semaphore(this.maxQueued);
        List<String> names = new ArrayList<>();
        for (WorkerSpec w : workers) names.add(w.name());
        names.add(SeoWorkers.REPORT_WORKER);
        this.workerOrder = List.copyOf(names);

        int threads = Math.max(1, jobThreads);
        this.exec = new ThreadPoolExecutor(
                threads, threads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("seo-job"));
    }

    /**
     * @return 새 잡 id
     * @throws IllegalArgumentException   target 이 null/공백
     * @throws RejectedExecutionException 대기 중인 잡이 maxQueued 에 도달했거나 서비스가 닫힘
     */
    public String submit(String target) {
        String url = UrlUtils.normalizeTarget(target);
        if (exec.isShutdown()) throw new RejectedExecutionException("job service is closed");
        if (!admission.tryAcquire()) {
            throw new RejectedExecutionException("job queue is full (maxQueued=" + maxQueued + ")");
        }
        final AnalysisJob job;
        try {
            job = tracker.create(url);
        } catch (RuntimeException e) {
            admission.release();
            throw e;
        }
        final String jobId = job.getId();

        Map<String, WorkerSlot> slots = new LinkedHashMap<>();
        for (String name : workerOrder) slots.put(name, new WorkerSlot());
        progress.put(jobId, slots);
        CompletableFuture<AnalysisOutcome> future = new CompletableFuture<>();
        outcomes.put(jobId, future);

        try {
            exec.execute(() -> runJob(job, future));
        } catch (RejectedExecutionException e) {
            admission.release();
            outcomes.remove(jobId);
            progress.remove(jobId);
            tracker.fail(jobId, "job service rejected the job: " + e.getMessage());
            throw e;
        }
        LOG.info("[{}] Queued analysis of {}", jobId, url);
        SLOG.info("job-queued", "jobId", jobId, "target", url);
        return jobId;
    }

    private void runJob(AnalysisJob job, CompletableFuture<AnalysisOutcome> future) {
        try {
            future.complete(orchestrator.execute(job, listenerFor(job.getId())));
        } catch (RuntimeException e) {
            LOG.error("[{}] Job crashed: {}", job.getId(), e.toString(), e);
            tracker.fail(job.getId(), messageOf(e));
            future.completeExceptionally(e);
        } finally {
            admission.release();
            retire(job.getId());
        }
    }

    private void retire(String jobId) {
        synchronized (finishedOrder) {
            finishedOrder.addLast(jobId);
            while (finishedOrder.size() > retainFinished) {
                String old = finishedOrder.pollFirst();
                outcomes.remove(old);
                progress.remove(old);
            }
        }
    }

    private WorkerProgressListener listenerFor(String jobId) {
        return (j, worker, state, durationMs) -> {
            Map<String, WorkerSlot> slots = progress.get(jobId);
            if (slots == null) return;
            WorkerSlot slot = slots.computeIfAbsent(worker, k -> new WorkerSlot());
            slot.update(state, durationMs);
        };
    }

    /** 폴링용 읽기 전용 뷰. 모르는 잡이면 JobNotFoundException */
    public JobProgress progress(String jobId) {
        AnalysisJob job = tracker.get(jobId);
        Map<String, WorkerSlot> slots = progress.get(jobId);
        if (slots == null) {
            // 보관 기간이 지났거나 이 프로세스에서 실행하지 않은 잡: 액션 로그로 복원
            return progressFromLog(jobId, job);
        }
        List<JobProgress.WorkerProgress> per = new ArrayList<>(slots.size());
        String current = null;
        for (Map.Entry<String, WorkerSlot> e : slots.entrySet()) {
            WorkerSlot s = e.getValue();
            WorkerState st = s.state();
            if (current == null && st == WorkerState.RUNNING) current = e.getKey();
            per.add(new JobProgress.WorkerProgress(e.getKey(), st, s.durationMs()));
        }
        return new JobProgress(jobId, job.getStatus(), current, per);
    }

    private JobProgress progressFromLog(String jobId, AnalysisJob job) {
        Map<String, JobProgress.WorkerProgress> byName = new LinkedHashMap<>();
        for (String name : workerOrder) byName.put(name, new JobProgress.WorkerProgress(name, WorkerState.PENDING, null));
        for (ActionLogEntry e : tracker.actionLog(jobId)) {
            if (!byName.containsKey(e.worker())) continue;
            if (ACTION_DONE.equals(e.action())) {
                byName.put(e.worker(), new JobProgress.WorkerProgress(e.worker(), WorkerState.COMPLETED, e.durationMs()));
            } else if (ACTION_ERROR.equals(e.action())) {
                byName.put(e.worker(), new JobProgress.WorkerProgress(e.worker(), WorkerState.FAILED, e.durationMs()));
            }
        }
        return new JobProgress(jobId, job.getStatus(), null, new ArrayList<>(byName.values()));
    }

    /** 메모리에 진행/결과를 들고 있는 잡 수 */
    public int retainedJobCount() {
        return outcomes.size();
    }

    /** 끝난 잡의 결과. 아직 실행 중이거나, 보관 기간이 지났거나, 이 프로세스에서 돌지 않은 잡이면 empty */
    public Optional<AnalysisOutcome> outcome(String jobId) {
        CompletableFuture<AnalysisOutcome> f = outcomes.get(jobId);
        if (f == null || !f.isDone() || f.isCompletedExceptionally()) return Optional.empty();
        return Optional.ofNullable(f.join());
    }

    /** 테스트/CLI용 블로킹 대기. 결과 보관 기간이 지난 잡은 JobNotFoundException */
    public AnalysisOutcome await(String jobId, Duration timeout)
            throws InterruptedException, TimeoutException, ExecutionException {
        CompletableFuture<AnalysisOutcome> f = outcomes.get(jobId);
        if (f == null) throw new JobNotFoundException(jobId);
        return f.get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
    }

    /** 새 잡은 거부하고 이미 들어온 잡은 끝까지 실행 */
    @Override
    public void close() {
        exec.shutdown();
        try {
            if (!exec.awaitTermination(60, TimeUnit.SECONDS)) {
                LOG.warn("Job executor did not drain in 60s; interrupting");
                exec.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            exec.shutdownNow();
        }
    }

    /** 워커 하나의 진행 상태 (리스너 스레드가 쓰고 폴링 스레드가 읽음) */
    private static final class WorkerSlot {
        private volatile WorkerState state = WorkerState.PENDING;
        private volatile Long durationMs;

        synchronized void update(WorkerState next, Long ms) {
            // 종료 상태 뒤에 RUNNING 이 늦게 도착해도 되돌리지 않는다
            if (state == WorkerState.COMPLETED || state == WorkerState.FAILED) return;
            state = next;
            if (ms != null) durationMs = ms;
        }

        WorkerState state() { return state; }
        Long durationMs() { return durationMs; }
    }

    private static String messageOf(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }
}
