package com.seoanalyzer.core.job;

import com.seoanalyzer.core.api.AnalysisStore;
import com.seoanalyzer.core.model.ActionLogEntry;
import com.seoanalyzer.core.model.AnalysisJob;
import com.seoanalyzer.core.model.JobStatus;
import com.seoanalyzer.core.model.JobSummary;
import com.seoanalyzer.core.store.AnalysisStoreException;
import com.seoanalyzer.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 잡 레코드와 수명주기 상태 머신의 소유자.
 *  - 메모리 레코드가 기준이고 저장소는 write-through
 *  - 잡 단위 락으로 transition 한 번이 원자적으로 반영된다
 *  - 같은 상태 재호출은 덮어쓰기(비종결) 또는 무시(종결)
 *  - 종결된 잡은 최근 retainTerminal 건만 메모리에 남기고, 밀려난 잡은 저장소에서 다시 읽는다
 */
public final class RequestTracker {

    private static final Logger LOG = LoggerFactory.getLogger(RequestTracker.class);
    private static final StructuredLog SLOG = StructuredLog.get(RequestTracker.class);

    public static final int DEFAULT_RETAINED_TERMINAL = 256;

    private final AnalysisStore store;
    private final int retainTerminal;
    private final Map<String, AnalysisJob> jobs = new ConcurrentHashMap<>();
    private final Map<String, List<JobStatus>> history = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();
    private final Deque<String> terminalOrder = new ArrayDeque<>();

    public RequestTracker(AnalysisStore store) {
        this(store, DEFAULT_RETAINED_TERMINAL);
    }

    /** @param retainTerminal 메모리에 남겨 둘 종결 잡 수 (0이면 종결 즉시 내보냄) */
    public RequestTracker(AnalysisStore store, int retainTerminal) {
        this.store = Objects.requireNonNull(store, "store");
        this.retainTerminal = Math.max(0, retainTerminal);
    }

    /** 새 잡(PENDING) 생성. 저장소 실패는 AnalysisStoreException 그대로 전파 */
    public AnalysisJob create(String target) {
        if (target == null || target.isBlank()) throw new IllegalArgumentException("target must not be blank");
        AnalysisJob job = store.createJob(target);
        jobs.put(job.getId(), job);
        history.put(job.getId(), Collections.synchronizedList(new ArrayList<>(List.of(job.getStatus()))));
        SLOG.debug("job-created", "jobId", job.getId(), "target", target);
        return job;
    }

    public AnalysisJob transition(String jobId, JobStatus status) {
        return transition(jobId, status, null, null, null, null);
    }

    /**
     * 잡 한 건을 원자적으로 갱신.
     * @param overallScore COMPLETED/PARTIAL 에서만 허용 (그 외 상태에서 넘기면 IllegalArgumentException)
     */
    public AnalysisJob transition(String jobId,
                                  JobStatus status,
                                  Map<String, Object> resultSummary,
                                  String report,
                                  String error,
                                  Integer overallScore) {
        Objects.requireNonNull(status, "status");
        if (overallScore != null && status != JobStatus.COMPLETED && status != JobStatus.PARTIAL) {
            throw new IllegalArgumentException("overallScore is only set on COMPLETED/PARTIAL, not " + status);
        }
        synchronized (lockFor(jobId)) {
            AnalysisJob cur = get(jobId);
            if (cur.getStatus() == status && status.isTerminal()) {
                LOG.debug("[{}] Ignoring repeated terminal status {}", jobId, status);
                return cur;
            }
            if (cur.getStatus() != status && !cur.getStatus().canAdvanceTo(status)) {
                throw new IllegalJobTransitionException(jobId, cur.getStatus(), status);
            }
            AnalysisJob next = store.updateStatus(jobId, status, resultSummary, report, error, overallScore);
            apply(cur, next);
            return next;
        }
    }

    /**
     * FAILED 로 종결. 저장소가 죽어 있어도 메모리 레코드는 반드시 FAILED 가 된다.
     * 이미 종결된 잡이면 그대로 반환.
     */
    public AnalysisJob fail(String jobId, String message) {
        synchronized (lockFor(jobId)) {
            AnalysisJob cur = get(jobId);
            if (cur.getStatus().isTerminal()) return cur;

            AnalysisJob next;
            try {
                next = store.updateStatus(jobId, JobStatus.FAILED, null, null, message, null);
            } catch (AnalysisStoreException e) {
                LOG.error("[{}] Could not persist FAILED status: {}", jobId, e.getMessage());
                next = cur.toBuilder()
                        .status(JobStatus.FAILED)
                        .completedAt(Instant.now())
                        .errorMessage(message)
                        .build();
            }
            apply(cur, next);
            return next;
        }
    }

    /** 메모리 → 저장소 순으로 조회. 없으면 JobNotFoundException */
    public AnalysisJob get(String jobId) {
        if (jobId == null) throw new JobNotFoundException(null);
        AnalysisJob job = jobs.get(jobId);
        if (job != null) return job;
        return store.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /** 잡의 액션 로그 (오래된 것부터) */
    public List<ActionLogEntry> actionLog(String jobId) {
        return store.logsFor(jobId);
    }

    /** 메모리에 들고 있는 잡 레코드 수 */
    public int retainedJobCount() {
        return jobs.size();
    }

    /** 이 프로세스에서 관찰된 상태 순서 (메모리에서 밀려난 잡은 빈 목록) */
    public List<JobStatus> statusHistory(String jobId) {
        List<JobStatus> h = history.get(jobId);
        if (h == null) return List.of();
        synchronized (h) {
            return List.copyOf(h);
        }
    }

    public List<JobSummary> list(int limit) {
        return store.listJobs(limit);
    }

    // ------------ helpers ------------

    private void apply(AnalysisJob cur, AnalysisJob next) {
        jobs.put(next.getId(), next);
        if (cur.getStatus() != next.getStatus()) {
            history.computeIfAbsent(next.getId(), k -> Collections.synchronizedList(new ArrayList<>()))
                    .add(next.getStatus());
            LOG.info("[{}] Status {} -> {}", next.getId(), cur.getStatus(), next.getStatus());
            if (next.getStatus().isTerminal()) retire(next.getId());
        }
    }

    private void retire(String jobId) {
        synchronized (terminalOrder) {
            terminalOrder.addLast(jobId);
            while (terminalOrder.size() > retainTerminal) {
                String old = terminalOrder.pollFirst();
                jobs.remove(old);
                history.remove(old);
                locks.remove(old);
                LOG.debug("[{}] Evicted finished job from memory", old);
            }
        }
    }

    private Object lockFor(String jobId) {
        return locks.computeIfAbsent(String.valueOf(jobId), k -> new Object());
    }
}
