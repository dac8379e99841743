package com.seoanalyzer.core.session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * (jobId, workerName) 단위로 격리된 실행 컨텍스트.
 * 대화 턴은 이 핸들 안에만 쌓이므로 다른 워커/잡이 관찰할 수 없다.
 */
public final class SessionHandle {

    /** 대화 한 턴. role = "user" | "model" */
    public record Turn(String role, String text) {}

    private final String sessionId;
    private final String jobId;
    private final String workerName;
    private final Instant createdAt = Instant.now();
    private final List<Turn> turns = new ArrayList<>();

    SessionHandle(String sessionId, String jobId, String workerName) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.workerName = Objects.requireNonNull(workerName, "workerName");
    }

    public String getSessionId() { return sessionId; }
    public String getJobId() { return jobId; }
    public String getWorkerName() { return workerName; }
    public Instant getCreatedAt() { return createdAt; }

    public synchronized void appendTurn(String role, String text) {
        turns.add(new Turn(role, text == null ? "" : text));
    }

    /** 스냅샷 복사본 */
    public synchronized List<Turn> turns() {
        return Collections.unmodifiableList(new ArrayList<>(turns));
    }

    @Override public String toString() {
        return "SessionHandle{" + sessionId + "}";
    }
}
