package com.seoanalyzer.core.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * (job, worker)마다 세션을 하나씩 발급한다. 같은 키로 두 번 발급하지 않는다(재사용 금지).
 * 세션은 프로세스 수명 동안 유지되며 별도 정리 API는 없다.
 */
public final class SessionRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SessionRegistry.class);

    /** 맵 키. 표시용 세션 id 는 구분자 때문에 겹칠 수 있어 키로 쓰지 않는다 */
    private record Key(String jobId, String workerName) {}

    private final String appName;
    private final Map<Key, SessionHandle> sessions = new ConcurrentHashMap<>();

    public SessionRegistry() { this("seo_analyzer"); }

    public SessionRegistry(String appName) {
        this.appName = Objects.requireNonNull(appName, "appName");
    }

    public SessionHandle createSession(String jobId, String workerName) {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(workerName, "workerName");
        String id = sessionIdOf(jobId, workerName);
        SessionHandle fresh = new SessionHandle(id, jobId, workerName);
        SessionHandle prev = sessions.putIfAbsent(new Key(jobId, workerName), fresh);
        if (prev != null) {
            throw new IllegalStateException("Session already exists for job=" + jobId + ", worker=" + workerName);
        }
        LOG.debug("[{}] Session created: {}", jobId, id);
        return fresh;
    }

    public Optional<SessionHandle> find(String jobId, String workerName) {
        return Optional.ofNullable(sessions.get(new Key(jobId, workerName)));
    }

    public int size() { return sessions.size(); }

    private String sessionIdOf(String jobId, String workerName) {
        return appName + "_" + jobId + "_" + workerName;
    }
}
