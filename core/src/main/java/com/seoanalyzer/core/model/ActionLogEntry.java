package com.seoanalyzer.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 잡별 액션 로그 한 줄 (append-only, 감사/이력 조회용).
 * @param durationMs 측정하지 않은 액션이면 null
 */
public record ActionLogEntry(String jobId,
                             String worker,
                             String action,
                             Map<String, Object> detail,
                             Long durationMs,
                             Instant createdAt) {
    public ActionLogEntry {
        detail = (detail == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(detail)));
        createdAt = (createdAt == null ? Instant.now() : createdAt);
    }
}
