package com.seoanalyzer.core.api;

import com.seoanalyzer.core.model.ActionLogEntry;
import com.seoanalyzer.core.model.AnalysisJob;
import com.seoanalyzer.core.model.JobStatus;
import com.seoanalyzer.core.model.JobSummary;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 내구성 저장소 계약. 모든 쓰기는 단일 레코드 단위로 원자적이어야 한다.
 * 구현체는 I/O 실패를 AnalysisStoreException(unchecked)으로 올린다.
 */
public interface AnalysisStore {

    /** 새 잡(PENDING) 생성 후 반환 */
    AnalysisJob createJob(String target);

    /**
     * 상태와 부가 필드 갱신. null 인자는 기존 값을 유지한다.
     * @param resultSummary 워커별 요약/점수 등 (nullable)
     */
    AnalysisJob updateStatus(String jobId,
                             JobStatus status,
                             Map<String, Object> resultSummary,
                             String report,
                             String error,
                             Integer overallScore);

    void appendLog(String jobId, String worker, String action, Map<String, Object> detail, Long durationMs);

    /** 최신순 */
    List<JobSummary> listJobs(int limit);

    Optional<AnalysisJob> findJob(String jobId);

    /** 오래된 순 */
    List<ActionLogEntry> logsFor(String jobId);
}
