package com.seoanalyzer.core.http;

import java.time.Duration;
import java.util.Optional;

/**
 * 실패한 capability 응답 하나를 보고 다시 보낼지, 얼마나 기다릴지 정한다.
 * 서버가 준 Retry-After 를 반영하는 것도 정책의 몫이다.
 */
public interface RetryPolicy {

    /** 응답 없이 끝난 시도(연결 실패, 타임아웃)의 상태 코드 */
    int TRANSPORT_FAILURE = -1;

    /**
     * @param attempt    방금 실패한 시도 번호 (1부터)
     * @param statusCode HTTP 상태 또는 {@link #TRANSPORT_FAILURE}
     * @param retryAfter 서버가 요청한 대기 시간, 없으면 null
     * @return 재시도하면 그 전에 기다릴 시간, 포기하면 empty
     */
    Optional<Duration> backoff(int attempt, int statusCode, Duration retryAfter);

    /** 첫 시도를 포함한 최대 시도 횟수 */
    int maxAttempts();
}
