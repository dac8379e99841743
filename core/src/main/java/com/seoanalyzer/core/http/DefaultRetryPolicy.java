package com.seoanalyzer.core.http;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 429, 5xx, 전송 실패만 재시도.
 * 대기: Retry-After 가 있으면 그 값, 없으면 base → 2x → 4x (±10% jitter). 어느 쪽이든 30초 상한.
 */
public final class DefaultRetryPolicy implements RetryPolicy {

    public static final Duration MAX_DELAY = Duration.ofSeconds(30);

    private final int maxAttempts;
    private final long baseMillis;

    public DefaultRetryPolicy() { this(3, 500); }

    public DefaultRetryPolicy(int maxAttempts, long baseMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
    }

    /** 설정의 capability.maxRetries 는 재시도 횟수: 시도 횟수 = maxRetries + 1 */
    public static DefaultRetryPolicy ofRetries(int maxRetries, long baseMillis) {
        return new DefaultRetryPolicy(Math.max(0, maxRetries) + 1, baseMillis);
    }

    @Override
    public Optional<Duration> backoff(int attempt, int statusCode, Duration retryAfter) {
        if (attempt >= maxAttempts || !isRetryable(statusCode)) return Optional.empty();
        Duration wait = (retryAfter != null && !retryAfter.isNegative()) ? retryAfter : exponential(attempt);
        return Optional.of(capped(wait));
    }

    static boolean isRetryable(int statusCode) {
        return statusCode == 429 || statusCode >= 500 || statusCode == TRANSPORT_FAILURE;
    }

    /** attempt 번째 실패 뒤의 지수 대기 (jitter 포함, 상한 적용) */
    Duration exponential(int attempt) {
        long pow = 1L << Math.min(20, Math.max(0, attempt - 1));
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2);
        double ms = Math.min((double) baseMillis * pow * jitter, (double) MAX_DELAY.toMillis());
        return Duration.ofMillis((long) ms);
    }

    private static Duration capped(Duration d) {
        return d.compareTo(MAX_DELAY) > 0 ? MAX_DELAY : d;
    }

    @Override
    public int maxAttempts() { return maxAttempts; }
}
