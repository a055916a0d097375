package com.ryuqq.guardmap.core.transfer;

import java.time.Duration;

/**
 * 재시도 정책.
 *
 * <p>{@code maxAttempts}는 첫 시도를 포함한 총 시도 횟수입니다.
 * 재시도 가능한 실패가 {@code maxAttempts}번 누적되면 재시도가 소진됩니다.</p>
 *
 * @param maxAttempts 총 시도 횟수 (1 이상)
 * @param backoff 재시도 간 대기 전략
 * @author GuardMap Team
 * @since 1.0.0
 */
public record RetryPolicy(int maxAttempts, BackoffStrategy backoff) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1 (current: " + maxAttempts + ")");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
    }

    /**
     * 3회 시도, 1초 선형 증가.
     *
     * @return 기본 정책
     */
    public static RetryPolicy defaults() {
        return linear(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY);
    }

    public static RetryPolicy linear(int maxAttempts, Duration initialDelay) {
        return new RetryPolicy(maxAttempts, BackoffStrategy.linear(initialDelay));
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, BackoffStrategy.none());
    }
}
