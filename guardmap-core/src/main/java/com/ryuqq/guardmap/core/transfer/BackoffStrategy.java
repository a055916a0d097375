package com.ryuqq.guardmap.core.transfer;

import java.time.Duration;

/**
 * 재시도 간 대기 시간 전략.
 *
 * <p>기본은 선형 증가입니다: {@code initialDelay * (retryIndex + 1)}.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BackoffStrategy {

    /**
     * @param retryIndex 0부터 시작하는 재시도 순번 (첫 실패 후 대기 = 0)
     * @return 대기 시간
     */
    Duration delayFor(int retryIndex);

    static BackoffStrategy linear(Duration initialDelay) {
        requireNonNegative(initialDelay);
        return retryIndex -> initialDelay.multipliedBy(retryIndex + 1L);
    }

    static BackoffStrategy fixed(Duration delay) {
        requireNonNegative(delay);
        return retryIndex -> delay;
    }

    static BackoffStrategy none() {
        return retryIndex -> Duration.ZERO;
    }

    private static void requireNonNegative(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be non-negative (current: " + delay + ")");
        }
    }
}
