package com.ryuqq.guardmap.core.transfer;

import java.time.Duration;

/**
 * 한 번의 재시도 루프 동안의 상태.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class RetryState {

    private final int maxAttempts;
    private int attempt;
    private Duration lastDelay = Duration.ZERO;
    private Throwable lastFailure;

    public RetryState(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1 (current: " + maxAttempts + ")");
        }
        this.maxAttempts = maxAttempts;
    }

    public void startAttempt() {
        attempt++;
    }

    public void recordFailure(Throwable failure) {
        this.lastFailure = failure;
    }

    public void recordDelay(Duration delay) {
        this.lastDelay = delay;
    }

    public boolean isExhausted() {
        return attempt >= maxAttempts;
    }

    /**
     * @return 현재까지 시작한 시도 횟수 (1부터)
     */
    public int attempt() {
        return attempt;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration lastDelay() {
        return lastDelay;
    }

    public Throwable lastFailure() {
        return lastFailure;
    }

    @Override
    public String toString() {
        return "RetryState{attempt=" + attempt + "/" + maxAttempts + ", delay=" + lastDelay.toMillis() + "ms}";
    }
}
