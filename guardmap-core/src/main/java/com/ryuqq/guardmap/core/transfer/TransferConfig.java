package com.ryuqq.guardmap.core.transfer;

import java.time.Duration;

/**
 * 전송 채널 설정.
 *
 * <p>기본값: timeout=30s, retry=3회 시도 / 1초 선형 증가</p>
 *
 * @param timeout 한 번의 시도에 허용되는 최대 시간
 * @param retryPolicy 재시도 정책
 * @author GuardMap Team
 * @since 1.0.0
 */
public record TransferConfig(Duration timeout, RetryPolicy retryPolicy) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public TransferConfig {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
    }

    public TransferConfig() {
        this(DEFAULT_TIMEOUT, RetryPolicy.defaults());
    }

    public TransferConfig withTimeout(Duration timeout) {
        return new TransferConfig(timeout, retryPolicy);
    }

    public TransferConfig withRetryPolicy(RetryPolicy retryPolicy) {
        return new TransferConfig(timeout, retryPolicy);
    }
}
