package com.ryuqq.guardmap.core.exception;

/**
 * 전송 계층 I/O 실패 분류.
 *
 * <p>일시적 실패는 재시도하고, 나머지는 즉시 전파합니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public enum TransferErrorKind {

    CONNECTION_RESET(true, "connection reset by peer"),
    CONNECTION_ABORTED(true, "connection aborted"),
    INTERRUPTED(true, "interrupted system call"),
    TEMPORARILY_UNAVAILABLE(true, "resource temporarily unavailable"),
    TIMED_OUT(true, "connection timed out"),
    ADDRESS_UNAVAILABLE(false, "address not available"),
    NETWORK_UNREACHABLE(false, "network is unreachable"),
    CONNECTION_REFUSED(false, "connection refused"),
    OTHER(false, "transfer failed");

    private final boolean retryable;
    private final String description;

    TransferErrorKind(boolean retryable, String description) {
        this.retryable = retryable;
        this.description = description;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String description() {
        return description;
    }
}
