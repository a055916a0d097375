package com.ryuqq.guardmap.core.exception;

import java.time.Duration;

/**
 * 전송 작업이 제한 시간 내에 완료되지 않은 경우.
 *
 * <p>호출자는 이 예외를 받지만 실행 중이던 작업은 중단되지 않고 버려집니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public class OperationTimedOutException extends GuardMapException {

    private final Duration timeout;

    public OperationTimedOutException(Duration timeout) {
        super("operation timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
