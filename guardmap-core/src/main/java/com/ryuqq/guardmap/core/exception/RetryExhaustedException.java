package com.ryuqq.guardmap.core.exception;

/**
 * 재시도 가능한 실패가 최대 시도 횟수만큼 반복된 경우.
 *
 * <p>마지막 실패 원인을 cause로 가집니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public class RetryExhaustedException extends GuardMapException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastCause) {
        super("retry exhausted after " + attempts + " attempts: " + lastCause.getMessage(), lastCause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
