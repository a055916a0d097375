package com.ryuqq.guardmap.core.exception;

/**
 * null 키로 컨테이너 연산을 시도한 경우.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public class NullKeyException extends GuardMapException {

    public NullKeyException(String operation) {
        super("key cannot be null (operation: " + operation + ")");
    }

    public NullKeyException(String operation, ContainerStateSnapshot snapshot) {
        super("key cannot be null (operation: " + operation + ")", null, snapshot);
    }
}
