package com.ryuqq.guardmap.core.exception;

/**
 * 컨테이너가 최대 크기에 도달했거나 크기 계산이 오버플로된 경우.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public class AllocationFailureException extends GuardMapException {

    public AllocationFailureException(String message) {
        super(message);
    }

    public AllocationFailureException(String message, ContainerStateSnapshot snapshot) {
        super(message, null, snapshot);
    }
}
