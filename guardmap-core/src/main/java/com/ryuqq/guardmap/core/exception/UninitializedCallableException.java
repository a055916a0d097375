package com.ryuqq.guardmap.core.exception;

/**
 * 필수 협력 함수(sizer, codec)가 설정되지 않았거나 사용 불가한 상태에서 호출된 경우.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public class UninitializedCallableException extends GuardMapException {

    public UninitializedCallableException(String callableName) {
        super(callableName + " is not configured");
    }

    public UninitializedCallableException(String callableName, Throwable cause) {
        super(callableName + " failed: " + cause.getMessage(), cause);
    }
}
