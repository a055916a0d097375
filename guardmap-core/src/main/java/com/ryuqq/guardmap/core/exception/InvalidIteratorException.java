package com.ryuqq.guardmap.core.exception;

/**
 * 무효화된 반복자에 대해 역참조, 이동, 비교를 시도한 경우.
 *
 * <p>반복자는 명시적 무효화, 소유권 이전, close, 또는 컨테이너의 구조 변경으로 무효화됩니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public class InvalidIteratorException extends GuardMapException {

    public InvalidIteratorException(String message) {
        super(message);
    }
}
