package com.ryuqq.guardmap.core.exception;

/**
 * 프레임 검증 실패.
 *
 * <p>체크섬 불일치, 잘못된 길이 헤더, 잘린 프레임 등에서 발생합니다.
 * 이 예외가 발생하면 부분 페이로드는 절대 반환되지 않습니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public class DataIntegrityException extends GuardMapException {

    public DataIntegrityException(String message) {
        super(message);
    }

    public DataIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
