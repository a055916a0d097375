package com.ryuqq.guardmap.core.lock;

import com.ryuqq.guardmap.core.lock.noop.NoOpLockPolicy;

import java.util.Locale;

/**
 * 락 정책 종류.
 *
 * <p>설정 값({@code shared-exclusive | exclusive | none})과 구현체를 연결합니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public enum LockPolicyType {

    SHARED_EXCLUSIVE("shared-exclusive"),
    EXCLUSIVE("exclusive"),
    NONE("none");

    private final String configValue;

    LockPolicyType(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    /**
     * 새 정책 인스턴스를 생성합니다.
     *
     * @return 정책 구현체
     */
    public LockPolicy create() {
        switch (this) {
            case SHARED_EXCLUSIVE:
                return new SharedExclusiveLockPolicy();
            case EXCLUSIVE:
                return new ExclusiveLockPolicy();
            case NONE:
            default:
                return new NoOpLockPolicy();
        }
    }

    /**
     * 설정 문자열을 해석합니다. 대소문자와 {@code _}/{@code -} 구분을 무시합니다.
     *
     * @param value 설정 값
     * @return 정책 종류
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static LockPolicyType fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("lock policy cannot be null or blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (LockPolicyType type : values()) {
            if (type.configValue.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown lock policy (current: " + value + ")");
    }
}
