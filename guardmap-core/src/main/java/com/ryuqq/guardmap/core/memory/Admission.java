package com.ryuqq.guardmap.core.memory;

/**
 * 메모리 예산 진입 판정 결과.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public enum Admission {

    /** 상한 이내 */
    ADMITTED,

    /** 상한 초과 */
    REJECTED;

    public boolean isAdmitted() {
        return this == ADMITTED;
    }
}
