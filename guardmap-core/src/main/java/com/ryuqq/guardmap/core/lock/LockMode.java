package com.ryuqq.guardmap.core.lock;

/**
 * 락 획득 모드.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public enum LockMode {

    /** 읽기 (공유) */
    SHARED,

    /** 쓰기 (배타) */
    EXCLUSIVE
}
