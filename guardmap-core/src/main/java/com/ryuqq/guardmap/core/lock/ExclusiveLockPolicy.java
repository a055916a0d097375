package com.ryuqq.guardmap.core.lock;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 읽기와 쓰기를 모두 하나의 {@link ReentrantLock}으로 직렬화하는 정책.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class ExclusiveLockPolicy extends AbstractLockPolicy {

    private final ReentrantLock lock = new ReentrantLock();

    @Override
    protected Lock sharedLock() {
        return lock;
    }

    @Override
    protected Lock exclusiveLock() {
        return lock;
    }

    @Override
    public LockPolicyType type() {
        return LockPolicyType.EXCLUSIVE;
    }

    public boolean isLocked() {
        return lock.isLocked();
    }
}
