package com.ryuqq.guardmap.core.lock;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * N readers XOR 1 writer 정책.
 *
 * <p>{@link ReentrantReadWriteLock} 기반입니다. 읽기 락을 보유한 스레드가 쓰기 락을 요청하면
 * 자기 자신과 교착되므로, 대기하지 않고 {@link IllegalStateException}을 던집니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class SharedExclusiveLockPolicy extends AbstractLockPolicy {

    private final ReentrantReadWriteLock lock;

    public SharedExclusiveLockPolicy() {
        this(false);
    }

    /**
     * @param fair true면 FIFO 순서로 획득
     */
    public SharedExclusiveLockPolicy(boolean fair) {
        this.lock = new ReentrantReadWriteLock(fair);
    }

    @Override
    protected Lock sharedLock() {
        return lock.readLock();
    }

    @Override
    protected Lock exclusiveLock() {
        return lock.writeLock();
    }

    @Override
    protected void beforeExclusive() {
        if (lock.getReadHoldCount() > 0 && !lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException(
                "cannot upgrade shared lock to exclusive (read holds: " + lock.getReadHoldCount() + ")"
            );
        }
    }

    @Override
    public LockPolicyType type() {
        return LockPolicyType.SHARED_EXCLUSIVE;
    }

    public int readLockCount() {
        return lock.getReadLockCount();
    }

    public boolean isWriteLocked() {
        return lock.isWriteLocked();
    }
}
