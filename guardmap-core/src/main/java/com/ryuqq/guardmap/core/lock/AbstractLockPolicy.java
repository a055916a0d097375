package com.ryuqq.guardmap.core.lock;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;

/**
 * {@link LockPolicy} 공통 구현.
 *
 * <p>하위 클래스는 공유/배타 모드에 대응하는 {@link Lock}만 제공합니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public abstract class AbstractLockPolicy implements LockPolicy {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final long instanceId = SEQUENCE.incrementAndGet();

    protected abstract Lock sharedLock();

    protected abstract Lock exclusiveLock();

    /**
     * 배타 락 획득 직전 검사. 기본 구현은 아무것도 하지 않습니다.
     */
    protected void beforeExclusive() {
    }

    @Override
    public LockHandle acquireRead() {
        LockHandle handle = new LockHandle(sharedLock(), LockMode.SHARED);
        handle.acquire();
        return handle;
    }

    @Override
    public LockHandle acquireWrite() {
        beforeExclusive();
        LockHandle handle = new LockHandle(exclusiveLock(), LockMode.EXCLUSIVE);
        handle.acquire();
        return handle;
    }

    @Override
    public Optional<LockHandle> tryAcquireRead() {
        LockHandle handle = new LockHandle(sharedLock(), LockMode.SHARED);
        return handle.tryAcquire() ? Optional.of(handle) : Optional.empty();
    }

    @Override
    public Optional<LockHandle> tryAcquireWrite() {
        beforeExclusive();
        LockHandle handle = new LockHandle(exclusiveLock(), LockMode.EXCLUSIVE);
        return handle.tryAcquire() ? Optional.of(handle) : Optional.empty();
    }

    @Override
    public Optional<LockHandle> tryAcquireRead(Duration timeout) throws InterruptedException {
        requireTimeout(timeout);
        LockHandle handle = new LockHandle(sharedLock(), LockMode.SHARED);
        return handle.tryAcquire(timeout) ? Optional.of(handle) : Optional.empty();
    }

    @Override
    public Optional<LockHandle> tryAcquireWrite(Duration timeout) throws InterruptedException {
        requireTimeout(timeout);
        beforeExclusive();
        LockHandle handle = new LockHandle(exclusiveLock(), LockMode.EXCLUSIVE);
        return handle.tryAcquire(timeout) ? Optional.of(handle) : Optional.empty();
    }

    @Override
    public long instanceId() {
        return instanceId;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "#" + instanceId;
    }

    private static void requireTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative (current: " + timeout + ")");
        }
    }
}
