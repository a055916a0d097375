package com.ryuqq.guardmap.core.lock;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

/**
 * 보유 중인 락에 대한 capability.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * UNACQUIRED ──acquire()──▶ ACQUIRED ──close()──▶ RELEASED
 * </pre>
 *
 * <p>RELEASED 상태의 핸들을 다시 사용하거나 두 번 해제하면 {@link IllegalStateException}이 발생합니다.
 * 핸들은 획득한 스레드에서만 해제해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try (LockHandle handle = policy.acquireWrite()) {
 *     container.put(key, value);
 * }
 * }</pre>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class LockHandle implements AutoCloseable {

    /**
     * 핸들 수명 주기.
     */
    public enum State {
        UNACQUIRED,
        ACQUIRED,
        RELEASED
    }

    private final Lock lock;
    private final LockMode mode;
    private volatile State state = State.UNACQUIRED;
    private volatile Thread owner;

    /**
     * 아직 획득하지 않은 핸들을 생성합니다.
     *
     * @param lock 대상 락
     * @param mode 획득 모드
     */
    public LockHandle(Lock lock, LockMode mode) {
        if (lock == null) {
            throw new IllegalArgumentException("lock cannot be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        this.lock = lock;
        this.mode = mode;
    }

    void acquire() {
        requireUnacquired();
        lock.lock();
        markAcquired();
    }

    boolean tryAcquire() {
        requireUnacquired();
        if (lock.tryLock()) {
            markAcquired();
            return true;
        }
        return false;
    }

    boolean tryAcquire(Duration timeout) throws InterruptedException {
        requireUnacquired();
        if (lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
            markAcquired();
            return true;
        }
        return false;
    }

    /**
     * 락을 해제합니다.
     *
     * @throws IllegalStateException 이미 해제되었거나 획득하지 않은 경우
     */
    @Override
    public void close() {
        if (state != State.ACQUIRED) {
            throw new IllegalStateException("lock handle is not held (current: " + state + ")");
        }
        state = State.RELEASED;
        owner = null;
        lock.unlock();
    }

    /**
     * 핸들이 락을 보유하고 있음을 확인합니다.
     *
     * @throws IllegalStateException 보유 중이 아닌 경우
     */
    public void ensureHeld() {
        if (state != State.ACQUIRED) {
            throw new IllegalStateException("lock handle is not held (current: " + state + ")");
        }
    }

    public boolean isHeld() {
        return state == State.ACQUIRED;
    }

    /**
     * @return 현재 스레드가 이 핸들로 락을 획득했고 아직 해제하지 않았으면 true
     */
    public boolean isHeldByCurrentThread() {
        return state == State.ACQUIRED && owner == Thread.currentThread();
    }

    public State state() {
        return state;
    }

    public LockMode mode() {
        return mode;
    }

    private void markAcquired() {
        owner = Thread.currentThread();
        state = State.ACQUIRED;
    }

    private void requireUnacquired() {
        if (state != State.UNACQUIRED) {
            throw new IllegalStateException("lock handle cannot be reused (current: " + state + ")");
        }
    }
}
