package com.ryuqq.guardmap.core.lock.noop;

import com.ryuqq.guardmap.core.lock.AbstractLockPolicy;
import com.ryuqq.guardmap.core.lock.LockPolicyType;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;

/**
 * LockPolicy NoOp 구현.
 *
 * <p>락을 적용하지 않습니다. 단일 스레드에서만 사용하거나, 외부에서 이미 동기화된 경우에 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>acquireRead()/acquireWrite(): 즉시 반환</li>
 *   <li>tryAcquire*(): 항상 성공</li>
 *   <li>핸들 상태 전이(ACQUIRED → RELEASED)는 그대로 검증</li>
 * </ul>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class NoOpLockPolicy extends AbstractLockPolicy {

    private static final Lock NO_OP_LOCK = new NoOpLock();

    @Override
    protected Lock sharedLock() {
        return NO_OP_LOCK;
    }

    @Override
    protected Lock exclusiveLock() {
        return NO_OP_LOCK;
    }

    @Override
    public LockPolicyType type() {
        return LockPolicyType.NONE;
    }

    private static final class NoOpLock implements Lock {

        @Override
        public void lock() {
            // NoOp
        }

        @Override
        public void lockInterruptibly() {
            // NoOp
        }

        @Override
        public boolean tryLock() {
            return true;
        }

        @Override
        public boolean tryLock(long time, TimeUnit unit) {
            return true;
        }

        @Override
        public void unlock() {
            // NoOp
        }

        @Override
        public Condition newCondition() {
            throw new UnsupportedOperationException("NoOpLock does not support conditions");
        }
    }
}
