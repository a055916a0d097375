package com.ryuqq.guardmap.core.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 두 정책의 배타 락을 전역 순서({@link LockPolicy#instanceId()} 오름차순)로 획득합니다.
 *
 * <p>호출 순서와 무관하게 항상 같은 순서로 획득하므로 {@code swap(a, b)}와 {@code swap(b, a)}가
 * 동시에 실행되어도 교착되지 않습니다. 같은 정책이면 한 번만 획득합니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class LockOrdering {

    private static final Logger log = LoggerFactory.getLogger(LockOrdering.class);

    private LockOrdering() {
    }

    /**
     * 두 배타 락을 순서대로 획득합니다.
     *
     * @param a 첫 번째 정책
     * @param b 두 번째 정책
     * @return 둘 다 보유 중인 핸들 쌍 (역순 해제)
     */
    public static PairedHandle acquireExclusive(LockPolicy a, LockPolicy b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("lock policies cannot be null");
        }
        if (a == b) {
            return new PairedHandle(a.acquireWrite(), null);
        }
        LockPolicy first = a.instanceId() <= b.instanceId() ? a : b;
        LockPolicy second = first == a ? b : a;
        log.debug("Acquiring paired exclusive locks in order {} -> {}", first, second);

        LockHandle firstHandle = first.acquireWrite();
        try {
            return new PairedHandle(firstHandle, second.acquireWrite());
        } catch (RuntimeException e) {
            firstHandle.close();
            throw e;
        }
    }

    /**
     * 두 개의 핸들을 묶어 역순으로 해제합니다.
     */
    public static final class PairedHandle implements AutoCloseable {

        private final LockHandle first;
        private final LockHandle second;

        private PairedHandle(LockHandle first, LockHandle second) {
            this.first = first;
            this.second = second;
        }

        public boolean isSingle() {
            return second == null;
        }

        @Override
        public void close() {
            try {
                if (second != null) {
                    second.close();
                }
            } finally {
                first.close();
            }
        }
    }
}
