package com.ryuqq.guardmap.testkit.contract;

import com.ryuqq.guardmap.core.lock.LockHandle;
import com.ryuqq.guardmap.core.lock.LockPolicy;
import com.ryuqq.guardmap.core.lock.LockPolicyType;
import com.ryuqq.guardmap.core.lock.SharedExclusiveLockPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SharedExclusiveLockPolicy 계약 테스트.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
@DisplayName("SharedExclusiveLockPolicy 계약 테스트")
class SharedExclusiveLockPolicyContractTest extends AbstractLockPolicyContractTest {

    @Override
    protected LockPolicy createPolicy() {
        return new SharedExclusiveLockPolicy();
    }

    @Override
    protected LockPolicyType expectedType() {
        return LockPolicyType.SHARED_EXCLUSIVE;
    }

    @Test
    @DisplayName("읽기 락을 보유한 스레드는 쓰기 락으로 승격할 수 없다")
    void 읽기_락_보유_중_쓰기_승격_거부() {
        // given
        LockHandle read = policy.acquireRead();

        // when & then
        try {
            assertThatThrownBy(() -> policy.acquireWrite())
                .isInstanceOf(IllegalStateException.class);
        } finally {
            read.close();
        }
    }

    @Test
    @DisplayName("쓰기 락을 보유한 스레드는 읽기 락을 추가로 획득할 수 있다")
    void 쓰기_락_보유_중_읽기_재진입_허용() {
        // given
        SharedExclusiveLockPolicy sharedExclusive = (SharedExclusiveLockPolicy) policy;

        // when
        try (LockHandle write = policy.acquireWrite();
             LockHandle read = policy.acquireRead()) {

            // then
            assertThat(sharedExclusive.isWriteLocked()).isTrue();
            assertThat(sharedExclusive.readLockCount()).isEqualTo(1);
        }
        assertThat(sharedExclusive.isWriteLocked()).isFalse();
    }
}
