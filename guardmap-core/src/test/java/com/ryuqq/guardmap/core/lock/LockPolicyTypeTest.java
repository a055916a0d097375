package com.ryuqq.guardmap.core.lock;

import com.ryuqq.guardmap.core.lock.noop.NoOpLockPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LockPolicyType 유닛 테스트.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
@DisplayName("LockPolicyType 테스트")
class LockPolicyTypeTest {

    @Test
    @DisplayName("설정 값은 대소문자와 밑줄 표기를 허용한다")
    void fromConfigValue_정규화() {
        assertThat(LockPolicyType.fromConfigValue("shared-exclusive")).isEqualTo(LockPolicyType.SHARED_EXCLUSIVE);
        assertThat(LockPolicyType.fromConfigValue("SHARED_EXCLUSIVE")).isEqualTo(LockPolicyType.SHARED_EXCLUSIVE);
        assertThat(LockPolicyType.fromConfigValue(" Exclusive ")).isEqualTo(LockPolicyType.EXCLUSIVE);
        assertThat(LockPolicyType.fromConfigValue("none")).isEqualTo(LockPolicyType.NONE);
    }

    @Test
    @DisplayName("알 수 없는 값은 거부된다")
    void fromConfigValue_거부() {
        assertThatThrownBy(() -> LockPolicyType.fromConfigValue("optimistic"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("optimistic");
        assertThatThrownBy(() -> LockPolicyType.fromConfigValue(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("create는 유형에 맞는 새 정책 인스턴스를 만든다")
    void create_정책_생성() {
        assertThat(LockPolicyType.SHARED_EXCLUSIVE.create()).isInstanceOf(SharedExclusiveLockPolicy.class);
        assertThat(LockPolicyType.EXCLUSIVE.create()).isInstanceOf(ExclusiveLockPolicy.class);
        assertThat(LockPolicyType.NONE.create()).isInstanceOf(NoOpLockPolicy.class);
        assertThat(LockPolicyType.EXCLUSIVE.create()).isNotSameAs(LockPolicyType.EXCLUSIVE.create());
    }
}
