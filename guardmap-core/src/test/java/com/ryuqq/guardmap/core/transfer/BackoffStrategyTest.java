package com.ryuqq.guardmap.core.transfer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffStrategy / RetryPolicy 유닛 테스트.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
@DisplayName("BackoffStrategy 테스트")
class BackoffStrategyTest {

    @Test
    @DisplayName("선형 백오프는 initial × (i + 1)")
    void linear_선형_증가() {
        BackoffStrategy linear = BackoffStrategy.linear(Duration.ofSeconds(1));

        assertThat(linear.delayFor(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(linear.delayFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(linear.delayFor(2)).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    @DisplayName("고정 백오프는 순번과 무관하게 같은 지연")
    void fixed_고정_지연() {
        BackoffStrategy fixed = BackoffStrategy.fixed(Duration.ofMillis(250));

        assertThat(fixed.delayFor(0)).isEqualTo(Duration.ofMillis(250));
        assertThat(fixed.delayFor(5)).isEqualTo(Duration.ofMillis(250));
        assertThat(BackoffStrategy.none().delayFor(3)).isZero();
    }

    @Test
    @DisplayName("잘못된 설정은 거부된다")
    void 설정_검증() {
        assertThatThrownBy(() -> BackoffStrategy.linear(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("delay must be non-negative");
        assertThatThrownBy(() -> BackoffStrategy.fixed(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("RetryPolicy 기본값은 3회 시도, 1초 선형 백오프")
    void retryPolicy_기본값() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertThat(policy.maxAttempts()).isEqualTo(3);
        assertThat(policy.backoff().delayFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(RetryPolicy.noRetry().maxAttempts()).isEqualTo(1);
    }
}
