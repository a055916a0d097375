package com.ryuqq.guardmap.core.memory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * FragmentationMonitor 유닛 테스트.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
@DisplayName("FragmentationMonitor 테스트")
class FragmentationMonitorTest {

    @Test
    @DisplayName("단편화율은 freed / (live + freed) 백분율이다")
    void fragmentationPct_계산() {
        // given
        FragmentationMonitor monitor = new FragmentationMonitor();
        monitor.recordAlloc(100);

        // when
        monitor.recordFree(25);

        // then: live 75, freed 25
        assertThat(monitor.fragmentationPct()).isCloseTo(25.0, within(0.001));
    }

    @Test
    @DisplayName("live 바이트가 0이면 단편화율은 0이다")
    void fragmentationPct_live_0() {
        // given
        FragmentationMonitor monitor = new FragmentationMonitor();
        monitor.recordAlloc(100);

        // when
        monitor.recordFree(100);

        // then
        assertThat(monitor.fragmentationPct()).isZero();
    }

    @Test
    @DisplayName("임계값 초과는 샘플링 시점에만 감지된다")
    void needsDefragmentation_샘플링_시점() {
        // given
        FragmentationMonitor monitor = new FragmentationMonitor(20.0, 3);
        monitor.recordAlloc(10);
        monitor.recordAlloc(10);
        monitor.recordFree(10);

        // then: 아직 2회 할당, 샘플 없음
        assertThat(monitor.needsDefragmentation()).isFalse();

        // when: 3번째 할당에서 샘플링 (live 20, freed 10 → 33%)
        monitor.recordAlloc(10);

        // then
        assertThat(monitor.needsDefragmentation()).isTrue();
    }

    @Test
    @DisplayName("정리 신호는 defragment 전까지 유지된다")
    void needsDefragmentation_고정() {
        // given
        FragmentationMonitor monitor = new FragmentationMonitor(20.0, 1);
        monitor.recordAlloc(10);
        monitor.recordFree(5);
        monitor.recordAlloc(5);
        assertThat(monitor.needsDefragmentation()).isTrue();

        // when: 단편화율이 낮아지는 할당이 이어져도
        for (int i = 0; i < 10; i++) {
            monitor.recordAlloc(1_000);
        }

        // then
        assertThat(monitor.needsDefragmentation()).isTrue();
    }

    @Test
    @DisplayName("defragment는 직전 샘플을 반환하고 해제 누적량과 신호를 초기화한다")
    void defragment_초기화() {
        // given
        FragmentationMonitor monitor = new FragmentationMonitor(20.0, 1);
        monitor.recordAlloc(100);
        monitor.recordFree(50);
        monitor.recordAlloc(10);

        // when
        FragmentationSample before = monitor.defragment();

        // then
        assertThat(before.needsDefrag()).isTrue();
        assertThat(before.totalFreed()).isEqualTo(50);
        assertThat(before.fragmentationPct()).isGreaterThan(20.0);
        assertThat(monitor.needsDefragmentation()).isFalse();
        assertThat(monitor.fragmentationPct()).isZero();
        assertThat(monitor.snapshot().totalAllocated()).isEqualTo(60);
    }

    @Test
    @DisplayName("설정 값 검증")
    void 설정_검증() {
        assertThatThrownBy(() -> new FragmentationMonitor(101.0, 10))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FragmentationMonitor(Double.NaN, 10))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FragmentationMonitor(20.0, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("checkIntervalOps must be positive");

        FragmentationMonitor monitor = new FragmentationMonitor();
        monitor.setThresholdPct(50.0);
        monitor.setCheckIntervalOps(7);
        assertThat(monitor.thresholdPct()).isEqualTo(50.0);
        assertThat(monitor.checkIntervalOps()).isEqualTo(7);
    }
}
