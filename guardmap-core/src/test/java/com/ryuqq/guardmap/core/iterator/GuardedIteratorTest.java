package com.ryuqq.guardmap.core.iterator;

import com.ryuqq.guardmap.core.exception.InvalidIteratorException;
import com.ryuqq.guardmap.core.lock.LockHandle;
import com.ryuqq.guardmap.core.lock.LockMode;
import com.ryuqq.guardmap.core.lock.SharedExclusiveLockPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * GuardedIterator 유닛 테스트.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
@DisplayName("GuardedIterator 테스트")
class GuardedIteratorTest {

    private SharedExclusiveLockPolicy policy;
    private ListBackedContainer container;
    private final List<GuardedIterator<String, Integer>> opened = new ArrayList<>();

    @BeforeEach
    void setUp() {
        policy = new SharedExclusiveLockPolicy();
        container = new ListBackedContainer();
        container.put("a", 1);
        container.put("b", 2);
        container.put("c", 3);
    }

    @AfterEach
    void tearDown() {
        opened.forEach(GuardedIterator::close);
    }

    private GuardedIterator<String, Integer> open(LockMode mode) {
        GuardedIterator<String, Integer> iterator =
            new GuardedIterator<>(container, () -> container, policy.acquire(mode));
        opened.add(iterator);
        return iterator;
    }

    // ============================================================
    // 1. 이동과 역참조
    // ============================================================

    @Test
    void 삽입_순서대로_순회() {
        // given
        GuardedIterator<String, Integer> iterator = open(LockMode.SHARED);
        List<String> keys = new ArrayList<>();

        // when
        while (iterator.hasNext()) {
            keys.add(iterator.next().getKey());
        }

        // then
        assertThat(keys).containsExactly("a", "b", "c");
        assertThat(iterator.atEnd()).isTrue();
    }

    @Test
    void 끝_위치에서_역참조와_전진은_실패() {
        // given
        GuardedIterator<String, Integer> iterator = open(LockMode.SHARED);
        iterator.advance(3);

        // when & then
        assertThatThrownBy(iterator::current).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(iterator::advance).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void 범위를_벗어난_이동은_실패하고_위치는_유지() {
        // given
        GuardedIterator<String, Integer> iterator = open(LockMode.SHARED);
        iterator.advance();

        // when & then
        assertThatThrownBy(() -> iterator.advance(3)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> iterator.advance(-2)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThat(iterator.position()).isEqualTo(1);

        iterator.retreat();
        assertThatThrownBy(iterator::retreat).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void 거리_비교_동일_위치() {
        // given
        GuardedIterator<String, Integer> first = open(LockMode.SHARED);
        GuardedIterator<String, Integer> second = open(LockMode.SHARED);

        // when
        second.advance(2);

        // then
        assertThat(first.distanceTo(second)).isEqualTo(2);
        assertThat(second.distanceTo(first)).isEqualTo(-2);
        assertThat(first.compareTo(second)).isNegative();
        assertThat(first.isAt(second)).isFalse();

        first.advance(2);
        assertThat(first.isAt(second)).isTrue();
        Map.Entry<String, Integer> entry = first.current();
        assertThat(entry.getKey()).isEqualTo("c");
    }

    // ============================================================
    // 2. 무효화
    // ============================================================

    @Test
    void invalidate_이후_모든_접근은_실패하지만_락은_유지() {
        // given
        GuardedIterator<String, Integer> iterator = open(LockMode.SHARED);

        // when
        iterator.invalidate();

        // then
        assertThat(iterator.isValid()).isFalse();
        assertThatThrownBy(iterator::current).isInstanceOf(InvalidIteratorException.class);
        assertThatThrownBy(iterator::advance).isInstanceOf(InvalidIteratorException.class);
        assertThat(policy.readLockCount()).isEqualTo(1);

        iterator.close();
        assertThat(policy.readLockCount()).isZero();
    }

    @Test
    void 다른_반복자가_무효화되면_거리_계산도_실패() {
        // given
        GuardedIterator<String, Integer> valid = open(LockMode.SHARED);
        GuardedIterator<String, Integer> invalid = open(LockMode.SHARED);
        invalid.invalidate();

        // when & then
        assertThatThrownBy(() -> valid.distanceTo(invalid)).isInstanceOf(InvalidIteratorException.class);
        assertThatThrownBy(() -> invalid.isAt(valid)).isInstanceOf(InvalidIteratorException.class);
    }

    @Test
    void 구조_변경이_감지되면_무효화() {
        // given
        GuardedIterator<String, Integer> iterator = open(LockMode.EXCLUSIVE);

        // when: 락 보유자가 반영하지 않은 변경
        container.erase("a");

        // then
        assertThat(iterator.isValid()).isFalse();
        assertThat(iterator.state()).isEqualTo(GuardedIterator.State.INVALIDATED);
    }

    @Test
    void 값_교체는_반복자를_무효화하지_않음() {
        // given
        GuardedIterator<String, Integer> iterator = open(LockMode.EXCLUSIVE);

        // when
        container.put("a", 100);

        // then
        assertThat(iterator.isValid()).isTrue();
        assertThat(iterator.current().getValue()).isEqualTo(100);
    }

    @Test
    void 배타_반복자는_변경을_반영하고_계속_사용() {
        // given
        GuardedIterator<String, Integer> iterator = open(LockMode.EXCLUSIVE);
        iterator.advance();

        // when
        container.erase("b");
        iterator.acknowledgeMutation();

        // then
        assertThat(iterator.isValid()).isTrue();
        assertThat(iterator.current().getKey()).isEqualTo("c");
    }

    @Test
    void 공유_반복자는_변경을_반영할_수_없음() {
        // given
        GuardedIterator<String, Integer> iterator = open(LockMode.SHARED);

        // when & then
        assertThatThrownBy(iterator::acknowledgeMutation).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 컨테이너가_교체되면_무효화() {
        // given
        ListBackedContainer[] current = {container};
        GuardedIterator<String, Integer> iterator =
            new GuardedIterator<>(container, () -> current[0], policy.acquireRead());
        opened.add(iterator);

        // when
        current[0] = new ListBackedContainer();

        // then
        assertThat(iterator.isValid()).isFalse();
    }

    // ============================================================
    // 3. 락 소유권
    // ============================================================

    @Test
    void transfer는_위치와_락을_승계() {
        // given
        GuardedIterator<String, Integer> original = open(LockMode.SHARED);
        original.advance();

        // when
        GuardedIterator<String, Integer> moved = original.transfer();
        opened.add(moved);

        // then
        assertThat(original.isValid()).isFalse();
        assertThat(moved.position()).isEqualTo(1);
        assertThat(policy.readLockCount()).isEqualTo(1);

        original.close();
        assertThat(policy.readLockCount()).isEqualTo(1);
        moved.close();
        assertThat(policy.readLockCount()).isZero();
    }

    @Test
    void close는_여러_번_호출해도_안전() {
        // given
        GuardedIterator<String, Integer> iterator = open(LockMode.EXCLUSIVE);

        // when
        iterator.close();
        iterator.close();

        // then
        assertThat(policy.isWriteLocked()).isFalse();
        assertThat(iterator.isValid()).isFalse();
    }

    @Test
    void 보유하지_않은_핸들로는_생성할_수_없음() {
        // given
        LockHandle released = policy.acquireRead();
        released.close();

        // when & then
        assertThatThrownBy(() -> new GuardedIterator<>(container, () -> container, released))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 다른_컨테이너의_반복자와는_비교할_수_없음() {
        // given
        ListBackedContainer other = new ListBackedContainer();
        GuardedIterator<String, Integer> mine = open(LockMode.SHARED);
        GuardedIterator<String, Integer> theirs =
            new GuardedIterator<>(other, () -> other, new SharedExclusiveLockPolicy().acquireRead());
        opened.add(theirs);

        // when & then
        assertThatThrownBy(() -> mine.distanceTo(theirs)).isInstanceOf(IllegalArgumentException.class);
    }
}
