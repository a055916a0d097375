package com.ryuqq.guardmap.core.iterator;

import com.ryuqq.guardmap.core.exception.InvalidIteratorException;
import com.ryuqq.guardmap.core.lock.LockHandle;
import com.ryuqq.guardmap.core.lock.LockMode;
import com.ryuqq.guardmap.core.spi.OrderedContainer;

import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * 락과 1:1로 결합된 위치 기반 반복자.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * VALID ──invalidate()──────────▶ INVALIDATED
 * VALID ──transfer()────────────▶ INVALIDATED (새 인스턴스가 VALID와 락을 승계)
 * VALID ──close()───────────────▶ INVALIDATED (락 해제)
 * VALID ──컨테이너 구조 변경/교체──▶ INVALIDATED
 * </pre>
 *
 * <p>INVALIDATED 상태에서 역참조, 이동, 거리 계산, 비교를 시도하면
 * {@link InvalidIteratorException}이 발생합니다. 두 반복자를 사용하는 연산은 양쪽을 모두 먼저 검증합니다.</p>
 *
 * <p>{@link #invalidate()}는 락을 해제하지 않습니다. 락은 {@link #close()}에서만 해제됩니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 반복자는 생성한 스레드에서만 사용해야 합니다.</p>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class GuardedIterator<K, V>
    implements Iterator<Map.Entry<K, V>>, Comparable<GuardedIterator<K, V>>, AutoCloseable {

    /**
     * 반복자 상태.
     */
    public enum State {
        VALID,
        INVALIDATED
    }

    private final OrderedContainer<K, V> container;
    private final Supplier<OrderedContainer<K, V>> currentContainer;
    private LockHandle handle;
    private long expectedModCount;
    private int position;
    private State state;

    /**
     * 컨테이너의 첫 위치를 가리키는 반복자를 생성합니다.
     *
     * @param container 순회 대상 컨테이너
     * @param currentContainer 소유 맵이 현재 보유한 컨테이너 (swap 감지용)
     * @param handle 보유 중인 락 핸들
     * @throws IllegalStateException handle이 락을 보유하지 않은 경우
     */
    public GuardedIterator(
        OrderedContainer<K, V> container,
        Supplier<OrderedContainer<K, V>> currentContainer,
        LockHandle handle
    ) {
        this(container, currentContainer, handle, 0, container.modificationCount());
    }

    private GuardedIterator(
        OrderedContainer<K, V> container,
        Supplier<OrderedContainer<K, V>> currentContainer,
        LockHandle handle,
        int position,
        long expectedModCount
    ) {
        if (container == null || currentContainer == null) {
            throw new IllegalArgumentException("container cannot be null");
        }
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        handle.ensureHeld();
        this.container = container;
        this.currentContainer = currentContainer;
        this.handle = handle;
        this.position = position;
        this.expectedModCount = expectedModCount;
        this.state = State.VALID;
    }

    /**
     * 현재 위치의 엔트리.
     *
     * @return 엔트리
     * @throws InvalidIteratorException 무효화된 경우
     * @throws NoSuchElementException 끝 위치인 경우
     */
    public Map.Entry<K, V> current() {
        validate();
        if (position >= container.size()) {
            throw new NoSuchElementException("iterator is at end");
        }
        return container.entryAt(position);
    }

    /**
     * 다음 위치로 이동합니다.
     *
     * @throws NoSuchElementException 이미 끝 위치인 경우
     */
    public void advance() {
        validate();
        if (position >= container.size()) {
            throw new NoSuchElementException("cannot advance past end");
        }
        position++;
    }

    /**
     * {@code n}칸 이동합니다. 음수면 뒤로 이동합니다.
     *
     * @param n 이동량
     * @throws IndexOutOfBoundsException 결과 위치가 {@code [0, size]}를 벗어난 경우
     */
    public void advance(int n) {
        validate();
        long target = (long) position + n;
        if (target < 0 || target > container.size()) {
            throw new IndexOutOfBoundsException(
                "position out of range: " + target + " (size: " + container.size() + ")"
            );
        }
        position = (int) target;
    }

    /**
     * 이전 위치로 이동합니다.
     *
     * @throws NoSuchElementException 첫 위치인 경우
     */
    public void retreat() {
        validate();
        if (position == 0) {
            throw new NoSuchElementException("cannot retreat before begin");
        }
        position--;
    }

    /**
     * {@code other.position - this.position}.
     *
     * @param other 같은 컨테이너의 반복자
     * @return 위치 차이
     */
    public int distanceTo(GuardedIterator<K, V> other) {
        validateBoth(other);
        return other.position - position;
    }

    /**
     * 같은 위치를 가리키는지 확인합니다.
     *
     * @param other 같은 컨테이너의 반복자
     * @return 위치가 같으면 true
     */
    public boolean isAt(GuardedIterator<K, V> other) {
        validateBoth(other);
        return position == other.position;
    }

    @Override
    public int compareTo(GuardedIterator<K, V> other) {
        validateBoth(other);
        return Integer.compare(position, other.position);
    }

    public boolean atEnd() {
        validate();
        return position >= container.size();
    }

    public int position() {
        validate();
        return position;
    }

    @Override
    public boolean hasNext() {
        return !atEnd();
    }

    @Override
    public Map.Entry<K, V> next() {
        Map.Entry<K, V> entry = current();
        position++;
        return entry;
    }

    /**
     * 반복자를 명시적으로 무효화합니다. 락은 {@link #close()}까지 유지됩니다.
     */
    public void invalidate() {
        state = State.INVALIDATED;
    }

    /**
     * 위치와 락을 새 반복자로 이전합니다. 이 인스턴스는 무효화되고 더 이상 락을 소유하지 않습니다.
     *
     * @return 승계받은 반복자
     */
    public GuardedIterator<K, V> transfer() {
        validate();
        GuardedIterator<K, V> moved =
            new GuardedIterator<>(container, currentContainer, handle, position, expectedModCount);
        handle = null;
        state = State.INVALIDATED;
        return moved;
    }

    /**
     * 배타 모드 반복자의 소유자가 같은 락 아래에서 컨테이너를 변경한 뒤 호출합니다.
     * 현재 위치를 유지한 채 변경 횟수를 다시 기록합니다.
     *
     * @throws IllegalStateException 공유 모드 반복자인 경우
     */
    public void acknowledgeMutation() {
        if (state != State.VALID || handle == null || !handle.isHeld()) {
            throw new InvalidIteratorException("iterator is invalidated");
        }
        if (handle.mode() != LockMode.EXCLUSIVE) {
            throw new IllegalStateException("only exclusive iterators may mutate the container");
        }
        expectedModCount = container.modificationCount();
        position = Math.min(position, container.size());
    }

    /**
     * 락을 해제하고 반복자를 무효화합니다. 여러 번 호출해도 안전합니다.
     */
    @Override
    public void close() {
        state = State.INVALIDATED;
        if (handle != null && handle.isHeld()) {
            LockHandle held = handle;
            handle = null;
            held.close();
        }
    }

    public boolean isValid() {
        return state == State.VALID
            && handle != null
            && handle.isHeld()
            && currentContainer.get() == container
            && container.modificationCount() == expectedModCount;
    }

    public State state() {
        return isValid() ? State.VALID : State.INVALIDATED;
    }

    /**
     * @return 현재 스레드가 이 반복자의 락을 보유하고 있으면 true
     */
    public boolean isOwnedByCurrentThread() {
        return handle != null && handle.isHeldByCurrentThread();
    }

    public LockMode mode() {
        if (handle == null) {
            throw new InvalidIteratorException("iterator no longer owns a lock");
        }
        return handle.mode();
    }

    /**
     * 반복자가 가리키는 컨테이너. 소유 맵이 위치 기반 연산을 수행할 때 사용합니다.
     *
     * @param owner 확인할 컨테이너
     * @return 같은 컨테이너면 true
     */
    public boolean belongsTo(OrderedContainer<?, ?> owner) {
        return container == owner;
    }

    private void validate() {
        if (!isValid()) {
            state = State.INVALIDATED;
            throw new InvalidIteratorException("iterator is invalidated");
        }
    }

    private void validateBoth(GuardedIterator<K, V> other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        validate();
        other.validate();
        if (other.container != container) {
            throw new IllegalArgumentException("iterators belong to different containers");
        }
    }
}
