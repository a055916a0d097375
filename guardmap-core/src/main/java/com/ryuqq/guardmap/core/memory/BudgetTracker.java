package com.ryuqq.guardmap.core.memory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 바이트 단위 메모리 예산 추적기.
 *
 * <p>하나의 {@link AtomicLong}으로 할당량을 정확히 계측합니다.
 * 해제량이 할당량보다 크면 0으로 포화되며, 음수가 되지 않습니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>모든 연산은 lock-free이며 여러 스레드에서 동시에 호출 가능</li>
 *   <li>{@link #fits(long)}와 {@link #recordAlloc(long)} 사이의 원자성은 보장하지 않음
 *       (호출자가 쓰기 락으로 직렬화)</li>
 * </ul>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class BudgetTracker {

    private final AtomicLong allocated = new AtomicLong();
    private volatile long ceiling;

    /**
     * 생성자.
     *
     * @param ceilingBytes 메모리 상한 (bytes, 양수)
     * @throws IllegalArgumentException ceilingBytes가 양수가 아닌 경우
     */
    public BudgetTracker(long ceilingBytes) {
        this.ceiling = validateCeiling(ceilingBytes);
    }

    /**
     * 추가 할당이 상한 내에 들어가는지 확인합니다.
     *
     * @param bytes 추가로 필요한 바이트
     * @return 상한 이내면 true
     */
    public boolean fits(long bytes) {
        long current = allocated.get();
        return bytes <= ceiling - current;
    }

    /**
     * 할당 기록. {@link Long#MAX_VALUE}에서 포화됩니다.
     *
     * @param bytes 할당된 바이트 (음수 불가)
     */
    public void recordAlloc(long bytes) {
        requireNonNegative(bytes);
        allocated.accumulateAndGet(bytes, (current, delta) -> {
            long sum = current + delta;
            return sum < 0 ? Long.MAX_VALUE : sum;
        });
    }

    /**
     * 해제 기록. 0에서 포화됩니다.
     *
     * @param bytes 해제된 바이트 (음수 불가)
     */
    public void recordFree(long bytes) {
        requireNonNegative(bytes);
        allocated.accumulateAndGet(bytes, (current, delta) -> Math.max(0L, current - delta));
    }

    public long allocatedBytes() {
        return allocated.get();
    }

    public long ceilingBytes() {
        return ceiling;
    }

    public long availableBytes() {
        return Math.max(0L, ceiling - allocated.get());
    }

    /**
     * 상한 변경. 현재 할당량보다 낮게 설정할 수 있으며, 이 경우 초과분 정리는 호출자 책임입니다.
     *
     * @param ceilingBytes 새 상한
     */
    public void setCeiling(long ceilingBytes) {
        this.ceiling = validateCeiling(ceilingBytes);
    }

    public void reset() {
        allocated.set(0L);
    }

    private static long validateCeiling(long ceilingBytes) {
        if (ceilingBytes <= 0) {
            throw new IllegalArgumentException(
                "ceilingBytes must be positive (current: " + ceilingBytes + ")"
            );
        }
        return ceilingBytes;
    }

    private static void requireNonNegative(long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("bytes must be non-negative (current: " + bytes + ")");
        }
    }
}
