package com.ryuqq.guardmap.core.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * 컨테이너 접근을 보호하는 락 정책 SPI.
 *
 * <p>구현체는 생성 시점에 선택되며, 모든 구현은 같은 인터페이스를 따릅니다.</p>
 *
 * <ul>
 *   <li>{@link SharedExclusiveLockPolicy}: N readers XOR 1 writer</li>
 *   <li>{@link ExclusiveLockPolicy}: 읽기/쓰기 모두 직렬화</li>
 *   <li>{@link com.ryuqq.guardmap.core.lock.noop.NoOpLockPolicy}: 락 없음 (단일 스레드 전용)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * LockPolicy policy = LockPolicyType.SHARED_EXCLUSIVE.create();
 * try (LockHandle handle = policy.acquireRead()) {
 *     return container.find(key);
 * }
 * }</pre>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public interface LockPolicy {

    /**
     * 공유 락 획득 (블로킹).
     *
     * @return 보유 중인 핸들
     */
    LockHandle acquireRead();

    /**
     * 배타 락 획득 (블로킹).
     *
     * @return 보유 중인 핸들
     * @throws IllegalStateException 현재 스레드가 공유 락을 보유한 채 배타 락을 요청한 경우
     */
    LockHandle acquireWrite();

    /**
     * 공유 락 획득 시도 (비블로킹).
     *
     * @return 획득 시 핸들, 실패 시 empty
     */
    Optional<LockHandle> tryAcquireRead();

    /**
     * 배타 락 획득 시도 (비블로킹).
     *
     * @return 획득 시 핸들, 실패 시 empty
     */
    Optional<LockHandle> tryAcquireWrite();

    /**
     * 공유 락 획득 시도 (타임아웃 대기).
     *
     * @param timeout 최대 대기 시간
     * @return 획득 시 핸들, 타임아웃 시 empty
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    Optional<LockHandle> tryAcquireRead(Duration timeout) throws InterruptedException;

    /**
     * 배타 락 획득 시도 (타임아웃 대기).
     *
     * @param timeout 최대 대기 시간
     * @return 획득 시 핸들, 타임아웃 시 empty
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    Optional<LockHandle> tryAcquireWrite(Duration timeout) throws InterruptedException;

    /**
     * 전역 락 순서에 쓰이는 안정적인 식별자. 생성 순서대로 증가합니다.
     *
     * @return 인스턴스 ID
     */
    long instanceId();

    LockPolicyType type();

    /**
     * 모드에 따라 락을 획득합니다.
     *
     * @param mode 획득 모드
     * @return 보유 중인 핸들
     */
    default LockHandle acquire(LockMode mode) {
        return mode == LockMode.SHARED ? acquireRead() : acquireWrite();
    }
}
