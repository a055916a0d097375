/**
 * 락 정책 패키지.
 *
 * <p>맵의 읽기/쓰기 동기화를 {@link com.ryuqq.guardmap.core.lock.LockPolicy} 뒤로 숨깁니다.
 * 획득한 락은 {@link com.ryuqq.guardmap.core.lock.LockHandle}로 표현되며 try-with-resources로 해제합니다.</p>
 *
 * <p><strong>제공 정책:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.guardmap.core.lock.SharedExclusiveLockPolicy} - N readers XOR 1 writer</li>
 *   <li>{@link com.ryuqq.guardmap.core.lock.ExclusiveLockPolicy} - 읽기도 배타적으로 직렬화</li>
 *   <li>{@link com.ryuqq.guardmap.core.lock.noop.NoOpLockPolicy} - 동기화 없음 (단일 스레드 전용)</li>
 * </ul>
 *
 * <p>두 맵을 동시에 잠가야 하는 연산은 {@link com.ryuqq.guardmap.core.lock.LockOrdering}을 사용합니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
package com.ryuqq.guardmap.core.lock;
