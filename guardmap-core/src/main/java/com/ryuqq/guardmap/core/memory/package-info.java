/**
 * 메모리 예산 및 단편화 관리 패키지.
 *
 * <p>컨테이너가 보고하는 할당/해제량을 계측하고, 상한을 넘는 쓰기에 대해 LRU 퇴출을 계획합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.guardmap.core.memory.BudgetTracker} - 원자적 할당량 카운터와 상한</li>
 *   <li>{@link com.ryuqq.guardmap.core.memory.RecencyTracker} - 최근 사용 순서 (LRU)</li>
 *   <li>{@link com.ryuqq.guardmap.core.memory.FragmentationMonitor} - 주기적 단편화율 샘플링</li>
 *   <li>{@link com.ryuqq.guardmap.core.memory.ResourceManager} - 위 세 요소를 묶는 파사드</li>
 * </ul>
 *
 * <h2>쓰기 진입 규칙</h2>
 * <pre>
 * 1. 새 엔트리가 상한보다 크면 즉시 거부
 * 2. 부족분이 없으면 진입
 * 3. 부족분을 maxEvictionAttempts개 이내의 LRU 후보로 메울 수 있으면 필요한 만큼 퇴출
 * 4. 메울 수 없으면 아무것도 퇴출하지 않고 거부
 * </pre>
 *
 * <h2>단편화</h2>
 * <p>단편화율은 {@code freed / (live + freed) * 100}입니다. 임계값을 넘으면 정리 신호가 켜지며,
 * 신호는 {@code defragment()}가 호출될 때까지 유지됩니다. 정리 작업은 자동으로 실행되지 않습니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
package com.ryuqq.guardmap.core.memory;
