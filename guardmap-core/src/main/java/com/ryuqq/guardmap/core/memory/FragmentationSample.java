package com.ryuqq.guardmap.core.memory;

/**
 * 단편화 모니터의 시점 스냅샷.
 *
 * @param totalAllocated 현재 살아있는 할당량 (bytes)
 * @param totalFreed 마지막 정리 이후 누적 해제량 (bytes)
 * @param thresholdPct 정리 신호 임계값 (%)
 * @param checkIntervalOps 샘플링 주기 (할당 횟수)
 * @param needsDefrag 정리 필요 여부
 * @author GuardMap Team
 * @since 1.0.0
 */
public record FragmentationSample(
    long totalAllocated,
    long totalFreed,
    double thresholdPct,
    long checkIntervalOps,
    boolean needsDefrag
) {

    /**
     * 단편화율 (%).
     *
     * @return {@code freed / (allocated + freed) * 100}, 할당량이 0이면 0
     */
    public double fragmentationPct() {
        return FragmentationMonitor.ratio(totalAllocated, totalFreed);
    }
}
