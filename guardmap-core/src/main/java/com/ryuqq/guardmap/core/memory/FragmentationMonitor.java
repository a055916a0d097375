package com.ryuqq.guardmap.core.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 할당/해제량을 샘플링하여 단편화 정리 신호를 발생시키는 모니터.
 *
 * <p><strong>동작:</strong></p>
 * <pre>
 * 1. recordAlloc() 호출마다 할당 횟수 증가
 * 2. 할당 횟수가 checkIntervalOps의 배수가 되면 단편화율 샘플링
 * 3. 단편화율 &gt; thresholdPct 이면 needsDefrag = true
 * 4. needsDefrag는 defragment() 호출 전까지 유지 (sticky)
 * </pre>
 *
 * <p>정리 작업 자체는 절대 자동으로 실행되지 않습니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class FragmentationMonitor {

    private static final Logger log = LoggerFactory.getLogger(FragmentationMonitor.class);

    public static final double DEFAULT_THRESHOLD_PCT = 20.0;
    public static final long DEFAULT_CHECK_INTERVAL_OPS = 1000L;

    private double thresholdPct;
    private long checkIntervalOps;

    private long totalAllocated;
    private long totalFreed;
    private long allocationCount;
    private boolean needsDefrag;

    public FragmentationMonitor() {
        this(DEFAULT_THRESHOLD_PCT, DEFAULT_CHECK_INTERVAL_OPS);
    }

    /**
     * 생성자.
     *
     * @param thresholdPct 임계값 (0~100)
     * @param checkIntervalOps 샘플링 주기 (양수)
     * @throws IllegalArgumentException 범위를 벗어난 경우
     */
    public FragmentationMonitor(double thresholdPct, long checkIntervalOps) {
        this.thresholdPct = validateThreshold(thresholdPct);
        this.checkIntervalOps = validateInterval(checkIntervalOps);
    }

    public synchronized void recordAlloc(long bytes) {
        totalAllocated = saturatingAdd(totalAllocated, bytes);
        allocationCount++;
        if (allocationCount % checkIntervalOps == 0) {
            sample();
        }
    }

    public synchronized void recordFree(long bytes) {
        totalAllocated = Math.max(0L, totalAllocated - bytes);
        totalFreed = saturatingAdd(totalFreed, bytes);
    }

    public synchronized boolean needsDefragmentation() {
        return needsDefrag;
    }

    public synchronized double fragmentationPct() {
        return ratio(totalAllocated, totalFreed);
    }

    /**
     * 정리 완료 처리. 해제 누적량과 정리 신호를 초기화합니다.
     *
     * @return 초기화 직전의 샘플
     */
    public synchronized FragmentationSample defragment() {
        FragmentationSample before = snapshot();
        totalFreed = 0L;
        needsDefrag = false;
        return before;
    }

    public synchronized FragmentationSample snapshot() {
        return new FragmentationSample(totalAllocated, totalFreed, thresholdPct, checkIntervalOps, needsDefrag);
    }

    public synchronized void setThresholdPct(double thresholdPct) {
        this.thresholdPct = validateThreshold(thresholdPct);
    }

    public synchronized void setCheckIntervalOps(long checkIntervalOps) {
        this.checkIntervalOps = validateInterval(checkIntervalOps);
    }

    public synchronized double thresholdPct() {
        return thresholdPct;
    }

    public synchronized long checkIntervalOps() {
        return checkIntervalOps;
    }

    private void sample() {
        double pct = ratio(totalAllocated, totalFreed);
        if (pct > thresholdPct && !needsDefrag) {
            needsDefrag = true;
            log.info("Fragmentation {}% exceeded threshold {}%, defragmentation recommended",
                String.format("%.1f", pct), thresholdPct);
        }
    }

    static double ratio(long allocated, long freed) {
        if (allocated == 0L) {
            return 0.0;
        }
        return (double) freed / ((double) allocated + (double) freed) * 100.0;
    }

    private static long saturatingAdd(long a, long b) {
        long sum = a + b;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }

    private static double validateThreshold(double thresholdPct) {
        if (Double.isNaN(thresholdPct) || thresholdPct < 0.0 || thresholdPct > 100.0) {
            throw new IllegalArgumentException(
                "thresholdPct must be between 0 and 100 (current: " + thresholdPct + ")"
            );
        }
        return thresholdPct;
    }

    private static long validateInterval(long checkIntervalOps) {
        if (checkIntervalOps <= 0) {
            throw new IllegalArgumentException(
                "checkIntervalOps must be positive (current: " + checkIntervalOps + ")"
            );
        }
        return checkIntervalOps;
    }
}
