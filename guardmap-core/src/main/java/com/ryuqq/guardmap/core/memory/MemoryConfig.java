package com.ryuqq.guardmap.core.memory;

/**
 * 메모리 서브시스템 설정.
 *
 * <p>기본값:</p>
 * <ul>
 *   <li>ceilingBytes: {@link Long#MAX_VALUE} (사실상 무제한)</li>
 *   <li>fragmentationThresholdPct: 20.0</li>
 *   <li>checkIntervalOps: 1000</li>
 *   <li>maxEvictionAttempts: 10</li>
 * </ul>
 *
 * @param ceilingBytes 메모리 상한 (bytes)
 * @param fragmentationThresholdPct 단편화 임계값 (0~100)
 * @param checkIntervalOps 단편화 샘플링 주기
 * @param maxEvictionAttempts 한 번의 쓰기에서 퇴출할 수 있는 최대 엔트리 수
 * @author GuardMap Team
 * @since 1.0.0
 */
public record MemoryConfig(
    long ceilingBytes,
    double fragmentationThresholdPct,
    long checkIntervalOps,
    int maxEvictionAttempts
) {

    public static final long UNBOUNDED = Long.MAX_VALUE;
    public static final int DEFAULT_MAX_EVICTION_ATTEMPTS = 10;

    public MemoryConfig {
        if (ceilingBytes <= 0) {
            throw new IllegalArgumentException("ceilingBytes must be positive (current: " + ceilingBytes + ")");
        }
        if (Double.isNaN(fragmentationThresholdPct)
            || fragmentationThresholdPct < 0.0 || fragmentationThresholdPct > 100.0) {
            throw new IllegalArgumentException(
                "fragmentationThresholdPct must be between 0 and 100 (current: " + fragmentationThresholdPct + ")"
            );
        }
        if (checkIntervalOps <= 0) {
            throw new IllegalArgumentException("checkIntervalOps must be positive (current: " + checkIntervalOps + ")");
        }
        if (maxEvictionAttempts < 0) {
            throw new IllegalArgumentException(
                "maxEvictionAttempts must be non-negative (current: " + maxEvictionAttempts + ")"
            );
        }
    }

    public MemoryConfig() {
        this(
            UNBOUNDED,
            FragmentationMonitor.DEFAULT_THRESHOLD_PCT,
            FragmentationMonitor.DEFAULT_CHECK_INTERVAL_OPS,
            DEFAULT_MAX_EVICTION_ATTEMPTS
        );
    }

    public MemoryConfig withCeilingBytes(long ceilingBytes) {
        return new MemoryConfig(ceilingBytes, fragmentationThresholdPct, checkIntervalOps, maxEvictionAttempts);
    }

    public MemoryConfig withFragmentationThresholdPct(double thresholdPct) {
        return new MemoryConfig(ceilingBytes, thresholdPct, checkIntervalOps, maxEvictionAttempts);
    }

    public MemoryConfig withCheckIntervalOps(long intervalOps) {
        return new MemoryConfig(ceilingBytes, fragmentationThresholdPct, intervalOps, maxEvictionAttempts);
    }

    public MemoryConfig withMaxEvictionAttempts(int attempts) {
        return new MemoryConfig(ceilingBytes, fragmentationThresholdPct, checkIntervalOps, attempts);
    }
}
