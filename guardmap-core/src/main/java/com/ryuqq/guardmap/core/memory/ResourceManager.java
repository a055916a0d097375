package com.ryuqq.guardmap.core.memory;

import com.ryuqq.guardmap.core.exception.MemoryLimitExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 메모리 예산, 최근 사용 순서, 단편화 모니터를 묶는 파사드.
 *
 * <p><strong>쓰기 진입 흐름 ({@link #admitWrite}):</strong></p>
 * <pre>
 * 1. net = required - released (기존 값 교체 시 released &gt; 0)
 * 2. allocated + net ≤ ceiling → 즉시 진입
 * 3. 초과 시 LRU 후보를 최대 maxEvictionAttempts개까지 수집 (쓰려는 키 제외)
 * 4. 후보 합계로 부족분을 메울 수 있으면 필요한 만큼만 퇴출 후 진입
 * 5. 메울 수 없으면 아무것도 퇴출하지 않고 MemoryLimitExceededException
 * </pre>
 *
 * <p><strong>동시성:</strong> {@link #admitWrite}와 {@link #enforceCeiling}은
 * 컨테이너 쓰기 락을 보유한 상태에서 호출되어야 합니다.
 * 나머지 연산은 스레드 안전합니다.</p>
 *
 * @param <K> 키 타입
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class ResourceManager<K> {

    private static final Logger log = LoggerFactory.getLogger(ResourceManager.class);

    private final BudgetTracker budget;
    private final RecencyTracker<K> recency;
    private final FragmentationMonitor fragmentation;
    private volatile int maxEvictionAttempts;

    public ResourceManager() {
        this(new MemoryConfig());
    }

    /**
     * 생성자.
     *
     * @param config 메모리 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ResourceManager(MemoryConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.budget = new BudgetTracker(config.ceilingBytes());
        this.recency = new RecencyTracker<>();
        this.fragmentation = new FragmentationMonitor(
            config.fragmentationThresholdPct(),
            config.checkIntervalOps()
        );
        this.maxEvictionAttempts = config.maxEvictionAttempts();
    }

    /**
     * 부수 효과 없이 {@code size} 바이트 추가 가능 여부를 판정합니다.
     *
     * @param size 필요한 바이트
     * @return 판정 결과
     */
    public Admission admit(long size) {
        return budget.fits(size) ? Admission.ADMITTED : Admission.REJECTED;
    }

    /**
     * 쓰기 진입. 필요하면 LRU 엔트리를 퇴출합니다.
     *
     * @param key 쓰려는 키 (퇴출 대상에서 제외)
     * @param requiredBytes 새 엔트리의 크기
     * @param releasedBytes 교체로 해제될 기존 엔트리의 크기 (신규면 0)
     * @param target 퇴출 대상 컨테이너
     * @return 퇴출된 키 목록 (LRU 순서)
     * @throws MemoryLimitExceededException 퇴출로도 공간을 확보하지 못한 경우 (상태 변경 없음)
     */
    public List<K> admitWrite(K key, long requiredBytes, long releasedBytes, EvictionTarget<K> target) {
        Objects.requireNonNull(target, "target");
        long ceiling = budget.ceilingBytes();
        long allocated = budget.allocatedBytes();

        if (requiredBytes > ceiling) {
            log.warn("Rejected write of {} bytes: larger than ceiling {}", requiredBytes, ceiling);
            throw new MemoryLimitExceededException(requiredBytes, allocated, ceiling);
        }

        long shortfall = allocated - releasedBytes + requiredBytes - ceiling;
        if (shortfall <= 0) {
            return List.of();
        }

        List<K> victims = planEviction(key, shortfall, maxEvictionAttempts, target);
        if (victims == null) {
            log.warn("Rejected write of {} bytes: shortfall {} not coverable by {} eviction candidates",
                requiredBytes, shortfall, maxEvictionAttempts);
            throw new MemoryLimitExceededException(requiredBytes, allocated, ceiling);
        }

        evictAll(victims, target);
        return victims;
    }

    /**
     * 상한을 낮춘 뒤 초과분을 LRU 순서로 퇴출합니다. 퇴출 개수 제한은 적용하지 않습니다.
     *
     * @param target 퇴출 대상 컨테이너
     * @return 퇴출된 키 목록
     */
    public List<K> enforceCeiling(EvictionTarget<K> target) {
        long shortfall = budget.allocatedBytes() - budget.ceilingBytes();
        if (shortfall <= 0) {
            return List.of();
        }
        List<K> victims = planEviction(null, shortfall, recency.size(), target);
        if (victims == null) {
            victims = recency.leastRecent(recency.size());
        }
        evictAll(victims, target);
        return victims;
    }

    /**
     * 퇴출 계획을 세웁니다. 부족분을 메울 수 없으면 null.
     */
    private List<K> planEviction(K excluded, long shortfall, int limit, EvictionTarget<K> target) {
        // 제외 키 하나를 건너뛸 여유
        List<K> candidates = recency.leastRecent(limit == Integer.MAX_VALUE ? limit : limit + 1);
        List<K> plan = new ArrayList<>();
        long freed = 0L;
        for (K candidate : candidates) {
            if (plan.size() >= limit) {
                break;
            }
            if (candidate.equals(excluded)) {
                continue;
            }
            plan.add(candidate);
            freed += target.sizeOf(candidate);
            if (freed >= shortfall) {
                return plan;
            }
        }
        return null;
    }

    private void evictAll(List<K> victims, EvictionTarget<K> target) {
        for (K victim : victims) {
            target.evict(victim);
            recency.remove(victim);
            log.debug("Evicted least recently used key {}", victim);
        }
    }

    public void touch(K key) {
        recency.touch(key);
    }

    public void forget(K key) {
        recency.remove(key);
    }

    /**
     * 퇴출 후보를 LRU 순서로 조회합니다. 상태는 변경하지 않습니다.
     *
     * @param n 최대 개수
     * @return 후보 키 목록
     */
    public List<K> evictCandidates(int n) {
        return recency.leastRecent(n);
    }

    public List<K> recencyOrder() {
        return recency.keysMostRecentFirst();
    }

    public void recordAlloc(long size) {
        budget.recordAlloc(size);
        fragmentation.recordAlloc(size);
    }

    public void recordFree(long size) {
        budget.recordFree(size);
        fragmentation.recordFree(size);
    }

    public boolean needsDefragmentation() {
        return fragmentation.needsDefragmentation();
    }

    /**
     * 정리 신호와 해제 누적량을 초기화합니다. 컨테이너 압축은 호출자가 수행합니다.
     *
     * @return 초기화 직전의 단편화 샘플
     */
    public FragmentationSample defragment() {
        FragmentationSample before = fragmentation.defragment();
        log.info("Defragmented: fragmentation was {}%", String.format("%.1f", before.fragmentationPct()));
        return before;
    }

    /**
     * 예산과 최근 사용 순서를 초기화합니다. 누적 단편화 통계는 유지됩니다.
     */
    public void clear() {
        budget.reset();
        recency.clear();
    }

    public long currentMemoryUsage() {
        return budget.allocatedBytes();
    }

    public long memoryCeiling() {
        return budget.ceilingBytes();
    }

    public void setMemoryCeiling(long ceilingBytes) {
        budget.setCeiling(ceilingBytes);
    }

    public double fragmentationRate() {
        return fragmentation.fragmentationPct();
    }

    public FragmentationSample fragmentationSample() {
        return fragmentation.snapshot();
    }

    public void setFragmentationThreshold(double thresholdPct) {
        fragmentation.setThresholdPct(thresholdPct);
    }

    public double fragmentationThreshold() {
        return fragmentation.thresholdPct();
    }

    public void setCheckInterval(long checkIntervalOps) {
        fragmentation.setCheckIntervalOps(checkIntervalOps);
    }

    public int maxEvictionAttempts() {
        return maxEvictionAttempts;
    }

    public void setMaxEvictionAttempts(int attempts) {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
        this.maxEvictionAttempts = attempts;
    }

    public int trackedKeys() {
        return recency.size();
    }
}
