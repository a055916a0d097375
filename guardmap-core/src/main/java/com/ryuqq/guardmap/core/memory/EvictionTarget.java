package com.ryuqq.guardmap.core.memory;

/**
 * 퇴출 대상 컨테이너에 대한 최소 인터페이스.
 *
 * <p>{@link #evict(Object)}로 제거된 엔트리의 바이트는 구현체가
 * {@link ResourceManager#recordFree(long)}로 반환해야 합니다 (보통 할당 훅 경유).</p>
 *
 * @param <K> 키 타입
 * @author GuardMap Team
 * @since 1.0.0
 */
public interface EvictionTarget<K> {

    /**
     * @param key 키
     * @return 해당 엔트리가 차지하는 바이트, 없으면 0
     */
    long sizeOf(K key);

    /**
     * @param key 제거할 키
     */
    void evict(K key);
}
