package com.ryuqq.guardmap.core.exception;

/**
 * 예외 발생 시점의 컨테이너 상태 스냅샷.
 *
 * <p>진단 목적으로만 사용되며, 예외 메시지에 함께 출력됩니다.</p>
 *
 * @param size 저장된 엔트리 수
 * @param maxSize 컨테이너가 수용 가능한 최대 엔트리 수
 * @param bucketCount 현재 버킷 수
 * @param memoryUsage 현재 계측된 메모리 사용량 (bytes)
 * @param memoryCeiling 메모리 상한 (bytes)
 * @author GuardMap Team
 * @since 1.0.0
 */
public record ContainerStateSnapshot(
    long size,
    long maxSize,
    long bucketCount,
    long memoryUsage,
    long memoryCeiling
) {

    @Override
    public String toString() {
        return "size=" + size
            + ", maxSize=" + maxSize
            + ", bucketCount=" + bucketCount
            + ", memory=" + memoryUsage + "/" + memoryCeiling;
    }
}
