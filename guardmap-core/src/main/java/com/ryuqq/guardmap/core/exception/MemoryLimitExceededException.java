package com.ryuqq.guardmap.core.exception;

/**
 * 퇴출(eviction)로도 쓰기에 필요한 공간을 확보하지 못한 경우.
 *
 * <p>이 예외가 발생한 쓰기는 컨테이너와 메모리 예산 어느 쪽도 변경하지 않습니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public class MemoryLimitExceededException extends GuardMapException {

    private final long requiredBytes;
    private final long allocatedBytes;
    private final long ceilingBytes;

    public MemoryLimitExceededException(long requiredBytes, long allocatedBytes, long ceilingBytes) {
        this(requiredBytes, allocatedBytes, ceilingBytes, null);
    }

    public MemoryLimitExceededException(
        long requiredBytes,
        long allocatedBytes,
        long ceilingBytes,
        ContainerStateSnapshot snapshot
    ) {
        super(
            "memory limit exceeded: required " + requiredBytes + " bytes, allocated "
                + allocatedBytes + " of " + ceilingBytes + " bytes",
            null,
            snapshot
        );
        this.requiredBytes = requiredBytes;
        this.allocatedBytes = allocatedBytes;
        this.ceilingBytes = ceilingBytes;
    }

    public long requiredBytes() {
        return requiredBytes;
    }

    public long allocatedBytes() {
        return allocatedBytes;
    }

    public long ceilingBytes() {
        return ceilingBytes;
    }

    /**
     * 예외와 동일한 수치를 유지한 채 스냅샷을 덧붙인 사본.
     *
     * @param snapshot 컨테이너 상태
     * @return 새 예외
     */
    public MemoryLimitExceededException withSnapshot(ContainerStateSnapshot snapshot) {
        return new MemoryLimitExceededException(requiredBytes, allocatedBytes, ceilingBytes, snapshot);
    }
}
