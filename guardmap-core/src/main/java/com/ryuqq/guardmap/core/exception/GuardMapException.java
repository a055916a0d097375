package com.ryuqq.guardmap.core.exception;

import java.util.Optional;

/**
 * GuardMap 계층에서 발생하는 모든 예외의 최상위 타입.
 *
 * <p>Unchecked 예외로 정의하여 컨테이너 API 시그니처에 checked 예외가 전파되지 않도록 합니다.
 * 맵 수준에서 발생한 예외는 {@link ContainerStateSnapshot}을 함께 가질 수 있습니다.</p>
 *
 * <p><strong>하위 타입:</strong></p>
 * <ul>
 *   <li>{@link NullKeyException}: null 키 사용</li>
 *   <li>{@link KeyNotFoundException}: 존재하지 않는 키 조회</li>
 *   <li>{@link InvalidIteratorException}: 무효화된 반복자 사용</li>
 *   <li>{@link MemoryLimitExceededException}: 퇴출 후에도 메모리 상한 초과</li>
 *   <li>{@link AllocationFailureException}: 컨테이너 용량 초과</li>
 *   <li>{@link UninitializedCallableException}: sizer/codec 미설정</li>
 *   <li>{@link DataIntegrityException}: 체크섬 불일치 또는 손상된 프레임</li>
 *   <li>{@link OperationTimedOutException}: 전송 작업 시간 초과</li>
 *   <li>{@link RetryExhaustedException}: 재시도 소진</li>
 *   <li>{@link TransferIOException}: 전송 계층 I/O 실패</li>
 * </ul>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public class GuardMapException extends RuntimeException {

    private final transient ContainerStateSnapshot snapshot;

    public GuardMapException(String message) {
        this(message, null, null);
    }

    public GuardMapException(String message, Throwable cause) {
        this(message, cause, null);
    }

    /**
     * 상태 스냅샷을 포함하는 생성자.
     *
     * @param message 예외 메시지
     * @param cause 원인 (nullable)
     * @param snapshot 컨테이너 상태 스냅샷 (nullable)
     */
    public GuardMapException(String message, Throwable cause, ContainerStateSnapshot snapshot) {
        super(snapshot == null ? message : message + " [" + snapshot + "]", cause);
        this.snapshot = snapshot;
    }

    /**
     * 예외 발생 시점의 컨테이너 상태.
     *
     * @return 스냅샷 (맵 외부에서 발생한 경우 empty)
     */
    public Optional<ContainerStateSnapshot> snapshot() {
        return Optional.ofNullable(snapshot);
    }
}
