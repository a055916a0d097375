package com.ryuqq.guardmap.core.exception;

/**
 * 전송 계층(sink/source)에서 발생한 I/O 실패.
 *
 * <p>{@link TransferErrorKind}로 재시도 가능 여부가 결정됩니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public class TransferIOException extends GuardMapException {

    private final TransferErrorKind kind;

    public TransferIOException(TransferErrorKind kind) {
        this(kind, kind.description(), null);
    }

    public TransferIOException(TransferErrorKind kind, String message, Throwable cause) {
        super(kind.name() + ": " + message, cause);
        this.kind = kind;
    }

    public TransferErrorKind kind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
