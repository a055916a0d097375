package com.ryuqq.guardmap.core.transfer;

import com.ryuqq.guardmap.core.exception.OperationTimedOutException;
import com.ryuqq.guardmap.core.exception.TransferErrorKind;
import com.ryuqq.guardmap.core.exception.TransferIOException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * 전송 실패를 재시도 가능(true) 또는 치명적(false)으로 분류합니다.
 *
 * <p><strong>분류 순서:</strong></p>
 * <ol>
 *   <li>{@link TransferIOException}: 자신의 {@link TransferErrorKind}를 따름</li>
 *   <li>{@link OperationTimedOutException}: 재시도 가능</li>
 *   <li>{@link IOException} 계열: 타입과 메시지로 {@link TransferErrorKind} 판정</li>
 *   <li>그 외: 치명적</li>
 * </ol>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class TransferErrorClassifier implements Predicate<Throwable> {

    public static final TransferErrorClassifier INSTANCE = new TransferErrorClassifier();

    @Override
    public boolean test(Throwable failure) {
        if (failure instanceof TransferIOException) {
            return ((TransferIOException) failure).isRetryable();
        }
        if (failure instanceof OperationTimedOutException) {
            return true;
        }
        if (failure instanceof UncheckedIOException && failure.getCause() != null) {
            return kindOf(failure.getCause()).isRetryable();
        }
        if (failure instanceof IOException) {
            return kindOf(failure).isRetryable();
        }
        return false;
    }

    /**
     * 예외를 {@link TransferErrorKind}로 매핑합니다.
     *
     * @param failure 실패 원인
     * @return 분류 결과 (알 수 없으면 OTHER)
     */
    public static TransferErrorKind kindOf(Throwable failure) {
        if (failure instanceof TransferIOException) {
            return ((TransferIOException) failure).kind();
        }
        if (failure instanceof SocketTimeoutException) {
            return TransferErrorKind.TIMED_OUT;
        }
        if (failure instanceof ConnectException) {
            return TransferErrorKind.CONNECTION_REFUSED;
        }
        if (failure instanceof NoRouteToHostException) {
            return TransferErrorKind.NETWORK_UNREACHABLE;
        }
        if (failure instanceof InterruptedIOException) {
            return TransferErrorKind.INTERRUPTED;
        }
        String message = failure.getMessage();
        if (message == null) {
            return TransferErrorKind.OTHER;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("connection reset")) {
            return TransferErrorKind.CONNECTION_RESET;
        }
        if (lower.contains("connection aborted") || lower.contains("software caused connection abort")) {
            return TransferErrorKind.CONNECTION_ABORTED;
        }
        if (lower.contains("temporarily unavailable") || lower.contains("try again")) {
            return TransferErrorKind.TEMPORARILY_UNAVAILABLE;
        }
        if (lower.contains("timed out")) {
            return TransferErrorKind.TIMED_OUT;
        }
        if (lower.contains("interrupted")) {
            return TransferErrorKind.INTERRUPTED;
        }
        if (lower.contains("connection refused")) {
            return TransferErrorKind.CONNECTION_REFUSED;
        }
        if (lower.contains("network is unreachable")) {
            return TransferErrorKind.NETWORK_UNREACHABLE;
        }
        if (lower.contains("cannot assign requested address") || lower.contains("address not available")) {
            return TransferErrorKind.ADDRESS_UNAVAILABLE;
        }
        return TransferErrorKind.OTHER;
    }

    /**
     * checked 예외를 {@link TransferIOException}으로 감쌉니다. unchecked 예외는 그대로 반환합니다.
     *
     * @param failure 실패 원인
     * @return 던질 수 있는 unchecked 예외
     */
    public static RuntimeException toUnchecked(Throwable failure) {
        if (failure instanceof UncheckedIOException && failure.getCause() != null) {
            return toUnchecked(failure.getCause());
        }
        if (failure instanceof RuntimeException) {
            return (RuntimeException) failure;
        }
        TransferErrorKind kind = kindOf(failure);
        return new TransferIOException(kind, String.valueOf(failure.getMessage()), failure);
    }
}
