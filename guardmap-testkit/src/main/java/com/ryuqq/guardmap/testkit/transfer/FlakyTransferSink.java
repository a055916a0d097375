package com.ryuqq.guardmap.testkit.transfer;

import com.ryuqq.guardmap.core.exception.TransferErrorKind;
import com.ryuqq.guardmap.core.exception.TransferIOException;
import com.ryuqq.guardmap.core.spi.TransferSink;

import java.io.ByteArrayOutputStream;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 처음 N번의 쓰기를 지정한 오류로 실패시키고 이후에는 정상 기록하는 테스트용 Sink.
 *
 * <p>실패한 쓰기는 아무 바이트도 기록하지 않습니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public class FlakyTransferSink implements TransferSink {

    private final ByteArrayOutputStream written = new ByteArrayOutputStream();
    private final AtomicInteger remainingFailures;
    private final AtomicInteger writeAttempts = new AtomicInteger();
    private final AtomicInteger flushes = new AtomicInteger();
    private final TransferErrorKind failureKind;

    /**
     * 생성자.
     *
     * @param failures 실패시킬 쓰기 횟수
     * @param failureKind 실패 시 던질 오류 종류
     */
    public FlakyTransferSink(int failures, TransferErrorKind failureKind) {
        if (failures < 0) {
            throw new IllegalArgumentException("failures must be non-negative (current: " + failures + ")");
        }
        if (failureKind == null) {
            throw new IllegalArgumentException("failureKind cannot be null");
        }
        this.remainingFailures = new AtomicInteger(failures);
        this.failureKind = failureKind;
    }

    @Override
    public void write(byte[] frame) {
        writeAttempts.incrementAndGet();
        if (remainingFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new TransferIOException(failureKind);
        }
        synchronized (written) {
            written.writeBytes(frame);
        }
    }

    @Override
    public void flush() {
        flushes.incrementAndGet();
    }

    public byte[] written() {
        synchronized (written) {
            return written.toByteArray();
        }
    }

    public int writeAttempts() {
        return writeAttempts.get();
    }

    public int flushes() {
        return flushes.get();
    }
}
