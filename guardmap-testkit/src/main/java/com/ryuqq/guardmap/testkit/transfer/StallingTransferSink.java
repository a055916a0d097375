package com.ryuqq.guardmap.testkit.transfer;

import com.ryuqq.guardmap.core.exception.TransferErrorKind;
import com.ryuqq.guardmap.core.exception.TransferIOException;
import com.ryuqq.guardmap.core.spi.TransferSink;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link #release()}가 호출될 때까지 모든 쓰기를 멈춰 두는 테스트용 Sink.
 *
 * <p>타임아웃 동작 검증에 사용합니다. 멈춘 쓰기는 release 이후에 완료됩니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public class StallingTransferSink implements TransferSink {

    private final CountDownLatch started = new CountDownLatch(1);
    private final CountDownLatch released = new CountDownLatch(1);
    private final AtomicInteger completedWrites = new AtomicInteger();

    @Override
    public void write(byte[] frame) {
        started.countDown();
        try {
            released.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferIOException(TransferErrorKind.INTERRUPTED, "stalled write interrupted", e);
        }
        completedWrites.incrementAndGet();
    }

    @Override
    public void flush() {
        // 버퍼 없음
    }

    /**
     * 멈춘 쓰기를 모두 풀어 줍니다.
     */
    public void release() {
        released.countDown();
    }

    /**
     * 첫 쓰기가 시작될 때까지 기다립니다.
     *
     * @param timeout 최대 대기 시간
     * @return 시작되었으면 true
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public boolean awaitStarted(Duration timeout) throws InterruptedException {
        return started.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int completedWrites() {
        return completedWrites.get();
    }
}
