package com.ryuqq.guardmap.core.transfer;

import com.ryuqq.guardmap.core.exception.DataIntegrityException;
import com.ryuqq.guardmap.core.exception.GuardMapException;
import com.ryuqq.guardmap.core.exception.OperationTimedOutException;
import com.ryuqq.guardmap.core.exception.RetryExhaustedException;
import com.ryuqq.guardmap.core.spi.TransferSink;
import com.ryuqq.guardmap.core.spi.TransferSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * 타임아웃, 분류 기반 재시도, 체크섬 프레이밍을 제공하는 전송 채널.
 *
 * <p><strong>타임아웃:</strong></p>
 * <ul>
 *   <li>작업은 채널 전용 스레드에서 실행되고 호출자는 Future를 최대 timeout만큼 기다림</li>
 *   <li>만료 시 호출자는 {@link OperationTimedOutException}을 받음</li>
 *   <li>실행 중인 작업은 인터럽트되지 않고 버려짐
 *       (협조적 중단이 필요하면 {@link #callWithTimeout(CancellableWork, Duration)} 사용)</li>
 * </ul>
 *
 * <p><strong>재시도:</strong></p>
 * <pre>
 * attempt 1 실패 (retryable) → sleep(backoff(0)) → attempt 2 실패 → sleep(backoff(1)) → ...
 * maxAttempts번 실패 → RetryExhaustedException(마지막 원인)
 * 치명적 실패 → 즉시 전파 (시도 횟수 소모 없음)
 * </pre>
 *
 * <p><strong>무결성:</strong> 모든 필드는 CRC-32가 붙은 {@link Envelope}으로 전송되며,
 * 검증에 실패하면 부분 데이터 없이 {@link DataIntegrityException}이 발생합니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class ResilientChannel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilientChannel.class);
    private static final long SHUTDOWN_GRACE_SECONDS = 5;
    private static final AtomicInteger CHANNEL_SEQUENCE = new AtomicInteger();

    private final TransferConfig config;
    private final Sleeper sleeper;
    private final Predicate<Throwable> retryable;
    private final ExecutorService executor;

    public ResilientChannel() {
        this(new TransferConfig());
    }

    public ResilientChannel(TransferConfig config) {
        this(config, Sleeper.SYSTEM, TransferErrorClassifier.INSTANCE);
    }

    /**
     * 생성자.
     *
     * @param config 전송 설정
     * @param sleeper 재시도 대기 구현
     * @param retryable 재시도 가능 여부 분류기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ResilientChannel(TransferConfig config, Sleeper sleeper, Predicate<Throwable> retryable) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (retryable == null) {
            throw new IllegalArgumentException("retryable cannot be null");
        }
        this.config = config;
        this.sleeper = sleeper;
        this.retryable = retryable;
        this.executor = Executors.newCachedThreadPool(daemonThreads());
    }

    /**
     * 제한 시간 내에 작업 결과를 기다립니다.
     *
     * @param work 작업
     * @param timeout 제한 시간
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws OperationTimedOutException 제한 시간 초과 (작업은 버려짐)
     */
    public <T> T callWithTimeout(Callable<T> work, Duration timeout) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        return await(executor.submit(work), timeout, null);
    }

    /**
     * 협조적 취소 토큰을 전달하는 타임아웃 실행. 만료 시 토큰이 취소 상태가 됩니다.
     *
     * @param work 작업
     * @param timeout 제한 시간
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws OperationTimedOutException 제한 시간 초과
     */
    public <T> T callWithTimeout(CancellableWork<T> work, Duration timeout) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        CancellationToken token = new CancellationToken();
        return await(executor.submit(() -> work.call(token)), timeout, token);
    }

    private <T> T await(Future<T> future, Duration timeout, CancellationToken token) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            // false: 실행 중인 작업은 인터럽트하지 않음
            future.cancel(false);
            if (token != null) {
                token.cancel();
            }
            log.warn("Transfer operation timed out after {}ms, abandoning in-flight work", timeout.toMillis());
            throw new OperationTimedOutException(timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw TransferErrorClassifier.toUnchecked(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            throw new GuardMapException("Interrupted while waiting for transfer", e);
        }
    }

    /**
     * 기본 재시도 정책으로 작업을 실행합니다.
     *
     * @param work 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     */
    public <T> T callWithRetry(Callable<T> work) {
        return callWithRetry(work, config.retryPolicy());
    }

    /**
     * 재시도 가능한 실패를 정책에 따라 재시도합니다.
     *
     * @param work 작업
     * @param policy 재시도 정책
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws RetryExhaustedException 재시도 가능한 실패가 maxAttempts번 누적된 경우
     * @throws GuardMapException 작업이 인터럽트된 경우 (인터럽트 상태는 복원됨)
     */
    public <T> T callWithRetry(Callable<T> work, RetryPolicy policy) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        RetryState state = new RetryState(policy.maxAttempts());
        while (true) {
            state.startAttempt();
            try {
                return work.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GuardMapException("Interrupted during transfer attempt " + state.attempt(), e);
            } catch (Exception e) {
                if (!retryable.test(e)) {
                    throw TransferErrorClassifier.toUnchecked(e);
                }
                state.recordFailure(e);
                if (state.isExhausted()) {
                    log.error("Transfer failed after {} attempts", state.attempt(), e);
                    throw new RetryExhaustedException(state.attempt(), e);
                }
                Duration delay = policy.backoff().delayFor(state.attempt() - 1);
                state.recordDelay(delay);
                log.warn("Retryable transfer failure ({}), retrying in {}ms: {}",
                    state, delay.toMillis(), e.getMessage());
                pause(delay);
            }
        }
    }

    /**
     * 페이로드에 체크섬을 붙입니다.
     *
     * @param payload 페이로드
     * @return Envelope
     */
    public Envelope writeFramed(byte[] payload) {
        return Envelope.seal(payload);
    }

    /**
     * 체크섬을 검증하고 페이로드를 반환합니다.
     *
     * @param envelope 수신한 Envelope
     * @return 페이로드 사본
     * @throws DataIntegrityException 체크섬 불일치
     */
    public byte[] readFramed(Envelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        if (!envelope.isIntact()) {
            throw new DataIntegrityException(
                "checksum mismatch: expected " + Integer.toHexString(envelope.checksum())
                    + ", payload length " + envelope.length()
            );
        }
        return envelope.payload();
    }

    /**
     * 페이로드를 프레임으로 감싸 전송합니다. 각 시도는 timeout으로 제한되고 실패는 재시도됩니다.
     *
     * @param sink 출력 대상
     * @param payload 페이로드
     */
    public void send(TransferSink sink, byte[] payload) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        byte[] frame = EnvelopeCodec.encode(writeFramed(payload));
        callWithRetry(() -> callWithTimeout(() -> {
            sink.write(frame);
            return null;
        }, config.timeout()));
    }

    /**
     * 프레임 하나를 수신하고 검증합니다.
     *
     * @param source 입력 소스
     * @return 검증된 페이로드
     * @throws DataIntegrityException 프레임이 손상된 경우
     */
    public byte[] receive(TransferSource source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        Envelope envelope = callWithRetry(
            () -> callWithTimeout(() -> EnvelopeCodec.readFrom(source), config.timeout())
        );
        return readFramed(envelope);
    }

    /**
     * 출력 대상을 flush합니다. 재시도와 timeout이 적용됩니다.
     *
     * @param sink 출력 대상
     */
    public void flush(TransferSink sink) {
        callWithRetry(() -> callWithTimeout(() -> {
            sink.flush();
            return null;
        }, config.timeout()));
    }

    public TransferConfig config() {
        return config;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Abandoned transfer work still running after {}s, forcing shutdown",
                    SHUTDOWN_GRACE_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private void pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GuardMapException("Retry backoff interrupted", e);
        }
    }

    private static ThreadFactory daemonThreads() {
        int channelId = CHANNEL_SEQUENCE.incrementAndGet();
        AtomicInteger threadSequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable,
                "guardmap-transfer-" + channelId + "-" + threadSequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
