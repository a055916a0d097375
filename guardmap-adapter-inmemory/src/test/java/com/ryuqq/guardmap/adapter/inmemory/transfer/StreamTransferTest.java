package com.ryuqq.guardmap.adapter.inmemory.transfer;

import com.ryuqq.guardmap.core.exception.DataIntegrityException;
import com.ryuqq.guardmap.core.exception.TransferErrorKind;
import com.ryuqq.guardmap.core.exception.TransferIOException;
import com.ryuqq.guardmap.core.transfer.ResilientChannel;
import com.ryuqq.guardmap.core.transfer.RetryPolicy;
import com.ryuqq.guardmap.core.transfer.TransferConfig;
import com.ryuqq.guardmap.core.transfer.TransferErrorClassifier;
import com.ryuqq.guardmap.testkit.transfer.RecordingSleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Stream 기반 전송 어댑터 테스트.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
@DisplayName("StreamTransferSink / StreamTransferSource 테스트")
class StreamTransferTest {

    private RecordingSleeper sleeper;
    private ResilientChannel channel;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        TransferConfig config = new TransferConfig()
            .withTimeout(Duration.ofSeconds(5))
            .withRetryPolicy(RetryPolicy.linear(3, Duration.ofMillis(10)));
        channel = new ResilientChannel(config, sleeper, TransferErrorClassifier.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        channel.close();
    }

    @Test
    @DisplayName("파이프 양 끝에서 프레임을 주고받는다")
    void 파이프_왕복() throws IOException {
        // given
        PipedInputStream in = new PipedInputStream(64 * 1024);
        PipedOutputStream out = new PipedOutputStream(in);
        StreamTransferSink sink = new StreamTransferSink(out);
        StreamTransferSource source = new StreamTransferSource(in);

        // when
        channel.send(sink, new byte[]{1, 2, 3, 4});
        channel.flush(sink);

        // then
        assertThat(channel.receive(source)).containsExactly(1, 2, 3, 4);
    }

    @Test
    @DisplayName("스트림이 중간에 끝나면 DataIntegrityException")
    void 짧은_스트림() {
        // given
        StreamTransferSource source = new StreamTransferSource(new ByteArrayInputStream(new byte[3]));

        // when & then
        assertThatThrownBy(() -> source.readFully(8))
            .isInstanceOf(DataIntegrityException.class)
            .hasMessageContaining("unexpected end of stream");
    }

    @Test
    @DisplayName("연결 재설정 IOException은 재시도 가능한 TransferIOException으로 변환된다")
    void IOException_분류_변환() {
        // given
        StreamTransferSink sink = new StreamTransferSink(new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("Connection reset by peer");
            }
        });

        // when & then
        assertThatThrownBy(() -> sink.write(new byte[]{1}))
            .isInstanceOf(TransferIOException.class)
            .satisfies(e -> assertThat(((TransferIOException) e).kind())
                .isEqualTo(TransferErrorKind.CONNECTION_RESET));
    }

    @Test
    @DisplayName("일시적으로 실패하는 스트림은 재시도 후 한 번만 기록된다")
    void 일시적_실패_재시도() {
        // given
        ByteArrayOutputStream target = new ByteArrayOutputStream();
        int[] failures = {2};
        StreamTransferSink sink = new StreamTransferSink(new OutputStream() {
            @Override
            public void write(int b) {
                target.write(b);
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                if (failures[0]-- > 0) {
                    throw new IOException("Resource temporarily unavailable");
                }
                target.write(b, off, len);
            }
        });

        // when
        channel.send(sink, new byte[]{42});

        // then
        StreamTransferSource source = new StreamTransferSource(new ByteArrayInputStream(target.toByteArray()));
        assertThat(channel.receive(source)).containsExactly(42);
        assertThat(sleeper.delays()).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20));
    }
}
