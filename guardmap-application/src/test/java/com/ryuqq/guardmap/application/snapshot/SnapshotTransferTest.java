package com.ryuqq.guardmap.application.snapshot;

import com.ryuqq.guardmap.adapter.inmemory.container.InMemoryOrderedContainer;
import com.ryuqq.guardmap.adapter.inmemory.transfer.InMemoryTransferBuffer;
import com.ryuqq.guardmap.core.codec.Codecs;
import com.ryuqq.guardmap.core.exception.DataIntegrityException;
import com.ryuqq.guardmap.core.transfer.Envelope;
import com.ryuqq.guardmap.core.transfer.EnvelopeCodec;
import com.ryuqq.guardmap.core.transfer.ResilientChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SnapshotTransfer 유닛 테스트.
 *
 * <p>스트림 레이아웃과 손상된 헤더/레코드 거부를 검증합니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
@DisplayName("SnapshotTransfer 테스트")
class SnapshotTransferTest {

    private ResilientChannel channel;
    private SnapshotTransfer<String, Integer> transfer;

    @BeforeEach
    void setUp() {
        channel = new ResilientChannel();
        transfer = new SnapshotTransfer<>(channel, Codecs.utf8String(), Codecs.int32());
    }

    @AfterEach
    void tearDown() {
        channel.close();
    }

    private static byte[] longField(long value) {
        return ByteBuffer.allocate(Long.BYTES).putLong(value).array();
    }

    private static byte[] record(int keyLength, byte[] key, byte[] value) {
        return ByteBuffer.allocate(Integer.BYTES + key.length + value.length)
            .putInt(keyLength)
            .put(key)
            .put(value)
            .array();
    }

    private static InMemoryTransferBuffer framed(byte[]... payloads) {
        InMemoryTransferBuffer buffer = new InMemoryTransferBuffer();
        for (byte[] payload : payloads) {
            buffer.write(EnvelopeCodec.encode(Envelope.seal(payload)));
        }
        return buffer;
    }

    // ============================================================
    // 1. 레이아웃
    // ============================================================

    @Test
    void 헤더_세_필드_뒤에_레코드가_삽입_순서로_이어짐() {
        // given
        InMemoryOrderedContainer<String, Integer> container = new InMemoryOrderedContainer<>(32, 10);
        container.put("k1", 100);
        container.put("key2", 200);
        InMemoryTransferBuffer buffer = new InMemoryTransferBuffer();

        // when
        transfer.write(container, buffer);

        // then
        assertThat(ByteBuffer.wrap(EnvelopeCodec.readFrom(buffer).payload()).getLong()).isEqualTo(2L);
        assertThat(ByteBuffer.wrap(EnvelopeCodec.readFrom(buffer).payload()).getLong()).isEqualTo(10L);
        assertThat(ByteBuffer.wrap(EnvelopeCodec.readFrom(buffer).payload()).getLong()).isEqualTo(32L);

        ByteBuffer first = ByteBuffer.wrap(EnvelopeCodec.readFrom(buffer).payload());
        assertThat(first.getInt()).isEqualTo(2);
        byte[] key = new byte[2];
        first.get(key);
        assertThat(new String(key, StandardCharsets.UTF_8)).isEqualTo("k1");
        assertThat(first.getInt()).isEqualTo(100);
        assertThat(first.hasRemaining()).isFalse();

        assertThat(EnvelopeCodec.readFrom(buffer).payload()).hasSize(4 + 4 + 4);
        assertThat(buffer.remaining()).isZero();
    }

    @Test
    void 읽기는_헤더와_엔트리를_그대로_복원() {
        // given
        InMemoryTransferBuffer buffer = framed(
            longField(2), longField(8), longField(16),
            record(1, "a".getBytes(StandardCharsets.UTF_8), Codecs.int32().encode(1)),
            record(1, "b".getBytes(StandardCharsets.UTF_8), Codecs.int32().encode(2))
        );

        // when
        Snapshot<String, Integer> snapshot = transfer.read(buffer);

        // then
        assertThat(snapshot.size()).isEqualTo(2);
        assertThat(snapshot.maxSize()).isEqualTo(8);
        assertThat(snapshot.bucketCount()).isEqualTo(16);
        assertThat(snapshot.entries()).extracting(Map.Entry::getKey).containsExactly("a", "b");
        assertThat(snapshot.entries()).extracting(Map.Entry::getValue).containsExactly(1, 2);
    }

    @Test
    void 빈_키도_허용() {
        // given
        InMemoryTransferBuffer buffer = framed(
            longField(1), longField(1), longField(16),
            record(0, new byte[0], Codecs.int32().encode(7))
        );

        // when
        Snapshot<String, Integer> snapshot = transfer.read(buffer);

        // then
        assertThat(snapshot.entries().get(0).getKey()).isEmpty();
        assertThat(snapshot.entries().get(0).getValue()).isEqualTo(7);
    }

    // ============================================================
    // 2. 손상된 헤더
    // ============================================================

    @Test
    void 음수_크기는_거부() {
        InMemoryTransferBuffer buffer = framed(longField(-1), longField(10), longField(16));

        assertThatThrownBy(() -> transfer.read(buffer))
            .isInstanceOf(DataIntegrityException.class)
            .hasMessageContaining("invalid snapshot size");
    }

    @Test
    void 크기가_maxSize를_넘으면_거부() {
        InMemoryTransferBuffer buffer = framed(longField(5), longField(4), longField(16));

        assertThatThrownBy(() -> transfer.read(buffer))
            .isInstanceOf(DataIntegrityException.class)
            .hasMessageContaining("exceeds its maxSize");
    }

    @Test
    void 너비가_잘못된_헤더_필드는_거부() {
        InMemoryTransferBuffer buffer = framed(new byte[4]);

        assertThatThrownBy(() -> transfer.read(buffer))
            .isInstanceOf(DataIntegrityException.class)
            .hasMessageContaining("size field must be 8 bytes");
    }

    // ============================================================
    // 3. 손상된 레코드
    // ============================================================

    @Test
    void 키_길이가_레코드를_넘으면_거부() {
        InMemoryTransferBuffer buffer = framed(
            longField(1), longField(1), longField(16),
            record(100, "a".getBytes(StandardCharsets.UTF_8), Codecs.int32().encode(1))
        );

        assertThatThrownBy(() -> transfer.read(buffer))
            .isInstanceOf(DataIntegrityException.class)
            .hasMessageContaining("invalid key length 100");
    }

    @Test
    void 키_길이_헤더보다_짧은_레코드는_거부() {
        InMemoryTransferBuffer buffer = framed(longField(1), longField(1), longField(16), new byte[3]);

        assertThatThrownBy(() -> transfer.read(buffer))
            .isInstanceOf(DataIntegrityException.class)
            .hasMessageContaining("shorter than key length header");
    }

    @Test
    void 값을_디코딩할_수_없으면_DataIntegrityException() {
        InMemoryTransferBuffer buffer = framed(
            longField(1), longField(1), longField(16),
            record(1, "a".getBytes(StandardCharsets.UTF_8), new byte[3])
        );

        assertThatThrownBy(() -> transfer.read(buffer)).isInstanceOf(DataIntegrityException.class);
    }

    @Test
    void 같은_키의_레코드가_반복되면_거부() {
        InMemoryTransferBuffer buffer = framed(
            longField(3), longField(3), longField(16),
            record(1, "a".getBytes(StandardCharsets.UTF_8), Codecs.int32().encode(1)),
            record(1, "b".getBytes(StandardCharsets.UTF_8), Codecs.int32().encode(2)),
            record(1, "b".getBytes(StandardCharsets.UTF_8), Codecs.int32().encode(2))
        );

        assertThatThrownBy(() -> transfer.read(buffer))
            .isInstanceOf(DataIntegrityException.class)
            .hasMessageContaining("duplicate key in snapshot record 2");
    }

    @Test
    void 레코드_수가_헤더보다_적으면_거부() {
        InMemoryTransferBuffer buffer = framed(
            longField(2), longField(2), longField(16),
            record(1, "a".getBytes(StandardCharsets.UTF_8), Codecs.int32().encode(1))
        );

        assertThatThrownBy(() -> transfer.read(buffer)).isInstanceOf(DataIntegrityException.class);
    }
}
