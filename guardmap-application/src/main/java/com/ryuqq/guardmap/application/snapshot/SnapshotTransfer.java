package com.ryuqq.guardmap.application.snapshot;

import com.ryuqq.guardmap.core.exception.DataIntegrityException;
import com.ryuqq.guardmap.core.spi.Codec;
import com.ryuqq.guardmap.core.spi.OrderedContainer;
import com.ryuqq.guardmap.core.spi.TransferSink;
import com.ryuqq.guardmap.core.spi.TransferSource;
import com.ryuqq.guardmap.core.transfer.ResilientChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 컨테이너 전체 스냅샷의 쓰기/읽기.
 *
 * <p><strong>스트림 구성 (각 항목이 하나의 Envelope):</strong></p>
 * <pre>
 * 1. size         (8B long)
 * 2. maxSize      (8B long)
 * 3. bucketCount  (8B long)
 * 4. record × size: [keyLen (4B)][key bytes][value bytes]
 * </pre>
 *
 * <p>읽기는 전체 스트림을 검증한 뒤에만 결과를 반환합니다.
 * 중간에 실패하면 부분 결과 없이 예외가 전파됩니다.</p>
 *
 * <p>원본 컨테이너의 키는 유일하므로 같은 키의 레코드가 두 번 나오면 손상된 스트림으로 판단합니다.
 * 타임아웃으로 버려진 쓰기가 늦게 완료되고 재시도가 같은 프레임을 다시 쓰면 이런 중복이 생깁니다.</p>
 *
 * <p>락은 호출자(GuardedMap)가 보유합니다.</p>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class SnapshotTransfer<K, V> {

    private static final Logger log = LoggerFactory.getLogger(SnapshotTransfer.class);
    private static final int INITIAL_CAPACITY_LIMIT = 1024;

    private final ResilientChannel channel;
    private final Codec<K> keyCodec;
    private final Codec<V> valueCodec;

    public SnapshotTransfer(ResilientChannel channel, Codec<K> keyCodec, Codec<V> valueCodec) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (keyCodec == null || valueCodec == null) {
            throw new IllegalArgumentException("codecs cannot be null");
        }
        this.channel = channel;
        this.keyCodec = keyCodec;
        this.valueCodec = valueCodec;
    }

    /**
     * 컨테이너 내용을 삽입 순서대로 전송합니다.
     *
     * @param container 원본 컨테이너
     * @param sink 출력 대상
     */
    public void write(OrderedContainer<K, V> container, TransferSink sink) {
        int size = container.size();
        channel.send(sink, encodeLong(size));
        channel.send(sink, encodeLong(container.maxSize()));
        channel.send(sink, encodeLong(container.bucketCount()));
        for (int i = 0; i < size; i++) {
            Map.Entry<K, V> entry = container.entryAt(i);
            channel.send(sink, encodeRecord(entry.getKey(), entry.getValue()));
        }
        channel.flush(sink);
        log.info("Snapshot written: {} entries", size);
    }

    /**
     * 스냅샷 전체를 읽고 검증합니다.
     *
     * @param source 입력 소스
     * @return 검증된 스냅샷
     * @throws DataIntegrityException 체크섬 또는 구조가 잘못되었거나 키가 중복된 경우
     */
    public Snapshot<K, V> read(TransferSource source) {
        long size = decodeLong(channel.receive(source), "size");
        long maxSize = decodeLong(channel.receive(source), "maxSize");
        long bucketCount = decodeLong(channel.receive(source), "bucketCount");
        if (size < 0 || size > Integer.MAX_VALUE) {
            throw new DataIntegrityException("invalid snapshot size: " + size);
        }
        if (bucketCount < 0 || bucketCount > Integer.MAX_VALUE) {
            throw new DataIntegrityException("invalid snapshot bucket count: " + bucketCount);
        }
        if (maxSize < size) {
            throw new DataIntegrityException("snapshot size " + size + " exceeds its maxSize " + maxSize);
        }

        int initialCapacity = (int) Math.min(size, INITIAL_CAPACITY_LIMIT);
        List<Map.Entry<K, V>> entries = new ArrayList<>(initialCapacity);
        Set<K> seen = new HashSet<>(initialCapacity * 2);
        for (long i = 0; i < size; i++) {
            Map.Entry<K, V> entry = decodeRecord(channel.receive(source));
            if (!seen.add(entry.getKey())) {
                throw new DataIntegrityException("duplicate key in snapshot record " + i + " of " + size);
            }
            entries.add(entry);
        }
        log.info("Snapshot read: {} entries", size);
        return new Snapshot<>(size, maxSize, bucketCount, entries);
    }

    private byte[] encodeRecord(K key, V value) {
        byte[] keyBytes = keyCodec.encode(key);
        byte[] valueBytes = valueCodec.encode(value);
        return ByteBuffer.allocate(Integer.BYTES + keyBytes.length + valueBytes.length)
            .putInt(keyBytes.length)
            .put(keyBytes)
            .put(valueBytes)
            .array();
    }

    private Map.Entry<K, V> decodeRecord(byte[] payload) {
        if (payload.length < Integer.BYTES) {
            throw new DataIntegrityException("record shorter than key length header: " + payload.length);
        }
        ByteBuffer buffer = ByteBuffer.wrap(payload);
        int keyLength = buffer.getInt();
        if (keyLength < 0 || keyLength > buffer.remaining()) {
            throw new DataIntegrityException(
                "invalid key length " + keyLength + " in record of " + payload.length + " bytes"
            );
        }
        byte[] keyBytes = new byte[keyLength];
        buffer.get(keyBytes);
        byte[] valueBytes = new byte[buffer.remaining()];
        buffer.get(valueBytes);
        try {
            return new AbstractMap.SimpleImmutableEntry<>(keyCodec.decode(keyBytes), valueCodec.decode(valueBytes));
        } catch (DataIntegrityException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DataIntegrityException("failed to decode record: " + e.getMessage(), e);
        }
    }

    private static byte[] encodeLong(long value) {
        return ByteBuffer.allocate(Long.BYTES).putLong(value).array();
    }

    private static long decodeLong(byte[] payload, String field) {
        if (payload.length != Long.BYTES) {
            throw new DataIntegrityException(
                field + " field must be " + Long.BYTES + " bytes (current: " + payload.length + ")"
            );
        }
        return ByteBuffer.wrap(payload).getLong();
    }
}
