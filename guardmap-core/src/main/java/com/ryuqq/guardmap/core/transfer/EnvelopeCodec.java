package com.ryuqq.guardmap.core.transfer;

import com.ryuqq.guardmap.core.exception.DataIntegrityException;
import com.ryuqq.guardmap.core.spi.TransferSource;

import java.nio.ByteBuffer;

/**
 * Envelope 와이어 포맷.
 *
 * <pre>
 * ┌────────────────┬────────────────┬──────────────────┐
 * │ CRC-32 (4B BE) │ Length (4B BE) │ Payload (Length) │
 * └────────────────┴────────────────┴──────────────────┘
 * </pre>
 *
 * <p>길이가 음수이거나 {@link #MAX_PAYLOAD_SIZE}를 넘으면 {@link DataIntegrityException}이 발생합니다.
 * 체크섬 검증은 {@link ResilientChannel#readFramed(Envelope)}에서 수행합니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class EnvelopeCodec {

    public static final int HEADER_SIZE = Integer.BYTES * 2;

    /** 16 MB */
    public static final int MAX_PAYLOAD_SIZE = 16 * 1024 * 1024;

    private EnvelopeCodec() {
    }

    public static byte[] encode(Envelope envelope) {
        byte[] payload = envelope.payload();
        return ByteBuffer.allocate(HEADER_SIZE + payload.length)
            .putInt(envelope.checksum())
            .putInt(payload.length)
            .put(payload)
            .array();
    }

    /**
     * 하나의 완전한 프레임을 디코딩합니다.
     *
     * @param frame 헤더를 포함한 프레임
     * @return Envelope (체크섬 미검증)
     * @throws DataIntegrityException 길이가 맞지 않는 경우
     */
    public static Envelope decode(byte[] frame) {
        if (frame.length < HEADER_SIZE) {
            throw new DataIntegrityException("frame shorter than header: " + frame.length + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(frame);
        int checksum = buffer.getInt();
        int length = validateLength(buffer.getInt());
        if (buffer.remaining() != length) {
            throw new DataIntegrityException(
                "frame length mismatch: header " + length + ", actual " + buffer.remaining()
            );
        }
        byte[] payload = new byte[length];
        buffer.get(payload);
        return new Envelope(checksum, payload);
    }

    /**
     * 소스에서 프레임 하나를 읽습니다.
     *
     * @param source 입력 소스
     * @return Envelope (체크섬 미검증)
     */
    public static Envelope readFrom(TransferSource source) {
        ByteBuffer header = ByteBuffer.wrap(source.readFully(HEADER_SIZE));
        int checksum = header.getInt();
        int length = validateLength(header.getInt());
        byte[] payload = length == 0 ? new byte[0] : source.readFully(length);
        return new Envelope(checksum, payload);
    }

    private static int validateLength(int length) {
        if (length < 0 || length > MAX_PAYLOAD_SIZE) {
            throw new DataIntegrityException(
                "invalid payload length: " + length + " (max: " + MAX_PAYLOAD_SIZE + ")"
            );
        }
        return length;
    }
}
