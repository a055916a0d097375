package com.ryuqq.guardmap.adapter.inmemory.transfer;

import com.ryuqq.guardmap.core.exception.DataIntegrityException;
import com.ryuqq.guardmap.core.spi.TransferSink;
import com.ryuqq.guardmap.core.spi.TransferSource;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * 프로세스 내부 전송 버퍼. 쓰기 쪽과 읽기 쪽을 모두 제공합니다.
 *
 * <p>쓴 바이트는 쓴 순서대로 읽힙니다. 스레드 안전합니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class InMemoryTransferBuffer implements TransferSink, TransferSource {

    private final ByteArrayOutputStream written = new ByteArrayOutputStream();
    private byte[] readable = new byte[0];
    private int readPosition;

    public InMemoryTransferBuffer() {
    }

    /**
     * 미리 채워진 버퍼를 생성합니다.
     *
     * @param initial 읽을 바이트
     */
    public InMemoryTransferBuffer(byte[] initial) {
        written.writeBytes(initial);
    }

    @Override
    public synchronized void write(byte[] frame) {
        written.writeBytes(frame);
    }

    @Override
    public void flush() {
        // 버퍼링 없음
    }

    @Override
    public synchronized byte[] readFully(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative (current: " + length + ")");
        }
        syncReadable();
        if (readable.length - readPosition < length) {
            throw new DataIntegrityException(
                "unexpected end of buffer: expected " + length + " bytes, available "
                    + (readable.length - readPosition)
            );
        }
        byte[] bytes = Arrays.copyOfRange(readable, readPosition, readPosition + length);
        readPosition += length;
        return bytes;
    }

    /**
     * 지금까지 쓴 전체 바이트의 사본.
     *
     * @return 바이트 사본
     */
    public synchronized byte[] toByteArray() {
        return written.toByteArray();
    }

    public synchronized int size() {
        return written.size();
    }

    public synchronized int remaining() {
        syncReadable();
        return readable.length - readPosition;
    }

    private void syncReadable() {
        if (readable.length != written.size()) {
            readable = written.toByteArray();
        }
    }
}
