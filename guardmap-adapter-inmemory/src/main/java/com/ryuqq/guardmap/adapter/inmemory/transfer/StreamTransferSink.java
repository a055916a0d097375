package com.ryuqq.guardmap.adapter.inmemory.transfer;

import com.ryuqq.guardmap.core.spi.TransferSink;
import com.ryuqq.guardmap.core.transfer.TransferErrorClassifier;

import java.io.IOException;
import java.io.OutputStream;

/**
 * {@link OutputStream} 기반 {@link TransferSink}.
 *
 * <p>소켓의 출력 스트림을 그대로 감쌀 수 있습니다. {@link IOException}은
 * {@link TransferErrorClassifier#toUnchecked(Throwable)}로 분류된 전송 예외로 변환됩니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class StreamTransferSink implements TransferSink {

    private final OutputStream out;

    public StreamTransferSink(OutputStream out) {
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        this.out = out;
    }

    @Override
    public void write(byte[] frame) {
        try {
            out.write(frame);
        } catch (IOException e) {
            throw TransferErrorClassifier.toUnchecked(e);
        }
    }

    @Override
    public void flush() {
        try {
            out.flush();
        } catch (IOException e) {
            throw TransferErrorClassifier.toUnchecked(e);
        }
    }
}
