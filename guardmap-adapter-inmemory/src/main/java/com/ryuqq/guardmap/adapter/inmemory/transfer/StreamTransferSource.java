package com.ryuqq.guardmap.adapter.inmemory.transfer;

import com.ryuqq.guardmap.core.exception.DataIntegrityException;
import com.ryuqq.guardmap.core.spi.TransferSource;
import com.ryuqq.guardmap.core.transfer.TransferErrorClassifier;

import java.io.IOException;
import java.io.InputStream;

/**
 * {@link InputStream} 기반 {@link TransferSource}.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class StreamTransferSource implements TransferSource {

    private final InputStream in;

    public StreamTransferSource(InputStream in) {
        if (in == null) {
            throw new IllegalArgumentException("in cannot be null");
        }
        this.in = in;
    }

    @Override
    public byte[] readFully(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative (current: " + length + ")");
        }
        try {
            byte[] bytes = in.readNBytes(length);
            if (bytes.length != length) {
                throw new DataIntegrityException(
                    "unexpected end of stream: expected " + length + " bytes, got " + bytes.length
                );
            }
            return bytes;
        } catch (IOException e) {
            throw TransferErrorClassifier.toUnchecked(e);
        }
    }
}
