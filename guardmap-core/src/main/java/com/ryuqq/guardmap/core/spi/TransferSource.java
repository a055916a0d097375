package com.ryuqq.guardmap.core.spi;

/**
 * Inbound byte transport used by the resilient channel.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public interface TransferSource {

    /**
     * Reads exactly {@code length} bytes.
     *
     * @param length number of bytes to read
     * @return a new array of exactly {@code length} bytes
     * @throws com.ryuqq.guardmap.core.exception.TransferIOException on transport failure
     * @throws com.ryuqq.guardmap.core.exception.DataIntegrityException if the stream ends early
     */
    byte[] readFully(int length);
}
