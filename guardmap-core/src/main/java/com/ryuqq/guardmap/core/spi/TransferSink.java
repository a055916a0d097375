package com.ryuqq.guardmap.core.spi;

/**
 * Outbound byte transport used by the resilient channel.
 *
 * <p>Failures are reported as {@link com.ryuqq.guardmap.core.exception.TransferIOException}
 * so that the channel can classify them as retryable or fatal. A write must either hand off
 * all bytes or none of them.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public interface TransferSink {

    /**
     * Writes one complete frame.
     *
     * @param frame the bytes to write
     */
    void write(byte[] frame);

    /**
     * Flushes buffered frames to the underlying transport.
     */
    void flush();
}
