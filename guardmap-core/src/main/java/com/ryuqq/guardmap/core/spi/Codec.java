package com.ryuqq.guardmap.core.spi;

/**
 * Byte-level encoding of a single key or value.
 *
 * <p>Implementations must be stateless and thread-safe. {@code decode(encode(x))} must
 * be equal to {@code x}.</p>
 *
 * @param <T> encoded type
 * @author GuardMap Team
 * @since 1.0.0
 */
public interface Codec<T> {

    byte[] encode(T value);

    T decode(byte[] bytes);
}
