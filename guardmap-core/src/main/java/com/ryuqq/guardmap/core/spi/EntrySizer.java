package com.ryuqq.guardmap.core.spi;

/**
 * Measures the number of bytes an entry is charged against the memory budget.
 *
 * @param <K> key type
 * @param <V> value type
 * @author GuardMap Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EntrySizer<K, V> {

    /**
     * @param key the key
     * @param value the value
     * @return non-negative size in bytes
     */
    long sizeOf(K key, V value);
}
