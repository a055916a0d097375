package com.ryuqq.guardmap.core.spi;

/**
 * Callback the container invokes around entry storage so that the guard layer
 * can meter memory.
 *
 * @param <K> key type
 * @param <V> value type
 * @author GuardMap Team
 * @since 1.0.0
 * @see OrderedContainer
 */
public interface AllocationHook<K, V> {

    /**
     * Called before storing a new entry or a replacement value.
     *
     * <p>Throwing from this method aborts the store and leaves the container unchanged.</p>
     *
     * @param key the key being stored
     * @param value the value being stored
     */
    void beforeAllocate(K key, V value);

    /**
     * Called after an entry or a replaced value left the container.
     *
     * @param key the key
     * @param value the value that was released
     */
    void afterDeallocate(K key, V value);
}
