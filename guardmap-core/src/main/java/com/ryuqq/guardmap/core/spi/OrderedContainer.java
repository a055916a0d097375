package com.ryuqq.guardmap.core.spi;

import java.util.Map;
import java.util.Optional;

/**
 * Ordered associative container SPI wrapped by the guard layer.
 *
 * <p>Implementations keep entries in insertion order and expose positional access so that
 * guarded iterators can walk the container by index. The guard layer never inspects the
 * hashing or probing strategy; it only relies on the operations declared here.</p>
 *
 * <p><strong>Structural modification contract:</strong></p>
 * <ul>
 *   <li>Inserting a new key, erasing a key, {@link #clear()}, and any rehash triggered by
 *       {@link #reserve(int)} or {@link #compact()} increment {@link #modificationCount()}</li>
 *   <li>Replacing the value of an existing key does NOT change the modification count</li>
 * </ul>
 *
 * <p><strong>Allocation hook contract:</strong></p>
 * <ul>
 *   <li>{@link AllocationHook#beforeAllocate} is invoked before a new entry or a replacement
 *       value is stored. If it throws, the container must stay unchanged.</li>
 *   <li>{@link AllocationHook#afterDeallocate} is invoked after an entry or a replaced value
 *       has left the container (erase, clear, replacement).</li>
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> Implementations are NOT required to be thread-safe.
 * All access is serialized by the guard layer's lock policy.</p>
 *
 * @param <K> key type
 * @param <V> value type
 * @author GuardMap Team
 * @since 1.0.0
 */
public interface OrderedContainer<K, V> {

    /**
     * Inserts or assigns a value.
     *
     * @param key the key (non-null)
     * @param value the value (non-null)
     * @return the previous value, or {@code null} if the key was absent
     */
    V put(K key, V value);

    /**
     * Inserts only if the key is absent.
     *
     * @param key the key (non-null)
     * @param value the value (non-null)
     * @return {@code true} if a new entry was created
     */
    boolean insert(K key, V value);

    /**
     * Looks up a value.
     *
     * @param key the key
     * @return the value, or empty if absent
     */
    Optional<V> find(K key);

    boolean containsKey(K key);

    /**
     * Removes an entry, preserving the relative order of the remaining entries.
     *
     * @param key the key
     * @return the removed value, or {@code null} if absent
     */
    V erase(K key);

    /**
     * Removes every entry.
     */
    void clear();

    int size();

    /**
     * Maximum number of entries this container can hold.
     *
     * @return upper bound on {@link #size()}
     */
    long maxSize();

    /**
     * Current bucket count of the underlying table.
     *
     * @return bucket count (at least 1)
     */
    int bucketCount();

    /**
     * Grows the table so that at least {@code count} buckets exist.
     *
     * @param count requested bucket count
     */
    void reserve(int count);

    /**
     * Rebuilds the table to the smallest size that fits the current entries.
     *
     * <p>Called on explicit defragmentation.</p>
     */
    void compact();

    /**
     * Returns the entry at an insertion-order position.
     *
     * @param index position in {@code [0, size())}
     * @return immutable entry view
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    Map.Entry<K, V> entryAt(int index);

    /**
     * Insertion-order position of a key.
     *
     * @param key the key
     * @return the index, or {@code -1} if absent
     */
    int indexOf(K key);

    /**
     * Structural modification counter.
     *
     * @return a value that changes whenever positions may have shifted
     */
    long modificationCount();

    /**
     * Installs the allocation hook. Passing {@code null} removes it.
     *
     * @param hook the hook
     */
    void setAllocationHook(AllocationHook<K, V> hook);
}
