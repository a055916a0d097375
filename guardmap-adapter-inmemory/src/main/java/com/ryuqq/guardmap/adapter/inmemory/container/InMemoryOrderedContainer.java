package com.ryuqq.guardmap.adapter.inmemory.container;

import com.ryuqq.guardmap.core.exception.AllocationFailureException;
import com.ryuqq.guardmap.core.exception.NullKeyException;
import com.ryuqq.guardmap.core.spi.AllocationHook;
import com.ryuqq.guardmap.core.spi.OrderedContainer;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of {@link OrderedContainer} for testing and reference purposes.
 *
 * <p>Entries are kept in an {@link ArrayList} in insertion order, with a {@link HashMap}
 * from key to position for O(1) lookup.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>entries:</strong> ArrayList&lt;Slot&gt; - insertion-ordered entries (positional access)</li>
 *   <li><strong>positions:</strong> HashMap&lt;K, Integer&gt; - key to position index</li>
 *   <li><strong>bucketCount:</strong> simulated power-of-two table size, doubled at 0.75 load</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>put / find / containsKey:</strong> O(1)</li>
 *   <li><strong>erase:</strong> O(N) - remaining entries shift to keep insertion order</li>
 *   <li><strong>entryAt:</strong> O(1)</li>
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> NOT thread-safe. Access must be serialized by the
 * guard layer's lock policy.</p>
 *
 * @param <K> key type
 * @param <V> value type
 * @author GuardMap Team
 * @since 1.0.0
 */
public class InMemoryOrderedContainer<K, V> implements OrderedContainer<K, V> {

    public static final int DEFAULT_BUCKET_COUNT = 16;
    public static final long DEFAULT_MAX_SIZE = Integer.MAX_VALUE - 8L;

    private static final float MAX_LOAD_FACTOR = 0.75f;
    private static final int MAX_BUCKET_COUNT = 1 << 30;

    private final ArrayList<Slot<K, V>> entries = new ArrayList<>();
    private final Map<K, Integer> positions = new HashMap<>();
    private final long maxSize;

    private int bucketCount;
    private long modCount;
    private AllocationHook<K, V> hook;

    public InMemoryOrderedContainer() {
        this(DEFAULT_BUCKET_COUNT, DEFAULT_MAX_SIZE);
    }

    /**
     * Creates a container.
     *
     * @param initialBucketCount initial bucket count (rounded up to a power of two)
     * @param maxSize maximum number of entries
     * @throws IllegalArgumentException if either argument is not positive
     */
    public InMemoryOrderedContainer(int initialBucketCount, long maxSize) {
        if (initialBucketCount <= 0) {
            throw new IllegalArgumentException(
                "initialBucketCount must be positive (current: " + initialBucketCount + ")"
            );
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive (current: " + maxSize + ")");
        }
        this.bucketCount = roundUpToPowerOfTwo(initialBucketCount);
        this.maxSize = maxSize;
    }

    @Override
    public V put(K key, V value) {
        requireKey(key, "put");
        requireValue(value);
        Integer position = positions.get(key);
        if (position != null) {
            Slot<K, V> slot = entries.get(position);
            if (hook != null) {
                hook.beforeAllocate(key, value);
            }
            V previous = slot.value;
            slot.value = value;
            if (hook != null) {
                hook.afterDeallocate(key, previous);
            }
            return previous;
        }
        append(key, value);
        return null;
    }

    @Override
    public boolean insert(K key, V value) {
        requireKey(key, "insert");
        requireValue(value);
        if (positions.containsKey(key)) {
            return false;
        }
        append(key, value);
        return true;
    }

    private void append(K key, V value) {
        if (entries.size() >= maxSize) {
            throw new AllocationFailureException(
                "container is full (maxSize: " + maxSize + ")"
            );
        }
        if (hook != null) {
            hook.beforeAllocate(key, value);
        }
        positions.put(key, entries.size());
        entries.add(new Slot<>(key, value));
        modCount++;
        growIfNeeded();
    }

    @Override
    public Optional<V> find(K key) {
        Integer position = positions.get(key);
        return position == null ? Optional.empty() : Optional.of(entries.get(position).value);
    }

    @Override
    public boolean containsKey(K key) {
        return positions.containsKey(key);
    }

    @Override
    public V erase(K key) {
        Integer position = positions.remove(key);
        if (position == null) {
            return null;
        }
        Slot<K, V> removed = entries.remove((int) position);
        for (int i = position; i < entries.size(); i++) {
            positions.put(entries.get(i).key, i);
        }
        modCount++;
        if (hook != null) {
            hook.afterDeallocate(removed.key, removed.value);
        }
        return removed.value;
    }

    @Override
    public void clear() {
        if (entries.isEmpty()) {
            return;
        }
        List<Slot<K, V>> removed = new ArrayList<>(entries);
        entries.clear();
        positions.clear();
        modCount++;
        if (hook != null) {
            for (Slot<K, V> slot : removed) {
                hook.afterDeallocate(slot.key, slot.value);
            }
        }
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public long maxSize() {
        return maxSize;
    }

    @Override
    public int bucketCount() {
        return bucketCount;
    }

    @Override
    public void reserve(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative (current: " + count + ")");
        }
        int target = roundUpToPowerOfTwo(count);
        if (target > bucketCount) {
            bucketCount = target;
            modCount++;
        }
    }

    @Override
    public void compact() {
        int needed = (int) Math.ceil(entries.size() / (double) MAX_LOAD_FACTOR);
        int target = roundUpToPowerOfTwo(Math.max(DEFAULT_BUCKET_COUNT, needed));
        entries.trimToSize();
        if (target != bucketCount) {
            bucketCount = target;
            modCount++;
        }
    }

    @Override
    public Map.Entry<K, V> entryAt(int index) {
        Slot<K, V> slot = entries.get(index);
        return new AbstractMap.SimpleImmutableEntry<>(slot.key, slot.value);
    }

    @Override
    public int indexOf(K key) {
        Integer position = positions.get(key);
        return position == null ? -1 : position;
    }

    @Override
    public long modificationCount() {
        return modCount;
    }

    @Override
    public void setAllocationHook(AllocationHook<K, V> hook) {
        this.hook = hook;
    }

    /**
     * Current load factor ({@code size / bucketCount}).
     *
     * @return load factor
     */
    public float loadFactor() {
        return entries.size() / (float) bucketCount;
    }

    private void growIfNeeded() {
        if (entries.size() > bucketCount * MAX_LOAD_FACTOR && bucketCount < MAX_BUCKET_COUNT) {
            bucketCount <<= 1;
        }
    }

    private static int roundUpToPowerOfTwo(int value) {
        if (value <= 1) {
            return 1;
        }
        if (value >= MAX_BUCKET_COUNT) {
            return MAX_BUCKET_COUNT;
        }
        return Integer.highestOneBit(value - 1) << 1;
    }

    private static void requireKey(Object key, String operation) {
        if (key == null) {
            throw new NullKeyException(operation);
        }
    }

    private static void requireValue(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    private static final class Slot<K, V> {

        private final K key;
        private V value;

        private Slot(K key, V value) {
            this.key = key;
            this.value = value;
        }
    }
}
