package com.ryuqq.guardmap.testkit.contract;

import com.ryuqq.guardmap.core.exception.AllocationFailureException;
import com.ryuqq.guardmap.core.exception.NullKeyException;
import com.ryuqq.guardmap.core.spi.AllocationHook;
import com.ryuqq.guardmap.core.spi.OrderedContainer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Abstract base class for OrderedContainer Contract Tests.
 *
 * <p>Validates the behaviour the guard layer relies on:</p>
 * <ul>
 *   <li>insertion order and positional access</li>
 *   <li>modification count semantics (structural changes only)</li>
 *   <li>power-of-two bucket counts with bounded load</li>
 *   <li>allocation hook ordering and veto</li>
 * </ul>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public abstract class AbstractOrderedContainerContractTest {

    protected static final int INITIAL_BUCKET_COUNT = 16;
    protected static final long MAX_SIZE = 100;
    protected static final double MAX_LOAD_FACTOR = 0.75;

    protected OrderedContainer<String, Integer> container;

    /**
     * Creates an empty container.
     *
     * @param initialBucketCount initial bucket count
     * @param maxSize maximum number of entries
     * @return container under test
     */
    protected abstract OrderedContainer<String, Integer> createContainer(int initialBucketCount, long maxSize);

    @BeforeEach
    void setUpContainer() {
        container = createContainer(INITIAL_BUCKET_COUNT, MAX_SIZE);
    }

    // ============================================================
    // Basic map behaviour
    // ============================================================

    @Test
    void put_returns_previous_value() {
        assertThat(container.put("a", 1)).isNull();
        assertThat(container.put("a", 2)).isEqualTo(1);
        assertThat(container.find("a")).contains(2);
        assertThat(container.size()).isEqualTo(1);
    }

    @Test
    void insert_does_not_overwrite() {
        assertThat(container.insert("a", 1)).isTrue();
        assertThat(container.insert("a", 2)).isFalse();
        assertThat(container.find("a")).contains(1);
    }

    @Test
    void find_of_absent_key_is_empty() {
        assertThat(container.find("missing")).isEmpty();
        assertThat(container.containsKey("missing")).isFalse();
        assertThat(container.indexOf("missing")).isEqualTo(-1);
    }

    @Test
    void erase_returns_removed_value() {
        container.put("a", 1);

        assertThat(container.erase("a")).isEqualTo(1);
        assertThat(container.erase("a")).isNull();
        assertThat(container.size()).isZero();
    }

    @Test
    void null_key_is_rejected() {
        assertThatThrownBy(() -> container.put(null, 1)).isInstanceOf(NullKeyException.class);
        assertThatThrownBy(() -> container.insert(null, 1)).isInstanceOf(NullKeyException.class);
    }

    @Test
    void full_container_rejects_new_keys_without_change() {
        OrderedContainer<String, Integer> small = createContainer(INITIAL_BUCKET_COUNT, 2);
        small.put("a", 1);
        small.put("b", 2);

        assertThatThrownBy(() -> small.put("c", 3)).isInstanceOf(AllocationFailureException.class);
        assertThat(small.size()).isEqualTo(2);
        assertThat(small.containsKey("c")).isFalse();

        // 기존 키 교체는 허용
        assertThat(small.put("a", 10)).isEqualTo(1);
    }

    // ============================================================
    // Ordering
    // ============================================================

    @Test
    void entries_are_kept_in_insertion_order() {
        for (int i = 0; i < 10; i++) {
            container.put("k" + i, i);
        }
        container.put("k3", 33);

        assertThat(keys(container)).containsExactly("k0", "k1", "k2", "k3", "k4", "k5", "k6", "k7", "k8", "k9");
        assertThat(container.entryAt(3).getValue()).isEqualTo(33);
    }

    @Test
    void erase_shifts_following_positions() {
        container.put("a", 1);
        container.put("b", 2);
        container.put("c", 3);

        container.erase("a");

        assertThat(keys(container)).containsExactly("b", "c");
        assertThat(container.indexOf("b")).isZero();
        assertThat(container.indexOf("c")).isEqualTo(1);
    }

    @Test
    void entryAt_outside_range_fails() {
        container.put("a", 1);

        assertThatThrownBy(() -> container.entryAt(1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    // ============================================================
    // Modification count
    // ============================================================

    @Test
    void structural_changes_bump_modification_count() {
        long initial = container.modificationCount();

        container.put("a", 1);
        long afterInsert = container.modificationCount();
        container.erase("a");
        long afterErase = container.modificationCount();
        container.put("b", 2);
        long beforeClear = container.modificationCount();
        container.clear();

        assertThat(afterInsert).isNotEqualTo(initial);
        assertThat(afterErase).isNotEqualTo(afterInsert);
        assertThat(container.modificationCount()).isNotEqualTo(beforeClear);
    }

    @Test
    void value_replacement_keeps_modification_count() {
        container.put("a", 1);
        long before = container.modificationCount();

        container.put("a", 2);

        assertThat(container.modificationCount()).isEqualTo(before);
    }

    // ============================================================
    // Buckets
    // ============================================================

    @Test
    void bucket_count_is_power_of_two_with_bounded_load() {
        for (int i = 0; i < MAX_SIZE; i++) {
            container.put("k" + i, i);
            int buckets = container.bucketCount();
            assertThat(Integer.bitCount(buckets)).isEqualTo(1);
            assertThat(container.size()).isLessThanOrEqualTo((int) (buckets * MAX_LOAD_FACTOR));
        }
    }

    @Test
    void reserve_grows_bucket_count() {
        container.reserve(1000);

        assertThat(container.bucketCount()).isGreaterThanOrEqualTo(1000);
        assertThat(Integer.bitCount(container.bucketCount())).isEqualTo(1);
    }

    @Test
    void compact_shrinks_after_removals_and_keeps_entries() {
        for (int i = 0; i < MAX_SIZE; i++) {
            container.put("k" + i, i);
        }
        int grown = container.bucketCount();
        for (int i = 5; i < MAX_SIZE; i++) {
            container.erase("k" + i);
        }

        container.compact();

        assertThat(container.bucketCount()).isLessThan(grown);
        assertThat(keys(container)).containsExactly("k0", "k1", "k2", "k3", "k4");
    }

    // ============================================================
    // Allocation hook
    // ============================================================

    @Test
    void hook_observes_allocations_and_deallocations() {
        RecordingHook hook = new RecordingHook();
        container.setAllocationHook(hook);

        container.put("a", 1);
        container.put("a", 2);
        container.put("b", 3);
        container.erase("b");
        container.clear();

        assertThat(hook.events).containsExactly(
            "alloc a=1",
            "alloc a=2", "free a=1",
            "alloc b=3",
            "free b=3",
            "free a=2"
        );
    }

    @Test
    void hook_veto_leaves_container_unchanged() {
        container.put("a", 1);
        long modCount = container.modificationCount();
        container.setAllocationHook(new AllocationHook<>() {
            @Override
            public void beforeAllocate(String key, Integer value) {
                throw new IllegalStateException("veto");
            }

            @Override
            public void afterDeallocate(String key, Integer value) {
            }
        });

        assertThatThrownBy(() -> container.put("b", 2)).hasMessage("veto");
        assertThatThrownBy(() -> container.put("a", 9)).hasMessage("veto");

        assertThat(keys(container)).containsExactly("a");
        assertThat(container.find("a")).contains(1);
        assertThat(container.modificationCount()).isEqualTo(modCount);
    }

    /**
     * Collects the keys of {@code target} in position order.
     *
     * @param target container
     * @return keys
     */
    protected static List<String> keys(OrderedContainer<String, Integer> target) {
        List<String> keys = new ArrayList<>();
        for (int i = 0; i < target.size(); i++) {
            Map.Entry<String, Integer> entry = target.entryAt(i);
            keys.add(entry.getKey());
        }
        return keys;
    }

    private static final class RecordingHook implements AllocationHook<String, Integer> {

        private final List<String> events = new ArrayList<>();

        @Override
        public void beforeAllocate(String key, Integer value) {
            events.add("alloc " + key + "=" + value);
        }

        @Override
        public void afterDeallocate(String key, Integer value) {
            events.add("free " + key + "=" + value);
        }
    }
}
