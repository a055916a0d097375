package com.ryuqq.guardmap.application.map;

import com.ryuqq.guardmap.application.config.GuardedMapConfig;
import com.ryuqq.guardmap.application.snapshot.Snapshot;
import com.ryuqq.guardmap.application.snapshot.SnapshotTransfer;
import com.ryuqq.guardmap.core.exception.AllocationFailureException;
import com.ryuqq.guardmap.core.exception.ContainerStateSnapshot;
import com.ryuqq.guardmap.core.exception.InvalidIteratorException;
import com.ryuqq.guardmap.core.exception.KeyNotFoundException;
import com.ryuqq.guardmap.core.exception.MemoryLimitExceededException;
import com.ryuqq.guardmap.core.exception.NullKeyException;
import com.ryuqq.guardmap.core.exception.UninitializedCallableException;
import com.ryuqq.guardmap.core.iterator.GuardedIterator;
import com.ryuqq.guardmap.core.lock.LockHandle;
import com.ryuqq.guardmap.core.lock.LockMode;
import com.ryuqq.guardmap.core.lock.LockOrdering;
import com.ryuqq.guardmap.core.lock.LockPolicy;
import com.ryuqq.guardmap.core.memory.EvictionTarget;
import com.ryuqq.guardmap.core.memory.FragmentationSample;
import com.ryuqq.guardmap.core.memory.ResourceManager;
import com.ryuqq.guardmap.core.spi.AllocationHook;
import com.ryuqq.guardmap.core.spi.Codec;
import com.ryuqq.guardmap.core.spi.EntrySizer;
import com.ryuqq.guardmap.core.spi.OrderedContainer;
import com.ryuqq.guardmap.core.spi.TransferSink;
import com.ryuqq.guardmap.core.spi.TransferSource;
import com.ryuqq.guardmap.core.transfer.ResilientChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * 메모리 예산, 락 정책, 재시도 전송을 결합한 순서 보존 맵.
 *
 * <p><strong>쓰기 흐름:</strong></p>
 * <pre>
 * 1. LockPolicy.acquireWrite()
 * 2. ResourceManager.admitWrite() → 필요 시 LRU 퇴출, 불가 시 MemoryLimitExceededException (변경 없음)
 * 3. OrderedContainer.put() → AllocationHook이 바이트를 계측
 * 4. ResourceManager.touch(key)
 * 5. 락 해제 (try-with-resources)
 * </pre>
 *
 * <p><strong>읽기:</strong> 공유 락 아래에서 수행되며 {@link #find(Object)}는 최근 사용 순서를 갱신합니다.</p>
 *
 * <p><strong>전송:</strong> {@link #serialize(TransferSink)}는 공유 락,
 * {@link #deserialize(TransferSource)}는 배타 락을 전송이 끝날 때까지 보유합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try (GuardedMap<String, byte[]> map = GuardedMap.<String, byte[]>builder()
 *         .container(new InMemoryOrderedContainer<>())
 *         .config(new GuardedMapConfig().withMemoryCeilingBytes(10 * 1024))
 *         .sizer((key, value) -> value.length)
 *         .keyCodec(Codecs.utf8String())
 *         .valueCodec(Codecs.bytes())
 *         .build()) {
 *     map.put("k", new byte[1024]);
 *     map.serialize(sink);
 * }
 * }</pre>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class GuardedMap<K, V> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GuardedMap.class);

    private final LockPolicy lockPolicy;
    private final ResilientChannel channel;
    private final boolean ownsChannel;
    private final Codec<K> keyCodec;
    private final Codec<V> valueCodec;
    private final AllocationHook<K, V> meteringHook = new MeteringHook();
    private final EvictionTarget<K> evictionTarget = new ContainerEvictionTarget();

    // swap()으로 다른 맵과 교환되는 상태: 락 아래에서만 접근
    private volatile OrderedContainer<K, V> container;
    private ResourceManager<K> resources;
    private EntrySizer<K, V> sizer;

    private GuardedMap(Builder<K, V> builder) {
        GuardedMapConfig config = builder.config;
        this.lockPolicy = builder.lockPolicy != null ? builder.lockPolicy : config.lockPolicy().create();
        this.ownsChannel = builder.channel == null;
        this.channel = builder.channel != null ? builder.channel : new ResilientChannel(config.transferConfig());
        this.keyCodec = builder.keyCodec;
        this.valueCodec = builder.valueCodec;
        this.sizer = builder.sizer != null ? builder.sizer : codecSizer(builder.keyCodec, builder.valueCodec);
        this.resources = new ResourceManager<>(config.memoryConfig());
        this.container = builder.container;
        adoptExistingEntries();
        this.container.setAllocationHook(meteringHook);
    }

    public static <K, V> Builder<K, V> builder() {
        return new Builder<>();
    }

    // ============================================================
    // 쓰기
    // ============================================================

    /**
     * 값을 삽입하거나 교체합니다.
     *
     * @param key 키
     * @param value 값
     * @return 이전 값 (없으면 empty)
     * @throws MemoryLimitExceededException 퇴출로도 공간을 확보하지 못한 경우 (변경 없음)
     * @throws AllocationFailureException 컨테이너가 가득 찬 경우
     */
    public Optional<V> put(K key, V value) {
        requireKey(key, "put");
        requireValue(value);
        try (LockHandle ignored = lockPolicy.acquireWrite()) {
            return Optional.ofNullable(putUnderLock(key, value));
        }
    }

    /**
     * 키가 없을 때만 삽입합니다.
     *
     * @param key 키
     * @param value 값
     * @return 새로 삽입되었으면 true
     */
    public boolean insert(K key, V value) {
        requireKey(key, "insert");
        requireValue(value);
        try (LockHandle ignored = lockPolicy.acquireWrite()) {
            if (container.containsKey(key)) {
                return false;
            }
            putUnderLock(key, value);
            return true;
        }
    }

    private V putUnderLock(K key, V value) {
        OrderedContainer<K, V> target = container;
        long required = measure(key, value);
        Optional<V> existing = target.find(key);
        if (existing.isEmpty() && target.size() >= target.maxSize()) {
            throw new AllocationFailureException(
                "container is full (maxSize: " + target.maxSize() + ")", stateUnderLock()
            );
        }
        long released = existing.isPresent() ? measure(key, existing.get()) : 0L;
        try {
            resources.admitWrite(key, required, released, evictionTarget);
        } catch (MemoryLimitExceededException e) {
            throw e.withSnapshot(stateUnderLock());
        }
        V previous = target.put(key, value);
        resources.touch(key);
        return previous;
    }

    /**
     * 키를 제거합니다.
     *
     * @param key 키
     * @return 제거되었으면 true
     */
    public boolean erase(K key) {
        requireKey(key, "erase");
        try (LockHandle ignored = lockPolicy.acquireWrite()) {
            return eraseUnderLock(key);
        }
    }

    /**
     * 배타 모드 반복자가 가리키는 엔트리를 제거합니다. 반복자는 다음 엔트리를 가리키게 됩니다.
     *
     * <p>반복자를 보유한 스레드에서 호출해야 합니다.</p>
     *
     * @param iterator 이 맵의 배타 모드 반복자
     * @return 같은 반복자 (다음 위치)
     * @throws InvalidIteratorException 반복자가 무효화된 경우
     * @throws IllegalArgumentException 다른 맵의 반복자인 경우
     * @throws IllegalStateException 공유 모드 반복자이거나 다른 스레드가 락을 보유한 반복자인 경우
     */
    public GuardedIterator<K, V> erase(GuardedIterator<K, V> iterator) {
        if (iterator == null) {
            throw new IllegalArgumentException("iterator cannot be null");
        }
        if (!iterator.isValid()) {
            throw new InvalidIteratorException("cannot erase through an invalidated iterator");
        }
        if (!iterator.belongsTo(container)) {
            throw new IllegalArgumentException("iterator belongs to a different map");
        }
        if (iterator.mode() != LockMode.EXCLUSIVE) {
            throw new IllegalStateException("erasing through an iterator requires an exclusive iterator");
        }
        if (!iterator.isOwnedByCurrentThread()) {
            throw new IllegalStateException("iterator lock is held by another thread");
        }
        K key = iterator.current().getKey();
        eraseUnderLock(key);
        iterator.acknowledgeMutation();
        return iterator;
    }

    private boolean eraseUnderLock(K key) {
        if (container.erase(key) == null) {
            return false;
        }
        resources.forget(key);
        return true;
    }

    public void clear() {
        try (LockHandle ignored = lockPolicy.acquireWrite()) {
            container.clear();
            resources.clear();
        }
    }

    // ============================================================
    // 읽기
    // ============================================================

    /**
     * 값을 조회하고 최근 사용으로 표시합니다.
     *
     * @param key 키
     * @return 값 (없으면 empty)
     */
    public Optional<V> find(K key) {
        requireKey(key, "find");
        try (LockHandle ignored = lockPolicy.acquireRead()) {
            Optional<V> value = container.find(key);
            if (value.isPresent()) {
                resources.touch(key);
            }
            return value;
        }
    }

    /**
     * 값을 조회합니다. 키가 없으면 예외를 던집니다.
     *
     * @param key 키
     * @return 값
     * @throws KeyNotFoundException 키가 없는 경우
     */
    public V at(K key) {
        requireKey(key, "at");
        try (LockHandle ignored = lockPolicy.acquireRead()) {
            Optional<V> value = container.find(key);
            if (value.isEmpty()) {
                throw new KeyNotFoundException(key, stateUnderLock());
            }
            resources.touch(key);
            return value.get();
        }
    }

    public boolean containsKey(K key) {
        requireKey(key, "containsKey");
        try (LockHandle ignored = lockPolicy.acquireRead()) {
            return container.containsKey(key);
        }
    }

    public int size() {
        try (LockHandle ignored = lockPolicy.acquireRead()) {
            return container.size();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public long maxSize() {
        try (LockHandle ignored = lockPolicy.acquireRead()) {
            return container.maxSize();
        }
    }

    public int bucketCount() {
        try (LockHandle ignored = lockPolicy.acquireRead()) {
            return container.bucketCount();
        }
    }

    /**
     * 삽입 순서의 키 목록 사본.
     *
     * @return 키 목록
     */
    public List<K> keys() {
        try (LockHandle ignored = lockPolicy.acquireRead()) {
            List<K> keys = new ArrayList<>(container.size());
            for (int i = 0; i < container.size(); i++) {
                keys.add(container.entryAt(i).getKey());
            }
            return keys;
        }
    }

    // ============================================================
    // 반복자
    // ============================================================

    /**
     * 공유 락을 보유한 반복자를 생성합니다. 반드시 close해야 합니다.
     *
     * @return 반복자
     */
    public GuardedIterator<K, V> iterator() {
        return iterator(LockMode.SHARED);
    }

    /**
     * 지정한 모드의 락을 보유한 반복자를 생성합니다. 반드시 close해야 합니다.
     *
     * @param mode 락 모드
     * @return 반복자
     */
    public GuardedIterator<K, V> iterator(LockMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        LockHandle handle = lockPolicy.acquire(mode);
        try {
            return new GuardedIterator<>(container, () -> container, handle);
        } catch (RuntimeException e) {
            handle.close();
            throw e;
        }
    }

    /**
     * 공유 모드 반복자로 작업을 실행합니다. 모든 종료 경로에서 락이 해제됩니다.
     *
     * @param action 반복자를 사용하는 작업
     * @param <R> 결과 타입
     * @return 작업 결과
     */
    public <R> R withIterator(Function<GuardedIterator<K, V>, R> action) {
        return withIterator(LockMode.SHARED, action);
    }

    public <R> R withIterator(LockMode mode, Function<GuardedIterator<K, V>, R> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        try (GuardedIterator<K, V> iterator = iterator(mode)) {
            return action.apply(iterator);
        }
    }

    public void forEach(BiConsumer<? super K, ? super V> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        withIterator(iterator -> {
            while (iterator.hasNext()) {
                Map.Entry<K, V> entry = iterator.next();
                action.accept(entry.getKey(), entry.getValue());
            }
            return null;
        });
    }

    // ============================================================
    // swap
    // ============================================================

    /**
     * 두 맵의 내용과 메모리 계측 상태를 교환합니다.
     *
     * <p>두 배타 락을 전역 순서로 획득하므로 {@code a.swap(b)}와 {@code b.swap(a)}가
     * 동시에 실행되어도 교착되지 않습니다. 자기 자신과의 교환은 아무 일도 하지 않습니다.
     * 양쪽의 기존 반복자는 모두 무효화됩니다.</p>
     *
     * @param other 교환 대상
     */
    public void swap(GuardedMap<K, V> other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        if (other == this) {
            return;
        }
        try (LockOrdering.PairedHandle ignored = LockOrdering.acquireExclusive(lockPolicy, other.lockPolicy)) {
            OrderedContainer<K, V> containerTmp = container;
            container = other.container;
            other.container = containerTmp;

            ResourceManager<K> resourcesTmp = resources;
            resources = other.resources;
            other.resources = resourcesTmp;

            EntrySizer<K, V> sizerTmp = sizer;
            sizer = other.sizer;
            other.sizer = sizerTmp;

            container.setAllocationHook(meteringHook);
            other.container.setAllocationHook(other.meteringHook);
            log.debug("Swapped contents of {} and {}", lockPolicy, other.lockPolicy);
        }
    }

    // ============================================================
    // 메모리 관리
    // ============================================================

    public long memoryUsage() {
        try (LockHandle ignored = lockPolicy.acquireRead()) {
            return resources.currentMemoryUsage();
        }
    }

    public long memoryCeiling() {
        try (LockHandle ignored = lockPolicy.acquireRead()) {
            return resources.memoryCeiling();
        }
    }

    /**
     * 메모리 상한을 변경합니다. 현재 사용량이 새 상한을 넘으면 LRU 순서로 퇴출합니다.
     *
     * @param ceilingBytes 새 상한
     * @return 퇴출된 키 목록
     */
    public List<K> setMemoryCeiling(long ceilingBytes) {
        try (LockHandle ignored = lockPolicy.acquireWrite()) {
            resources.setMemoryCeiling(ceilingBytes);
            return resources.enforceCeiling(evictionTarget);
        }
    }

    public boolean needsDefragmentation() {
        try (LockHandle ignored = lockPolicy.acquireRead()) {
            return resources.needsDefragmentation();
        }
    }

    public double fragmentationRate() {
        try (LockHandle ignored = lockPolicy.acquireRead()) {
            return resources.fragmentationRate();
        }
    }

    public void setFragmentationThreshold(double thresholdPct) {
        try (LockHandle ignored = lockPolicy.acquireWrite()) {
            resources.setFragmentationThreshold(thresholdPct);
        }
    }

    public double fragmentationThreshold() {
        try (LockHandle ignored = lockPolicy.acquireRead()) {
            return resources.fragmentationThreshold();
        }
    }

    public void setFragmentationCheckInterval(long checkIntervalOps) {
        try (LockHandle ignored = lockPolicy.acquireWrite()) {
            resources.setCheckInterval(checkIntervalOps);
        }
    }

    /**
     * 컨테이너를 압축하고 단편화 신호를 초기화합니다. 자동으로 실행되지 않습니다.
     *
     * @return 정리 직전의 단편화 샘플
     */
    public FragmentationSample defragment() {
        try (LockHandle ignored = lockPolicy.acquireWrite()) {
            container.compact();
            return resources.defragment();
        }
    }

    /**
     * LRU 순서의 퇴출 후보를 조회합니다. 상태는 변경하지 않습니다.
     *
     * @param n 최대 개수
     * @return 후보 키 목록
     */
    public List<K> evictionCandidates(int n) {
        try (LockHandle ignored = lockPolicy.acquireRead()) {
            return resources.evictCandidates(n);
        }
    }

    /**
     * 가장 최근 사용 순의 키 목록.
     *
     * @return 키 목록
     */
    public List<K> recencyOrder() {
        try (LockHandle ignored = lockPolicy.acquireRead()) {
            return resources.recencyOrder();
        }
    }

    public ContainerStateSnapshot stateSnapshot() {
        try (LockHandle ignored = lockPolicy.acquireRead()) {
            return stateUnderLock();
        }
    }

    private ContainerStateSnapshot stateUnderLock() {
        return new ContainerStateSnapshot(
            container.size(),
            container.maxSize(),
            container.bucketCount(),
            resources.currentMemoryUsage(),
            resources.memoryCeiling()
        );
    }

    // ============================================================
    // 전송
    // ============================================================

    /**
     * 전체 내용을 공유 락 아래에서 전송합니다.
     *
     * @param sink 출력 대상
     * @throws UninitializedCallableException codec이 설정되지 않은 경우
     */
    public void serialize(TransferSink sink) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        SnapshotTransfer<K, V> transfer = snapshotTransfer();
        try (LockHandle ignored = lockPolicy.acquireRead()) {
            transfer.write(container, sink);
        }
    }

    /**
     * 스냅샷을 배타 락 아래에서 읽어 현재 내용을 대체합니다.
     *
     * <p>스냅샷 전체를 먼저 읽고 검증하므로 전송 실패나 무결성 오류 시 기존 내용은 그대로 유지됩니다.
     * 엔트리 크기의 합이 메모리 상한을 넘으면 기존 내용을 건드리지 않고 거부합니다.
     * 복원 중에는 LRU 퇴출이 일어나지 않으므로 스냅샷의 모든 엔트리가 복원되거나 아무것도 복원되지 않습니다.</p>
     *
     * @param source 입력 소스
     * @throws UninitializedCallableException codec이 설정되지 않은 경우
     * @throws AllocationFailureException 스냅샷이 컨테이너 최대 크기를 넘는 경우
     * @throws MemoryLimitExceededException 스냅샷 전체가 메모리 상한을 넘는 경우
     */
    public void deserialize(TransferSource source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        SnapshotTransfer<K, V> transfer = snapshotTransfer();
        try (LockHandle ignored = lockPolicy.acquireWrite()) {
            Snapshot<K, V> snapshot = transfer.read(source);
            if (snapshot.size() > container.maxSize()) {
                throw new AllocationFailureException(
                    "snapshot of " + snapshot.size() + " entries exceeds maxSize " + container.maxSize(),
                    stateUnderLock()
                );
            }
            long restoredBytes = measureSnapshot(snapshot);

            // 이 지점 이후로는 실패하지 않음: 검증된 엔트리를 퇴출 없이 그대로 삽입
            container.clear();
            resources.clear();
            container.reserve((int) snapshot.bucketCount());
            for (Map.Entry<K, V> entry : snapshot.entries()) {
                container.put(entry.getKey(), entry.getValue());
                resources.touch(entry.getKey());
            }
            log.info("Deserialized {} entries ({} bytes) into map", snapshot.size(), restoredBytes);
        }
    }

    /**
     * 스냅샷 전체 크기를 계측하고 현재 상한 안에 들어오는지 확인합니다.
     */
    private long measureSnapshot(Snapshot<K, V> snapshot) {
        long total = 0;
        for (Map.Entry<K, V> entry : snapshot.entries()) {
            long size = measure(entry.getKey(), entry.getValue());
            total = size > Long.MAX_VALUE - total ? Long.MAX_VALUE : total + size;
        }
        long ceiling = resources.memoryCeiling();
        if (total > ceiling) {
            log.warn("Rejected snapshot of {} entries: {} bytes exceed memory ceiling {}",
                snapshot.size(), total, ceiling);
            throw new MemoryLimitExceededException(total, resources.currentMemoryUsage(), ceiling, stateUnderLock());
        }
        return total;
    }

    private SnapshotTransfer<K, V> snapshotTransfer() {
        if (keyCodec == null) {
            throw new UninitializedCallableException("keyCodec");
        }
        if (valueCodec == null) {
            throw new UninitializedCallableException("valueCodec");
        }
        return new SnapshotTransfer<>(channel, keyCodec, valueCodec);
    }

    public LockPolicy lockPolicy() {
        return lockPolicy;
    }

    public ResilientChannel channel() {
        return channel;
    }

    @Override
    public void close() {
        if (ownsChannel) {
            channel.close();
        }
    }

    // ============================================================
    // 내부
    // ============================================================

    private void adoptExistingEntries() {
        for (int i = 0; i < container.size(); i++) {
            Map.Entry<K, V> entry = container.entryAt(i);
            resources.recordAlloc(measure(entry.getKey(), entry.getValue()));
            resources.touch(entry.getKey());
        }
    }

    private long measure(K key, V value) {
        if (sizer == null) {
            throw new UninitializedCallableException("entrySizer");
        }
        long size = sizer.sizeOf(key, value);
        if (size < 0) {
            throw new IllegalStateException("entrySizer returned a negative size (current: " + size + ")");
        }
        return size;
    }

    private static <K, V> EntrySizer<K, V> codecSizer(Codec<K> keyCodec, Codec<V> valueCodec) {
        if (keyCodec == null || valueCodec == null) {
            return null;
        }
        return (key, value) -> (long) keyCodec.encode(key).length + valueCodec.encode(value).length;
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

    /**
     * 컨테이너의 할당/해제를 현재 ResourceManager에 반영합니다.
     */
    private final class MeteringHook implements AllocationHook<K, V> {

        @Override
        public void beforeAllocate(K key, V value) {
            resources.recordAlloc(measure(key, value));
        }

        @Override
        public void afterDeallocate(K key, V value) {
            resources.recordFree(measure(key, value));
        }
    }

    private final class ContainerEvictionTarget implements EvictionTarget<K> {

        @Override
        public long sizeOf(K key) {
            return container.find(key).map(value -> measure(key, value)).orElse(0L);
        }

        @Override
        public void evict(K key) {
            container.erase(key);
        }
    }

    /**
     * GuardedMap 빌더.
     *
     * @param <K> 키 타입
     * @param <V> 값 타입
     */
    public static final class Builder<K, V> {

        private OrderedContainer<K, V> container;
        private GuardedMapConfig config = new GuardedMapConfig();
        private EntrySizer<K, V> sizer;
        private Codec<K> keyCodec;
        private Codec<V> valueCodec;
        private LockPolicy lockPolicy;
        private ResilientChannel channel;

        private Builder() {
        }

        public Builder<K, V> container(OrderedContainer<K, V> container) {
            this.container = container;
            return this;
        }

        public Builder<K, V> config(GuardedMapConfig config) {
            this.config = config;
            return this;
        }

        /**
         * 엔트리 크기 계측 함수. 생략하면 codec 인코딩 길이의 합을 사용합니다.
         */
        public Builder<K, V> sizer(EntrySizer<K, V> sizer) {
            this.sizer = sizer;
            return this;
        }

        public Builder<K, V> keyCodec(Codec<K> keyCodec) {
            this.keyCodec = keyCodec;
            return this;
        }

        public Builder<K, V> valueCodec(Codec<V> valueCodec) {
            this.valueCodec = valueCodec;
            return this;
        }

        /**
         * 설정의 lockPolicy 대신 사용할 정책 인스턴스.
         */
        public Builder<K, V> lockPolicy(LockPolicy lockPolicy) {
            this.lockPolicy = lockPolicy;
            return this;
        }

        /**
         * 외부에서 관리하는 채널. 지정하면 {@link GuardedMap#close()}가 채널을 닫지 않습니다.
         */
        public Builder<K, V> channel(ResilientChannel channel) {
            this.channel = channel;
            return this;
        }

        /**
         * @return 새 GuardedMap
         * @throws IllegalArgumentException container 또는 config가 null인 경우
         */
        public GuardedMap<K, V> build() {
            if (container == null) {
                throw new IllegalArgumentException("container cannot be null");
            }
            if (config == null) {
                throw new IllegalArgumentException("config cannot be null");
            }
            return new GuardedMap<>(this);
        }
    }
}
