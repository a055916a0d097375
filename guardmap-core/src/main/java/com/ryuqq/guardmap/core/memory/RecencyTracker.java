package com.ryuqq.guardmap.core.memory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * 최근 사용 순서(recency) 추적기.
 *
 * <p>access-order {@link LinkedHashMap}을 키 목록과 키→위치 인덱스로 함께 사용하므로,
 * 추적 중인 키 집합과 인덱스의 키 집합은 항상 같습니다.</p>
 *
 * <p>공유 락 아래의 읽기 연산도 {@link #touch(Object)}를 호출하므로 내부적으로 동기화됩니다.</p>
 *
 * @param <K> 키 타입
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class RecencyTracker<K> {

    // 순회 순서: least-recent → most-recent
    private final LinkedHashMap<K, Boolean> order = new LinkedHashMap<>(16, 0.75f, true);

    /**
     * 키를 가장 최근 사용으로 이동합니다. 추적 중이 아니면 새로 추가합니다.
     *
     * @param key 키
     */
    public synchronized void touch(K key) {
        order.put(key, Boolean.TRUE);
    }

    public synchronized boolean remove(K key) {
        return order.remove(key) != null;
    }

    public synchronized void clear() {
        order.clear();
    }

    public synchronized boolean contains(K key) {
        return order.containsKey(key);
    }

    public synchronized int size() {
        return order.size();
    }

    /**
     * 가장 오래 사용되지 않은 키부터 최대 {@code n}개를 조회합니다. 상태는 변경하지 않습니다.
     *
     * @param n 최대 개수
     * @return LRU 순서의 키 목록
     */
    public synchronized List<K> leastRecent(int n) {
        if (n <= 0) {
            return List.of();
        }
        List<K> result = new ArrayList<>(Math.min(n, order.size()));
        Iterator<K> it = order.keySet().iterator();
        while (it.hasNext() && result.size() < n) {
            result.add(it.next());
        }
        return result;
    }

    /**
     * 전체 키를 가장 최근 사용 순으로 반환합니다.
     *
     * @return MRU 순서의 키 목록 (사본)
     */
    public synchronized List<K> keysMostRecentFirst() {
        List<K> keys = new ArrayList<>(order.keySet());
        Collections.reverse(keys);
        return keys;
    }
}
