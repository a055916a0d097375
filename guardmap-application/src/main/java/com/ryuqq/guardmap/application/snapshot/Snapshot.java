package com.ryuqq.guardmap.application.snapshot;

import java.util.List;
import java.util.Map;

/**
 * 역직렬화되어 검증까지 끝난 컨테이너 스냅샷.
 *
 * @param size 헤더의 엔트리 수
 * @param maxSize 원본 컨테이너의 최대 크기
 * @param bucketCount 원본 컨테이너의 버킷 수
 * @param entries 삽입 순서의 엔트리
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author GuardMap Team
 * @since 1.0.0
 */
public record Snapshot<K, V>(
    long size,
    long maxSize,
    long bucketCount,
    List<Map.Entry<K, V>> entries
) {

    public Snapshot {
        entries = List.copyOf(entries);
    }
}
