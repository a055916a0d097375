package com.ryuqq.guardmap.core.transfer;

/**
 * {@link CancellationToken}을 받는 작업.
 *
 * @param <T> 결과 타입
 * @author GuardMap Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CancellableWork<T> {

    T call(CancellationToken token) throws Exception;
}
