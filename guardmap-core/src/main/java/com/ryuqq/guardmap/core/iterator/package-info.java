/**
 * 락을 보유하는 위치 기반 반복자.
 *
 * @see com.ryuqq.guardmap.core.iterator.GuardedIterator
 * @since 1.0.0
 */
package com.ryuqq.guardmap.core.iterator;
