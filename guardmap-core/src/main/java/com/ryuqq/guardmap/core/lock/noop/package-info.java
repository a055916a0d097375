/**
 * 동기화를 하지 않는 NoOp 락 정책.
 *
 * @since 1.0.0
 */
package com.ryuqq.guardmap.core.lock.noop;
