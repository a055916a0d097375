package com.ryuqq.guardmap.core.transfer;

import java.time.Duration;

/**
 * 재시도 대기. 테스트에서 실제 대기 없이 지연 값을 검증할 수 있도록 분리합니다.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
