package com.ryuqq.guardmap.testkit.transfer;

import com.ryuqq.guardmap.core.transfer.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 실제로 잠들지 않고 요청된 대기 시간만 기록하는 Sleeper.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> delays = new CopyOnWriteArrayList<>();

    @Override
    public void sleep(Duration delay) {
        delays.add(delay);
    }

    public List<Duration> delays() {
        return List.copyOf(delays);
    }
}
