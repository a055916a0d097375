package com.ryuqq.guardmap.core.transfer;

import java.util.concurrent.CancellationException;

/**
 * 협조적 취소 신호.
 *
 * <p>타임아웃이 나면 채널이 토큰을 취소 상태로 바꿉니다.
 * 작업은 안전한 지점에서 {@link #throwIfCancelled()}로 스스로 중단할 수 있습니다.</p>
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("operation was cancelled after timeout");
        }
    }
}
