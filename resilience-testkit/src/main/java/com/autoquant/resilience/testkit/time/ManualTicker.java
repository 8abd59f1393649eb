package com.autoquant.resilience.testkit.time;

import com.autoquant.resilience.core.time.Ticker;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 테스트에서 수동으로 진행시키는 {@link Ticker}.
 *
 * <p>Circuit Breaker의 open 지속 시간이나 Deadline 만료를 실제 대기 없이 검증할 때 사용합니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public final class ManualTicker implements Ticker {

    private final AtomicLong nanos;

    public ManualTicker() {
        this(0L);
    }

    public ManualTicker(long initialNanos) {
        this.nanos = new AtomicLong(initialNanos);
    }

    @Override
    public long nanoTime() {
        return nanos.get();
    }

    /**
     * 시간을 밀리초 단위로 진행.
     *
     * @param millis 진행할 시간 (0 이상)
     * @throws IllegalArgumentException 음수인 경우
     */
    public void advance(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis cannot be negative (current: " + millis + ")");
        }
        nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
    }

    /**
     * 시간을 나노초 단위로 진행 (1ms 미만 경계 검증용).
     *
     * @param delta 진행할 시간 (0 이상)
     * @throws IllegalArgumentException 음수인 경우
     */
    public void advanceNanos(long delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("delta cannot be negative (current: " + delta + ")");
        }
        nanos.addAndGet(delta);
    }
}
