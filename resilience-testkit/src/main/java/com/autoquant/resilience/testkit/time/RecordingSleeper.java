package com.autoquant.resilience.testkit.time;

import com.autoquant.resilience.core.time.Sleeper;

import java.util.ArrayList;
import java.util.List;

/**
 * 실제로 대기하지 않고 요청된 대기 시간만 기록하는 {@link Sleeper}.
 *
 * <p>{@link ManualTicker}와 연결하면 대기 요청만큼 가상 시계를 진행시킵니다.
 * 재시도 backoff 누적 시간과 Deadline 상호작용을 결정적으로 검증할 수 있습니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public final class RecordingSleeper implements Sleeper {

    private final List<Long> sleeps = new ArrayList<>();
    private final ManualTicker ticker;

    public RecordingSleeper() {
        this(null);
    }

    /**
     * 생성자.
     *
     * @param ticker 대기 시간만큼 진행시킬 시계 (null이면 진행하지 않음)
     */
    public RecordingSleeper(ManualTicker ticker) {
        this.ticker = ticker;
    }

    @Override
    public void sleep(long millis) throws InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException("Interrupted before sleep");
        }
        synchronized (sleeps) {
            sleeps.add(millis);
        }
        if (ticker != null) {
            ticker.advance(millis);
        }
    }

    /**
     * 기록된 대기 시간 목록 (요청 순서).
     *
     * @return 불변 복사본
     */
    public List<Long> sleeps() {
        synchronized (sleeps) {
            return List.copyOf(sleeps);
        }
    }

    /**
     * 누적 대기 시간.
     *
     * @return 밀리초 합계
     */
    public long totalSleptMs() {
        synchronized (sleeps) {
            long total = 0;
            for (long sleep : sleeps) {
                total += sleep;
            }
            return total;
        }
    }
}
