package com.autoquant.resilience.core.time;

/**
 * 단조 증가(monotonic) 시계.
 *
 * <p>Circuit Breaker의 trip 시각과 데드라인 계산에 사용됩니다.
 * 테스트에서는 수동으로 시간을 진행시키는 구현을 주입합니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Ticker {

    /**
     * 현재 시각 (나노초, 임의의 기준점).
     *
     * @return 나노초
     */
    long nanoTime();

    /**
     * {@link System#nanoTime()} 기반 Ticker.
     *
     * @return 시스템 Ticker
     */
    static Ticker system() {
        return System::nanoTime;
    }
}
