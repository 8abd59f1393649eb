package com.autoquant.resilience.core.time;

/**
 * 백오프 대기.
 *
 * <p>호출 스레드만 멈추며, Circuit Breaker 잠금을 잡은 상태로 호출되지 않습니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정한 시간 동안 대기.
     *
     * @param millis 대기 시간 (밀리초)
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    void sleep(long millis) throws InterruptedException;

    /**
     * {@link Thread#sleep(long)} 기반 Sleeper.
     *
     * @return 시스템 Sleeper
     */
    static Sleeper system() {
        return Thread::sleep;
    }
}
