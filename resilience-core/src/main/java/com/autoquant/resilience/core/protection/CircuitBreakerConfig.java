package com.autoquant.resilience.core.protection;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureThreshold: CLOSED에서 trip까지의 실패 횟수 (기본 3)</li>
 *   <li>openDurationMs: OPEN 유지 시간, 경과 후 probe 허용 (기본 60000ms)</li>
 *   <li>closeThreshold: HALF_OPEN에서 CLOSED로 돌아가기 위한 probe 성공 횟수 (기본 1)</li>
 *   <li>failureWindowMs: 실패 집계 윈도우 (기본 0)</li>
 * </ul>
 *
 * <p><strong>실패 집계 윈도우:</strong></p>
 * <ul>
 *   <li>0: 고정 카운터. 성공 시에만 초기화됩니다.</li>
 *   <li>양수: 슬라이딩 시간 윈도우. 성공 시 초기화되고, 윈도우보다 오래된 실패는 집계에서 빠집니다.</li>
 * </ul>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 * @param failureThreshold trip 임계값 (1 이상)
 * @param openDurationMs OPEN 유지 시간 (밀리초, 0 이상)
 * @param closeThreshold HALF_OPEN 성공 임계값 (1 이상)
 * @param failureWindowMs 실패 집계 윈도우 (밀리초, 0은 고정 카운터)
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    long openDurationMs,
    int closeThreshold,
    long failureWindowMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=3, openDurationMs=60000ms, closeThreshold=1, failureWindowMs=0</p>
     */
    public CircuitBreakerConfig() {
        this(3, 60000, 1, 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (openDurationMs < 0) {
            throw new IllegalArgumentException(
                "openDurationMs cannot be negative (current: " + openDurationMs + ")"
            );
        }
        if (closeThreshold <= 0) {
            throw new IllegalArgumentException(
                "closeThreshold must be positive (current: " + closeThreshold + ")"
            );
        }
        if (failureWindowMs < 0) {
            throw new IllegalArgumentException(
                "failureWindowMs cannot be negative (current: " + failureWindowMs + ")"
            );
        }
    }

    /**
     * 슬라이딩 시간 윈도우 사용 여부.
     *
     * @return failureWindowMs가 양수이면 true
     */
    public boolean isSlidingWindow() {
        return failureWindowMs > 0;
    }

    /**
     * failureThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, openDurationMs, closeThreshold, failureWindowMs);
    }

    /**
     * openDurationMs만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withOpenDurationMs(long openDurationMs) {
        return new CircuitBreakerConfig(failureThreshold, openDurationMs, closeThreshold, failureWindowMs);
    }

    /**
     * closeThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withCloseThreshold(int closeThreshold) {
        return new CircuitBreakerConfig(failureThreshold, openDurationMs, closeThreshold, failureWindowMs);
    }

    /**
     * failureWindowMs만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withFailureWindowMs(long failureWindowMs) {
        return new CircuitBreakerConfig(failureThreshold, openDurationMs, closeThreshold, failureWindowMs);
    }
}
