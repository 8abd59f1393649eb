package com.autoquant.resilience.core.protection;

/**
 * Circuit Breaker 상태의 읽기 전용 스냅샷.
 *
 * <p>대시보드나 메트릭 수집기가 폴링하기 위한 값입니다. 코어는 이벤트를 push하지 않습니다.</p>
 *
 * @param name Circuit Breaker 이름
 * @param state 현재 상태
 * @param failureCount 현재 집계 중인 실패 수 (CLOSED)
 * @param successCount 현재 집계 중인 probe 성공 수 (HALF_OPEN)
 * @param tripCount 누적 trip 횟수 (CLOSED → OPEN 전이만 집계)
 * @param lastTripAtNanos 마지막 trip 시각 (Ticker 기준 나노초, trip 이력이 없으면 0)
 * @param probeInFlight HALF_OPEN probe 진행 여부
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public record CircuitBreakerSnapshot(
    String name,
    CircuitBreakerState state,
    int failureCount,
    int successCount,
    long tripCount,
    long lastTripAtNanos,
    boolean probeInFlight
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name 또는 state가 null인 경우
     */
    public CircuitBreakerSnapshot {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }
}
