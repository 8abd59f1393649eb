package com.autoquant.resilience.core.statemachine;

import com.autoquant.resilience.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker 상태 전이 검증 및 실행.
 *
 * <p>Circuit Breaker 구현체는 상태를 바꾸기 전에 반드시 이 클래스를 통해
 * 전이가 허용된 규칙을 따르는지 검증합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN (trip)</li>
 *   <li>OPEN → HALF_OPEN (cooldown 경과, probe 허용)</li>
 *   <li>HALF_OPEN → CLOSED (probe 성공 임계값 도달)</li>
 *   <li>HALF_OPEN → OPEN (probe 실패)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>CLOSED → HALF_OPEN, OPEN → CLOSED 직행 불가</li>
 *   <li>자기 자신으로의 전이 불가</li>
 *   <li>수동 {@code reset()}은 이 규칙을 거치지 않습니다</li>
 * </ul>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public final class CircuitTransition {

    // Utility class - prevent instantiation
    private CircuitTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이 허용 여부 확인 (예외 없음).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(CircuitBreakerState from, CircuitBreakerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return switch (from) {
            case CLOSED -> to == CircuitBreakerState.OPEN;
            case OPEN -> to == CircuitBreakerState.HALF_OPEN;
            case HALF_OPEN -> to == CircuitBreakerState.CLOSED || to == CircuitBreakerState.OPEN;
        };
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(CircuitBreakerState from, CircuitBreakerState to) {
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid circuit transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static CircuitBreakerState transition(CircuitBreakerState current, CircuitBreakerState next) {
        validate(current, next);
        return next;
    }
}
