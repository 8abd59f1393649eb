package com.autoquant.resilience.core.exception;

import com.autoquant.resilience.core.model.CallTag;
import com.autoquant.resilience.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker가 호출을 거부했음을 나타냅니다.
 *
 * <p>"이번 호출이 실패했다"가 아니라 "리소스가 다운되어 있으니 시도하지 말라"는 신호입니다.
 * 재시도 대상이 아니며 백오프도 적용되지 않습니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public class CircuitOpenException extends ResilienceException {

    private final String breakerName;
    private final CircuitBreakerState state;

    public CircuitOpenException(CallTag tag, String breakerName, CircuitBreakerState state) {
        this(tag, breakerName, state, null);
    }

    /**
     * 재시도 도중 Circuit이 열린 경우 직전 시도의 원인을 함께 전달합니다.
     *
     * @param tag 호출 태그
     * @param breakerName Circuit Breaker 이름
     * @param state 거부 시점 상태
     * @param lastCause 직전 시도의 실패 원인 (첫 시도 전 거부면 null)
     */
    public CircuitOpenException(CallTag tag, String breakerName, CircuitBreakerState state, Throwable lastCause) {
        super(tag, String.format("Circuit '%s' is %s - failing fast (%s)", breakerName, state, tag), lastCause);
        this.breakerName = breakerName;
        this.state = state;
    }

    public String getBreakerName() {
        return breakerName;
    }

    /**
     * 거부 시점의 Circuit Breaker 상태.
     *
     * @return OPEN 또는 HALF_OPEN (probe 진행 중)
     */
    public CircuitBreakerState getState() {
        return state;
    }
}
