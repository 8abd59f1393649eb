package com.autoquant.resilience.core.protection.noop;

import com.autoquant.resilience.core.model.CallTag;
import com.autoquant.resilience.core.outcome.Outcome;
import com.autoquant.resilience.core.protection.CircuitBreaker;
import com.autoquant.resilience.core.protection.CircuitBreakerSnapshot;
import com.autoquant.resilience.core.protection.CircuitBreakerState;
import com.autoquant.resilience.core.protection.CircuitPermit;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 허용하며, 상태 추적을 하지 않습니다.
 * Circuit Breaker 없이 재시도만 적용하고자 할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>allow(): 항상 일반 허가 발급</li>
 *   <li>record(): 아무 동작 안 함</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 *   <li>reset(): 아무 동작 안 함</li>
 * </ul>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private static final String NAME = "noop";

    @Override
    public CircuitPermit allow(CallTag tag) {
        return CircuitPermit.granted(tag);
    }

    @Override
    public void record(CircuitPermit permit, Outcome<?> outcome) {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(NAME, CircuitBreakerState.CLOSED, 0, 0, 0, 0, false);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void reset() {
        // NoOp
    }
}
