/**
 * Circuit Breaker 상태 머신 규칙.
 *
 * <p>{@link com.autoquant.resilience.core.statemachine.CircuitTransition}이 허용된 전이 표를 보관합니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
package com.autoquant.resilience.core.statemachine;
