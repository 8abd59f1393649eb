/**
 * In-Memory Circuit Breaker 구현.
 *
 * <p>{@link com.autoquant.resilience.core.protection.CircuitBreaker} SPI의 프로세스 로컬 구현을 제공합니다.
 * 상태는 메모리에만 존재하며 재시작 시 CLOSED로 돌아갑니다.</p>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-inmemory (InMemoryCircuitBreaker)
 *   ↓ implements
 * core/protection (CircuitBreaker SPI)
 *   ↓ validates with
 * core/statemachine (CircuitTransition)
 * </pre>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
package com.autoquant.resilience.adapter.inmemory.breaker;
