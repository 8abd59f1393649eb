/**
 * Circuit Breaker SPI 패키지.
 *
 * <p>원격 거래 API 호출을 보호하는 Circuit Breaker의 계약, 상태, 설정, 스냅샷을 정의합니다.
 * 프로세스 로컬 구현은 {@code resilience-adapter-inmemory} 모듈의
 * {@code InMemoryCircuitBreaker}가 제공합니다.</p>
 *
 * <h2>호출 순서</h2>
 * <pre>
 * 1. CircuitBreaker.allow()   → CircuitPermit 발급, 거부면 즉시 CircuitOpenException
 * 2. RemoteOperation.call()   → 실제 원격 호출
 * 3. OutcomeClassifier        → Success / TransientFailure / PermanentFailure / Timeout
 * 4. CircuitBreaker.record()  → 같은 CircuitPermit으로, 재시도 판단 이전에 항상 기록
 * </pre>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지의 {@link com.autoquant.resilience.core.protection.noop.NoOpCircuitBreaker}는
 * 모든 요청을 허용하고 아무것도 기록하지 않습니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 * @see com.autoquant.resilience.core.protection.CircuitBreaker
 * @see com.autoquant.resilience.core.protection.CircuitBreakerConfig
 */
package com.autoquant.resilience.core.protection;
