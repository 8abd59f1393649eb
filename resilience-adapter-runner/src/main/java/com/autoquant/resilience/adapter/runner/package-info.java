/**
 * Runner Adapter Layer - RetryExecutor 구현체.
 *
 * <p>이 패키지는 RetryExecutor 인터페이스의 구체적인 구현체와 백오프 계산기를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.autoquant.resilience.adapter.runner.RetryWrapper} - Circuit Breaker 연동 재시도 실행기</li>
 *   <li>{@link com.autoquant.resilience.adapter.runner.BackoffCalculator} - Exponential Backoff with ± Jitter</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (RetryWrapper)
 *   ↓ implements
 * core/executor (RetryExecutor interface)
 *   ↓ depends on
 * core/protection (CircuitBreaker SPI), core/operation (RemoteOperation, OutcomeClassifier)
 * </pre>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
package com.autoquant.resilience.adapter.runner;
