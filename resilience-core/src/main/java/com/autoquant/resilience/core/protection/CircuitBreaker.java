package com.autoquant.resilience.core.protection;

import com.autoquant.resilience.core.model.CallTag;
import com.autoquant.resilience.core.outcome.Outcome;

/**
 * Circuit Breaker SPI.
 *
 * <p>원격 API 호출의 실패를 추적하고, 임계값 도달 시 빠르게 실패(Fail-Fast)하여
 * 복구 중인 리소스에 부하가 몰리는 것을 방지합니다.</p>
 *
 * <p>Circuit Breaker 자체는 실패하지 않습니다. {@code allow()}와 {@code record()}는 잘못된 인자 외에는
 * 예외를 던지지 않으며, 가용성을 낮추는(호출 거부) 방식으로만 동작합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = ...;
 * CallTag tag = CallTag.generate();
 *
 * CircuitPermit permit = cb.allow(tag);
 * if (!permit.isGranted()) {
 *     throw new CircuitOpenException(tag, cb.getName(), cb.getState());
 * }
 *
 * Outcome<Order> outcome;
 * try {
 *     outcome = Outcome.success(broker.submit(order));
 * } catch (Exception e) {
 *     outcome = classifier.classify(e, elapsedMs);
 * }
 * cb.record(permit, outcome);
 * }</pre>
 *
 * <p>Half-Open probe 소유자는 {@link CallTag}가 아니라 {@link CircuitPermit} 인스턴스로 구분합니다.
 * 태그는 여러 호출이 공유할 수 있는 로깅용 값이기 때문입니다.</p>
 *
 * <p>구현체는 thread-safe해야 합니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 새 시도의 진행 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 일반 허가</li>
     *   <li>OPEN: openDuration 경과 시 probe 허가 (HALF_OPEN으로 전이), 그 외 거부</li>
     *   <li>HALF_OPEN: 진행 중인 probe가 없을 때만 probe 허가, 그 외 거부</li>
     * </ul>
     *
     * @param tag 호출 태그 (로깅용)
     * @return 허가. {@link CircuitPermit#isGranted()}가 false면 거부
     */
    CircuitPermit allow(CallTag tag);

    /**
     * 시도 결과 기록.
     *
     * <ul>
     *   <li>CLOSED: 실패 시 실패 카운터 증가, 임계값 도달 시 OPEN. 성공 시 실패 카운터 초기화.</li>
     *   <li>HALF_OPEN: 현재 probe 허가의 성공이면 성공 카운터 증가, closeThreshold 도달 시 CLOSED.
     *       다른 허가의 성공은 무시. 실패는 허가와 무관하게 즉시 OPEN.</li>
     *   <li>OPEN: 아무 동작 안 함</li>
     * </ul>
     *
     * @param permit {@link #allow(CallTag)}가 발급한 허가
     * @param outcome 시도 결과
     * @throws IllegalArgumentException 거부된 허가인 경우
     */
    void record(CircuitPermit permit, Outcome<?> outcome);

    /**
     * 현재 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 상태와 카운터의 읽기 전용 스냅샷 조회.
     *
     * @return 스냅샷
     */
    CircuitBreakerSnapshot snapshot();

    /**
     * Circuit Breaker 이름 (보호 대상 리소스 이름).
     *
     * @return 이름
     */
    String getName();

    /**
     * CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다. 모든 카운터와 probe 슬롯을 초기화합니다.</p>
     */
    void reset();
}
