package com.autoquant.resilience.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>한 시점에 정확히 하나의 상태만 활성화되며, 동시 호출자에 대해 원자적으로 전이합니다.
 * 종료 상태는 없고, 보호 대상 리소스가 살아있는 동안 순환합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 ≥ failureThreshold, trip 시각 기록)
 * OPEN (차단)
 *   │
 *   ▼ (openDuration 경과 + probe 슬롯 비어있음)
 * HALF_OPEN (반개방, 단일 probe)
 *   │
 *   ├─► 성공 ≥ closeThreshold → CLOSED (카운터 초기화)
 *   └─► 실패 1회 → OPEN (trip 시각 재기록)
 * </pre>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>모든 요청을 통과시키며 실패 횟수를 추적합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>openDuration이 경과하면 첫 번째 호출자가 probe가 되며 HALF_OPEN으로 전이합니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (한 번에 하나의 probe만 통과).
     *
     * <p>probe가 진행 중인 동안 다른 호출자는 거부됩니다 (Thundering Herd 방지).</p>
     */
    HALF_OPEN
}
