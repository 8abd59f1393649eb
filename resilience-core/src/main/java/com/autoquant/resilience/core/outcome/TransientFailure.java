package com.autoquant.resilience.core.outcome;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>네트워크 순단</li>
 *   <li>외부 서비스 일시 장애 (503 Service Unavailable)</li>
 *   <li>Rate Limit 초과 (429 Too Many Requests)</li>
 * </ul>
 *
 * @param cause 원인 (필수)
 * @param <T> 값 타입
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public record TransientFailure<T>(Throwable cause) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public TransientFailure {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
    }

    @Override
    public OutcomeKind kind() {
        return OutcomeKind.TRANSIENT_FAILURE;
    }

    @Override
    public Throwable causeOrNull() {
        return cause;
    }
}
