package com.autoquant.resilience.core.outcome;

/**
 * 영구적 실패 (재시도 불가).
 *
 * <p>재시도해도 성공할 수 없는 경우를 나타냅니다. 남은 시도 횟수와 무관하게
 * 즉시 호출자에게 전파됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>유효성 검증 실패 (잘못된 주문 파라미터)</li>
 *   <li>인증 실패 (401 Unauthorized)</li>
 *   <li>권한 없음 (403 Forbidden)</li>
 * </ul>
 *
 * @param cause 원인 (필수)
 * @param <T> 값 타입
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public record PermanentFailure<T>(Throwable cause) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public PermanentFailure {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
    }

    @Override
    public OutcomeKind kind() {
        return OutcomeKind.PERMANENT_FAILURE;
    }

    @Override
    public Throwable causeOrNull() {
        return cause;
    }
}
