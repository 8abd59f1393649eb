package com.autoquant.resilience.core.outcome;

/**
 * 시간 초과.
 *
 * <p>시도 타임아웃 초과, 호출자 데드라인 초과, 호출자 취소 모두 Timeout으로 기록됩니다.</p>
 *
 * @param elapsedMs 시도 시작부터 경과한 시간 (밀리초, 0 이상)
 * @param cause 원인 (선택, null 가능)
 * @param <T> 값 타입
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public record Timeout<T>(long elapsedMs, Throwable cause) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException elapsedMs가 음수인 경우
     */
    public Timeout {
        if (elapsedMs < 0) {
            throw new IllegalArgumentException("elapsedMs must be non-negative (current: " + elapsedMs + ")");
        }
        // cause는 null 허용
    }

    @Override
    public OutcomeKind kind() {
        return OutcomeKind.TIMEOUT;
    }

    @Override
    public Throwable causeOrNull() {
        return cause;
    }
}
