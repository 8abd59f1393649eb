package com.autoquant.resilience.core.exception;

import com.autoquant.resilience.core.model.CallTag;

/**
 * 호출자가 실행 중인 호출을 취소(인터럽트)했음을 나타냅니다.
 *
 * <p>이 예외가 던져질 때 스레드의 인터럽트 플래그는 복원된 상태입니다.
 * 진행 중이던 시도는 Circuit Breaker에 Timeout으로 기록된 뒤 전파됩니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public class CallCancelledException extends ResilienceException {

    private final int attempt;

    public CallCancelledException(CallTag tag, int attempt, Throwable cause) {
        super(tag, String.format("Call cancelled during attempt %d (%s)", attempt, tag), cause);
        this.attempt = attempt;
    }

    public int getAttempt() {
        return attempt;
    }
}
