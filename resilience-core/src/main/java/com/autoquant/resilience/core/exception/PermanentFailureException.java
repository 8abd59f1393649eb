package com.autoquant.resilience.core.exception;

import com.autoquant.resilience.core.model.CallTag;

/**
 * 재시도 불가능한 실패.
 *
 * <p>남은 시도 횟수와 무관하게 즉시 전파됩니다. 원인 체인은 그대로 유지됩니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public class PermanentFailureException extends ResilienceException {

    private final int attempt;

    public PermanentFailureException(CallTag tag, int attempt, Throwable cause) {
        super(tag, String.format("Permanent failure on attempt %d (%s): %s", attempt, tag, cause), cause);
        this.attempt = attempt;
    }

    /**
     * 실패한 시도 번호 (1부터 시작).
     *
     * @return 시도 번호
     */
    public int getAttempt() {
        return attempt;
    }
}
