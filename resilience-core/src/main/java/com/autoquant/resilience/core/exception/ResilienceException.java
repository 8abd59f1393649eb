package com.autoquant.resilience.core.exception;

import com.autoquant.resilience.core.model.CallTag;

/**
 * Retry Wrapper가 호출자에게 전파하는 모든 예외의 최상위 타입.
 *
 * <p><strong>하위 타입:</strong></p>
 * <ul>
 *   <li>{@link CircuitOpenException}: Circuit Breaker 거부 (Operation 실패 아님)</li>
 *   <li>{@link PermanentFailureException}: 재시도 불가 실패</li>
 *   <li>{@link RetryExhaustedException}: 재시도 예산 또는 데드라인 소진</li>
 *   <li>{@link CallCancelledException}: 호출자 취소</li>
 * </ul>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public abstract class ResilienceException extends RuntimeException {

    private final CallTag tag;

    protected ResilienceException(CallTag tag, String message) {
        super(message);
        this.tag = tag;
    }

    protected ResilienceException(CallTag tag, String message, Throwable cause) {
        super(message, cause);
        this.tag = tag;
    }

    /**
     * 실패한 호출의 태그 조회.
     *
     * @return CallTag
     */
    public CallTag getTag() {
        return tag;
    }
}
