package com.autoquant.resilience.core.outcome;

/**
 * Outcome 종류.
 *
 * <p>{@link com.autoquant.resilience.core.retry.RetryPolicy}가 재시도 대상 종류를 선언할 때와
 * 로그/예외에 마지막 결과 종류를 남길 때 사용합니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public enum OutcomeKind {

    /** 성공. */
    SUCCESS,

    /** 일시적 실패 (네트워크 순단, Rate Limit 등). 재시도 가능. */
    TRANSIENT_FAILURE,

    /** 영구적 실패 (검증 오류, 인증 실패 등). 절대 재시도하지 않음. */
    PERMANENT_FAILURE,

    /** 시간 초과. 재시도 예산과 Circuit Breaker 실패 카운트 모두에 반영. */
    TIMEOUT;

    /**
     * 실패 종류인지 확인.
     *
     * @return SUCCESS가 아니면 true
     */
    public boolean isFailure() {
        return this != SUCCESS;
    }
}
