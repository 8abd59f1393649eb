package com.autoquant.resilience.core.operation;

import com.autoquant.resilience.core.exception.RemoteApiException;
import com.autoquant.resilience.core.outcome.Outcome;

import java.util.Set;

/**
 * HTTP 상태 코드 기반 분류기.
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ul>
 *   <li>408 Request Timeout → Timeout</li>
 *   <li>retryableCodes (기본 429, 500, 502, 503, 504) → TransientFailure</li>
 *   <li>그 외 상태 코드, 상태 코드가 없는 예외 → PermanentFailure</li>
 * </ul>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public final class StatusCodeOutcomeClassifier implements OutcomeClassifier {

    /** 기본 재시도 가능 상태 코드. */
    public static final Set<Integer> DEFAULT_RETRYABLE_CODES = Set.of(429, 500, 502, 503, 504);

    private static final int REQUEST_TIMEOUT = 408;

    private final Set<Integer> retryableCodes;

    /**
     * 기본 재시도 가능 상태 코드로 생성.
     */
    public StatusCodeOutcomeClassifier() {
        this(DEFAULT_RETRYABLE_CODES);
    }

    /**
     * 재시도 가능 상태 코드 지정.
     *
     * @param retryableCodes 재시도 가능 상태 코드
     * @throws IllegalArgumentException retryableCodes가 null인 경우
     */
    public StatusCodeOutcomeClassifier(Set<Integer> retryableCodes) {
        if (retryableCodes == null) {
            throw new IllegalArgumentException("retryableCodes cannot be null");
        }
        this.retryableCodes = Set.copyOf(retryableCodes);
    }

    @Override
    public <T> Outcome<T> classify(Throwable failure, long elapsedMs) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        if (!(failure instanceof RemoteApiException apiException)) {
            return Outcome.permanentFailure(failure);
        }
        return classifyStatus(apiException.getStatusCode(), failure, elapsedMs);
    }

    /**
     * 상태 코드만으로 분류.
     *
     * @param statusCode HTTP 상태 코드
     * @param failure 원인
     * @param elapsedMs 경과 시간 (밀리초)
     * @param <T> 결과 값 타입
     * @return 분류 결과
     */
    <T> Outcome<T> classifyStatus(int statusCode, Throwable failure, long elapsedMs) {
        if (statusCode == REQUEST_TIMEOUT) {
            return Outcome.timeout(elapsedMs, failure);
        }
        if (retryableCodes.contains(statusCode)) {
            return Outcome.transientFailure(failure);
        }
        return Outcome.permanentFailure(failure);
    }

    /**
     * 재시도 가능 상태 코드 조회.
     *
     * @return 불변 Set
     */
    public Set<Integer> getRetryableCodes() {
        return retryableCodes;
    }
}
