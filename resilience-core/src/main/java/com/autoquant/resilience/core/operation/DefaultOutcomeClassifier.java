package com.autoquant.resilience.core.operation;

import com.autoquant.resilience.core.exception.PermanentRemoteException;
import com.autoquant.resilience.core.exception.RemoteApiException;
import com.autoquant.resilience.core.exception.RemoteTimeoutException;
import com.autoquant.resilience.core.exception.TransientRemoteException;
import com.autoquant.resilience.core.outcome.Outcome;

import java.util.concurrent.TimeoutException;

/**
 * 정규화된 예외 타입 기반 기본 분류기.
 *
 * <p><strong>분류 순서:</strong></p>
 * <ol>
 *   <li>{@link TransientRemoteException} → TransientFailure</li>
 *   <li>{@link PermanentRemoteException} → PermanentFailure</li>
 *   <li>{@link RemoteTimeoutException}, {@link TimeoutException} → Timeout</li>
 *   <li>그 외 {@link RemoteApiException} → 상태 코드로 분류 ({@link StatusCodeOutcomeClassifier})</li>
 *   <li>알 수 없는 예외 → PermanentFailure</li>
 * </ol>
 *
 * <p>알 수 없는 예외는 정규화 계층을 거치지 않은 버그로 보고 재시도하지 않습니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public final class DefaultOutcomeClassifier implements OutcomeClassifier {

    private final StatusCodeOutcomeClassifier statusCodeClassifier;

    public DefaultOutcomeClassifier() {
        this(new StatusCodeOutcomeClassifier());
    }

    /**
     * 상태 코드 분류기 지정.
     *
     * @param statusCodeClassifier 상태 코드만 있는 RemoteApiException 분류에 사용
     * @throws IllegalArgumentException statusCodeClassifier가 null인 경우
     */
    public DefaultOutcomeClassifier(StatusCodeOutcomeClassifier statusCodeClassifier) {
        if (statusCodeClassifier == null) {
            throw new IllegalArgumentException("statusCodeClassifier cannot be null");
        }
        this.statusCodeClassifier = statusCodeClassifier;
    }

    @Override
    public <T> Outcome<T> classify(Throwable failure, long elapsedMs) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        if (failure instanceof TransientRemoteException) {
            return Outcome.transientFailure(failure);
        }
        if (failure instanceof PermanentRemoteException) {
            return Outcome.permanentFailure(failure);
        }
        if (failure instanceof RemoteTimeoutException || failure instanceof TimeoutException) {
            return Outcome.timeout(elapsedMs, failure);
        }
        if (failure instanceof RemoteApiException apiException) {
            return statusCodeClassifier.classifyStatus(apiException.getStatusCode(), failure, elapsedMs);
        }
        return Outcome.permanentFailure(failure);
    }
}
