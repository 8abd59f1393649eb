package com.autoquant.resilience.core.operation;

import com.autoquant.resilience.core.outcome.Outcome;

/**
 * 시도 중 발생한 예외를 Outcome으로 분류.
 *
 * <p>일시적/영구적/타임아웃 구분의 책임은 정규화 계층에 있으며,
 * 분류기는 정규화된 예외 타입이나 상태 코드만 보고 판단합니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public interface OutcomeClassifier {

    /**
     * 예외 분류.
     *
     * @param failure 시도 중 발생한 예외 (null 불가)
     * @param elapsedMs 시도 시작부터 경과한 시간 (밀리초)
     * @param <T> 결과 값 타입
     * @return TransientFailure, PermanentFailure, Timeout 중 하나
     */
    <T> Outcome<T> classify(Throwable failure, long elapsedMs);
}
