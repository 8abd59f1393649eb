package com.autoquant.resilience.core.operation;

/**
 * 코어가 보호하는 원격 작업 단위.
 *
 * <p>성공하면 값을 반환하고, 실패하면 정규화 계층의 예외를 던집니다.
 * 코어는 성공/실패/타임아웃 외의 부수 효과를 알지 못합니다.</p>
 *
 * @param <T> 결과 값 타입
 * @author AutoQuant Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RemoteOperation<T> {

    /**
     * 원격 호출 실행.
     *
     * @return 결과 값
     * @throws Exception 원격 호출 실패 ({@link OutcomeClassifier}가 분류)
     */
    T call() throws Exception;
}
