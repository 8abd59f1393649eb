package com.autoquant.resilience.core.executor;

import com.autoquant.resilience.core.model.CallTag;
import com.autoquant.resilience.core.operation.RemoteOperation;
import com.autoquant.resilience.core.retry.RetryPolicy;
import com.autoquant.resilience.core.time.Deadline;

/**
 * Circuit Breaker를 거쳐 원격 작업을 재시도와 함께 실행.
 *
 * <p><strong>결과:</strong></p>
 * <ul>
 *   <li>성공: 값 반환</li>
 *   <li>{@link com.autoquant.resilience.core.exception.CircuitOpenException}: Circuit Breaker 거부 (시도 아님)</li>
 *   <li>{@link com.autoquant.resilience.core.exception.PermanentFailureException}: 재시도 불가 실패</li>
 *   <li>{@link com.autoquant.resilience.core.exception.RetryExhaustedException}: 시도 예산 또는 데드라인 소진</li>
 *   <li>{@link com.autoquant.resilience.core.exception.CallCancelledException}: 호출자 인터럽트</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 구현체는 thread-safe해야 하며, 여러 스레드가 같은
 * Circuit Breaker를 공유하며 동시에 호출할 수 있습니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public interface RetryExecutor {

    /**
     * 데드라인 없이 실행 (태그는 자동 생성).
     *
     * @param operation 원격 작업
     * @param policy 재시도 정책
     * @param <T> 결과 값 타입
     * @return 결과 값
     */
    default <T> T execute(RemoteOperation<T> operation, RetryPolicy policy) {
        return execute(CallTag.generate(), operation, policy, Deadline.none());
    }

    /**
     * 태그와 데드라인을 지정하여 실행.
     *
     * @param tag 호출 태그
     * @param operation 원격 작업
     * @param policy 재시도 정책
     * @param deadline 호출자 데드라인 ({@link Deadline#none()} 가능)
     * @param <T> 결과 값 타입
     * @return 결과 값
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    <T> T execute(CallTag tag, RemoteOperation<T> operation, RetryPolicy policy, Deadline deadline);
}
