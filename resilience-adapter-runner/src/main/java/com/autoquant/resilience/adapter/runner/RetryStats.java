package com.autoquant.resilience.adapter.runner;

/**
 * RetryWrapper 누적 통계 스냅샷.
 *
 * @param calls execute() 호출 수
 * @param retries 백오프 후 재시도한 횟수
 * @param successes 성공으로 끝난 호출 수
 * @param exhausted 재시도 예산/데드라인 소진으로 끝난 호출 수
 * @param permanentFailures 영구 실패로 끝난 호출 수
 * @param circuitOpenRejections Circuit Breaker 거부로 끝난 호출 수
 * @param cancellations 호출자 취소로 끝난 호출 수
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public record RetryStats(
    long calls,
    long retries,
    long successes,
    long exhausted,
    long permanentFailures,
    long circuitOpenRejections,
    long cancellations
) {

    /**
     * 호출당 재시도 비율.
     *
     * @return retries / calls, 호출이 없으면 0.0
     */
    public double retryRate() {
        if (calls == 0) {
            return 0.0;
        }
        return (double) retries / calls;
    }

    /**
     * 종료된 호출 수 (성공, 소진, 영구 실패, 거부, 취소의 합).
     *
     * @return 종료된 호출 수
     */
    public long completed() {
        return successes + exhausted + permanentFailures + circuitOpenRejections + cancellations;
    }
}
