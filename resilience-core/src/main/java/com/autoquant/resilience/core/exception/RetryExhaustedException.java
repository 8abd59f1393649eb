package com.autoquant.resilience.core.exception;

import com.autoquant.resilience.core.model.CallTag;
import com.autoquant.resilience.core.outcome.OutcomeKind;

/**
 * 재시도 예산 소진.
 *
 * <p>다음 중 하나로 발생합니다:</p>
 * <ul>
 *   <li>maxAttempts 만큼 시도했으나 모두 일시적 실패/타임아웃</li>
 *   <li>마지막 결과 종류가 정책상 재시도 대상이 아님</li>
 *   <li>다음 재시도가 호출자 데드라인을 넘김 ({@link #isDeadlineExceeded()})</li>
 * </ul>
 *
 * <p>마지막 시도의 원인이 {@link #getCause()}로 전달됩니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public class RetryExhaustedException extends ResilienceException {

    private final int attempts;
    private final OutcomeKind lastOutcomeKind;
    private final boolean deadlineExceeded;

    public RetryExhaustedException(CallTag tag, int attempts, OutcomeKind lastOutcomeKind,
                                   boolean deadlineExceeded, Throwable cause) {
        super(tag, buildMessage(tag, attempts, lastOutcomeKind, deadlineExceeded), cause);
        this.attempts = attempts;
        this.lastOutcomeKind = lastOutcomeKind;
        this.deadlineExceeded = deadlineExceeded;
    }

    private static String buildMessage(CallTag tag, int attempts, OutcomeKind lastOutcomeKind, boolean deadlineExceeded) {
        if (deadlineExceeded) {
            return String.format("Deadline exceeded after %d attempt(s), last outcome: %s (%s)", attempts, lastOutcomeKind, tag);
        }
        return String.format("Exhausted %d attempt(s), last outcome: %s (%s)", attempts, lastOutcomeKind, tag);
    }

    /**
     * 실제 실행된 시도 횟수.
     *
     * @return 시도 횟수 (데드라인이 시작 전에 지난 경우 0)
     */
    public int getAttempts() {
        return attempts;
    }

    /**
     * 마지막 시도의 결과 종류.
     *
     * @return OutcomeKind, 시도가 없었으면 null
     */
    public OutcomeKind getLastOutcomeKind() {
        return lastOutcomeKind;
    }

    public boolean isDeadlineExceeded() {
        return deadlineExceeded;
    }
}
