package com.autoquant.resilience.core.time;

/**
 * 호출자가 지정한 전체 데드라인.
 *
 * <p>남은 시도 횟수가 있더라도 데드라인을 넘겨 재시도하지 않습니다.
 * 데드라인이 있으면 진행 중인 시도도 남은 시간으로 제한됩니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(null, 0);

    private final Ticker ticker;
    private final long deadlineNanos;

    private Deadline(Ticker ticker, long deadlineNanos) {
        this.ticker = ticker;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * 제한 없는 데드라인.
     *
     * @return 무제한 Deadline
     */
    public static Deadline none() {
        return NONE;
    }

    /**
     * 지금부터 timeoutMs 후의 데드라인 (시스템 Ticker).
     *
     * @param timeoutMs 제한 시간 (밀리초, 0 이상)
     * @return Deadline
     * @throws IllegalArgumentException timeoutMs가 음수인 경우
     */
    public static Deadline after(long timeoutMs) {
        return after(timeoutMs, Ticker.system());
    }

    /**
     * 지금부터 timeoutMs 후의 데드라인.
     *
     * @param timeoutMs 제한 시간 (밀리초, 0 이상)
     * @param ticker 시계
     * @return Deadline
     * @throws IllegalArgumentException timeoutMs가 음수이거나 ticker가 null인 경우
     */
    public static Deadline after(long timeoutMs, Ticker ticker) {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs cannot be negative (current: " + timeoutMs + ")");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null");
        }
        return new Deadline(ticker, ticker.nanoTime() + timeoutMs * 1_000_000L);
    }

    /**
     * 제한이 있는 데드라인인지 확인.
     *
     * @return 무제한이면 false
     */
    public boolean isBounded() {
        return ticker != null;
    }

    /**
     * 데드라인이 지났는지 확인.
     *
     * @return 지났으면 true (무제한이면 항상 false)
     */
    public boolean isExpired() {
        return isBounded() && ticker.nanoTime() - deadlineNanos >= 0;
    }

    /**
     * 남은 시간 조회.
     *
     * @return 남은 시간 (밀리초, 0 이상), 무제한이면 {@link Long#MAX_VALUE}
     */
    public long remainingMs() {
        if (!isBounded()) {
            return Long.MAX_VALUE;
        }
        long remainingNanos = deadlineNanos - ticker.nanoTime();
        return remainingNanos <= 0 ? 0 : remainingNanos / 1_000_000L;
    }

    /**
     * millis만큼 대기한 뒤에도 데드라인 이전인지 확인.
     *
     * @param millis 대기 예정 시간 (밀리초)
     * @return 대기 후에도 시간이 남으면 true
     */
    public boolean allows(long millis) {
        return !isBounded() || remainingMs() > millis;
    }

    @Override
    public String toString() {
        return isBounded() ? "Deadline{remaining=" + remainingMs() + "ms}" : "Deadline{none}";
    }
}
