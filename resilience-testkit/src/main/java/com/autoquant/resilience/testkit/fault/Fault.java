package com.autoquant.resilience.testkit.fault;

/**
 * 한 번의 호출에 주입할 장애.
 *
 * @param type 장애 종류
 * @param delayMs TIMEOUT 장애의 인위적 지연 (밀리초, 그 외 종류는 0)
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public record Fault(FaultType type, long delayMs) {

    /** 통과. */
    public static final Fault PASS = new Fault(FaultType.PASS, 0);

    /** 일시적 실패. */
    public static final Fault TRANSIENT = new Fault(FaultType.TRANSIENT, 0);

    /** 영구적 실패. */
    public static final Fault PERMANENT = new Fault(FaultType.PERMANENT, 0);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException type이 null이거나 delayMs가 음수인 경우
     */
    public Fault {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative (current: " + delayMs + ")");
        }
    }

    /**
     * 지연 후 타임아웃.
     *
     * @param delayMs 지연 (밀리초)
     * @return TIMEOUT Fault
     */
    public static Fault timeout(long delayMs) {
        return new Fault(FaultType.TIMEOUT, delayMs);
    }

    /**
     * 통과 여부.
     *
     * @return PASS면 true
     */
    public boolean isPass() {
        return type == FaultType.PASS;
    }
}
