package com.autoquant.resilience.testkit.fault;

/**
 * 주입할 장애 종류.
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public enum FaultType {

    /** 장애 없음, 원래 작업을 그대로 호출. */
    PASS,

    /** {@link com.autoquant.resilience.core.exception.TransientRemoteException} (기본 429). */
    TRANSIENT,

    /** {@link com.autoquant.resilience.core.exception.PermanentRemoteException} (기본 400). */
    PERMANENT,

    /** 지연 후 {@link com.autoquant.resilience.core.exception.RemoteTimeoutException}. */
    TIMEOUT
}
