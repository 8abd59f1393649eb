package com.autoquant.resilience.core.exception;

/**
 * 일시적 원격 오류 (네트워크 순단, Rate Limit, 5xx).
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public class TransientRemoteException extends RemoteApiException {

    public TransientRemoteException(String message) {
        super(message, UNKNOWN_STATUS);
    }

    public TransientRemoteException(String message, int statusCode) {
        super(message, statusCode);
    }

    public TransientRemoteException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
