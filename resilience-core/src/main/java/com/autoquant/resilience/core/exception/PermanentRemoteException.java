package com.autoquant.resilience.core.exception;

/**
 * 영구적 원격 오류 (잘못된 주문, 인증 실패 등).
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public class PermanentRemoteException extends RemoteApiException {

    public PermanentRemoteException(String message) {
        super(message, UNKNOWN_STATUS);
    }

    public PermanentRemoteException(String message, int statusCode) {
        super(message, statusCode);
    }

    public PermanentRemoteException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
