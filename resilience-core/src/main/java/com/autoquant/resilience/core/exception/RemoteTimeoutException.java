package com.autoquant.resilience.core.exception;

/**
 * 원격 호출이 제한 시간 내에 응답하지 않았음을 나타냅니다.
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public class RemoteTimeoutException extends RuntimeException {

    public RemoteTimeoutException(String message) {
        super(message);
    }

    public RemoteTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
