package com.autoquant.resilience.core.exception;

/**
 * 정규화 계층이 던지는 원격 API 오류.
 *
 * <p>브로커 SDK의 벤더별 오류는 정규화 계층에서 이 예외(또는 하위 타입)로 변환됩니다.
 * 코어는 벤더 오류를 직접 보지 않고, HTTP 상태 코드와 하위 타입만으로 분류합니다.</p>
 *
 * <ul>
 *   <li>{@link TransientRemoteException}: 일시적 오류 (재시도 가능)</li>
 *   <li>{@link PermanentRemoteException}: 영구적 오류 (재시도 불가)</li>
 *   <li>그 외: 상태 코드로 분류 ({@code StatusCodeOutcomeClassifier})</li>
 * </ul>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public class RemoteApiException extends RuntimeException {

    /** 상태 코드를 알 수 없는 경우의 값. */
    public static final int UNKNOWN_STATUS = -1;

    private final int statusCode;

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param statusCode HTTP 상태 코드 (알 수 없으면 {@link #UNKNOWN_STATUS})
     */
    public RemoteApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param message 오류 메시지
     * @param statusCode HTTP 상태 코드
     * @param cause 원본 벤더 오류
     */
    public RemoteApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP 상태 코드 조회.
     *
     * @return 상태 코드, 알 수 없으면 {@link #UNKNOWN_STATUS}
     */
    public int getStatusCode() {
        return statusCode;
    }
}
