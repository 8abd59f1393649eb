package com.autoquant.resilience.core.outcome;

/**
 * 원격 호출 1회 시도의 결과.
 *
 * <p>Outcome은 네 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 성공, 값 포함</li>
 *   <li>{@link TransientFailure}: 일시적 실패, 재시도 가능</li>
 *   <li>{@link PermanentFailure}: 영구적 실패, 재시도 불가</li>
 *   <li>{@link Timeout}: 시간 초과, 재시도 가능</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 허용된 구현이 컴파일 타임에 고정됩니다.
 * Outcome은 단일 호출 범위에서만 사용되는 일회성 값입니다.</p>
 *
 * @param <T> 성공 값 타입
 * @author AutoQuant Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Success, TransientFailure, PermanentFailure, Timeout {

    /**
     * 결과 종류 조회.
     *
     * @return OutcomeKind
     */
    OutcomeKind kind();

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * 결과가 실패(일시적, 영구적, 타임아웃 포함)인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * 실패 원인 조회.
     *
     * @return 원인 예외, 성공이거나 원인이 없는 타임아웃이면 null
     */
    default Throwable causeOrNull() {
        return null;
    }

    /**
     * 성공 결과 생성.
     *
     * @param value 성공 값 (null 허용)
     * @param <T> 값 타입
     * @return Success
     */
    static <T> Outcome<T> success(T value) {
        return new Success<>(value);
    }

    /**
     * 일시적 실패 결과 생성.
     *
     * @param cause 원인
     * @param <T> 값 타입
     * @return TransientFailure
     */
    static <T> Outcome<T> transientFailure(Throwable cause) {
        return new TransientFailure<>(cause);
    }

    /**
     * 영구적 실패 결과 생성.
     *
     * @param cause 원인
     * @param <T> 값 타입
     * @return PermanentFailure
     */
    static <T> Outcome<T> permanentFailure(Throwable cause) {
        return new PermanentFailure<>(cause);
    }

    /**
     * 타임아웃 결과 생성.
     *
     * @param elapsedMs 경과 시간 (밀리초)
     * @param cause 원인 (null 허용)
     * @param <T> 값 타입
     * @return Timeout
     */
    static <T> Outcome<T> timeout(long elapsedMs, Throwable cause) {
        return new Timeout<>(elapsedMs, cause);
    }
}
