package com.autoquant.resilience.core.outcome;

/**
 * 성공 결과.
 *
 * @param value 원격 호출이 반환한 값 (null 허용)
 * @param <T> 값 타입
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public record Success<T>(T value) implements Outcome<T> {

    @Override
    public OutcomeKind kind() {
        return OutcomeKind.SUCCESS;
    }
}
