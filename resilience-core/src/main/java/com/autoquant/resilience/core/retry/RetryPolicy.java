package com.autoquant.resilience.core.retry;

import com.autoquant.resilience.core.outcome.OutcomeKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * 재시도 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최대 시도 횟수, 첫 시도 포함 (기본 5)</li>
 *   <li>baseBackoffMs: 첫 재시도 전 대기 시간 (기본 500ms)</li>
 *   <li>multiplier: 시도마다 곱해지는 배수 (기본 2.0)</li>
 *   <li>maxBackoffMs: 대기 시간 상한 (기본 30000ms)</li>
 *   <li>jitterFraction: ± 지터 비율 (기본 0.1)</li>
 *   <li>retryableKinds: 재시도 대상 결과 종류 (기본 TRANSIENT_FAILURE, TIMEOUT)</li>
 *   <li>attemptTimeoutMs: 시도당 타임아웃, 0은 무제한 (기본 0)</li>
 * </ul>
 *
 * <p>PERMANENT_FAILURE는 재시도 대상으로 지정할 수 없습니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param baseBackoffMs 기본 대기 시간 (밀리초, 0 이상)
 * @param multiplier 지수 배수 (1.0 이상)
 * @param maxBackoffMs 대기 시간 상한 (밀리초, baseBackoffMs 이상)
 * @param jitterFraction 지터 비율 (0.0 ~ 1.0)
 * @param retryableKinds 재시도 대상 종류 (TRANSIENT_FAILURE, TIMEOUT의 부분집합)
 * @param attemptTimeoutMs 시도당 타임아웃 (밀리초, 0은 무제한)
 */
public record RetryPolicy(
    int maxAttempts,
    long baseBackoffMs,
    double multiplier,
    long maxBackoffMs,
    double jitterFraction,
    Set<OutcomeKind> retryableKinds,
    long attemptTimeoutMs
) {

    private static final Set<OutcomeKind> DEFAULT_RETRYABLE =
        EnumSet.of(OutcomeKind.TRANSIENT_FAILURE, OutcomeKind.TIMEOUT);

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=5, baseBackoffMs=500, multiplier=2.0, maxBackoffMs=30000,
     * jitterFraction=0.1, retryableKinds={TRANSIENT_FAILURE, TIMEOUT}, attemptTimeoutMs=0</p>
     */
    public RetryPolicy() {
        this(5, 500, 2.0, 30000, 0.1, DEFAULT_RETRYABLE, 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseBackoffMs < 0) {
            throw new IllegalArgumentException(
                "baseBackoffMs cannot be negative (current: " + baseBackoffMs + ")"
            );
        }
        if (Double.isNaN(multiplier) || multiplier < 1.0) {
            throw new IllegalArgumentException(
                "multiplier must be >= 1.0 (current: " + multiplier + ")"
            );
        }
        if (maxBackoffMs < baseBackoffMs) {
            throw new IllegalArgumentException(
                "maxBackoffMs must be >= baseBackoffMs (base: " + baseBackoffMs + ", max: " + maxBackoffMs + ")"
            );
        }
        if (Double.isNaN(jitterFraction) || jitterFraction < 0.0 || jitterFraction > 1.0) {
            throw new IllegalArgumentException(
                "jitterFraction must be between 0.0 and 1.0 (current: " + jitterFraction + ")"
            );
        }
        if (retryableKinds == null) {
            throw new IllegalArgumentException("retryableKinds cannot be null");
        }
        if (retryableKinds.contains(OutcomeKind.PERMANENT_FAILURE) || retryableKinds.contains(OutcomeKind.SUCCESS)) {
            throw new IllegalArgumentException(
                "retryableKinds may only contain TRANSIENT_FAILURE and TIMEOUT (current: " + retryableKinds + ")"
            );
        }
        if (attemptTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "attemptTimeoutMs cannot be negative (current: " + attemptTimeoutMs + ")"
            );
        }
        retryableKinds = retryableKinds.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(retryableKinds));
    }

    /**
     * 주어진 결과 종류가 재시도 대상인지 확인.
     *
     * @param kind 결과 종류
     * @return 재시도 대상이면 true
     */
    public boolean isRetryable(OutcomeKind kind) {
        return retryableKinds.contains(kind);
    }

    /**
     * 시도당 타임아웃 사용 여부.
     *
     * @return attemptTimeoutMs가 양수이면 true
     */
    public boolean hasAttemptTimeout() {
        return attemptTimeoutMs > 0;
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, baseBackoffMs, multiplier, maxBackoffMs, jitterFraction, retryableKinds, attemptTimeoutMs);
    }

    /**
     * baseBackoffMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withBaseBackoffMs(long baseBackoffMs) {
        return new RetryPolicy(maxAttempts, baseBackoffMs, multiplier, maxBackoffMs, jitterFraction, retryableKinds, attemptTimeoutMs);
    }

    /**
     * multiplier만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMultiplier(double multiplier) {
        return new RetryPolicy(maxAttempts, baseBackoffMs, multiplier, maxBackoffMs, jitterFraction, retryableKinds, attemptTimeoutMs);
    }

    /**
     * maxBackoffMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxBackoffMs(long maxBackoffMs) {
        return new RetryPolicy(maxAttempts, baseBackoffMs, multiplier, maxBackoffMs, jitterFraction, retryableKinds, attemptTimeoutMs);
    }

    /**
     * jitterFraction만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withJitterFraction(double jitterFraction) {
        return new RetryPolicy(maxAttempts, baseBackoffMs, multiplier, maxBackoffMs, jitterFraction, retryableKinds, attemptTimeoutMs);
    }

    /**
     * retryableKinds만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withRetryableKinds(Set<OutcomeKind> retryableKinds) {
        return new RetryPolicy(maxAttempts, baseBackoffMs, multiplier, maxBackoffMs, jitterFraction, retryableKinds, attemptTimeoutMs);
    }

    /**
     * attemptTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withAttemptTimeoutMs(long attemptTimeoutMs) {
        return new RetryPolicy(maxAttempts, baseBackoffMs, multiplier, maxBackoffMs, jitterFraction, retryableKinds, attemptTimeoutMs);
    }
}
