package com.autoquant.resilience.adapter.runner;

import com.autoquant.resilience.core.retry.RetryPolicy;

import java.util.Random;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 지수적으로 증가시키되, ± Jitter를 추가하여
 * 여러 호출자가 동시에 재시도하는 Thundering Herd Problem을 방지합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * nominal = min(baseBackoff * multiplier^(attempt-1), maxBackoff)
 * jitter  = uniform(-nominal * jitterFraction, +nominal * jitterFraction)
 * delay   = max(0, nominal + jitter)
 * </pre>
 *
 * <p><strong>예시 (base=100ms, multiplier=2, max=1000ms, jitter=0):</strong></p>
 * <ul>
 *   <li>attempt=1: 100ms</li>
 *   <li>attempt=2: 200ms</li>
 *   <li>attempt=3: 400ms</li>
 *   <li>attempt=5: 1600ms → 1000ms (capped)</li>
 * </ul>
 *
 * <p>난수원은 생성자로 주입받습니다. 같은 seed의 {@link Random}을 주입하면 지터가 재현됩니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final Random random;

    /**
     * 기본 난수원으로 생성.
     */
    public BackoffCalculator() {
        this(new Random());
    }

    /**
     * 난수원 주입.
     *
     * @param random 지터용 난수원
     * @throws IllegalArgumentException random이 null인 경우
     */
    public BackoffCalculator(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.random = random;
    }

    /**
     * 지터를 제외한 지연 시간 계산.
     *
     * <p>attempt에 대해 단조 비감소합니다.</p>
     *
     * @param policy 재시도 정책
     * @param attempt 방금 실패한 시도 번호 (1부터 시작)
     * @return 지연 시간 (밀리초)
     * @throws IllegalArgumentException policy가 null이거나 attempt가 양수가 아닌 경우
     */
    public long nominalDelay(RetryPolicy policy, int attempt) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (attempt <= 0) {
            throw new IllegalArgumentException(
                "attempt must be positive (current: " + attempt + ")"
            );
        }

        // pow 결과가 Infinity여도 min에서 상한으로 잘림
        double exponential = policy.baseBackoffMs() * Math.pow(policy.multiplier(), attempt - 1);
        return (long) Math.min(exponential, (double) policy.maxBackoffMs());
    }

    /**
     * 재시도 지연 시간 계산 (지터 포함).
     *
     * @param policy 재시도 정책
     * @param attempt 방금 실패한 시도 번호 (1부터 시작)
     * @return 재시도 전 대기 시간 (밀리초, 0 이상)
     * @throws IllegalArgumentException policy가 null이거나 attempt가 양수가 아닌 경우
     */
    public long calculate(RetryPolicy policy, int attempt) {
        long nominal = nominalDelay(policy, attempt);
        if (nominal == 0 || policy.jitterFraction() == 0.0) {
            return nominal;
        }

        double spread = nominal * policy.jitterFraction();
        double offset = (random.nextDouble() * 2.0 - 1.0) * spread;
        return Math.max(0L, Math.round(nominal + offset));
    }
}
