package com.autoquant.resilience.testkit.fault;

/**
 * 무작위 장애 주입 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>seed: 난수 seed, 같은 seed는 같은 장애 순서를 재현 (기본 42)</li>
 *   <li>failureProbability: 호출당 장애 확률 (기본 0.3)</li>
 *   <li>faultType: 주입할 장애 종류, PASS 불가 (기본 TRANSIENT)</li>
 *   <li>timeoutDelayMs: TIMEOUT 장애의 지연 (기본 0)</li>
 *   <li>burstAt: 버스트(장애 구간) 시작 호출 번호, 0은 버스트 없음 (기본 0)</li>
 *   <li>burstDuration: 버스트 길이 (호출 수, 기본 3)</li>
 * </ul>
 *
 * <p>버스트 구간 [burstAt, burstAt + burstDuration)의 호출은 확률과 무관하게 항상 실패합니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 * @param seed 난수 seed
 * @param failureProbability 장애 확률 (0.0 ~ 1.0)
 * @param faultType 장애 종류
 * @param timeoutDelayMs TIMEOUT 지연 (밀리초, 0 이상)
 * @param burstAt 버스트 시작 호출 번호 (0 이상)
 * @param burstDuration 버스트 길이 (0 이상)
 */
public record RandomFaultConfig(
    long seed,
    double failureProbability,
    FaultType faultType,
    long timeoutDelayMs,
    int burstAt,
    int burstDuration
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: seed=42, failureProbability=0.3, faultType=TRANSIENT, timeoutDelayMs=0,
     * burstAt=0 (없음), burstDuration=3</p>
     */
    public RandomFaultConfig() {
        this(42L, 0.3, FaultType.TRANSIENT, 0, 0, 3);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RandomFaultConfig {
        if (Double.isNaN(failureProbability) || failureProbability < 0.0 || failureProbability > 1.0) {
            throw new IllegalArgumentException(
                "failureProbability must be between 0.0 and 1.0 (current: " + failureProbability + ")"
            );
        }
        if (faultType == null || faultType == FaultType.PASS) {
            throw new IllegalArgumentException("faultType must be a failure type (current: " + faultType + ")");
        }
        if (timeoutDelayMs < 0) {
            throw new IllegalArgumentException(
                "timeoutDelayMs cannot be negative (current: " + timeoutDelayMs + ")"
            );
        }
        if (burstAt < 0) {
            throw new IllegalArgumentException("burstAt cannot be negative (current: " + burstAt + ")");
        }
        if (burstDuration < 0) {
            throw new IllegalArgumentException("burstDuration cannot be negative (current: " + burstDuration + ")");
        }
    }

    /**
     * 호출 번호가 버스트 구간에 속하는지 확인.
     *
     * @param callNumber 1부터 시작하는 호출 번호
     * @return 버스트 구간이면 true
     */
    public boolean isInBurst(int callNumber) {
        return burstAt > 0 && callNumber >= burstAt && callNumber < burstAt + burstDuration;
    }

    /**
     * seed만 변경한 새 인스턴스 생성.
     */
    public RandomFaultConfig withSeed(long seed) {
        return new RandomFaultConfig(seed, failureProbability, faultType, timeoutDelayMs, burstAt, burstDuration);
    }

    /**
     * failureProbability만 변경한 새 인스턴스 생성.
     */
    public RandomFaultConfig withFailureProbability(double failureProbability) {
        return new RandomFaultConfig(seed, failureProbability, faultType, timeoutDelayMs, burstAt, burstDuration);
    }

    /**
     * faultType만 변경한 새 인스턴스 생성.
     */
    public RandomFaultConfig withFaultType(FaultType faultType) {
        return new RandomFaultConfig(seed, failureProbability, faultType, timeoutDelayMs, burstAt, burstDuration);
    }

    /**
     * timeoutDelayMs만 변경한 새 인스턴스 생성.
     */
    public RandomFaultConfig withTimeoutDelayMs(long timeoutDelayMs) {
        return new RandomFaultConfig(seed, failureProbability, faultType, timeoutDelayMs, burstAt, burstDuration);
    }

    /**
     * 버스트 구간만 변경한 새 인스턴스 생성.
     */
    public RandomFaultConfig withBurst(int burstAt, int burstDuration) {
        return new RandomFaultConfig(seed, failureProbability, faultType, timeoutDelayMs, burstAt, burstDuration);
    }
}
