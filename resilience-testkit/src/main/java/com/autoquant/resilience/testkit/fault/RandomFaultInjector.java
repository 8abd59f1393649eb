package com.autoquant.resilience.testkit.fault;

import com.autoquant.resilience.core.operation.RemoteOperation;
import com.autoquant.resilience.core.time.Sleeper;

import java.util.Random;

/**
 * 무작위 모드 장애 주입기 (스트레스 테스트용).
 *
 * <p>seed를 명시한 {@link Random}으로 호출마다 장애 여부를 결정합니다.
 * 같은 seed는 호출 번호별로 같은 장애를 만듭니다. 동시 호출에서도 n번째 호출이 받는 장애는 같습니다.
 * 결정적 스크립트 모드는 {@link ScriptedFaultInjector}로 분리되어 있습니다.</p>
 *
 * @param <T> 감싼 작업의 결과 타입
 * @author AutoQuant Team
 * @since 1.0.0
 */
public final class RandomFaultInjector<T> extends FaultInjector<T> {

    private final RandomFaultConfig config;
    private final Random random;

    /**
     * 생성자 (TIMEOUT 지연에 시스템 Sleeper 사용).
     *
     * @param delegate 실제 원격 작업
     * @param config 무작위 장애 설정
     */
    public RandomFaultInjector(RemoteOperation<T> delegate, RandomFaultConfig config) {
        this(delegate, config, Sleeper.system());
    }

    /**
     * 생성자.
     *
     * @param delegate 실제 원격 작업
     * @param config 무작위 장애 설정
     * @param sleeper TIMEOUT 지연에 사용할 Sleeper
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RandomFaultInjector(RemoteOperation<T> delegate, RandomFaultConfig config, Sleeper sleeper) {
        super(delegate, sleeper);
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.random = new Random(config.seed());
    }

    @Override
    protected Fault nextFault(int callNumber) {
        // 버스트 구간에서도 호출마다 난수 하나를 소비
        boolean randomHit = random.nextDouble() < config.failureProbability();
        if (config.isInBurst(callNumber) || randomHit) {
            return new Fault(config.faultType(),
                config.faultType() == FaultType.TIMEOUT ? config.timeoutDelayMs() : 0);
        }
        return Fault.PASS;
    }

    public RandomFaultConfig getConfig() {
        return config;
    }
}
