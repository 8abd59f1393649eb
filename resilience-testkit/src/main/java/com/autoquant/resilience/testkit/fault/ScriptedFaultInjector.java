package com.autoquant.resilience.testkit.fault;

import com.autoquant.resilience.core.operation.RemoteOperation;
import com.autoquant.resilience.core.time.Sleeper;

/**
 * 결정적(deterministic) 재생 모드 장애 주입기.
 *
 * <p>{@link FaultScript}를 호출 순서대로 소비합니다. 스크립트가 소진되면 모든 호출을 통과시킵니다.
 * 단위 테스트에서 재현 가능한 시나리오를 만들 때 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ScriptedFaultInjector<String> op = new ScriptedFaultInjector<>(
 *     () -> "filled",
 *     FaultScript.of(Fault.TRANSIENT, Fault.TRANSIENT));
 *
 * retryWrapper.execute(op, policy); // 3번째 시도에서 "filled"
 * }</pre>
 *
 * @param <T> 감싼 작업의 결과 타입
 * @author AutoQuant Team
 * @since 1.0.0
 */
public final class ScriptedFaultInjector<T> extends FaultInjector<T> {

    private final FaultScript script;

    /**
     * 생성자 (TIMEOUT 지연에 시스템 Sleeper 사용).
     *
     * @param delegate 실제 원격 작업
     * @param script 장애 스크립트
     */
    public ScriptedFaultInjector(RemoteOperation<T> delegate, FaultScript script) {
        this(delegate, script, Sleeper.system());
    }

    /**
     * 생성자.
     *
     * @param delegate 실제 원격 작업
     * @param script 장애 스크립트
     * @param sleeper TIMEOUT 지연에 사용할 Sleeper
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ScriptedFaultInjector(RemoteOperation<T> delegate, FaultScript script, Sleeper sleeper) {
        super(delegate, sleeper);
        if (script == null) {
            throw new IllegalArgumentException("script cannot be null");
        }
        this.script = script;
    }

    @Override
    protected Fault nextFault(int callNumber) {
        return script.next();
    }

    public FaultScript getScript() {
        return script;
    }
}
