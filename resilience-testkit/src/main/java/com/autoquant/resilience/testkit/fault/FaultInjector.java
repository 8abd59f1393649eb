package com.autoquant.resilience.testkit.fault;

import com.autoquant.resilience.core.exception.PermanentRemoteException;
import com.autoquant.resilience.core.exception.RemoteTimeoutException;
import com.autoquant.resilience.core.exception.TransientRemoteException;
import com.autoquant.resilience.core.operation.RemoteOperation;
import com.autoquant.resilience.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 실제 원격 작업을 감싸 장애를 주입하는 테스트/스트레스 하네스의 기반 클래스.
 *
 * <p>호출마다 {@link #nextFault(int)}가 결정한 장애를 정규화된 예외로 표현합니다.
 * Circuit Breaker나 재시도 상태를 직접 변경하지 않으며, 감싼 작업이 반환하는 것처럼 보이는 결과만 바꿉니다.</p>
 *
 * <p>호출 번호 부여와 {@link #nextFault(int)} 결정은 하나의 임계 구역에서 일어납니다.
 * 여러 스레드가 동시에 호출해도 n번째 호출은 항상 n번째 결정을 받습니다.
 * 어느 스레드가 몇 번째 호출이 되는지는 스케줄링에 달려 있습니다.</p>
 *
 * <p><strong>장애 표현:</strong></p>
 * <ul>
 *   <li>TRANSIENT → {@link TransientRemoteException} (기본 상태 코드 429)</li>
 *   <li>PERMANENT → {@link PermanentRemoteException} (기본 상태 코드 400)</li>
 *   <li>TIMEOUT → delayMs 대기 후 {@link RemoteTimeoutException}</li>
 * </ul>
 *
 * @param <T> 감싼 작업의 결과 타입
 * @author AutoQuant Team
 * @since 1.0.0
 */
public abstract class FaultInjector<T> implements RemoteOperation<T> {

    private static final Logger log = LoggerFactory.getLogger(FaultInjector.class);

    static final int TRANSIENT_STATUS = 429;
    static final int PERMANENT_STATUS = 400;

    private final RemoteOperation<T> delegate;
    private final Sleeper sleeper;
    private final Object sequenceLock = new Object();
    private final AtomicInteger callCount = new AtomicInteger();
    private final AtomicInteger injectedCount = new AtomicInteger();

    /**
     * 생성자.
     *
     * @param delegate 실제 원격 작업
     * @param sleeper TIMEOUT 지연에 사용할 Sleeper
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    protected FaultInjector(RemoteOperation<T> delegate, Sleeper sleeper) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.delegate = delegate;
        this.sleeper = sleeper;
    }

    @Override
    public final T call() throws Exception {
        int callNumber;
        Fault fault;
        synchronized (sequenceLock) {
            callNumber = callCount.incrementAndGet();
            fault = nextFault(callNumber);
        }
        if (fault.isPass()) {
            return delegate.call();
        }

        injectedCount.incrementAndGet();
        log.debug("Injecting {} into call #{}", fault, callNumber);
        throw toFailure(fault, callNumber);
    }

    /**
     * Fault를 정규화된 원격 예외로 변환. TIMEOUT은 지연만큼 대기한 뒤 반환합니다.
     */
    private Exception toFailure(Fault fault, int callNumber) throws InterruptedException {
        return switch (fault.type()) {
            case TRANSIENT -> new TransientRemoteException(
                "Injected transient fault (call #" + callNumber + ")", TRANSIENT_STATUS);
            case PERMANENT -> new PermanentRemoteException(
                "Injected permanent fault (call #" + callNumber + ")", PERMANENT_STATUS);
            case TIMEOUT -> {
                sleeper.sleep(fault.delayMs());
                yield new RemoteTimeoutException(
                    "Injected timeout after " + fault.delayMs() + "ms (call #" + callNumber + ")");
            }
            case PASS -> throw new IllegalStateException("PASS is not a failure");
        };
    }

    /**
     * 이번 호출에 주입할 장애 결정.
     *
     * <p>호출 번호 순서대로, 한 번에 하나씩 불립니다. 구현체가 따로 동기화할 필요는 없습니다.</p>
     *
     * @param callNumber 1부터 시작하는 호출 번호
     * @return 주입할 Fault ({@link Fault#PASS}면 원래 작업 호출)
     */
    protected abstract Fault nextFault(int callNumber);

    /**
     * 누적 호출 수.
     *
     * @return 호출 수
     */
    public int getCallCount() {
        return callCount.get();
    }

    /**
     * 누적 장애 주입 수.
     *
     * @return 주입 수
     */
    public int getInjectedCount() {
        return injectedCount.get();
    }
}
