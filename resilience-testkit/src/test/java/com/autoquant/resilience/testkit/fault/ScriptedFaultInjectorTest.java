package com.autoquant.resilience.testkit.fault;

import com.autoquant.resilience.core.exception.PermanentRemoteException;
import com.autoquant.resilience.core.exception.RemoteTimeoutException;
import com.autoquant.resilience.core.exception.TransientRemoteException;
import com.autoquant.resilience.core.operation.RemoteOperation;
import com.autoquant.resilience.testkit.time.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * ScriptedFaultInjector 테스트.
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ScriptedFaultInjector 테스트")
class ScriptedFaultInjectorTest {

    @Mock
    private RemoteOperation<String> delegate;

    private RecordingSleeper sleeper;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
    }

    @Test
    @DisplayName("장애가 주입된 호출은 실제 작업을 호출하지 않는다")
    void 장애_주입_시_delegate_미호출() throws Exception {
        // given
        ScriptedFaultInjector<String> injector =
            new ScriptedFaultInjector<>(delegate, FaultScript.of(Fault.TRANSIENT), sleeper);

        // when & then
        assertThatThrownBy(injector::call)
            .isInstanceOf(TransientRemoteException.class)
            .hasMessageContaining("call #1")
            .extracting(e -> ((TransientRemoteException) e).getStatusCode())
            .isEqualTo(429);
        verify(delegate, never()).call();
        assertThat(injector.getInjectedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("스크립트 소진 후에는 실제 작업 결과를 그대로 반환한다")
    void 소진_후_통과() throws Exception {
        // given
        when(delegate.call()).thenReturn("filled");
        ScriptedFaultInjector<String> injector = new ScriptedFaultInjector<>(
            delegate, FaultScript.of(Fault.TRANSIENT, Fault.TRANSIENT), sleeper);

        // when
        Throwable first = catchFailure(injector);
        Throwable second = catchFailure(injector);
        String third = injector.call();

        // then
        assertThat(first).isInstanceOf(TransientRemoteException.class);
        assertThat(second).isInstanceOf(TransientRemoteException.class);
        assertThat(third).isEqualTo("filled");
        assertThat(injector.getCallCount()).isEqualTo(3);
        assertThat(injector.getInjectedCount()).isEqualTo(2);
        verify(delegate, times(1)).call();
    }

    @Test
    @DisplayName("PERMANENT 장애는 400 PermanentRemoteException")
    void permanent_장애() {
        ScriptedFaultInjector<String> injector =
            new ScriptedFaultInjector<>(delegate, FaultScript.of(Fault.PERMANENT), sleeper);

        assertThatThrownBy(injector::call)
            .isInstanceOf(PermanentRemoteException.class)
            .extracting(e -> ((PermanentRemoteException) e).getStatusCode())
            .isEqualTo(400);
    }

    @Test
    @DisplayName("TIMEOUT 장애는 지연 후 RemoteTimeoutException")
    void timeout_장애() {
        // given
        ScriptedFaultInjector<String> injector =
            new ScriptedFaultInjector<>(delegate, FaultScript.of(Fault.timeout(250)), sleeper);

        // when & then
        assertThatThrownBy(injector::call)
            .isInstanceOf(RemoteTimeoutException.class)
            .hasMessageContaining("250ms");
        assertThat(sleeper.sleeps()).containsExactly(250L);
    }

    @Test
    @DisplayName("실제 작업의 예외는 그대로 전파된다")
    void delegate_예외_전파() throws Exception {
        // given
        when(delegate.call()).thenThrow(new IllegalStateException("broker bug"));
        ScriptedFaultInjector<String> injector =
            new ScriptedFaultInjector<>(delegate, FaultScript.of(), sleeper);

        // when & then
        assertThatThrownBy(injector::call)
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("broker bug");
        assertThat(injector.getInjectedCount()).isZero();
    }

    @Test
    @DisplayName("생성자 인자는 null일 수 없다")
    void 생성자_검증() {
        assertThatThrownBy(() -> new ScriptedFaultInjector<>(null, FaultScript.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("delegate");
        assertThatThrownBy(() -> new ScriptedFaultInjector<>(delegate, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("script");
    }

    private static Throwable catchFailure(RemoteOperation<String> operation) {
        try {
            operation.call();
            return null;
        } catch (Exception e) {
            return e;
        }
    }
}
