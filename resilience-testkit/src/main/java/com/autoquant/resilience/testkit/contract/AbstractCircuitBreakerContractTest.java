package com.autoquant.resilience.testkit.contract;

import com.autoquant.resilience.core.exception.TransientRemoteException;
import com.autoquant.resilience.core.model.CallTag;
import com.autoquant.resilience.core.outcome.Outcome;
import com.autoquant.resilience.core.protection.CircuitBreaker;
import com.autoquant.resilience.core.protection.CircuitBreakerConfig;
import com.autoquant.resilience.core.protection.CircuitBreakerSnapshot;
import com.autoquant.resilience.core.protection.CircuitBreakerState;
import com.autoquant.resilience.core.protection.CircuitPermit;
import com.autoquant.resilience.core.time.Ticker;
import com.autoquant.resilience.testkit.time.ManualTicker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Abstract base class for CircuitBreaker contract tests.
 *
 * <p>Every {@link CircuitBreaker} implementation must pass these scenarios. Subclasses only
 * provide the factory method; time is driven by a {@link ManualTicker} so no test sleeps.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN after {@code failureThreshold} failures, success clears the count</li>
 *   <li>OPEN rejects every call until {@code openDurationMs} has elapsed</li>
 *   <li>at most one probe is in flight while HALF_OPEN, owned by its permit rather than its tag</li>
 *   <li>a probe failure reopens and restarts the cooldown</li>
 *   <li>{@code closeThreshold} probe successes close the circuit</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyCircuitBreakerContractTest extends AbstractCircuitBreakerContractTest {
 *     {@literal @}Override
 *     protected CircuitBreaker createCircuitBreaker(String name, CircuitBreakerConfig config, Ticker ticker) {
 *         return new MyCircuitBreaker(name, config, ticker);
 *     }
 * }
 * </pre>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public abstract class AbstractCircuitBreakerContractTest {

    protected static final long OPEN_DURATION_MS = 1_000;

    protected ManualTicker ticker;

    /**
     * Creates the implementation under test.
     *
     * @param name breaker name
     * @param config breaker configuration
     * @param ticker clock the breaker must read time from
     * @return a fresh breaker in CLOSED state
     */
    protected abstract CircuitBreaker createCircuitBreaker(String name, CircuitBreakerConfig config, Ticker ticker);

    @BeforeEach
    void setUpTicker() {
        ticker = new ManualTicker(1_000_000_000L);
    }

    protected CircuitBreaker newBreaker(int failureThreshold, int closeThreshold) {
        CircuitBreakerConfig config = new CircuitBreakerConfig()
            .withFailureThreshold(failureThreshold)
            .withOpenDurationMs(OPEN_DURATION_MS)
            .withCloseThreshold(closeThreshold);
        return createCircuitBreaker("contract", config, ticker);
    }

    protected static Outcome<String> failure() {
        return Outcome.transientFailure(new TransientRemoteException("503 from broker", 503));
    }

    protected static Outcome<String> success() {
        return Outcome.success("ok");
    }

    protected void trip(CircuitBreaker cb, int failures) {
        for (int i = 0; i < failures; i++) {
            CircuitPermit permit = cb.allow(CallTag.of("trip-" + i));
            assertThat(permit.isGranted()).isTrue();
            cb.record(permit, failure());
        }
    }

    protected CircuitPermit grantedPermit(CircuitBreaker cb, String tag) {
        CircuitPermit permit = cb.allow(CallTag.of(tag));
        assertThat(permit.isGranted()).isTrue();
        return permit;
    }

    // ============================================================
    // CLOSED
    // ============================================================

    @Test
    @DisplayName("새 Circuit Breaker는 CLOSED 상태로 시작하고 호출을 허용한다")
    void 초기_상태는_CLOSED() {
        // given
        CircuitBreaker cb = newBreaker(3, 1);

        // when & then
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        CircuitPermit permit = cb.allow(CallTag.of("first"));
        assertThat(permit.isGranted()).isTrue();
        assertThat(permit.isProbe()).isFalse();
        assertThat(cb.snapshot().tripCount()).isZero();
    }

    @Test
    @DisplayName("연속 실패가 임계치에 도달하면 OPEN으로 전이한다")
    void 임계치_도달_시_OPEN() {
        // given
        CircuitBreaker cb = newBreaker(3, 1);

        // when
        trip(cb, 2);
        CircuitBreakerState beforeThreshold = cb.getState();
        trip(cb, 1);

        // then
        assertThat(beforeThreshold).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(cb.snapshot().tripCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("CLOSED에서 성공은 실패 카운트를 초기화한다")
    void 성공은_실패_카운트_초기화() {
        // given
        CircuitBreaker cb = newBreaker(3, 1);
        trip(cb, 2);

        // when
        cb.record(grantedPermit(cb, "ok"), success());
        trip(cb, 2);

        // then
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(cb.snapshot().failureCount()).isEqualTo(2);
    }

    // ============================================================
    // OPEN
    // ============================================================

    @Test
    @DisplayName("OPEN 상태에서는 cooldown 동안 모든 호출을 거부한다")
    void OPEN_상태는_cooldown_동안_거부() {
        // given
        CircuitBreaker cb = newBreaker(2, 1);
        trip(cb, 2);

        // when
        ticker.advance(OPEN_DURATION_MS - 1);

        // then
        assertThat(cb.allow(CallTag.of("early")).isGranted()).isFalse();
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    @DisplayName("cooldown 경과 후 첫 호출이 probe로 허용되고 HALF_OPEN으로 전이한다")
    void cooldown_경과_후_probe_허용() {
        // given
        CircuitBreaker cb = newBreaker(2, 1);
        trip(cb, 2);
        ticker.advance(OPEN_DURATION_MS);

        // when
        CircuitPermit probe = cb.allow(CallTag.of("probe"));
        CircuitPermit second = cb.allow(CallTag.of("second"));

        // then
        assertThat(probe.isGranted()).isTrue();
        assertThat(probe.isProbe()).isTrue();
        assertThat(second.isGranted()).isFalse();
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(cb.snapshot().probeInFlight()).isTrue();
    }

    // ============================================================
    // HALF_OPEN
    // ============================================================

    @Test
    @DisplayName("probe 성공 시 CLOSED로 복귀하고 실패 카운트가 초기화된다")
    void probe_성공_시_CLOSED() {
        // given
        CircuitBreaker cb = newBreaker(2, 1);
        trip(cb, 2);
        ticker.advance(OPEN_DURATION_MS);
        CircuitPermit probe = grantedPermit(cb, "probe");

        // when
        cb.record(probe, success());

        // then
        CircuitBreakerSnapshot snapshot = cb.snapshot();
        assertThat(snapshot.state()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(snapshot.failureCount()).isZero();
        assertThat(snapshot.probeInFlight()).isFalse();
    }

    @Test
    @DisplayName("probe 실패 시 다시 OPEN이 되고 cooldown이 재시작된다")
    void probe_실패_시_OPEN_재진입() {
        // given
        CircuitBreaker cb = newBreaker(2, 1);
        trip(cb, 2);
        ticker.advance(OPEN_DURATION_MS);
        CircuitPermit probe = grantedPermit(cb, "probe");

        // when
        cb.record(probe, failure());
        ticker.advance(OPEN_DURATION_MS - 1);

        // then
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(cb.allow(CallTag.of("too-early")).isGranted()).isFalse();

        ticker.advance(1);
        assertThat(cb.allow(CallTag.of("next-probe")).isGranted()).isTrue();
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
    }

    @Test
    @DisplayName("closeThreshold가 2이면 probe 성공 두 번 후에 CLOSED가 된다")
    void closeThreshold_만큼_성공해야_CLOSED() {
        // given
        CircuitBreaker cb = newBreaker(2, 2);
        trip(cb, 2);
        ticker.advance(OPEN_DURATION_MS);

        // when
        CircuitPermit first = grantedPermit(cb, "probe-1");
        cb.record(first, success());
        CircuitBreakerState afterFirst = cb.getState();

        CircuitPermit second = grantedPermit(cb, "probe-2");
        cb.record(second, success());

        // then
        assertThat(afterFirst).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    @DisplayName("HALF_OPEN에서 probe 소유자가 아닌 호출의 성공은 CLOSED를 만들지 않는다")
    void 소유자_아닌_성공은_무시() {
        // given
        CircuitBreaker cb = newBreaker(2, 1);
        CircuitPermit straggler = grantedPermit(cb, "straggler");
        trip(cb, 2);
        ticker.advance(OPEN_DURATION_MS);
        grantedPermit(cb, "probe");

        // when
        cb.record(straggler, success());

        // then
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(cb.snapshot().probeInFlight()).isTrue();
    }

    @Test
    @DisplayName("probe와 같은 태그를 가진 늦은 호출의 성공도 probe 슬롯을 비우지 않는다")
    void 같은_태그의_늦은_성공은_HALF_OPEN_슬롯을_비우지_않음() {
        // given: 태그는 작업 종류마다 하나씩 공유된다
        CircuitBreaker cb = newBreaker(2, 2);
        CircuitPermit stale = grantedPermit(cb, "submit-order");
        trip(cb, 2);
        ticker.advance(OPEN_DURATION_MS);
        CircuitPermit probe = grantedPermit(cb, "submit-order");

        // when
        cb.record(stale, success());
        CircuitPermit other = cb.allow(CallTag.of("other"));

        // then
        assertThat(probe.isProbe()).isTrue();
        assertThat(other.isGranted()).isFalse();
        CircuitBreakerSnapshot snapshot = cb.snapshot();
        assertThat(snapshot.state()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(snapshot.successCount()).isZero();
        assertThat(snapshot.probeInFlight()).isTrue();

        // probe 자신의 성공만 슬롯을 비운다
        cb.record(probe, success());
        assertThat(cb.allow(CallTag.of("other")).isGranted()).isTrue();
    }

    @Test
    @DisplayName("허가는 같은 태그로 요청해도 매번 새 인스턴스로 발급된다")
    void 허가는_호출마다_새로_발급() {
        // given
        CircuitBreaker cb = newBreaker(3, 1);
        CallTag tag = CallTag.of("submit-order");

        // when
        CircuitPermit first = cb.allow(tag);
        CircuitPermit second = cb.allow(tag);

        // then
        assertThat(first).isNotSameAs(second);
        assertThat(first.getTag()).isEqualTo(second.getTag());
        assertThat(first.getId()).isNotEqualTo(second.getId());
    }

    @Test
    @DisplayName("OPEN 재진입은 tripCount를 증가시키지 않는다")
    void tripCount는_CLOSED에서_OPEN_전이만_센다() {
        // given
        CircuitBreaker cb = newBreaker(2, 1);
        trip(cb, 2);
        ticker.advance(OPEN_DURATION_MS);
        CircuitPermit probe = grantedPermit(cb, "probe");

        // when
        cb.record(probe, failure());

        // then
        assertThat(cb.snapshot().tripCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("동시에 allow()를 호출해도 HALF_OPEN probe는 하나만 허용된다")
    void 동시_allow_호출_시_probe는_하나() throws Exception {
        // given
        CircuitBreaker cb = newBreaker(2, 1);
        trip(cb, 2);
        ticker.advance(OPEN_DURATION_MS);

        int threads = 32;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        // when
        try {
            for (int i = 0; i < threads; i++) {
                CallTag tag = CallTag.of("racer-" + i);
                results.add(pool.submit(() -> {
                    start.await();
                    return cb.allow(tag).isGranted();
                }));
            }
            start.countDown();

            int granted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    granted++;
                }
            }

            // then
            assertThat(granted).isEqualTo(1);
            assertThat(cb.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        } finally {
            pool.shutdownNow();
        }
    }

    // ============================================================
    // reset / 입력 검증
    // ============================================================

    @Test
    @DisplayName("reset()은 어느 상태에서든 CLOSED로 되돌린다")
    void reset_후_CLOSED() {
        // given
        CircuitBreaker cb = newBreaker(2, 1);
        trip(cb, 2);

        // when
        cb.reset();

        // then
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(cb.allow(CallTag.of("after-reset")).isGranted()).isTrue();
    }

    @Test
    @DisplayName("null 인자는 IllegalArgumentException")
    void null_인자_거부() {
        CircuitBreaker cb = newBreaker(2, 1);

        assertThatThrownBy(() -> cb.allow(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cb.record(null, success()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cb.record(cb.allow(CallTag.of("tag")), null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("거부된 허가의 결과는 기록할 수 없다")
    void 거부된_허가_기록_거부() {
        // given
        CircuitBreaker cb = newBreaker(2, 1);
        trip(cb, 2);
        CircuitPermit rejected = cb.allow(CallTag.of("rejected"));

        // when & then
        assertThat(rejected.isGranted()).isFalse();
        assertThatThrownBy(() -> cb.record(rejected, success()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }
}
