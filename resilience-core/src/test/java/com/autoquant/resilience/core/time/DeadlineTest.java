package com.autoquant.resilience.core.time;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Deadline 테스트.
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
@DisplayName("Deadline 테스트")
class DeadlineTest {

    private AtomicLong nanos;
    private Ticker ticker;

    @BeforeEach
    void setUp() {
        nanos = new AtomicLong(5_000_000_000L);
        ticker = nanos::get;
    }

    private void advanceMs(long millis) {
        nanos.addAndGet(millis * 1_000_000L);
    }

    @Test
    @DisplayName("none()은 제한이 없고 만료되지 않는다")
    void none() {
        Deadline deadline = Deadline.none();

        assertThat(deadline.isBounded()).isFalse();
        assertThat(deadline.isExpired()).isFalse();
        assertThat(deadline.remainingMs()).isEqualTo(Long.MAX_VALUE);
        assertThat(deadline.allows(Long.MAX_VALUE - 1)).isTrue();
    }

    @Test
    @DisplayName("after()는 남은 시간을 시계 기준으로 계산한다")
    void after_남은_시간() {
        // given
        Deadline deadline = Deadline.after(1_000, ticker);

        // when
        advanceMs(400);

        // then
        assertThat(deadline.isBounded()).isTrue();
        assertThat(deadline.remainingMs()).isEqualTo(600);
        assertThat(deadline.allows(599)).isTrue();
        assertThat(deadline.allows(600)).isFalse();
    }

    @Test
    @DisplayName("시간이 지나면 만료되고 남은 시간은 0이다")
    void 만료() {
        // given
        Deadline deadline = Deadline.after(100, ticker);

        // when
        advanceMs(150);

        // then
        assertThat(deadline.isExpired()).isTrue();
        assertThat(deadline.remainingMs()).isZero();
        assertThat(deadline.allows(0)).isFalse();
    }

    @Test
    @DisplayName("after(0)은 즉시 만료된다")
    void 즉시_만료() {
        assertThat(Deadline.after(0, ticker).isExpired()).isTrue();
    }

    @Test
    @DisplayName("음수 timeout과 null ticker는 거부한다")
    void 입력_검증() {
        assertThatThrownBy(() -> Deadline.after(-1, ticker))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Deadline.after(10, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("toString()은 남은 시간을 포함한다")
    void toString_형식() {
        assertThat(Deadline.none().toString()).isEqualTo("Deadline{none}");
        assertThat(Deadline.after(250, ticker).toString()).isEqualTo("Deadline{remaining=250ms}");
    }
}
