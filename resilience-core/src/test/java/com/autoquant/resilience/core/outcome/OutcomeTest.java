package com.autoquant.resilience.core.outcome;

import com.autoquant.resilience.core.exception.TransientRemoteException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Outcome sealed interface 테스트.
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
@DisplayName("Outcome 테스트")
class OutcomeTest {

    @Test
    @DisplayName("success()는 값을 담은 Success를 만든다")
    void success_값_보관() {
        // when
        Outcome<String> outcome = Outcome.success("filled");

        // then
        assertThat(outcome).isInstanceOf(Success.class);
        assertThat(((Success<String>) outcome).value()).isEqualTo("filled");
        assertThat(outcome.kind()).isEqualTo(OutcomeKind.SUCCESS);
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.isFailure()).isFalse();
        assertThat(outcome.causeOrNull()).isNull();
    }

    @Test
    @DisplayName("Success는 null 값을 허용한다")
    void success_null_허용() {
        Outcome<Void> outcome = Outcome.success(null);

        assertThat(outcome.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("실패 Outcome은 원인을 노출한다")
    void 실패_원인_노출() {
        // given
        TransientRemoteException cause = new TransientRemoteException("rate limited", 429);

        // when
        Outcome<String> transientFailure = Outcome.transientFailure(cause);
        Outcome<String> permanentFailure = Outcome.permanentFailure(cause);
        Outcome<String> timeout = Outcome.timeout(1500, cause);

        // then
        assertThat(transientFailure.kind()).isEqualTo(OutcomeKind.TRANSIENT_FAILURE);
        assertThat(permanentFailure.kind()).isEqualTo(OutcomeKind.PERMANENT_FAILURE);
        assertThat(timeout.kind()).isEqualTo(OutcomeKind.TIMEOUT);
        assertThat(transientFailure.causeOrNull()).isSameAs(cause);
        assertThat(permanentFailure.causeOrNull()).isSameAs(cause);
        assertThat(timeout.causeOrNull()).isSameAs(cause);
        assertThat(transientFailure.isFailure()).isTrue();
        assertThat(((Timeout<String>) timeout).elapsedMs()).isEqualTo(1500);
    }

    @Test
    @DisplayName("Transient/Permanent 실패는 원인이 필수이다")
    void 실패_원인_필수() {
        assertThatThrownBy(() -> Outcome.transientFailure(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Outcome.permanentFailure(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Timeout은 원인 없이 만들 수 있지만 경과 시간은 음수일 수 없다")
    void timeout_검증() {
        assertThat(Outcome.timeout(0, null).causeOrNull()).isNull();
        assertThatThrownBy(() -> Outcome.timeout(-1, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("elapsedMs");
    }

    @Test
    @DisplayName("OutcomeKind.isFailure()는 SUCCESS만 false")
    void outcomeKind_isFailure() {
        assertThat(OutcomeKind.SUCCESS.isFailure()).isFalse();
        assertThat(OutcomeKind.TRANSIENT_FAILURE.isFailure()).isTrue();
        assertThat(OutcomeKind.PERMANENT_FAILURE.isFailure()).isTrue();
        assertThat(OutcomeKind.TIMEOUT.isFailure()).isTrue();
    }
}
