package io.jamsession.client;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconnectPolicyTest {

    @Test
    void defaultsDoubleFromOneSecond() {
        ReconnectPolicy policy = ReconnectPolicy.defaults();

        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delayFor(5)).isEqualTo(Duration.ofSeconds(16));
    }

    @Test
    void delayIsCapped() {
        ReconnectPolicy policy = ReconnectPolicy.defaults();

        assertThat(policy.delayFor(6)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.delayFor(60)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void attemptBudget() {
        ReconnectPolicy policy = ReconnectPolicy.defaults();

        assertThat(policy.shouldRetry(5)).isTrue();
        assertThat(policy.shouldRetry(6)).isFalse();
        assertThat(new ReconnectPolicy(Duration.ZERO, 1.0, Duration.ZERO, 0).shouldRetry(1)).isFalse();
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new ReconnectPolicy(Duration.ofSeconds(1), 0.5, Duration.ofSeconds(30), 5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReconnectPolicy(Duration.ofSeconds(10), 2.0, Duration.ofSeconds(1), 5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReconnectPolicy.defaults().delayFor(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
