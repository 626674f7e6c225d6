package io.cardlink.realtime.client;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ReconnectPolicyTest {

    @Test
    void delaysGrowLinearlyUntilMaxAttempts() {
        ReconnectPolicy policy = new ReconnectPolicy(3, Duration.ofMillis(1000), Set.of());

        assertThat(policy.nextDelay()).contains(Duration.ofMillis(1000));
        assertThat(policy.nextDelay()).contains(Duration.ofMillis(2000));
        assertThat(policy.nextDelay()).contains(Duration.ofMillis(3000));
        assertThat(policy.nextDelay()).isEmpty();
        assertThat(policy.attempts()).isEqualTo(3);
    }

    @Test
    void resetStartsOver() {
        ReconnectPolicy policy = new ReconnectPolicy(2, Duration.ofMillis(500), Set.of());
        policy.nextDelay();
        policy.nextDelay();

        policy.reset();

        assertThat(policy.attempts()).isZero();
        assertThat(policy.nextDelay()).contains(Duration.ofMillis(500));
    }

    @Test
    void normalClosureAndConfiguredCodesAreTerminal() {
        ReconnectPolicy policy = ReconnectPolicy.from(ChannelOptions.defaults());

        assertThat(policy.isRetryable(1000)).isFalse();
        assertThat(policy.isRetryable(4000)).isFalse();
        assertThat(policy.isRetryable(4003)).isFalse();
        assertThat(policy.isRetryable(1006)).isTrue();
        assertThat(policy.isRetryable(1011)).isTrue();
        assertThat(policy.isRetryable(4001)).isTrue();
    }

    @Test
    void zeroAttemptsNeverRetries() {
        ReconnectPolicy policy = new ReconnectPolicy(0, Duration.ofMillis(1000), Set.of());

        assertThat(policy.nextDelay()).isEmpty();
    }
}
