package io.cardlink.realtime.client;

import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChannelOptionsTest {

    @Test
    void defaults() {
        ChannelOptions o = ChannelOptions.defaults();

        assertThat(o.maxReconnectAttempts()).isEqualTo(5);
        assertThat(o.reconnectBaseDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(o.nonRetryableCloseCodes()).containsExactlyInAnyOrder(4000, 4003);
        assertThat(o.keepaliveInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(o.connectTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(o.tagDebounce()).isEqualTo(Duration.ofMillis(1500));
        assertThat(o.minTagTextLength()).isEqualTo(20);
        assertThat(o.tagsAfterCommitDelay()).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void readsPropertiesFile() throws Exception {
        Properties props = new Properties();
        try (InputStream in = getClass().getResourceAsStream("/cardlink-realtime-test.properties")) {
            props.load(in);
        }

        ChannelOptions o = ChannelOptions.fromProperties(props);

        assertThat(o.maxReconnectAttempts()).isEqualTo(3);
        assertThat(o.reconnectBaseDelay()).isEqualTo(Duration.ofMillis(250));
        assertThat(o.nonRetryableCloseCodes()).containsExactlyInAnyOrder(4000, 4001, 4003);
        assertThat(o.keepaliveInterval()).isEqualTo(Duration.ofSeconds(15));
        assertThat(o.connectTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(o.minTagTextLength()).isEqualTo(10);
        // absent keys keep defaults
        assertThat(o.tagDebounce()).isEqualTo(Duration.ofMillis(1500));
        assertThat(o.tagsAfterCommitDelay()).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void rejectsInvalidNumbers() {
        Properties props = new Properties();
        props.setProperty("cardlink.realtime.keepalive.interval-ms", "soon");

        assertThatThrownBy(() -> ChannelOptions.fromProperties(props))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("keepalive.interval-ms");
    }

    @Test
    void builderRejectsNonPositiveDurations() {
        assertThatThrownBy(() -> ChannelOptions.builder().reconnectBaseDelay(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
