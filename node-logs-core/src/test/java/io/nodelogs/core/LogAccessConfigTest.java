package io.nodelogs.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LogAccessConfigTest {

    @Test
    void defaultsMatchProtocolConstants() {
        LogAccessConfig config = LogAccessConfig.defaults();

        assertThat(config.successMarker()).isEqualTo("SUCCESS");
        assertThat(config.pollInterval()).isEqualTo(Duration.ofMillis(100));
        assertThat(config.retryCeiling().maxAttempts()).isEqualTo(16);
    }

    @Test
    void readsProperties() {
        Properties props = new Properties();
        props.setProperty(LogAccessConfig.PROP_POLL_INTERVAL_MS, "25");
        props.setProperty(LogAccessConfig.PROP_RETRY_CEILING, " 4 ");
        props.setProperty(LogAccessConfig.PROP_SUCCESS_MARKER, "OK");

        LogAccessConfig config = LogAccessConfig.fromProperties(props);

        assertThat(config.pollInterval()).isEqualTo(Duration.ofMillis(25));
        assertThat(config.retryCeiling().maxAttempts()).isEqualTo(4);
        assertThat(config.successMarker()).isEqualTo("OK");
    }

    @Test
    void absentPropertiesFallBackToDefaults() {
        LogAccessConfig config = LogAccessConfig.fromProperties(new Properties());

        assertThat(config.retryCeiling().maxAttempts()).isEqualTo(Protocol.DEFAULT_RETRY_CEILING);
    }

    @Test
    void rejectsInvalidValues() {
        Properties props = new Properties();
        props.setProperty(LogAccessConfig.PROP_POLL_INTERVAL_MS, "soon");

        assertThatThrownBy(() -> LogAccessConfig.fromProperties(props))
                .isInstanceOf(NodeLogsException.InvalidConfiguration.class)
                .hasMessageContaining(LogAccessConfig.PROP_POLL_INTERVAL_MS);
        Properties overflow = new Properties();
        overflow.setProperty(LogAccessConfig.PROP_RETRY_CEILING, "4294967312");
        assertThatThrownBy(() -> LogAccessConfig.fromProperties(overflow))
                .isInstanceOf(NodeLogsException.InvalidConfiguration.class)
                .hasMessageContaining(LogAccessConfig.PROP_RETRY_CEILING);
        assertThatThrownBy(() -> LogAccessConfig.builder().retryCeiling(0).build())
                .isInstanceOf(NodeLogsException.InvalidConfiguration.class);
        assertThatThrownBy(() -> LogAccessConfig.builder().pollInterval(Duration.ZERO))
                .isInstanceOf(NodeLogsException.InvalidConfiguration.class);
    }
}
