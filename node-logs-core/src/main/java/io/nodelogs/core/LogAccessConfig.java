package io.nodelogs.core;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Protocol settings shared by decoders, the reader and the handlers.
 *
 * <p>Use {@link #builder()} to override individual values:
 * <pre>{@code
 * LogAccessConfig config = LogAccessConfig.builder()
 *     .pollInterval(Duration.ofMillis(50))
 *     .retryCeiling(8)
 *     .build();
 * }</pre>
 */
public final class LogAccessConfig {

    public static final String PROP_SUCCESS_MARKER = "node-logs.success-marker";
    public static final String PROP_POLL_INTERVAL_MS = "node-logs.poll-interval-ms";
    public static final String PROP_RETRY_CEILING = "node-logs.retry-ceiling";

    private static final LogAccessConfig DEFAULTS = builder().build();

    private final String successMarker;
    private final Duration pollInterval;
    private final RetryCeiling retryCeiling;

    private LogAccessConfig(Builder builder) {
        this.successMarker = builder.successMarker;
        this.pollInterval = builder.pollInterval;
        this.retryCeiling = new RetryCeiling(builder.retryCeiling);
    }

    public static LogAccessConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads settings from properties, falling back to defaults for absent keys.
     *
     * @throws NodeLogsException.InvalidConfiguration if a present value cannot be used
     */
    public static LogAccessConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        Builder b = builder();
        String marker = props.getProperty(PROP_SUCCESS_MARKER);
        if (marker != null) {
            b.successMarker(marker.trim());
        }
        String interval = props.getProperty(PROP_POLL_INTERVAL_MS);
        if (interval != null) {
            b.pollInterval(Duration.ofMillis(parseLong(PROP_POLL_INTERVAL_MS, interval)));
        }
        String ceiling = props.getProperty(PROP_RETRY_CEILING);
        if (ceiling != null) {
            b.retryCeiling(parseInt(PROP_RETRY_CEILING, ceiling));
        }
        return b.build();
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new NodeLogsException.InvalidConfiguration(key + " must be a number, was [" + value + "]", e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new NodeLogsException.InvalidConfiguration(key + " must be a number, was [" + value + "]", e);
        }
    }

    /** Marker the first line of a successful response starts with. Default: {@code SUCCESS}. */
    public String successMarker() {
        return successMarker;
    }

    /** Delay between two snapshots of an in-flight request. Default: 100 ms. */
    public Duration pollInterval() {
        return pollInterval;
    }

    public RetryCeiling retryCeiling() {
        return retryCeiling;
    }

    @Override
    public String toString() {
        return "LogAccessConfig{successMarker=" + successMarker
                + ", pollInterval=" + pollInterval
                + ", retryCeiling=" + retryCeiling.maxAttempts() + "}";
    }

    /**
     * Builder for {@link LogAccessConfig}.
     */
    public static final class Builder {
        private String successMarker = Protocol.SUCCESS_LINE;
        private Duration pollInterval = Protocol.DEFAULT_POLL_INTERVAL;
        private int retryCeiling = Protocol.DEFAULT_RETRY_CEILING;

        private Builder() {}

        public Builder successMarker(String successMarker) {
            if (successMarker == null || successMarker.isEmpty()) {
                throw new NodeLogsException.InvalidConfiguration("success marker must not be empty");
            }
            this.successMarker = successMarker;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
                throw new NodeLogsException.InvalidConfiguration("poll interval must be positive, was " + pollInterval);
            }
            this.pollInterval = pollInterval;
            return this;
        }

        /** Sets the number of dispatcher attempts tolerated before a failure is final. Default: 16. */
        public Builder retryCeiling(int retryCeiling) {
            this.retryCeiling = retryCeiling;
            return this;
        }

        public LogAccessConfig build() {
            return new LogAccessConfig(this);
        }
    }
}
