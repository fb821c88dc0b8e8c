package com.flowsentinel.core.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed, immutable configuration for the detection process.
 *
 * <p>
 * Use {@link ConfigLoader} to resolve it from YAML and environment variables,
 * or the {@link Builder} for programmatic / test scenarios. The builder
 * validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorConfig {

    /** Status port value that disables the status server. */
    public static final int STATUS_DISABLED = -1;

    // ---------------------------------------------------------------
    // Paths
    // ---------------------------------------------------------------
    private final Path evePath;
    private final Path modelPath;
    private final Path featureColumnsPath;
    private final Path anomaliesPath;

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------
    private final List<String> featureColumns;
    private final long pollIntervalMs;
    private final long flushIntervalSeconds;
    private final int storeCapacity;
    private final WakeUpMode wakeUpMode;

    // ---------------------------------------------------------------
    // Status server
    // ---------------------------------------------------------------
    private final int statusPort;

    private DetectorConfig(Builder b) {
        this.evePath = Path.of(b.evePath);
        this.modelPath = Path.of(b.modelPath);
        this.featureColumnsPath = b.featureColumnsPath != null && !b.featureColumnsPath.isBlank()
                ? Path.of(b.featureColumnsPath)
                : null;
        this.anomaliesPath = Path.of(b.anomaliesPath);
        this.featureColumns = List.copyOf(b.featureColumns);
        this.pollIntervalMs = b.pollIntervalMs;
        this.flushIntervalSeconds = b.flushIntervalSeconds;
        this.storeCapacity = b.storeCapacity;
        this.wakeUpMode = b.wakeUpMode;
        this.statusPort = b.statusPort;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Path getEvePath() {
        return evePath;
    }

    public Path getModelPath() {
        return modelPath;
    }

    /**
     * @return the feature-columns artifact, or {@code null} to use the
     *         default schema
     */
    public Path getFeatureColumnsPath() {
        return featureColumnsPath;
    }

    public Path getAnomaliesPath() {
        return anomaliesPath;
    }

    /**
     * @return expected feature columns; empty to accept the model's columns
     */
    public List<String> getFeatureColumns() {
        return featureColumns;
    }

    public Duration getPollInterval() {
        return Duration.ofMillis(pollIntervalMs);
    }

    public Duration getFlushInterval() {
        return Duration.ofSeconds(flushIntervalSeconds);
    }

    public int getStoreCapacity() {
        return storeCapacity;
    }

    public WakeUpMode getWakeUpMode() {
        return wakeUpMode;
    }

    /**
     * @return status server port; {@code 0} for an ephemeral port,
     *         {@link #STATUS_DISABLED} when disabled
     */
    public int getStatusPort() {
        return statusPort;
    }

    public boolean isStatusEnabled() {
        return statusPort != STATUS_DISABLED;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DetectorConfig}.
     *
     * <p>
     * {@link #build()} checks that paths are non-blank, the poll interval is
     * at least 1 ms, the flush interval is not negative, the store capacity is
     * at least 1 and the status port is in [-1, 65535]. All violations are
     * reported together.
     * </p>
     */
    public static class Builder {
        private String evePath = "/var/log/suricata/eve.json";
        private String modelPath = "models/isolation_forest.json";
        private String featureColumnsPath = "models/feature_columns.json";
        private String anomaliesPath = System.getProperty("user.home") + "/network_data/anomalies.json";
        private List<String> featureColumns = new ArrayList<>();
        private long pollIntervalMs = 1_000;
        private long flushIntervalSeconds = 5;
        private int storeCapacity = 1_000;
        private WakeUpMode wakeUpMode = WakeUpMode.POLL;
        private int statusPort = 3001;

        public Builder evePath(String v) {
            this.evePath = v;
            return this;
        }

        public Builder modelPath(String v) {
            this.modelPath = v;
            return this;
        }

        /**
         * @param v feature-columns artifact path; {@code null} or blank for
         *          none
         * @return this builder
         */
        public Builder featureColumnsPath(String v) {
            this.featureColumnsPath = v;
            return this;
        }

        public Builder anomaliesPath(String v) {
            this.anomaliesPath = v;
            return this;
        }

        public Builder featureColumns(List<String> v) {
            this.featureColumns = v != null ? new ArrayList<>(v) : new ArrayList<>();
            return this;
        }

        public Builder pollIntervalMs(long v) {
            this.pollIntervalMs = v;
            return this;
        }

        public Builder flushIntervalSeconds(long v) {
            this.flushIntervalSeconds = v;
            return this;
        }

        public Builder storeCapacity(int v) {
            this.storeCapacity = v;
            return this;
        }

        public Builder wakeUpMode(WakeUpMode v) {
            this.wakeUpMode = v;
            return this;
        }

        public Builder statusPort(int v) {
            this.statusPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link DetectorConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public DetectorConfig build() {
            List<String> errors = new ArrayList<>();
            requireNonBlank(evePath, "eve_json_path", errors);
            requireNonBlank(modelPath, "model_path", errors);
            requireNonBlank(anomaliesPath, "anomalies_path", errors);

            for (String column : featureColumns) {
                if (column == null || column.isBlank()) {
                    errors.add("feature_columns must not contain blank names");
                    break;
                }
            }
            if (pollIntervalMs < 1) {
                errors.add("poll_interval_ms must be >= 1, got: " + pollIntervalMs);
            }
            if (flushIntervalSeconds < 0) {
                errors.add("flush_interval_seconds must be >= 0, got: " + flushIntervalSeconds);
            }
            if (storeCapacity < 1) {
                errors.add("store_capacity must be >= 1, got: " + storeCapacity);
            }
            if (wakeUpMode == null) {
                errors.add("wake_up must be set");
            }
            if (statusPort < STATUS_DISABLED || statusPort > 65_535) {
                errors.add("status port must be in [-1, 65535], got: " + statusPort);
            }

            if (!errors.isEmpty()) {
                throw new IllegalArgumentException(
                        "Invalid detector configuration: " + String.join("; ", errors));
            }
            return new DetectorConfig(this);
        }

        private static void requireNonBlank(String value, String name, List<String> errors) {
            if (value == null || value.isBlank()) {
                errors.add(name + " must not be null or blank");
            }
        }
    }

    @Override
    public String toString() {
        return "DetectorConfig{" +
                "evePath=" + evePath +
                ", modelPath=" + modelPath +
                ", featureColumnsPath=" + featureColumnsPath +
                ", anomaliesPath=" + anomaliesPath +
                ", featureColumns=" + featureColumns +
                ", pollIntervalMs=" + pollIntervalMs +
                ", flushIntervalSeconds=" + flushIntervalSeconds +
                ", storeCapacity=" + storeCapacity +
                ", wakeUpMode=" + wakeUpMode +
                ", statusPort=" + statusPort +
                '}';
    }
}
