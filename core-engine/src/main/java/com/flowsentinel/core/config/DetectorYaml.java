package com.flowsentinel.core.config;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.TypeDescription;
import org.yaml.snakeyaml.constructor.Constructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the detector YAML file, bound by SnakeYAML.
 *
 * <p>
 * Keys are snake_case in the file and map onto the camelCase properties
 * below through {@link #constructor(LoaderOptions)}. A {@code null} field
 * means "not set in the file" and leaves the {@link DetectorConfig}
 * default in place.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorYaml {

    private Suricata suricata;
    private String modelPath;
    private String featureColumnsPath;
    private String anomaliesPath;
    private List<String> featureColumns;
    private Detection detection;
    private Status status;

    /**
     * Build a SnakeYAML constructor that binds the snake_case layout onto
     * this class and its sections.
     *
     * @param options loader options (duplicate-key policy etc.)
     * @return constructor rooted at {@link DetectorYaml}
     */
    static Constructor constructor(LoaderOptions options) {
        TypeDescription root = new TypeDescription(DetectorYaml.class);
        root.substituteProperty("model_path", String.class, "getModelPath", "setModelPath");
        root.substituteProperty("feature_columns_path", String.class,
                "getFeatureColumnsPath", "setFeatureColumnsPath");
        root.substituteProperty("anomalies_path", String.class, "getAnomaliesPath", "setAnomaliesPath");
        root.substituteProperty("feature_columns", List.class,
                "getFeatureColumns", "setFeatureColumns", String.class);

        TypeDescription suricata = new TypeDescription(Suricata.class);
        suricata.substituteProperty("eve_json_path", String.class, "getEveJsonPath", "setEveJsonPath");

        TypeDescription detection = new TypeDescription(Detection.class);
        detection.substituteProperty("poll_interval_ms", Long.class,
                "getPollIntervalMs", "setPollIntervalMs");
        detection.substituteProperty("flush_interval_seconds", Long.class,
                "getFlushIntervalSeconds", "setFlushIntervalSeconds");
        detection.substituteProperty("store_capacity", Integer.class,
                "getStoreCapacity", "setStoreCapacity");
        detection.substituteProperty("wake_up", String.class, "getWakeUp", "setWakeUp");

        Constructor constructor = new Constructor(DetectorYaml.class, options);
        constructor.addTypeDescription(root);
        constructor.addTypeDescription(suricata);
        constructor.addTypeDescription(detection);
        return constructor;
    }

    /**
     * Copy every value present in the file onto {@code builder}.
     *
     * @param builder builder holding the defaults
     * @return the same builder
     * @throws IllegalArgumentException if {@code wake_up} names no mode
     */
    DetectorConfig.Builder applyTo(DetectorConfig.Builder builder) {
        if (suricata != null && suricata.getEveJsonPath() != null) {
            builder.evePath(suricata.getEveJsonPath());
        }
        if (modelPath != null) {
            builder.modelPath(modelPath);
        }
        if (featureColumnsPath != null) {
            builder.featureColumnsPath(featureColumnsPath);
        }
        if (anomaliesPath != null) {
            builder.anomaliesPath(anomaliesPath);
        }
        if (featureColumns != null) {
            builder.featureColumns(featureColumns);
        }
        if (detection != null) {
            detection.applyTo(builder);
        }
        if (status != null && status.getPort() != null) {
            builder.statusPort(status.getPort());
        }
        return builder;
    }

    // ---------------------------------------------------------------
    // Top-level properties
    // ---------------------------------------------------------------

    public Suricata getSuricata() {
        return suricata;
    }

    public void setSuricata(Suricata suricata) {
        this.suricata = suricata;
    }

    public String getModelPath() {
        return modelPath;
    }

    public void setModelPath(String modelPath) {
        this.modelPath = modelPath;
    }

    public String getFeatureColumnsPath() {
        return featureColumnsPath;
    }

    /**
     * @param featureColumnsPath artifact path; blank disables the artifact
     */
    public void setFeatureColumnsPath(String featureColumnsPath) {
        this.featureColumnsPath = featureColumnsPath;
    }

    public String getAnomaliesPath() {
        return anomaliesPath;
    }

    public void setAnomaliesPath(String anomaliesPath) {
        this.anomaliesPath = anomaliesPath;
    }

    public List<String> getFeatureColumns() {
        return featureColumns;
    }

    public void setFeatureColumns(List<String> featureColumns) {
        this.featureColumns = featureColumns != null ? new ArrayList<>(featureColumns) : null;
    }

    public Detection getDetection() {
        return detection;
    }

    public void setDetection(Detection detection) {
        this.detection = detection;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    /** {@code suricata:} section. */
    public static class Suricata {

        private String eveJsonPath;

        public String getEveJsonPath() {
            return eveJsonPath;
        }

        public void setEveJsonPath(String eveJsonPath) {
            this.eveJsonPath = eveJsonPath;
        }
    }

    /** {@code detection:} section. */
    public static class Detection {

        private Long pollIntervalMs;
        private Long flushIntervalSeconds;
        private Integer storeCapacity;
        private String wakeUp;

        void applyTo(DetectorConfig.Builder builder) {
            if (pollIntervalMs != null) {
                builder.pollIntervalMs(pollIntervalMs);
            }
            if (flushIntervalSeconds != null) {
                builder.flushIntervalSeconds(flushIntervalSeconds);
            }
            if (storeCapacity != null) {
                builder.storeCapacity(storeCapacity);
            }
            if (wakeUp != null) {
                builder.wakeUpMode(WakeUpMode.fromName(wakeUp));
            }
        }

        public Long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(Long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public Long getFlushIntervalSeconds() {
            return flushIntervalSeconds;
        }

        public void setFlushIntervalSeconds(Long flushIntervalSeconds) {
            this.flushIntervalSeconds = flushIntervalSeconds;
        }

        public Integer getStoreCapacity() {
            return storeCapacity;
        }

        public void setStoreCapacity(Integer storeCapacity) {
            this.storeCapacity = storeCapacity;
        }

        public String getWakeUp() {
            return wakeUp;
        }

        public void setWakeUp(String wakeUp) {
            this.wakeUp = wakeUp;
        }
    }

    /** {@code status:} section. */
    public static class Status {

        private Integer port;

        public Integer getPort() {
            return port;
        }

        public void setPort(Integer port) {
            this.port = port;
        }
    }
}
