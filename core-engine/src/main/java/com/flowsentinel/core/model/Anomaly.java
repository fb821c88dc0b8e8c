package com.flowsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A flow the scorer classified as anomalous (score below zero).
 *
 * <p>
 * Serialized as one element of the JSON array in the anomalies file that the
 * status API and dashboard read. Property names follow that file's
 * snake_case layout.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}; {@code timestamp} and {@code detectedAt} are
 * required. Instances are immutable, including the feature map.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"timestamp", "flow_id", "src_ip", "dst_ip", "proto",
        "packets", "bytes", "duration", "features", "score", "detected_at"})
public final class Anomaly {

    /** Event timestamp reported by the sensor. */
    private final String timestamp;

    private final String flowId;
    private final String srcIp;
    private final String dstIp;
    private final String proto;
    private final long packets;
    private final long bytes;

    /** Flow duration in seconds. */
    private final double duration;

    /** Feature values exactly as they were passed to the scorer. */
    private final Map<String, Double> features;

    private final double score;

    /** When this process classified the flow. */
    private final Instant detectedAt;

    @JsonCreator
    Anomaly(@JsonProperty("timestamp") String timestamp,
            @JsonProperty("flow_id") String flowId,
            @JsonProperty("src_ip") String srcIp,
            @JsonProperty("dst_ip") String dstIp,
            @JsonProperty("proto") String proto,
            @JsonProperty("packets") long packets,
            @JsonProperty("bytes") long bytes,
            @JsonProperty("duration") double duration,
            @JsonProperty("features") Map<String, Double> features,
            @JsonProperty("score") double score,
            @JsonProperty("detected_at") Instant detectedAt) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.flowId = flowId != null ? flowId : "";
        this.srcIp = srcIp != null ? srcIp : "";
        this.dstIp = dstIp != null ? dstIp : "";
        this.proto = proto != null ? proto : "";
        this.packets = packets;
        this.bytes = bytes;
        this.duration = duration;
        this.features = features != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(features))
                : Collections.emptyMap();
        this.score = score;
        this.detectedAt = Objects.requireNonNull(detectedAt, "detectedAt must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("timestamp")
    public String getTimestamp() {
        return timestamp;
    }

    @JsonProperty("flow_id")
    public String getFlowId() {
        return flowId;
    }

    @JsonProperty("src_ip")
    public String getSrcIp() {
        return srcIp;
    }

    @JsonProperty("dst_ip")
    public String getDstIp() {
        return dstIp;
    }

    @JsonProperty("proto")
    public String getProto() {
        return proto;
    }

    @JsonProperty("packets")
    public long getPackets() {
        return packets;
    }

    @JsonProperty("bytes")
    public long getBytes() {
        return bytes;
    }

    @JsonProperty("duration")
    public double getDuration() {
        return duration;
    }

    /**
     * @return unmodifiable map of feature name to value, in scoring order
     */
    @JsonProperty("features")
    public Map<String, Double> getFeatures() {
        return features;
    }

    @JsonProperty("score")
    public double getScore() {
        return score;
    }

    @JsonProperty("detected_at")
    public Instant getDetectedAt() {
        return detectedAt;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link Anomaly}.
     *
     * <p>
     * {@link #build()} throws {@link NullPointerException} when
     * {@code timestamp} or {@code detectedAt} is missing.
     * </p>
     */
    public static final class Builder {
        private String timestamp;
        private String flowId;
        private String srcIp;
        private String dstIp;
        private String proto;
        private long packets;
        private long bytes;
        private double duration;
        private Map<String, Double> features;
        private double score;
        private Instant detectedAt;

        private Builder() {
        }

        public Builder timestamp(String timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder flowId(String flowId) {
            this.flowId = flowId;
            return this;
        }

        public Builder srcIp(String srcIp) {
            this.srcIp = srcIp;
            return this;
        }

        public Builder dstIp(String dstIp) {
            this.dstIp = dstIp;
            return this;
        }

        public Builder proto(String proto) {
            this.proto = proto;
            return this;
        }

        public Builder packets(long packets) {
            this.packets = packets;
            return this;
        }

        public Builder bytes(long bytes) {
            this.bytes = bytes;
            return this;
        }

        public Builder duration(double duration) {
            this.duration = duration;
            return this;
        }

        public Builder features(Map<String, Double> features) {
            this.features = features;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Anomaly build() {
            return new Anomaly(timestamp, flowId, srcIp, dstIp, proto,
                    packets, bytes, duration, features, score, detectedAt);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return packets == that.packets
                && bytes == that.bytes
                && Double.compare(duration, that.duration) == 0
                && Double.compare(score, that.score) == 0
                && timestamp.equals(that.timestamp)
                && flowId.equals(that.flowId)
                && srcIp.equals(that.srcIp)
                && dstIp.equals(that.dstIp)
                && proto.equals(that.proto)
                && features.equals(that.features)
                && detectedAt.equals(that.detectedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, flowId, srcIp, dstIp, proto,
                packets, bytes, duration, features, score, detectedAt);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "timestamp='" + timestamp + '\'' +
                ", flowId='" + flowId + '\'' +
                ", srcIp='" + srcIp + '\'' +
                ", dstIp='" + dstIp + '\'' +
                ", proto='" + proto + '\'' +
                ", score=" + score +
                '}';
    }
}
