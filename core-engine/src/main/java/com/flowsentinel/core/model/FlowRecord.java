package com.flowsentinel.core.model;

import java.util.Objects;

/**
 * One sensor event of kind {@code flow}, reduced to the fields the detection
 * pipeline consumes.
 *
 * <p>
 * Counters are non-negative; negative values coming off the wire are clamped
 * to zero at build time, and the two-direction totals saturate at
 * {@link Long#MAX_VALUE}. Timestamps are microseconds on the sensor clock;
 * a timestamp the sensor did not send is {@link #NOT_REPORTED}, which is
 * distinct from an explicit {@code 0}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. Instances are immutable and safe to share between
 * threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class FlowRecord {

    /** Value of {@link #getStart()} / {@link #getEnd()} when the sensor omitted the field. */
    public static final long NOT_REPORTED = -1;

    private static final double MICROS_PER_SECOND = 1_000_000.0;

    private final String flowId;
    private final String timestamp;
    private final String srcIp;
    private final String dstIp;
    private final String proto;
    private final Protocol protocol;
    private final long pktsToServer;
    private final long pktsToClient;
    private final long bytesToServer;
    private final long bytesToClient;
    private final long start;
    private final long end;

    private FlowRecord(Builder b) {
        this.flowId = b.flowId != null ? b.flowId : "";
        this.timestamp = b.timestamp;
        this.srcIp = b.srcIp != null ? b.srcIp : "";
        this.dstIp = b.dstIp != null ? b.dstIp : "";
        this.proto = b.proto != null ? b.proto : "";
        this.protocol = Protocol.fromName(b.proto);
        this.pktsToServer = Math.max(0, b.pktsToServer);
        this.pktsToClient = Math.max(0, b.pktsToClient);
        this.bytesToServer = Math.max(0, b.bytesToServer);
        this.bytesToClient = Math.max(0, b.bytesToClient);
        this.start = b.start >= 0 ? b.start : NOT_REPORTED;
        this.end = b.end >= 0 ? b.end : NOT_REPORTED;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Derived quantities
    // ---------------------------------------------------------------

    /**
     * @return packets in both directions, saturating at {@link Long#MAX_VALUE}
     */
    public long totalPackets() {
        return saturatedSum(pktsToServer, pktsToClient);
    }

    /**
     * @return bytes in both directions, saturating at {@link Long#MAX_VALUE}
     */
    public long totalBytes() {
        return saturatedSum(bytesToServer, bytesToClient);
    }

    // both operands are clamped to >= 0, so overflow shows up as a negative sum
    private static long saturatedSum(long a, long b) {
        long sum = a + b;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }

    /**
     * Flow duration in seconds.
     *
     * <p>
     * Zero when either timestamp was not reported or when {@code end}
     * precedes {@code start}; never negative.
     * </p>
     *
     * @return duration in seconds
     */
    public double durationSeconds() {
        if (start == NOT_REPORTED || end == NOT_REPORTED || end < start) {
            return 0.0;
        }
        return (end - start) / MICROS_PER_SECOND;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getFlowId() {
        return flowId;
    }

    /**
     * @return the event timestamp as reported by the sensor, or {@code null}
     */
    public String getTimestamp() {
        return timestamp;
    }

    public String getSrcIp() {
        return srcIp;
    }

    public String getDstIp() {
        return dstIp;
    }

    /**
     * @return the raw protocol name, empty if absent
     */
    public String getProto() {
        return proto;
    }

    public Protocol getProtocol() {
        return protocol;
    }

    public long getPktsToServer() {
        return pktsToServer;
    }

    public long getPktsToClient() {
        return pktsToClient;
    }

    public long getBytesToServer() {
        return bytesToServer;
    }

    public long getBytesToClient() {
        return bytesToClient;
    }

    /**
     * @return start in microseconds, or {@link #NOT_REPORTED}
     */
    public long getStart() {
        return start;
    }

    /**
     * @return end in microseconds, or {@link #NOT_REPORTED}
     */
    public long getEnd() {
        return end;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static final class Builder {
        private String flowId;
        private String timestamp;
        private String srcIp;
        private String dstIp;
        private String proto;
        private long pktsToServer;
        private long pktsToClient;
        private long bytesToServer;
        private long bytesToClient;
        private long start = NOT_REPORTED;
        private long end = NOT_REPORTED;

        private Builder() {
        }

        public Builder flowId(String flowId) {
            this.flowId = flowId;
            return this;
        }

        public Builder timestamp(String timestamp) {
            this.timestamp = timestamp;
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

        public Builder pktsToServer(long pktsToServer) {
            this.pktsToServer = pktsToServer;
            return this;
        }

        public Builder pktsToClient(long pktsToClient) {
            this.pktsToClient = pktsToClient;
            return this;
        }

        public Builder bytesToServer(long bytesToServer) {
            this.bytesToServer = bytesToServer;
            return this;
        }

        public Builder bytesToClient(long bytesToClient) {
            this.bytesToClient = bytesToClient;
            return this;
        }

        /**
         * @param start microseconds; a negative value means not reported
         * @return this builder
         */
        public Builder start(long start) {
            this.start = start;
            return this;
        }

        public Builder end(long end) {
            this.end = end;
            return this;
        }

        public FlowRecord build() {
            return new FlowRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FlowRecord that))
            return false;
        return pktsToServer == that.pktsToServer
                && pktsToClient == that.pktsToClient
                && bytesToServer == that.bytesToServer
                && bytesToClient == that.bytesToClient
                && start == that.start
                && end == that.end
                && flowId.equals(that.flowId)
                && Objects.equals(timestamp, that.timestamp)
                && srcIp.equals(that.srcIp)
                && dstIp.equals(that.dstIp)
                && proto.equals(that.proto);
    }

    @Override
    public int hashCode() {
        return Objects.hash(flowId, timestamp, srcIp, dstIp, proto,
                pktsToServer, pktsToClient, bytesToServer, bytesToClient, start, end);
    }

    @Override
    public String toString() {
        return "FlowRecord{" +
                "flowId='" + flowId + '\'' +
                ", srcIp='" + srcIp + '\'' +
                ", dstIp='" + dstIp + '\'' +
                ", proto='" + proto + '\'' +
                ", packets=" + totalPackets() +
                ", bytes=" + totalBytes() +
                ", duration=" + durationSeconds() +
                '}';
    }
}
