package com.flowsentinel.core.features;

import com.flowsentinel.core.model.FeatureVector;
import com.flowsentinel.core.model.FlowRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a {@link FlowRecord} into the feature vector a scorer expects.
 *
 * <p>
 * Extraction is pure and total: it never throws for a well-formed record,
 * and every ratio whose denominator is zero resolves to {@code 0}, except
 * {@link FeatureColumns#CLIENT_SERVER_RATIO}, which is
 * {@link Double#POSITIVE_INFINITY} when the client sent no bytes back
 * ("no reverse traffic").
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are immutable and may be shared.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureExtractor {

    private final List<String> columns;

    /**
     * @param columns ordered feature names the vector must carry
     * @throws NullPointerException     if {@code columns} is {@code null}
     * @throws IllegalArgumentException if {@code columns} is empty or names a
     *                                  feature that cannot be computed
     */
    public FeatureExtractor(List<String> columns) {
        Objects.requireNonNull(columns, "Feature columns must not be null");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Feature columns must not be empty");
        }
        List<String> unknown = FeatureColumns.unknown(columns);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown feature column(s) " + unknown
                    + ". Supported: " + FeatureColumns.ALL);
        }
        this.columns = List.copyOf(columns);
    }

    /**
     * @return the ordered column names this extractor emits
     */
    public List<String> columns() {
        return columns;
    }

    /**
     * Extract the configured features, in configured order.
     *
     * @param flow the flow record; must not be {@code null}
     * @return feature vector matching {@link #columns()}
     */
    public FeatureVector extract(FlowRecord flow) {
        Map<String, Double> all = computeAll(flow);
        double[] values = new double[columns.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = all.get(columns.get(i));
        }
        return FeatureVector.of(columns, values);
    }

    /**
     * Compute every derived feature, whether or not the scorer uses it.
     *
     * @param flow the flow record; must not be {@code null}
     * @return map of feature name to value, in {@link FeatureColumns#ALL} order
     */
    public static Map<String, Double> computeAll(FlowRecord flow) {
        Objects.requireNonNull(flow, "FlowRecord must not be null");

        double totalPackets = flow.totalPackets();
        double totalBytes = flow.totalBytes();
        double duration = flow.durationSeconds();

        Map<String, Double> features = new LinkedHashMap<>();
        features.put(FeatureColumns.TOTAL_PACKETS, totalPackets);
        features.put(FeatureColumns.TOTAL_BYTES, totalBytes);
        features.put(FeatureColumns.DURATION, duration);
        features.put(FeatureColumns.PROTO, (double) flow.getProtocol().code());
        features.put(FeatureColumns.BYTES_PER_SEC, duration > 0 ? totalBytes / duration : 0.0);
        features.put(FeatureColumns.PKTS_PER_SEC, duration > 0 ? totalPackets / duration : 0.0);
        features.put(FeatureColumns.BYTES_PER_PACKET, totalPackets > 0 ? totalBytes / totalPackets : 0.0);
        features.put(FeatureColumns.CLIENT_SERVER_RATIO, flow.getBytesToClient() > 0
                ? (double) flow.getBytesToServer() / flow.getBytesToClient()
                : Double.POSITIVE_INFINITY);
        return features;
    }
}
