package com.flowsentinel.core.features;

import java.util.ArrayList;
import java.util.List;

/**
 * Names of every feature {@link FeatureExtractor} can compute, and the
 * default scoring schema.
 *
 * <p>
 * The names are shared with the model-training side: a model is trained on
 * some ordered subset of them, and the same ordered subset must be used when
 * scoring.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureColumns {

    public static final String TOTAL_PACKETS = "total_packets";
    public static final String TOTAL_BYTES = "total_bytes";
    public static final String DURATION = "duration";
    public static final String PROTO = "proto";
    public static final String BYTES_PER_SEC = "bytes_per_sec";
    public static final String PKTS_PER_SEC = "pkts_per_sec";
    public static final String BYTES_PER_PACKET = "bytes_per_packet";
    public static final String CLIENT_SERVER_RATIO = "client_server_ratio";

    /** Schema used when no feature-columns artifact accompanies the model. */
    public static final List<String> DEFAULT = List.of(TOTAL_PACKETS, TOTAL_BYTES, DURATION, PROTO);

    /** Every computable feature, in extraction order. */
    public static final List<String> ALL = List.of(
            TOTAL_PACKETS, TOTAL_BYTES, DURATION, PROTO,
            BYTES_PER_SEC, PKTS_PER_SEC, BYTES_PER_PACKET, CLIENT_SERVER_RATIO);

    private FeatureColumns() {
        // constants holder — not instantiable
    }

    /**
     * @param columns column names to check
     * @return the names in {@code columns} that no extractor feature matches,
     *         in input order; empty when all are known
     */
    public static List<String> unknown(List<String> columns) {
        List<String> unknown = new ArrayList<>();
        for (String column : columns) {
            if (!ALL.contains(column)) {
                unknown.add(column);
            }
        }
        return unknown;
    }
}
