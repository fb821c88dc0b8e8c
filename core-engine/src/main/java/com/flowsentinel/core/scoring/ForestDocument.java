package com.flowsentinel.core.scoring;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of an exported Isolation Forest.
 *
 * <pre>
 * {
 *   "max_samples": 256,
 *   "offset": -0.5,
 *   "n_features": 4,
 *   "trees": [
 *     { "children_left": [...], "children_right": [...], "feature": [...],
 *       "threshold": [...], "n_node_samples": [...] }
 *   ]
 * }
 * </pre>
 *
 * <p>
 * {@code offset} and {@code n_features} are optional.
 * </p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
final class ForestDocument {

    @JsonProperty("max_samples")
    int maxSamples;

    @JsonProperty("offset")
    Double offset;

    @JsonProperty("n_features")
    Integer featureCount;

    @JsonProperty("trees")
    List<TreeDocument> trees = new ArrayList<>();

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class TreeDocument {

        @JsonProperty("children_left")
        int[] childrenLeft;

        @JsonProperty("children_right")
        int[] childrenRight;

        @JsonProperty("feature")
        int[] feature;

        @JsonProperty("threshold")
        double[] threshold;

        @JsonProperty("n_node_samples")
        int[] nodeSamples;
    }
}
