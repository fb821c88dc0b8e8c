package com.flowsentinel.core.scoring;

import java.util.Objects;

/**
 * One fitted isolation tree in flattened array form.
 *
 * <p>
 * Node {@code i} is a leaf when {@code childrenLeft[i] == -1}. Internal nodes
 * send a sample left when {@code x[feature[i]] <= threshold[i]} and right
 * otherwise. {@code nodeSamples[i]} is the number of training samples that
 * reached the node, used to extend the path length at a leaf.
 * </p>
 */
final class IsolationTree {

    static final int LEAF = -1;

    private final int[] childrenLeft;
    private final int[] childrenRight;
    private final int[] feature;
    private final double[] threshold;
    private final int[] nodeSamples;

    IsolationTree(int[] childrenLeft, int[] childrenRight, int[] feature,
            double[] threshold, int[] nodeSamples) {
        this.childrenLeft = Objects.requireNonNull(childrenLeft, "children_left must not be null");
        this.childrenRight = Objects.requireNonNull(childrenRight, "children_right must not be null");
        this.feature = Objects.requireNonNull(feature, "feature must not be null");
        this.threshold = Objects.requireNonNull(threshold, "threshold must not be null");
        this.nodeSamples = Objects.requireNonNull(nodeSamples, "n_node_samples must not be null");
        validate();
    }

    /**
     * Path length of {@code x}: edges walked to reach a leaf, plus the
     * average path length of the leaf's unexpanded subtree.
     */
    double pathLength(double[] x) {
        int node = 0;
        int depth = 0;
        while (childrenLeft[node] != LEAF) {
            node = x[feature[node]] <= threshold[node] ? childrenLeft[node] : childrenRight[node];
            depth++;
        }
        return depth + IsolationForestScorer.averagePathLength(nodeSamples[node]);
    }

    /**
     * @return highest feature index any split node reads, or {@code -1} for a
     *         single-leaf tree
     */
    int maxFeatureIndex() {
        int max = -1;
        for (int i = 0; i < feature.length; i++) {
            if (childrenLeft[i] != LEAF) {
                max = Math.max(max, feature[i]);
            }
        }
        return max;
    }

    int nodeCount() {
        return childrenLeft.length;
    }

    private void validate() {
        int n = childrenLeft.length;
        if (n == 0) {
            throw new IllegalArgumentException("Tree has no nodes");
        }
        if (childrenRight.length != n || feature.length != n
                || threshold.length != n || nodeSamples.length != n) {
            throw new IllegalArgumentException("Tree arrays differ in length (expected " + n + ")");
        }
        for (int i = 0; i < n; i++) {
            boolean leftLeaf = childrenLeft[i] == LEAF;
            boolean rightLeaf = childrenRight[i] == LEAF;
            if (leftLeaf != rightLeaf) {
                throw new IllegalArgumentException("Node " + i + " has exactly one child");
            }
            if (!leftLeaf) {
                // children always follow their parent in the flattened layout; this rules out cycles
                if (childrenLeft[i] <= i || childrenLeft[i] >= n
                        || childrenRight[i] <= i || childrenRight[i] >= n) {
                    throw new IllegalArgumentException("Node " + i + " has an out-of-range child");
                }
                if (feature[i] < 0) {
                    throw new IllegalArgumentException("Node " + i + " splits on a negative feature index");
                }
            }
        }
    }
}
