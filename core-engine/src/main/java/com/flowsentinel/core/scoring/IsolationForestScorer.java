package com.flowsentinel.core.scoring;

import com.flowsentinel.core.model.FeatureVector;

import java.util.List;
import java.util.Objects;

/**
 * {@link Scorer} backed by a fitted Isolation Forest.
 *
 * <p>
 * The forest is supplied pre-trained (see {@link ScorerLoader}); this class
 * only evaluates it. For a sample {@code x} with mean path length
 * {@code E[h(x)]} over all trees:
 * </p>
 *
 * <pre>
 *   score = -2^(-E[h(x)] / c(maxSamples)) - offset
 * </pre>
 *
 * <p>
 * where {@code c(n)} is the average path length of an unsuccessful search in
 * a binary search tree of {@code n} nodes. With the default offset of
 * {@code -0.5}, samples that isolate faster than average score below zero.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Immutable after construction; concurrent scoring is safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class IsolationForestScorer implements Scorer {

    /** Offset used when the training side does not record one. */
    public static final double DEFAULT_OFFSET = -0.5;

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final List<IsolationTree> trees;
    private final int maxSamples;
    private final double offset;
    private final List<String> columns;
    private final double normalizer;

    IsolationForestScorer(List<IsolationTree> trees, int maxSamples, double offset, List<String> columns) {
        Objects.requireNonNull(trees, "Trees must not be null");
        Objects.requireNonNull(columns, "Feature columns must not be null");
        if (trees.isEmpty()) {
            throw new IllegalArgumentException("Forest must contain at least one tree");
        }
        if (maxSamples < 2) {
            throw new IllegalArgumentException("max_samples must be >= 2, got: " + maxSamples);
        }
        this.trees = List.copyOf(trees);
        this.maxSamples = maxSamples;
        this.offset = offset;
        this.columns = List.copyOf(columns);
        this.normalizer = averagePathLength(maxSamples);
    }

    @Override
    public double score(FeatureVector features) {
        Objects.requireNonNull(features, "FeatureVector must not be null");
        if (!columns.equals(features.names())) {
            throw new SchemaMismatchException("Scorer expects columns " + columns
                    + " but received " + features.names());
        }
        double[] x = features.values();
        double total = 0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(x);
        }
        double meanPath = total / trees.size();
        return -Math.pow(2.0, -meanPath / normalizer) - offset;
    }

    @Override
    public List<String> featureColumns() {
        return columns;
    }

    public int treeCount() {
        return trees.size();
    }

    public int maxSamples() {
        return maxSamples;
    }

    public double offset() {
        return offset;
    }

    /**
     * Average path length of an unsuccessful binary-search-tree lookup over
     * {@code n} samples.
     *
     * @param n number of samples
     * @return {@code c(n)}; {@code 0} for {@code n <= 1}, {@code 1} for
     *         {@code n == 2}
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    @Override
    public String toString() {
        return "IsolationForestScorer{" +
                "trees=" + trees.size() +
                ", maxSamples=" + maxSamples +
                ", offset=" + offset +
                ", columns=" + columns +
                '}';
    }
}
