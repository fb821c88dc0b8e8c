package com.flowsentinel.core.scoring;

import com.flowsentinel.core.model.FeatureVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IsolationForestScorer} and {@link IsolationTree}.
 */
class IsolationForestScorerTest {

    private static final List<String> COLUMNS = List.of("total_packets");

    @Test
    @DisplayName("Should score an isolated point as anomalous (negative)")
    void shouldScoreIsolatedPointNegative() {
        IsolationForestScorer scorer = singleSplitForest();

        double score = scorer.score(vector(5.0));

        assertThat(score).isNegative();
        assertThat(score).isCloseTo(-0.4346, within(1e-3));
    }

    @Test
    @DisplayName("Should score a point in the dense region as normal (non-negative)")
    void shouldScoreDensePointPositive() {
        IsolationForestScorer scorer = singleSplitForest();

        double score = scorer.score(vector(50.0));

        assertThat(score).isCloseTo(0.0325, within(1e-3));
    }

    @Test
    @DisplayName("Should send values equal to the threshold down the left branch")
    void shouldSendThresholdValueLeft() {
        IsolationForestScorer scorer = singleSplitForest();

        assertThat(scorer.score(vector(10.0))).isEqualTo(scorer.score(vector(5.0)));
    }

    @Test
    @DisplayName("Should average path lengths across trees")
    void shouldAverageAcrossTrees() {
        IsolationTree split = splitTree();
        IsolationTree leaf = new IsolationTree(new int[] {-1}, new int[] {-1}, new int[] {-2},
                new double[] {-2.0}, new int[] {256});
        IsolationForestScorer scorer = new IsolationForestScorer(List.of(split, leaf), 256,
                IsolationForestScorer.DEFAULT_OFFSET, COLUMNS);

        double c256 = IsolationForestScorer.averagePathLength(256);
        double meanPath = (1.0 + c256) / 2.0;
        double expected = -Math.pow(2.0, -meanPath / c256) + 0.5;

        assertThat(scorer.score(vector(5.0))).isCloseTo(expected, within(1e-12));
    }

    @Test
    @DisplayName("Should apply the configured offset")
    void shouldApplyOffset() {
        IsolationForestScorer base = singleSplitForest();
        IsolationForestScorer shifted = new IsolationForestScorer(List.of(splitTree()), 256, -0.6, COLUMNS);

        assertThat(shifted.score(vector(50.0)) - base.score(vector(50.0))).isCloseTo(0.1, within(1e-12));
    }

    @Test
    @DisplayName("Should compute the average unsuccessful search length c(n)")
    void shouldComputeAveragePathLength() {
        assertThat(IsolationForestScorer.averagePathLength(0)).isZero();
        assertThat(IsolationForestScorer.averagePathLength(1)).isZero();
        assertThat(IsolationForestScorer.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationForestScorer.averagePathLength(256)).isCloseTo(10.2448, within(1e-3));
    }

    @Test
    @DisplayName("Should reject a vector whose columns differ from the model's")
    void shouldRejectMismatchedVector() {
        IsolationForestScorer scorer = singleSplitForest();
        FeatureVector wrong = FeatureVector.of(List.of("total_bytes"), new double[] {5.0});

        assertThatThrownBy(() -> scorer.score(wrong))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessageContaining("total_packets");
    }

    @Test
    @DisplayName("Should reject trees with a single child or a backwards edge")
    void shouldRejectMalformedTrees() {
        assertThatThrownBy(() -> new IsolationTree(new int[] {1, -1}, new int[] {-1, -1},
                new int[] {0, -2}, new double[] {1.0, -2.0}, new int[] {2, 1}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exactly one child");
        assertThatThrownBy(() -> new IsolationTree(new int[] {0, -1, -1}, new int[] {2, -1, -1},
                new int[] {0, -2, -2}, new double[] {1.0, -2.0, -2.0}, new int[] {2, 1, 1}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out-of-range");
        assertThatThrownBy(() -> new IsolationTree(new int[] {-1}, new int[] {-1, -1},
                new int[] {-2}, new double[] {-2.0}, new int[] {1}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /** Root splits feature 0 at 10; 1 sample isolated on the left, 255 on the right. */
    private static IsolationTree splitTree() {
        return new IsolationTree(
                new int[] {1, -1, -1},
                new int[] {2, -1, -1},
                new int[] {0, -2, -2},
                new double[] {10.0, -2.0, -2.0},
                new int[] {256, 1, 255});
    }

    private static IsolationForestScorer singleSplitForest() {
        return new IsolationForestScorer(List.of(splitTree()), 256,
                IsolationForestScorer.DEFAULT_OFFSET, COLUMNS);
    }

    private static FeatureVector vector(double value) {
        return FeatureVector.of(COLUMNS, new double[] {value});
    }
}
