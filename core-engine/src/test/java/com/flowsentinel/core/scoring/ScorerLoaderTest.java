package com.flowsentinel.core.scoring;

import com.flowsentinel.core.features.FeatureColumns;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ScorerLoader}.
 */
class ScorerLoaderTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should load a forest and fall back to default columns when no artifact exists")
    void shouldLoadWithDefaultColumns() throws IOException {
        Path model = write("model.json", forestJson(4, 0));

        IsolationForestScorer scorer = ScorerLoader.load(model, dir.resolve("missing-columns.json"));

        assertThat(scorer.featureColumns()).isEqualTo(FeatureColumns.DEFAULT);
        assertThat(scorer.treeCount()).isEqualTo(1);
        assertThat(scorer.maxSamples()).isEqualTo(256);
        assertThat(scorer.offset()).isEqualTo(IsolationForestScorer.DEFAULT_OFFSET);
    }

    @Test
    @DisplayName("Should read the column list from the artifact")
    void shouldReadColumnsArtifact() throws IOException {
        Path model = write("model.json", forestJson(2, 1));
        Path columns = write("columns.json", "[\"total_bytes\", \"bytes_per_sec\"]");

        IsolationForestScorer scorer = ScorerLoader.load(model, columns);

        assertThat(scorer.featureColumns()).containsExactly("total_bytes", "bytes_per_sec");
    }

    @Test
    @DisplayName("Should use the offset stored with the model")
    void shouldUseStoredOffset() throws IOException {
        Path model = write("model.json", "{\"max_samples\": 256, \"offset\": -0.55, \"trees\": [" + TREE + "]}");

        assertThat(ScorerLoader.load(model, null).offset()).isEqualTo(-0.55);
    }

    @Test
    @DisplayName("Should fail when the model file does not exist")
    void shouldFailOnMissingModel() {
        assertThatThrownBy(() -> ScorerLoader.load(dir.resolve("nope.json"), null))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("Model file not found");
    }

    @Test
    @DisplayName("Should fail when the model file is not valid JSON")
    void shouldFailOnUnparseableModel() throws IOException {
        Path model = write("model.json", "{not json");

        assertThatThrownBy(() -> ScorerLoader.load(model, null))
                .isInstanceOf(ModelLoadException.class);
    }

    @Test
    @DisplayName("Should fail when the model has no trees or too few samples")
    void shouldFailOnEmptyForest() throws IOException {
        Path noTrees = write("a.json", "{\"max_samples\": 256, \"trees\": []}");
        Path tiny = write("b.json", "{\"max_samples\": 1, \"trees\": [" + TREE + "]}");

        assertThatThrownBy(() -> ScorerLoader.load(noTrees, null))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("no trees");
        assertThatThrownBy(() -> ScorerLoader.load(tiny, null))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("max_samples");
    }

    @Test
    @DisplayName("Should wrap structural tree errors in ModelLoadException")
    void shouldFailOnInvalidTree() throws IOException {
        Path model = write("model.json", "{\"max_samples\": 256, \"trees\": [{"
                + "\"children_left\": [1, -1], \"children_right\": [-1, -1], \"feature\": [0, -2],"
                + "\"threshold\": [1.0, -2.0], \"n_node_samples\": [2, 1]}]}");

        assertThatThrownBy(() -> ScorerLoader.load(model, null))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("Tree 0");
    }

    @Test
    @DisplayName("Should reject a model whose feature count differs from the column list")
    void shouldRejectFeatureCountMismatch() throws IOException {
        Path model = write("model.json", forestJson(5, 0));

        assertThatThrownBy(() -> ScorerLoader.load(model, null))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessageContaining("5 feature(s)");
    }

    @Test
    @DisplayName("Should reject a tree that splits on a feature beyond the column list")
    void shouldRejectOutOfRangeFeature() throws IOException {
        Path model = write("model.json", "{\"max_samples\": 256, \"trees\": [{"
                + "\"children_left\": [1, -1, -1], \"children_right\": [2, -1, -1], \"feature\": [7, -2, -2],"
                + "\"threshold\": [10.0, -2.0, -2.0], \"n_node_samples\": [256, 1, 255]}]}");

        assertThatThrownBy(() -> ScorerLoader.load(model, null))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessageContaining("feature index 7");
    }

    @Test
    @DisplayName("Should reject empty or duplicated column artifacts")
    void shouldRejectBadColumnArtifacts() throws IOException {
        Path empty = write("empty.json", "[]");
        Path dup = write("dup.json", "[\"proto\", \"proto\"]");

        assertThatThrownBy(() -> ScorerLoader.loadColumns(empty))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("empty");
        assertThatThrownBy(() -> ScorerLoader.loadColumns(dup))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("repeats");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static final String TREE = "{"
            + "\"children_left\": [1, -1, -1],"
            + "\"children_right\": [2, -1, -1],"
            + "\"feature\": [0, -2, -2],"
            + "\"threshold\": [10.0, -2.0, -2.0],"
            + "\"n_node_samples\": [256, 1, 255]"
            + "}";

    private static String forestJson(int featureCount, int splitFeature) {
        return "{\"max_samples\": 256, \"n_features\": " + featureCount + ", \"trees\": ["
                + TREE.replace("\"feature\": [0,", "\"feature\": [" + splitFeature + ",")
                + "]}";
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
