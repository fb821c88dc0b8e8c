package com.flowsentinel.core.scoring;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowsentinel.core.features.FeatureColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads a {@link Scorer} from its two artifacts: the exported model and the
 * ordered feature-column list it was trained on.
 *
 * <h3>Column resolution</h3>
 * <ol>
 * <li>If a columns path is given and the file exists, its JSON string array
 * is the schema.</li>
 * <li>Otherwise the schema falls back to {@link FeatureColumns#DEFAULT}.</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Loading fails fast. An unreadable or malformed artifact raises
 * {@link ModelLoadException}; a model that reads feature indices beyond the
 * column list, or declares a feature count different from it, raises
 * {@link SchemaMismatchException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScorerLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ScorerLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ScorerLoader() {
        // utility class — not instantiable
    }

    /**
     * Load an Isolation Forest scorer.
     *
     * @param modelPath   path to the exported forest; must not be {@code null}
     * @param columnsPath path to the feature-columns artifact, or {@code null}
     * @return a ready scorer
     * @throws ModelLoadException      if an artifact cannot be read or parsed
     * @throws SchemaMismatchException if model and columns disagree
     */
    public static IsolationForestScorer load(Path modelPath, Path columnsPath) {
        Objects.requireNonNull(modelPath, "Model path must not be null");
        List<String> columns = loadColumns(columnsPath);
        IsolationForestScorer scorer = loadForest(modelPath, columns);
        LOG.info("Model loaded successfully from {}", modelPath);
        LOG.info("Using features: {}", scorer.featureColumns());
        return scorer;
    }

    /**
     * Read the feature-columns artifact.
     *
     * @param columnsPath path to a JSON string array, or {@code null}
     * @return column names, or {@link FeatureColumns#DEFAULT} when the path is
     *         {@code null} or the file does not exist
     * @throws ModelLoadException if the file exists but cannot be parsed, is
     *                            empty, or repeats a column
     */
    public static List<String> loadColumns(Path columnsPath) {
        if (columnsPath == null || !Files.exists(columnsPath)) {
            LOG.info("No feature-columns artifact at {}; using default columns {}",
                    columnsPath, FeatureColumns.DEFAULT);
            return FeatureColumns.DEFAULT;
        }
        List<String> columns;
        try {
            columns = MAPPER.readValue(columnsPath.toFile(), new TypeReference<List<String>>() {
            });
        } catch (IOException e) {
            throw new ModelLoadException("Failed to read feature columns from " + columnsPath, e);
        }
        if (columns == null || columns.isEmpty()) {
            throw new ModelLoadException("Feature columns artifact " + columnsPath + " is empty");
        }
        List<String> seen = new ArrayList<>();
        for (String column : columns) {
            if (column == null || column.isBlank()) {
                throw new ModelLoadException("Feature columns artifact " + columnsPath
                        + " contains a blank column name");
            }
            if (seen.contains(column)) {
                throw new ModelLoadException("Feature columns artifact " + columnsPath
                        + " repeats column '" + column + "'");
            }
            seen.add(column);
        }
        return List.copyOf(columns);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static IsolationForestScorer loadForest(Path modelPath, List<String> columns) {
        if (!Files.isRegularFile(modelPath)) {
            throw new ModelLoadException("Model file not found: " + modelPath);
        }
        ForestDocument doc;
        try {
            doc = MAPPER.readValue(modelPath.toFile(), ForestDocument.class);
        } catch (IOException e) {
            throw new ModelLoadException("Failed to parse model file " + modelPath, e);
        }
        if (doc == null || doc.trees == null || doc.trees.isEmpty()) {
            throw new ModelLoadException("Model file " + modelPath + " contains no trees");
        }
        if (doc.maxSamples < 2) {
            throw new ModelLoadException("Model file " + modelPath
                    + " requires 'max_samples' >= 2, got: " + doc.maxSamples);
        }

        if (doc.featureCount != null && doc.featureCount != columns.size()) {
            throw new SchemaMismatchException("Model " + modelPath + " was trained on "
                    + doc.featureCount + " feature(s) but the column list has "
                    + columns.size() + ": " + columns);
        }

        List<IsolationTree> trees = new ArrayList<>(doc.trees.size());
        for (int i = 0; i < doc.trees.size(); i++) {
            ForestDocument.TreeDocument t = doc.trees.get(i);
            IsolationTree tree;
            try {
                tree = new IsolationTree(t.childrenLeft, t.childrenRight, t.feature,
                        t.threshold, t.nodeSamples);
            } catch (NullPointerException | IllegalArgumentException e) {
                throw new ModelLoadException("Tree " + i + " in " + modelPath
                        + " is invalid: " + e.getMessage(), e);
            }
            if (tree.maxFeatureIndex() >= columns.size()) {
                throw new SchemaMismatchException("Tree " + i + " in " + modelPath
                        + " splits on feature index " + tree.maxFeatureIndex()
                        + " but only " + columns.size() + " column(s) are declared: " + columns);
            }
            trees.add(tree);
        }

        double offset = doc.offset != null ? doc.offset : IsolationForestScorer.DEFAULT_OFFSET;
        return new IsolationForestScorer(trees, doc.maxSamples, offset, columns);
    }
}
