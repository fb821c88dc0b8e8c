/**
 * Model-based anomaly scoring.
 *
 * <p>
 * The pipeline depends only on the one-method
 * {@link com.flowsentinel.core.scoring.Scorer} contract, so the scoring
 * backend can be swapped without touching detection. The bundled backend is
 * {@link com.flowsentinel.core.scoring.IsolationForestScorer}, loaded by
 * {@link com.flowsentinel.core.scoring.ScorerLoader}.
 * </p>
 *
 * <h3>Failure modes</h3>
 * <ul>
 * <li>{@link com.flowsentinel.core.scoring.ModelLoadException}: an artifact
 * is missing or malformed</li>
 * <li>{@link com.flowsentinel.core.scoring.SchemaMismatchException}: the
 * model and the feature columns disagree</li>
 * </ul>
 * <p>
 * Both are raised at startup and are not recoverable.
 * </p>
 *
 * @since 1.0.0
 */
package com.flowsentinel.core.scoring;
