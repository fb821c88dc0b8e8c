package com.flowsentinel.core.scoring;

import com.flowsentinel.core.model.FeatureVector;

import java.util.List;

/**
 * Contract for every anomaly-scoring backend.
 *
 * <p>
 * A scorer is bound to a fixed, ordered feature schema when it is loaded and
 * maps a vector in that schema to a single score. The sign carries the
 * verdict: a <strong>negative</strong> score means anomalous. Callers never
 * interpret the magnitude beyond that threshold.
 * </p>
 * <p>
 * Implementations must be deterministic for a given loaded model and input,
 * must not mutate internal state while scoring, and must tolerate concurrent
 * {@link #score(FeatureVector)} calls.
 * </p>
 */
public interface Scorer {

    /**
     * Score a feature vector.
     *
     * @param features vector whose names equal {@link #featureColumns()}
     * @return anomaly score; negative means anomalous
     * @throws SchemaMismatchException if the vector's columns differ from the
     *                                 scorer's schema
     */
    double score(FeatureVector features);

    /**
     * Return the ordered feature columns this scorer was loaded with.
     *
     * @return unmodifiable column list
     */
    List<String> featureColumns();
}
