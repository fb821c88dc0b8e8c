/**
 * Bounded in-memory anomaly retention and its durable persistence.
 *
 * <p>
 * {@link com.flowsentinel.core.store.AnomalyStore} is the single-writer,
 * multi-reader container; {@link com.flowsentinel.core.store.JsonFileAnomalySink}
 * persists it with atomic file replacement, and
 * {@link com.flowsentinel.core.store.AnomalyFileReader} reads the result back
 * for consumers.
 * </p>
 *
 * @since 1.0.0
 */
package com.flowsentinel.core.store;
