/**
 * Deterministic feature extraction from flow records.
 *
 * @since 1.0.0
 */
package com.flowsentinel.core.features;
