/**
 * Process configuration for Flow Sentinel.
 *
 * <p>
 * {@link com.flowsentinel.core.config.ConfigLoader} reads YAML with
 * SnakeYAML, applies {@code FLOW_SENTINEL_*} environment overrides and
 * produces a validated {@link com.flowsentinel.core.config.DetectorConfig}.
 * </p>
 *
 * @since 1.0.0
 */
package com.flowsentinel.core.config;
