/**
 * The streaming detection pipeline.
 *
 * <p>
 * {@link com.flowsentinel.core.detection.DetectionOrchestrator} receives lines
 * from the tailers, parses them with
 * {@link com.flowsentinel.core.detection.FlowEventParser}, scores flow events
 * and stores anomalies. Per-line failures are isolated and counted in
 * {@link com.flowsentinel.core.detection.DetectionMetrics}.
 * </p>
 *
 * @since 1.0.0
 */
package com.flowsentinel.core.detection;
