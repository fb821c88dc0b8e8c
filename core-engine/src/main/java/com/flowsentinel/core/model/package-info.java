/**
 * Domain model classes for Flow Sentinel.
 *
 * <p>
 * Value types shared by the feature, scoring, storage and detection layers:
 * </p>
 * <ul>
 * <li>{@link com.flowsentinel.core.model.FlowRecord}: one parsed flow
 * event</li>
 * <li>{@link com.flowsentinel.core.model.FeatureVector}: ordered scorer
 * input</li>
 * <li>{@link com.flowsentinel.core.model.Anomaly}: a flow classified as
 * anomalous</li>
 * <li>{@link com.flowsentinel.core.model.Protocol}: protocol feature
 * codes</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.flowsentinel.core.model;
