/**
 * Process bootstrapping for the Flow Sentinel detector: the
 * {@link com.flowsentinel.service.FlowSentinelMain} entry point and the
 * {@link com.flowsentinel.service.StatusServer} HTTP endpoints.
 *
 * @since 1.0.0
 */
package com.flowsentinel.service;
