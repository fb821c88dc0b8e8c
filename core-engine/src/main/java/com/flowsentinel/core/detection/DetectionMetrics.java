package com.flowsentinel.core.detection;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for the detection pipeline.
 *
 * <p>
 * Updated by the producer thread, readable from any thread.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code events_processed_total} – flow events extracted and scored</li>
 * <li>{@code anomalies_detected_total} – flow events scored below zero</li>
 * <li>{@code malformed_lines_total} – lines that were not a JSON object</li>
 * <li>{@code ignored_events_total} – well-formed events that are not flows</li>
 * <li>{@code scoring_failures_total} – flow events whose extraction or
 * scoring threw</li>
 * <li>{@code processing_latency} – mean and max per-event latency</li>
 * </ul>
 */
public class DetectionMetrics {

    private final LongAdder eventsProcessed = new LongAdder();
    private final LongAdder anomaliesDetected = new LongAdder();
    private final LongAdder malformedLines = new LongAdder();
    private final LongAdder ignoredEvents = new LongAdder();
    private final LongAdder scoringFailures = new LongAdder();
    private final LongAdder latencyTotalNanos = new LongAdder();
    private final AtomicLong latencyMaxNanos = new AtomicLong();

    public void incrementEventsProcessed() {
        eventsProcessed.increment();
    }

    public void incrementAnomaliesDetected() {
        anomaliesDetected.increment();
    }

    public void incrementMalformedLines() {
        malformedLines.increment();
    }

    public void incrementIgnoredEvents() {
        ignoredEvents.increment();
    }

    public void incrementScoringFailures() {
        scoringFailures.increment();
    }

    public void recordLatency(long nanos) {
        latencyTotalNanos.add(nanos);
        latencyMaxNanos.accumulateAndGet(nanos, Math::max);
    }

    public long getEventsProcessed() {
        return eventsProcessed.sum();
    }

    public long getAnomaliesDetected() {
        return anomaliesDetected.sum();
    }

    public long getMalformedLines() {
        return malformedLines.sum();
    }

    public long getIgnoredEvents() {
        return ignoredEvents.sum();
    }

    public long getScoringFailures() {
        return scoringFailures.sum();
    }

    /**
     * @return mean latency in microseconds over processed events, or 0
     */
    public double getMeanLatencyMicros() {
        long events = eventsProcessed.sum() + scoringFailures.sum();
        return events == 0 ? 0.0 : latencyTotalNanos.sum() / 1_000.0 / events;
    }

    public long getMaxLatencyMicros() {
        return latencyMaxNanos.get() / 1_000;
    }

    @Override
    public String toString() {
        return "DetectionMetrics{" +
                "eventsProcessed=" + getEventsProcessed() +
                ", anomaliesDetected=" + getAnomaliesDetected() +
                ", malformedLines=" + getMalformedLines() +
                ", ignoredEvents=" + getIgnoredEvents() +
                ", scoringFailures=" + getScoringFailures() +
                '}';
    }
}
