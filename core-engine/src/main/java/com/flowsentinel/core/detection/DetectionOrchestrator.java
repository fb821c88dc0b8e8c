package com.flowsentinel.core.detection;

import com.flowsentinel.core.features.FeatureColumns;
import com.flowsentinel.core.features.FeatureExtractor;
import com.flowsentinel.core.model.Anomaly;
import com.flowsentinel.core.model.FeatureVector;
import com.flowsentinel.core.model.FlowRecord;
import com.flowsentinel.core.scoring.SchemaMismatchException;
import com.flowsentinel.core.scoring.Scorer;
import com.flowsentinel.core.store.AnomalyStore;
import com.flowsentinel.core.tail.FileTailer;
import com.flowsentinel.core.tail.LineHandler;
import com.flowsentinel.core.tail.TailState;
import com.flowsentinel.core.tail.WakeUpSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Wires tailing, parsing, feature extraction, scoring and storage into one
 * detection pipeline.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   WakeUpSource
 *     → FileTailer.poll()            (one per watched file)
 *     → FlowEventParser              (non-flow events ignored)
 *     → FeatureExtractor             (scorer's column order)
 *     → Scorer                       (negative ⇒ anomalous)
 *     → AnomalyStore.insert()
 *     → AnomalyStore.maybeFlush()    (after each anomaly)
 *   … and AnomalyStore.maybeFlush() once more per wake-up
 * </pre>
 *
 * <p>
 * A long backlog, such as the whole file re-read after a restart, is
 * persisted every flush interval while it is being read, not only once the
 * tailer reaches end of file.
 * </p>
 *
 * <h3>Schema</h3>
 * <p>
 * Construction fails with {@link SchemaMismatchException} if the configured
 * feature columns differ from the scorer's, or if the scorer declares a
 * column the extractor cannot compute.
 * </p>
 *
 * <h3>Threading</h3>
 * <p>
 * The wake-up source's thread is the only producer: it alone polls tailers
 * and inserts into the store. {@link #snapshot(int)}, {@link #totalProcessed()}
 * and {@link #getMetrics()} may be called from any thread.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * A malformed line, or an exception while extracting or scoring one event, is
 * logged and counted; the next line is processed normally.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionOrchestrator implements LineHandler, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionOrchestrator.class);

    private final Scorer scorer;
    private final FeatureExtractor extractor;
    private final FlowEventParser parser = new FlowEventParser();
    private final AnomalyStore store;
    private final Clock clock;
    private final DetectionMetrics metrics = new DetectionMetrics();
    private final List<FileTailer> tailers = new ArrayList<>();

    private WakeUpSource wakeUpSource;
    private boolean stopped;

    /**
     * @param scorer            loaded scoring backend
     * @param configuredColumns feature columns from configuration; empty means
     *                          "use the scorer's"
     * @param store             anomaly store this pipeline writes to
     * @param clock             time source for detection timestamps and
     *                          flush debouncing
     * @throws SchemaMismatchException if the columns disagree
     */
    public DetectionOrchestrator(Scorer scorer, List<String> configuredColumns,
            AnomalyStore store, Clock clock) {
        this.scorer = Objects.requireNonNull(scorer, "Scorer must not be null");
        this.store = Objects.requireNonNull(store, "AnomalyStore must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        Objects.requireNonNull(configuredColumns, "Configured columns must not be null");

        List<String> scorerColumns = scorer.featureColumns();
        if (!configuredColumns.isEmpty() && !configuredColumns.equals(scorerColumns)) {
            throw new SchemaMismatchException("Configured feature columns " + configuredColumns
                    + " do not match the model's columns " + scorerColumns);
        }
        List<String> unknown = FeatureColumns.unknown(scorerColumns);
        if (!unknown.isEmpty()) {
            throw new SchemaMismatchException("Model expects feature column(s) " + unknown
                    + " that cannot be extracted. Supported: " + FeatureColumns.ALL);
        }
        this.extractor = new FeatureExtractor(scorerColumns);
    }

    // ---------------------------------------------------------------
    // Wiring
    // ---------------------------------------------------------------

    /**
     * Tail {@code path} from its beginning.
     *
     * @param path file to watch
     * @return the created tailer
     */
    public FileTailer watch(Path path) {
        return watch(TailState.fresh(path));
    }

    /**
     * Tail a file from a seeded position.
     *
     * @param state initial tail state
     * @return the created tailer
     * @throws IllegalStateException if the pipeline was already started
     */
    public synchronized FileTailer watch(TailState state) {
        if (wakeUpSource != null) {
            throw new IllegalStateException("Cannot add a watched file after start()");
        }
        FileTailer tailer = new FileTailer(state, this);
        tailers.add(tailer);
        return tailer;
    }

    /**
     * Start processing; every wake-up runs {@link #runCycle()}.
     *
     * @param source wake-up source; closed again by {@link #stop()}
     * @throws IllegalStateException if already started or no file is watched
     */
    public synchronized void start(WakeUpSource source) {
        Objects.requireNonNull(source, "WakeUpSource must not be null");
        if (wakeUpSource != null) {
            throw new IllegalStateException("Pipeline already started");
        }
        if (tailers.isEmpty()) {
            throw new IllegalStateException("No file to watch; call watch() first");
        }
        wakeUpSource = source;
        LOG.info("Starting detection on {} file(s) with features {}",
                tailers.size(), extractor.columns());
        source.start(this::runCycle);
    }

    /**
     * Poll every tailer once, then give the store a chance to flush what the
     * last debounce window held back.
     */
    public void runCycle() {
        for (FileTailer tailer : tailers) {
            tailer.poll();
        }
        store.maybeFlush(clock.instant());
    }

    /**
     * Stop the wake-up source (letting an in-flight cycle finish), write any
     * unflushed anomalies, and release the store's flush thread.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        if (wakeUpSource != null) {
            wakeUpSource.close();
        }
        if (store.isDirty()) {
            store.flushNow(clock.instant());
        }
        store.close();
        LOG.info("Detection stopped: {}", metrics);
    }

    @Override
    public void close() {
        stop();
    }

    // ---------------------------------------------------------------
    // Per-line processing
    // ---------------------------------------------------------------

    @Override
    public void onLine(String line) {
        if (line == null || line.isBlank()) {
            return;
        }
        Optional<FlowRecord> flow;
        try {
            flow = parser.parse(line);
        } catch (EventParseException e) {
            metrics.incrementMalformedLines();
            LOG.debug("Skipping malformed line: {}", e.getMessage());
            return;
        }
        if (flow.isEmpty()) {
            metrics.incrementIgnoredEvents();
            return;
        }

        long startNanos = System.nanoTime();
        try {
            evaluate(flow.get());
            metrics.incrementEventsProcessed();
        } catch (RuntimeException e) {
            metrics.incrementScoringFailures();
            LOG.error("Error processing flow {}: {}", flow.get().getFlowId(), e.getMessage(), e);
        }
        metrics.recordLatency(System.nanoTime() - startNanos);
    }

    /**
     * Score one flow and store it if anomalous.
     *
     * @param flow the flow record
     * @return the stored anomaly, or empty if the flow scored as normal
     */
    public Optional<Anomaly> evaluate(FlowRecord flow) {
        Objects.requireNonNull(flow, "FlowRecord must not be null");
        FeatureVector features = extractor.extract(flow);
        double score = scorer.score(features);
        if (!(score < 0)) {
            return Optional.empty();
        }

        Instant detectedAt = clock.instant();
        Anomaly anomaly = Anomaly.builder()
                .timestamp(flow.getTimestamp() != null ? flow.getTimestamp() : detectedAt.toString())
                .flowId(flow.getFlowId())
                .srcIp(flow.getSrcIp())
                .dstIp(flow.getDstIp())
                .proto(flow.getProto())
                .packets(flow.totalPackets())
                .bytes(flow.totalBytes())
                .duration(flow.durationSeconds())
                .features(features.asMap())
                .score(score)
                .detectedAt(detectedAt)
                .build();
        store.insert(anomaly);
        store.maybeFlush(detectedAt);
        metrics.incrementAnomaliesDetected();
        LOG.info("Anomaly detected: flow={} src={} dst={} proto={} score={}",
                anomaly.getFlowId(), anomaly.getSrcIp(), anomaly.getDstIp(),
                anomaly.getProto(), score);
        return Optional.of(anomaly);
    }

    // ---------------------------------------------------------------
    // Read side (any thread)
    // ---------------------------------------------------------------

    /**
     * @param limit maximum entries to return
     * @return the most recent anomalies, oldest first
     */
    public List<Anomaly> snapshot(int limit) {
        return store.snapshot(limit);
    }

    /**
     * @return anomalies currently retained
     */
    public int anomalyCount() {
        return store.size();
    }

    /**
     * @return flow events scored since start
     */
    public long totalProcessed() {
        return metrics.getEventsProcessed();
    }

    public DetectionMetrics getMetrics() {
        return metrics;
    }

    public List<String> featureColumns() {
        return extractor.columns();
    }

    public synchronized List<FileTailer> getTailers() {
        return Collections.unmodifiableList(new ArrayList<>(tailers));
    }
}
