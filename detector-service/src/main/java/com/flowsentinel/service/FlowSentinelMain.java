package com.flowsentinel.service;

import com.flowsentinel.core.config.ConfigLoader;
import com.flowsentinel.core.config.DetectorConfig;
import com.flowsentinel.core.detection.DetectionOrchestrator;
import com.flowsentinel.core.scoring.IsolationForestScorer;
import com.flowsentinel.core.scoring.ModelLoadException;
import com.flowsentinel.core.scoring.SchemaMismatchException;
import com.flowsentinel.core.scoring.ScorerLoader;
import com.flowsentinel.core.store.AnomalyStore;
import com.flowsentinel.core.store.JsonFileAnomalySink;
import com.flowsentinel.core.tail.FileWatchWakeUpSource;
import com.flowsentinel.core.tail.PollingWakeUpSource;
import com.flowsentinel.core.tail.WakeUpSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Entry point of the Flow Sentinel detector.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   eve.json (tailed)
 *     → parse flow events
 *     → extract features
 *     → Isolation Forest score
 *     → AnomalyStore (bounded, debounced atomic flush)
 *     → anomalies.json / GET /api/anomalies
 * </pre>
 *
 * <p>
 * A model or schema problem at startup is fatal: it is logged and the
 * process exits with status {@code 1}.
 * </p>
 *
 * @since 1.0.0
 */
public final class FlowSentinelMain {

    private static final Logger LOG = LoggerFactory.getLogger(FlowSentinelMain.class);

    private FlowSentinelMain() {
        // entry-point class — not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        DetectorConfig config = ConfigLoader.load();

        // 2. Load the model; refuse to run on a bad artifact
        IsolationForestScorer scorer;
        try {
            scorer = ScorerLoader.load(config.getModelPath(), config.getFeatureColumnsPath());
        } catch (ModelLoadException | SchemaMismatchException e) {
            LOG.error("Error loading model: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        // 3. Assemble the pipeline
        Clock clock = Clock.systemUTC();
        AnomalyStore store = new AnomalyStore(config.getStoreCapacity(), config.getFlushInterval(),
                new JsonFileAnomalySink(config.getAnomaliesPath()), clock.instant());
        DetectionOrchestrator orchestrator;
        try {
            orchestrator = new DetectionOrchestrator(scorer, config.getFeatureColumns(), store, clock);
        } catch (SchemaMismatchException e) {
            LOG.error("Feature schema mismatch: {}", e.getMessage(), e);
            store.close();
            System.exit(1);
            return;
        }
        orchestrator.watch(config.getEvePath());

        // 4. Status endpoints
        StatusServer statusServer = new StatusServer(orchestrator);
        if (config.isStatusEnabled()) {
            statusServer.start(config.getStatusPort());
        }

        // 5. Shutdown hook, then run until terminated
        CountDownLatch terminated = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down");
            statusServer.stop();
            orchestrator.stop();
            terminated.countDown();
        }, "flow-sentinel-shutdown"));

        orchestrator.start(wakeUpSource(config));
        LOG.info("Monitoring {} for network flows; anomalies -> {}",
                config.getEvePath(), config.getAnomaliesPath());
        terminated.await();
    }

    static WakeUpSource wakeUpSource(DetectorConfig config) {
        return switch (config.getWakeUpMode()) {
            case POLL -> new PollingWakeUpSource(config.getPollInterval());
            case WATCH -> new FileWatchWakeUpSource(List.of(config.getEvePath()), config.getPollInterval());
        };
    }
}
