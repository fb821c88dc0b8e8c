package com.flowsentinel.core.tail;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Timer-driven {@link WakeUpSource}: fires at a fixed delay between the end
 * of one wake-up and the start of the next.
 *
 * @since 1.0.0
 */
public class PollingWakeUpSource implements WakeUpSource {

    private static final Logger LOG = LoggerFactory.getLogger(PollingWakeUpSource.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param interval delay between wake-ups; must be positive
     */
    public PollingWakeUpSource(Duration interval) {
        Objects.requireNonNull(interval, "Interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be > 0, got: " + interval);
        }
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tail-poller");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void start(Runnable onWakeUp) {
        Objects.requireNonNull(onWakeUp, "Wake-up callback must not be null");
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Polling source already started");
        }
        // an exception escaping a periodic task would cancel all later runs
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                onWakeUp.run();
            } catch (RuntimeException e) {
                LOG.error("Wake-up callback failed – will retry on next poll", e);
            }
        }, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Polling for new data every {} ms", interval.toMillis());
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Poller did not stop within {} s, interrupting", SHUTDOWN_TIMEOUT_SECONDS);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Polling stopped");
    }
}
