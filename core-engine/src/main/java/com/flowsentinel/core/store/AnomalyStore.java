package com.flowsentinel.core.store;

import com.flowsentinel.core.model.Anomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded, concurrently readable ring buffer of {@link Anomaly} records with
 * debounced durable flushing.
 *
 * <h3>Retention</h3>
 * <p>
 * Holds at most {@code capacity} entries in insertion order. Inserting into a
 * full store evicts the oldest entry.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * One producer inserts; any number of readers take snapshots. Both sides hold
 * a {@link ReentrantReadWriteLock} only for a single append or a single
 * copy-out, so neither can stall the other for longer than that.
 * </p>
 *
 * <h3>Flushing</h3>
 * <p>
 * {@link #maybeFlush(Instant)} hands a copy of the contents to the
 * {@link AnomalySink} on a flush executor when the store changed and at
 * least {@code flushInterval} has passed since the last successful flush
 * (or since creation). While a write is still running, further requests are
 * skipped and the store stays dirty, so slow storage delays persistence but
 * never ingestion. A failed write is logged; the next eligible request
 * writes the then-current contents.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyStore implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyStore.class);

    public static final int DEFAULT_CAPACITY = 1000;
    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(5);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final int capacity;
    private final Duration flushInterval;
    private final AnomalySink sink;
    private final Executor flushExecutor;
    private final ExecutorService ownedExecutor;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ArrayDeque<Anomaly> buffer;

    /** Bumped on every insert; compared with {@link #flushedVersion} to detect changes. */
    private volatile long version;
    private volatile long flushedVersion;
    private volatile Instant lastFlush;

    private final Object flushMonitor = new Object();
    private final AtomicBoolean flushInFlight = new AtomicBoolean(false);

    private final AtomicLong totalInserted = new AtomicLong();
    private final AtomicLong flushesWritten = new AtomicLong();
    private final AtomicLong flushesFailed = new AtomicLong();

    /**
     * Create a store that flushes on its own single background thread.
     *
     * @param capacity      maximum retained entries; must be &gt; 0
     * @param flushInterval minimum time between successful flushes
     * @param sink          durable destination
     * @param createdAt     start of the first debounce window
     */
    public AnomalyStore(int capacity, Duration flushInterval, AnomalySink sink, Instant createdAt) {
        this(capacity, flushInterval, sink, createdAt, newFlushExecutor(), true);
    }

    /**
     * Create a store that flushes on the given executor. The caller keeps
     * ownership of the executor.
     *
     * @param capacity      maximum retained entries; must be &gt; 0
     * @param flushInterval minimum time between successful flushes
     * @param sink          durable destination
     * @param createdAt     start of the first debounce window
     * @param flushExecutor executor that runs sink writes
     */
    public AnomalyStore(int capacity, Duration flushInterval, AnomalySink sink,
            Instant createdAt, Executor flushExecutor) {
        this(capacity, flushInterval, sink, createdAt, flushExecutor, false);
    }

    private AnomalyStore(int capacity, Duration flushInterval, AnomalySink sink,
            Instant createdAt, Executor flushExecutor, boolean ownsExecutor) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        Objects.requireNonNull(flushInterval, "flushInterval must not be null");
        if (flushInterval.isNegative()) {
            throw new IllegalArgumentException("flushInterval must not be negative, got: " + flushInterval);
        }
        this.capacity = capacity;
        this.flushInterval = flushInterval;
        this.sink = Objects.requireNonNull(sink, "AnomalySink must not be null");
        this.lastFlush = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.flushExecutor = Objects.requireNonNull(flushExecutor, "flushExecutor must not be null");
        this.ownedExecutor = ownsExecutor ? (ExecutorService) flushExecutor : null;
        this.buffer = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    // ---------------------------------------------------------------
    // Writes (producer)
    // ---------------------------------------------------------------

    /**
     * Append an anomaly, evicting the oldest entry if the store is full.
     *
     * @param anomaly the anomaly; must not be {@code null}
     */
    public void insert(Anomaly anomaly) {
        Objects.requireNonNull(anomaly, "Anomaly must not be null");
        lock.writeLock().lock();
        try {
            buffer.addLast(anomaly);
            if (buffer.size() > capacity) {
                buffer.pollFirst();
            }
            version++;
        } finally {
            lock.writeLock().unlock();
        }
        totalInserted.incrementAndGet();
    }

    // ---------------------------------------------------------------
    // Reads (any thread)
    // ---------------------------------------------------------------

    /**
     * Copy out the most recent entries.
     *
     * @param limit maximum number of entries; must be &gt;= 0
     * @return unmodifiable list of up to {@code limit} entries, oldest first
     */
    public List<Anomaly> snapshot(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
        }
        lock.readLock().lock();
        try {
            int n = Math.min(limit, buffer.size());
            List<Anomaly> recent = new ArrayList<>(n);
            Iterator<Anomaly> it = buffer.descendingIterator();
            while (recent.size() < n) {
                recent.add(it.next());
            }
            Collections.reverse(recent);
            return Collections.unmodifiableList(recent);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return unmodifiable copy of every retained entry, oldest first
     */
    public List<Anomaly> snapshot() {
        return snapshot(capacity);
    }

    public int size() {
        lock.readLock().lock();
        try {
            return buffer.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    /**
     * @return anomalies inserted since creation, including evicted ones
     */
    public long totalInserted() {
        return totalInserted.get();
    }

    public long flushesWritten() {
        return flushesWritten.get();
    }

    public long flushesFailed() {
        return flushesFailed.get();
    }

    /**
     * @return time of the last successful flush, or the creation time
     */
    public Instant lastFlush() {
        return lastFlush;
    }

    /**
     * @return {@code true} if entries were inserted since the last
     *         successful flush
     */
    public boolean isDirty() {
        return version != flushedVersion;
    }

    // ---------------------------------------------------------------
    // Flushing
    // ---------------------------------------------------------------

    /**
     * Flush if the store changed and the debounce interval has elapsed.
     *
     * @param now current time
     * @return {@code true} if a write was handed to the flush executor
     */
    public boolean maybeFlush(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        if (!isDirty()) {
            return false;
        }
        if (Duration.between(lastFlush, now).compareTo(flushInterval) < 0) {
            return false;
        }
        if (!flushInFlight.compareAndSet(false, true)) {
            LOG.debug("Previous flush still running – deferring");
            return false;
        }
        Capture capture = capture();
        try {
            flushExecutor.execute(() -> {
                try {
                    write(capture, now);
                } finally {
                    flushInFlight.set(false);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            flushInFlight.set(false);
            LOG.warn("Flush rejected by executor: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Write the current contents synchronously, ignoring the debounce
     * interval. Used for the final flush on shutdown.
     *
     * @param now current time
     * @return {@code true} if the write succeeded
     */
    public boolean flushNow(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        return write(capture(), now);
    }

    /**
     * Stop the store's own flush thread, letting a running write finish.
     * Does not flush; call {@link #flushNow(Instant)} first.
     */
    @Override
    public void close() {
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Flush thread did not stop within {} s", SHUTDOWN_TIMEOUT_SECONDS);
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Capture capture() {
        lock.readLock().lock();
        try {
            return new Capture(new ArrayList<>(buffer), version);
        } finally {
            lock.readLock().unlock();
        }
    }

    private boolean write(Capture capture, Instant now) {
        synchronized (flushMonitor) {
            if (capture.version < flushedVersion) {
                // a newer capture already reached the sink
                return true;
            }
            try {
                sink.write(capture.anomalies);
                flushedVersion = capture.version;
                lastFlush = now;
                flushesWritten.incrementAndGet();
                return true;
            } catch (IOException | RuntimeException e) {
                flushesFailed.incrementAndGet();
                LOG.error("Error writing {} anomalies: {}", capture.anomalies.size(), e.getMessage(), e);
                return false;
            }
        }
    }

    private static ExecutorService newFlushExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "anomaly-flush");
            t.setDaemon(true);
            return t;
        });
    }

    private static final class Capture {
        final List<Anomaly> anomalies;
        final long version;

        Capture(List<Anomaly> anomalies, long version) {
            this.anomalies = Collections.unmodifiableList(anomalies);
            this.version = version;
        }
    }
}
