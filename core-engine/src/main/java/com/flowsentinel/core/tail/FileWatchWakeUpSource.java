package com.flowsentinel.core.tail;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link WakeUpSource} driven by file-system change notifications.
 *
 * <p>
 * Watches the parent directory of every given file and wakes up when one of
 * those files is created, modified or deleted (rotation shows up as a
 * delete followed by a create). If no notification arrives within
 * {@code maxIdle} the source wakes up anyway, so a dropped notification
 * delays data by at most that long.
 * </p>
 *
 * @since 1.0.0
 */
public class FileWatchWakeUpSource implements WakeUpSource {

    private static final Logger LOG = LoggerFactory.getLogger(FileWatchWakeUpSource.class);

    private static final long JOIN_TIMEOUT_MILLIS = 30_000;

    private final Set<Path> files = new LinkedHashSet<>();
    private final Duration maxIdle;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private WatchService watchService;
    private Thread worker;

    /**
     * @param files   files whose changes should trigger a wake-up
     * @param maxIdle longest wait without a wake-up; must be positive
     */
    public FileWatchWakeUpSource(List<Path> files, Duration maxIdle) {
        Objects.requireNonNull(files, "Files must not be null");
        Objects.requireNonNull(maxIdle, "maxIdle must not be null");
        if (files.isEmpty()) {
            throw new IllegalArgumentException("At least one file must be watched");
        }
        if (maxIdle.isZero() || maxIdle.isNegative()) {
            throw new IllegalArgumentException("maxIdle must be > 0, got: " + maxIdle);
        }
        for (Path file : files) {
            this.files.add(file.toAbsolutePath());
        }
        this.maxIdle = maxIdle;
    }

    @Override
    public synchronized void start(Runnable onWakeUp) {
        Objects.requireNonNull(onWakeUp, "Wake-up callback must not be null");
        if (worker != null) {
            throw new IllegalStateException("File watch source already started");
        }
        try {
            watchService = FileSystems.getDefault().newWatchService();
            Set<Path> registered = new HashSet<>();
            for (Path file : files) {
                Path dir = file.getParent();
                if (registered.add(dir)) {
                    Files.createDirectories(dir);
                    dir.register(watchService,
                            StandardWatchEventKinds.ENTRY_CREATE,
                            StandardWatchEventKinds.ENTRY_MODIFY,
                            StandardWatchEventKinds.ENTRY_DELETE);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to register file watch for " + files, e);
        }

        running.set(true);
        worker = new Thread(() -> loop(onWakeUp), "tail-watcher");
        worker.setDaemon(true);
        worker.start();
        LOG.info("Watching {} for changes (max idle {} ms)", files, maxIdle.toMillis());
    }

    @Override
    public void close() {
        Thread t;
        synchronized (this) {
            if (!running.compareAndSet(true, false)) {
                return;
            }
            t = worker;
            try {
                watchService.close();
            } catch (IOException e) {
                LOG.warn("Error closing watch service: {}", e.getMessage());
            }
        }
        try {
            t.join(JOIN_TIMEOUT_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("File watch stopped");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void loop(Runnable onWakeUp) {
        wake(onWakeUp);
        try {
            while (running.get()) {
                WatchKey key = watchService.poll(maxIdle.toMillis(), TimeUnit.MILLISECONDS);
                if (key == null) {
                    wake(onWakeUp);
                    continue;
                }
                boolean relevant = false;
                Path dir = (Path) key.watchable();
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                        relevant = true;
                    } else if (files.contains(dir.resolve((Path) event.context()).toAbsolutePath())) {
                        relevant = true;
                    }
                }
                key.reset();
                if (relevant && running.get()) {
                    wake(onWakeUp);
                }
            }
        } catch (ClosedWatchServiceException e) {
            LOG.debug("Watch service closed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void wake(Runnable onWakeUp) {
        try {
            onWakeUp.run();
        } catch (RuntimeException e) {
            LOG.error("Wake-up callback failed – will retry on next change", e);
        }
    }
}
