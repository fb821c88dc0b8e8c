package com.flowsentinel.core.tail;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Incrementally reads lines appended to one file.
 *
 * <p>
 * Each {@link #poll()} reads from the stored offset to the current end of
 * file and hands every <em>complete</em> line to the {@link LineHandler}. A
 * trailing fragment without a newline is left unread and picked up by a
 * later poll once its terminator arrives. Under append-only growth every
 * line is therefore delivered exactly once, in file order.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <ul>
 * <li><b>Uninitialized</b>: the first poll creates the file (and its parent
 * directories) if it does not exist, then starts tracking.</li>
 * <li><b>Tracking</b>: if the file shrank below the offset or was replaced by
 * a different file, the offset resets to {@code 0} and the new content is
 * read from its start in the same poll.</li>
 * </ul>
 *
 * <h3>Failures</h3>
 * <p>
 * I/O errors are logged and reported as "no new data"; the next poll
 * retries. An exception thrown by the handler is logged and does not stop
 * delivery of the following lines.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * {@link #poll()} is synchronized; the tailer is meant to be driven by a
 * single producer thread.
 * </p>
 *
 * @since 1.0.0
 */
public class FileTailer {

    private static final Logger LOG = LoggerFactory.getLogger(FileTailer.class);

    private static final int BUFFER_SIZE = 64 * 1024;

    private final TailState state;
    private final LineHandler handler;
    private boolean tracking;

    private final AtomicLong linesDelivered = new AtomicLong();
    private final AtomicLong resets = new AtomicLong();

    /**
     * @param path    file to tail from its beginning
     * @param handler receiver of complete lines
     */
    public FileTailer(Path path, LineHandler handler) {
        this(TailState.fresh(path), handler);
    }

    /**
     * @param state   initial (possibly seeded) tail state
     * @param handler receiver of complete lines
     */
    public FileTailer(TailState state, LineHandler handler) {
        this.state = Objects.requireNonNull(state, "TailState must not be null");
        this.handler = Objects.requireNonNull(handler, "LineHandler must not be null");
    }

    /**
     * Deliver every complete line appended since the previous poll.
     *
     * @return number of lines handed to the handler
     */
    public synchronized int poll() {
        Path path = state.getPath();
        if (!tracking && !initialize(path)) {
            return 0;
        }

        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(path, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            LOG.debug("File {} is not present; waiting for it to reappear", path);
            return 0;
        } catch (IOException e) {
            LOG.warn("Cannot stat {}: {}", path, e.getMessage());
            return 0;
        }

        long size = attrs.size();
        Object key = attrs.fileKey();
        if (state.isTruncated(size)) {
            LOG.warn("File {} was truncated (size {} < offset {}), resetting position",
                    path, size, state.getOffset());
            state.reset();
            resets.incrementAndGet();
        } else if (state.isReplaced(key)) {
            LOG.warn("File {} was rotated (file identity changed), resetting position", path);
            state.reset();
            resets.incrementAndGet();
        }
        state.observe(size, key);

        if (size == state.getOffset()) {
            return 0;
        }
        try {
            int count = readCompleteLines(path, size);
            if (count > 0) {
                LOG.debug("Processed {} new line(s) from {}", count, path);
            }
            return count;
        } catch (IOException e) {
            LOG.warn("Error reading {} at offset {}: {}", path, state.getOffset(), e.getMessage());
            return 0;
        }
    }

    public TailState getState() {
        return state;
    }

    /**
     * @return total lines delivered since construction
     */
    public long getLinesDelivered() {
        return linesDelivered.get();
    }

    /**
     * @return how many times truncation or rotation reset the offset
     */
    public long getResets() {
        return resets.get();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private boolean initialize(Path path) {
        try {
            Path parent = path.getParent();
            if (parent != null && !Files.isDirectory(parent)) {
                LOG.warn("Directory {} does not exist, creating", parent);
                Files.createDirectories(parent);
            }
            if (!Files.exists(path)) {
                LOG.warn("File {} does not exist, creating empty file", path);
                Files.createFile(path);
            }
        } catch (IOException e) {
            LOG.warn("Cannot prepare {} for tailing: {}", path, e.getMessage());
            return false;
        }
        tracking = true;
        LOG.info("Tailing {} from offset {}", path, state.getOffset());
        return true;
    }

    /**
     * Read from the current offset up to {@code size}, delivering complete
     * lines. The offset advances after each delivered line, so an I/O error
     * part-way through never causes a line to be delivered twice.
     */
    private int readCompleteLines(Path path, long size) throws IOException {
        int delivered = 0;
        long position = state.getOffset();
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        ByteBuffer buffer = ByteBuffer.allocate(BUFFER_SIZE);

        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            channel.position(position);
            while (position < size) {
                buffer.clear();
                buffer.limit((int) Math.min(buffer.capacity(), size - position));
                int read = channel.read(buffer);
                if (read <= 0) {
                    break;
                }
                byte[] chunk = buffer.array();
                int lineStart = 0;
                for (int i = 0; i < read; i++) {
                    if (chunk[i] == '\n') {
                        pending.write(chunk, lineStart, i - lineStart);
                        lineStart = i + 1;
                        deliver(decode(pending));
                        pending.reset();
                        state.advanceTo(position + i + 1);
                        delivered++;
                    }
                }
                pending.write(chunk, lineStart, read - lineStart);
                position += read;
            }
        }
        return delivered;
    }

    private static String decode(ByteArrayOutputStream bytes) {
        String line = bytes.toString(StandardCharsets.UTF_8);
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private void deliver(String line) {
        linesDelivered.incrementAndGet();
        try {
            handler.onLine(line);
        } catch (RuntimeException e) {
            LOG.error("Line handler failed – continuing with next line", e);
        }
    }
}
