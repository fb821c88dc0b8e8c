package com.flowsentinel.core.tail;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Read position and identity of one watched file.
 *
 * <p>
 * Only the owning {@link FileTailer} mutates a state; the getters may be read
 * from any thread for monitoring.
 * </p>
 *
 * <h3>Invariant</h3>
 * <p>
 * {@code offset <= lastObservedSize} once the file has been observed. A file
 * whose current size is below the offset, or whose identity changed, is
 * treated as truncated or rotated and the offset returns to {@code 0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TailState {

    private final Path path;
    private volatile long offset;
    private volatile long lastObservedSize = -1;
    private volatile Object fileKey;

    private TailState(Path path, long offset) {
        this.path = Objects.requireNonNull(path, "Path must not be null").toAbsolutePath();
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must be >= 0, got: " + offset);
        }
        this.offset = offset;
    }

    /**
     * @param path watched file
     * @return a state that reads the file from its beginning
     */
    public static TailState fresh(Path path) {
        return new TailState(path, 0);
    }

    /**
     * Seed a state with a previously persisted offset. If the file has
     * meanwhile shrunk below it, the first poll treats it as truncated.
     *
     * @param path   watched file
     * @param offset byte offset of the first unread line
     * @return a seeded state
     */
    public static TailState startingAt(Path path, long offset) {
        return new TailState(path, offset);
    }

    public Path getPath() {
        return path;
    }

    /**
     * @return byte offset just past the last complete line consumed
     */
    public long getOffset() {
        return offset;
    }

    /**
     * @return file size at the last poll, or {@code -1} before the first
     */
    public long getLastObservedSize() {
        return lastObservedSize;
    }

    // ---------------------------------------------------------------
    // Mutation (FileTailer only)
    // ---------------------------------------------------------------

    boolean isTruncated(long currentSize) {
        return currentSize < offset;
    }

    /**
     * A file key that changed between polls means a different file now lives
     * at the path. Platforms without file keys report {@code null} and fall
     * back to size-based detection only.
     */
    boolean isReplaced(Object currentKey) {
        return fileKey != null && currentKey != null && !fileKey.equals(currentKey);
    }

    void observe(long size, Object key) {
        this.lastObservedSize = size;
        this.fileKey = key;
    }

    void advanceTo(long newOffset) {
        this.offset = newOffset;
    }

    void reset() {
        this.offset = 0;
    }

    @Override
    public String toString() {
        return "TailState{" +
                "path=" + path +
                ", offset=" + offset +
                ", lastObservedSize=" + lastObservedSize +
                '}';
    }
}
