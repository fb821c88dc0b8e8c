package com.flowsentinel.core.store;

import com.flowsentinel.core.model.Anomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

/**
 * Writes anomalies as a JSON array to a file, replacing it atomically.
 *
 * <p>
 * The array is written and synced to {@code <file>.tmp} in the same
 * directory, then moved over the target with {@code ATOMIC_MOVE}. A reader
 * opening the target therefore sees either the previous complete array or
 * the new one, never a partial write.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonFileAnomalySink implements AnomalySink {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileAnomalySink.class);

    private final Path target;
    private final Path temp;

    /**
     * @param target file that receives the anomaly array
     */
    public JsonFileAnomalySink(Path target) {
        this.target = Objects.requireNonNull(target, "Target path must not be null").toAbsolutePath();
        this.temp = this.target.resolveSibling(this.target.getFileName() + ".tmp");
    }

    @Override
    public void write(List<Anomaly> anomalies) throws IOException {
        Objects.requireNonNull(anomalies, "Anomalies must not be null");
        byte[] json = AnomalyJson.mapper().writeValueAsBytes(anomalies);

        Files.createDirectories(target.getParent());
        try {
            try (FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(json);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            moveIntoPlace();
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        LOG.debug("Wrote {} anomalies to {}", anomalies.size(), target);
    }

    public Path getTarget() {
        return target;
    }

    private void moveIntoPlace() throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.warn("Atomic move not supported for {}; falling back to plain replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
