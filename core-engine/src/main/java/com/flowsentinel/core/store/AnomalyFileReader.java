package com.flowsentinel.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flowsentinel.core.model.Anomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Consumer-side reader for the anomalies file.
 *
 * <p>
 * Never fails: a file that is missing, empty, or not yet parseable reads as
 * zero anomalies.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyFileReader {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyFileReader.class);

    private static final TypeReference<List<Anomaly>> ANOMALY_LIST = new TypeReference<>() {
    };

    private AnomalyFileReader() {
        // utility class — not instantiable
    }

    /**
     * @param path anomalies file; must not be {@code null}
     * @return unmodifiable list of persisted anomalies, oldest first
     */
    public static List<Anomaly> read(Path path) {
        Objects.requireNonNull(path, "Path must not be null");
        try {
            byte[] content = Files.readAllBytes(path);
            if (content.length == 0) {
                return Collections.emptyList();
            }
            List<Anomaly> anomalies = AnomalyJson.mapper().readValue(content, ANOMALY_LIST);
            return anomalies == null ? Collections.emptyList() : Collections.unmodifiableList(anomalies);
        } catch (NoSuchFileException e) {
            LOG.debug("Anomalies file {} does not exist yet", path);
            return Collections.emptyList();
        } catch (IOException e) {
            LOG.warn("Cannot read anomalies from {}: {}", path, e.getMessage());
            return Collections.emptyList();
        }
    }
}
