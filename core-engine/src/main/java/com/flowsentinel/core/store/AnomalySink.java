package com.flowsentinel.core.store;

import com.flowsentinel.core.model.Anomaly;

import java.io.IOException;
import java.util.List;

/**
 * Durable destination for the full contents of an {@link AnomalyStore}.
 *
 * <p>
 * Every call replaces what the previous call wrote; a sink never appends.
 * </p>
 */
@FunctionalInterface
public interface AnomalySink {

    /**
     * @param anomalies current store contents, oldest first
     * @throws IOException if the write fails; the previous contents must
     *                     then remain intact
     */
    void write(List<Anomaly> anomalies) throws IOException;
}
