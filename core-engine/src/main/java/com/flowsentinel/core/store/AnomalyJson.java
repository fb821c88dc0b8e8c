package com.flowsentinel.core.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson configuration for the anomalies file.
 *
 * <p>
 * Instants are written as ISO-8601 strings. Non-finite doubles (a
 * {@code client_server_ratio} of {@code +Infinity}) are written as the
 * strings {@code "Infinity"} / {@code "NaN"}, Jackson's default, so the file
 * stays valid JSON.
 * </p>
 */
public final class AnomalyJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private AnomalyJson() {
        // utility class — not instantiable
    }

    /**
     * @return the shared, thread-safe mapper
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
