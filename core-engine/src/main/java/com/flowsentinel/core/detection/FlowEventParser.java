package com.flowsentinel.core.detection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowsentinel.core.model.FlowRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * Parses one line of sensor output (newline-delimited JSON) into a
 * {@link FlowRecord}.
 *
 * <p>
 * Only events whose {@code event_type} is {@code "flow"} produce a record;
 * any other well-formed event yields {@link Optional#empty()}. Missing or
 * non-numeric counters read as {@code 0}; numbers sent as strings are
 * accepted. A missing or non-numeric {@code start}/{@code end} is
 * {@link FlowRecord#NOT_REPORTED}.
 * </p>
 *
 * <h3>Fields</h3>
 * <ul>
 * <li>top level: {@code timestamp}, {@code src_ip}, {@code dst_ip}</li>
 * <li>{@code flow} object: {@code pkts_toserver}, {@code pkts_toclient},
 * {@code bytes_toserver}, {@code bytes_toclient}, {@code start},
 * {@code end}, {@code proto}, {@code id}</li>
 * </ul>
 * <p>
 * {@code proto} and the flow id fall back to the top-level {@code proto} and
 * {@code flow_id} when the nested object lacks them.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Stateless; safe to share.
 * </p>
 *
 * @since 1.0.0
 */
public class FlowEventParser {

    public static final String FLOW_EVENT_TYPE = "flow";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

    /**
     * @param line one line of sensor output, without its terminator
     * @return the flow record, or empty for a non-flow event
     * @throws EventParseException if the line is not a JSON object
     */
    public Optional<FlowRecord> parse(String line) throws EventParseException {
        Objects.requireNonNull(line, "Line must not be null");
        JsonNode root;
        try {
            root = MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            throw new EventParseException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new EventParseException("Expected a JSON object");
        }

        JsonNode eventType = root.get("event_type");
        if (eventType == null || !FLOW_EVENT_TYPE.equals(eventType.asText())) {
            return Optional.empty();
        }

        JsonNode flow = root.path("flow");
        return Optional.of(FlowRecord.builder()
                .timestamp(text(root, "timestamp"))
                .srcIp(text(root, "src_ip"))
                .dstIp(text(root, "dst_ip"))
                .flowId(firstText(flow, "id", root, "flow_id"))
                .proto(firstText(flow, "proto", root, "proto"))
                .pktsToServer(number(flow, "pkts_toserver"))
                .pktsToClient(number(flow, "pkts_toclient"))
                .bytesToServer(number(flow, "bytes_toserver"))
                .bytesToClient(number(flow, "bytes_toclient"))
                .start(timestamp(flow, "start"))
                .end(timestamp(flow, "end"))
                .build());
    }

    // ---------------------------------------------------------------
    // Field helpers
    // ---------------------------------------------------------------

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static String firstText(JsonNode primary, String primaryField,
            JsonNode fallback, String fallbackField) {
        String value = text(primary, primaryField);
        return value != null ? value : text(fallback, fallbackField);
    }

    private static long number(JsonNode node, String field) {
        return numberOr(node, field, 0);
    }

    private static long timestamp(JsonNode node, String field) {
        return numberOr(node, field, FlowRecord.NOT_REPORTED);
    }

    private static long numberOr(JsonNode node, String field, long fallback) {
        JsonNode value = node.get(field);
        if (value == null) {
            return fallback;
        }
        if (value.isNumber()) {
            if (value.canConvertToLong()) {
                return value.asLong();
            }
            // beyond the long range: saturate instead of keeping the low bits
            return value.asDouble() > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
        if (value.isTextual()) {
            try {
                return Long.parseLong(value.asText().trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
