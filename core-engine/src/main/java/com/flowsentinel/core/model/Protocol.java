package com.flowsentinel.core.model;

import java.util.Locale;

/**
 * Transport protocol of a flow, reduced to the small set the scoring model
 * distinguishes.
 *
 * <p>
 * Each constant carries the numeric code used as the {@code proto} feature:
 * the IANA protocol number for TCP, UDP and ICMP, and {@code 0} for anything
 * else.
 * </p>
 *
 * @since 1.0.0
 */
public enum Protocol {

    TCP(6),
    UDP(17),
    ICMP(1),
    OTHER(0);

    private final int code;

    Protocol(int code) {
        this.code = code;
    }

    /**
     * @return numeric feature code for this protocol
     */
    public int code() {
        return code;
    }

    /**
     * Map a sensor protocol name to a constant. Matching ignores case;
     * {@code null}, blank and unrecognised names map to {@link #OTHER}.
     *
     * @param name protocol name as reported by the sensor
     * @return matching constant, never {@code null}
     */
    public static Protocol fromName(String name) {
        if (name == null || name.isBlank()) {
            return OTHER;
        }
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "TCP" -> TCP;
            case "UDP" -> UDP;
            case "ICMP" -> ICMP;
            default -> OTHER;
        };
    }
}
