package com.flowsentinel.core.config;

import java.util.Locale;

/**
 * What triggers a read of the watched files.
 *
 * @since 1.0.0
 */
public enum WakeUpMode {

    /** Fixed-delay timer. */
    POLL,

    /** File-system change notifications, with the poll interval as idle timeout. */
    WATCH;

    /**
     * @param name {@code poll} or {@code watch}, case-insensitive
     * @return matching mode
     * @throws IllegalArgumentException for any other value
     */
    public static WakeUpMode fromName(String name) {
        if (name != null) {
            switch (name.trim().toLowerCase(Locale.ROOT)) {
                case "poll":
                    return POLL;
                case "watch":
                    return WATCH;
                default:
                    break;
            }
        }
        throw new IllegalArgumentException("Unknown wake-up mode: '" + name + "'. Supported: poll, watch");
    }
}
