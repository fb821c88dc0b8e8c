package com.flowsentinel.core.tail;

/**
 * Receives each complete line a {@link FileTailer} reads, in file order.
 * The line excludes its terminator.
 */
@FunctionalInterface
public interface LineHandler {

    void onLine(String line);
}
