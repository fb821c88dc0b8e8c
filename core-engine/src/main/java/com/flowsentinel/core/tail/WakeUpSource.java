package com.flowsentinel.core.tail;

/**
 * Signals that watched files may have new bytes.
 *
 * <p>
 * The tailer does not care what produces the signal: a timer, an OS change
 * notification, or a test calling the callback by hand. Wake-ups are
 * delivered on a single thread owned by the source, one at a time.
 * </p>
 */
public interface WakeUpSource extends AutoCloseable {

    /**
     * Begin delivering wake-ups. The first one fires immediately.
     *
     * @param onWakeUp callback run on every wake-up
     * @throws IllegalStateException if the source was already started
     */
    void start(Runnable onWakeUp);

    /**
     * Stop delivering wake-ups. Blocks until a wake-up in progress has
     * returned, so no callback runs after this method completes.
     */
    @Override
    void close();
}
