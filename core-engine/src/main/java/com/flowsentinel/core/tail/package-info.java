/**
 * Incremental tailing of append-only log files.
 *
 * <p>
 * {@link com.flowsentinel.core.tail.FileTailer} owns the read position
 * ({@link com.flowsentinel.core.tail.TailState}) and survives truncation and
 * rotation. What triggers a read is left to a
 * {@link com.flowsentinel.core.tail.WakeUpSource}: a fixed-delay timer
 * ({@link com.flowsentinel.core.tail.PollingWakeUpSource}) or OS change
 * notifications ({@link com.flowsentinel.core.tail.FileWatchWakeUpSource}).
 * </p>
 *
 * @since 1.0.0
 */
package com.flowsentinel.core.tail;
