package dev.lzrvc.errortracker;

import java.time.Duration;

/**
 * Delivery sink for finished, sanitized events.
 *
 * <p>Implementations must never throw from {@link #send(Event)}: delivery failures are reported
 * through {@link Diagnostics} and otherwise ignored. Delivery is best effort and at most once.
 */
public interface Transport {

    void send(Event event);

    /**
     * Wait for queued deliveries to finish.
     *
     * @return {@code true} if nothing is left pending
     */
    default boolean flush(Duration timeout) {
        return true;
    }

    /** Release resources. Further sends may be ignored. */
    default void close() {
    }
}
