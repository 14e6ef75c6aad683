package com.recalc.core.service.topic;

import java.util.Optional;

/**
 * One subscriber's ordered, finite-backlog view of a {@link Topic}.
 *
 * Elements arrive in publish order. Only elements published after the
 * subscription was created are seen.
 *
 * @param <T> element type
 */
public interface Subscription<T> extends AutoCloseable {

    /**
     * Waits up to the given timeout for the next element.
     *
     * @param timeoutMs timeout in milliseconds
     * @return the next element, or empty on timeout, interruption or after close
     */
    Optional<T> next(long timeoutMs);

    /**
     * Gets the number of elements waiting to be consumed.
     */
    int backlog();

    /**
     * Gets the maximum backlog before the oldest element is dropped.
     */
    int getCapacity();

    /**
     * Gets how many elements were dropped because this subscriber fell behind.
     */
    long getDroppedCount();

    /**
     * Backlog as a percentage of capacity (0-100).
     */
    default int getUtilizationPercent() {
        int capacity = getCapacity();
        return capacity > 0 ? (backlog() * 100) / capacity : 0;
    }

    boolean isClosed();

    /**
     * Detaches from the topic and discards the backlog.
     */
    @Override
    void close();
}
