package com.recalc.core.service.telluric;

import java.time.Duration;

/**
 * Tuning for {@link TelluricPollingDaemon}.
 *
 * @param connectionsLimit    maximum items processed concurrently
 * @param pollPeriod          time between batch fetches
 * @param batchSize           maximum items per fetch
 * @param queueCapacity       items that may wait for a worker on top of those in flight
 * @param startupDrainEnabled whether pending items are drained before polling starts
 * @param shutdownTimeout     how long close waits for items in flight
 */
public record TelluricSettings(
        int connectionsLimit,
        Duration pollPeriod,
        int batchSize,
        int queueCapacity,
        boolean startupDrainEnabled,
        Duration shutdownTimeout
) {

    public TelluricSettings {
        if (connectionsLimit <= 0) {
            throw new IllegalArgumentException("connectionsLimit must be positive: " + connectionsLimit);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (queueCapacity < 0) {
            throw new IllegalArgumentException("queueCapacity must not be negative: " + queueCapacity);
        }
        if (pollPeriod == null || pollPeriod.isZero() || pollPeriod.isNegative()) {
            throw new IllegalArgumentException("pollPeriod must be positive: " + pollPeriod);
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must not be negative: " + shutdownTimeout);
        }
    }

    /**
     * Items the worker pool holds at most, running and waiting.
     */
    public int workerSlots() {
        return connectionsLimit + queueCapacity;
    }
}
