package com.recalc.core.service.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A pending telluric resolution handed out by the work source.
 *
 * @param observationId    the observation needing resolution
 * @param programId        owning program
 * @param lastInvalidation when the entry was last marked pending
 * @param failureCount     number of previous failed attempts
 */
public record TelluricBatchItem(
        String observationId,
        String programId,
        Instant lastInvalidation,
        int failureCount
) {

    public TelluricBatchItem {
        Objects.requireNonNull(observationId, "observationId");
    }

    public TelluricBatchItem(String observationId, String programId) {
        this(observationId, programId, Instant.EPOCH, 0);
    }
}
