package com.recalc.core.service.telluric;

import com.recalc.core.service.model.TelluricBatchItem;

import java.util.List;
import java.util.Optional;

/**
 * Store of pending telluric resolutions.
 *
 * Implementations run inside the caller's transaction, except for
 * {@link #recheckForScienceObservation}. Items handed out by
 * {@link #fetchBatch} are marked as calculating so concurrent fetches do not
 * return them again.
 */
public interface TelluricWorkSource {

    /**
     * Claims up to {@code limit} pending or due-for-retry items.
     */
    List<TelluricBatchItem> fetchBatch(int limit);

    /**
     * Claims the pending item of one observation, if it is still pending.
     */
    Optional<TelluricBatchItem> loadForObservation(String observationId);

    /**
     * Returns items left calculating by an interrupted run to pending.
     *
     * @return number of items reset
     */
    int resetInterrupted();

    /**
     * Rechecks the resolved telluric targets attached to a science observation
     * after its calculation completed. Manages its own transactions.
     */
    void recheckForScienceObservation(String observationId);
}
