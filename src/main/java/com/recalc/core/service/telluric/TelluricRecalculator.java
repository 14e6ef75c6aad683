package com.recalc.core.service.telluric;

import com.recalc.core.service.model.TelluricBatchItem;

/**
 * Resolves the telluric target of one pending item and records the outcome.
 */
@FunctionalInterface
public interface TelluricRecalculator {

    void process(TelluricBatchItem item);
}
