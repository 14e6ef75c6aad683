package com.recalc.core.service.model;

/**
 * Lifecycle of a computed artifact attached to an observation.
 */
public enum CalculationState {
    PENDING,
    RETRY,
    CALCULATING,
    READY
}
