package com.recalc.core.service.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Change notification for the telluric resolution entry of an observation.
 */
public record TelluricTargetElement(
        String observationId,
        EditType editType,
        Optional<CalculationState> oldState,
        Optional<CalculationState> newState
) {

    public TelluricTargetElement {
        Objects.requireNonNull(observationId, "observationId");
        Objects.requireNonNull(editType, "editType");
        oldState = oldState == null ? Optional.empty() : oldState;
        newState = newState == null ? Optional.empty() : newState;
    }

    /**
     * True when this edit moved the entry into {@link CalculationState#PENDING}
     * from any other state, including from nothing.
     */
    public boolean isTransitionToPending() {
        return oldState.filter(s -> s == CalculationState.PENDING).isEmpty()
                && newState.filter(s -> s == CalculationState.PENDING).isPresent();
    }
}
