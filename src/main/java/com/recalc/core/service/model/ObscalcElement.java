package com.recalc.core.service.model;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Change notification emitted when the calculation state of an observation changes.
 *
 * Created by the change feed at commit time of the underlying mutation and
 * immutable once published. {@code oldState} and {@code newState} are empty when
 * the row did not exist before or after the edit.
 *
 * @param observationId the observation whose calculation changed
 * @param programId     the program that owns the observation
 * @param editType      the kind of mutation
 * @param oldState      calculation state before the edit
 * @param newState      calculation state after the edit
 * @param users         users whose action produced the change; informational only
 */
public record ObscalcElement(
        String observationId,
        String programId,
        EditType editType,
        Optional<CalculationState> oldState,
        Optional<CalculationState> newState,
        Set<String> users
) {

    public ObscalcElement {
        Objects.requireNonNull(observationId, "observationId");
        Objects.requireNonNull(programId, "programId");
        Objects.requireNonNull(editType, "editType");
        oldState = oldState == null ? Optional.empty() : oldState;
        newState = newState == null ? Optional.empty() : newState;
        users = users == null ? Set.of() : Set.copyOf(users);
    }

    public static ObscalcElement of(String observationId, String programId, EditType editType,
                                    CalculationState oldState, CalculationState newState) {
        return new ObscalcElement(observationId, programId, editType,
                Optional.ofNullable(oldState), Optional.ofNullable(newState), Set.of());
    }
}
