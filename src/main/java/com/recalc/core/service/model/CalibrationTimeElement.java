package com.recalc.core.service.model;

import java.util.Objects;

/**
 * Notification that the calibration time of an observation changed and its
 * calibration target must be recomputed. Every element is acted on.
 */
public record CalibrationTimeElement(String programId, String observationId) {

    public CalibrationTimeElement {
        Objects.requireNonNull(programId, "programId");
        Objects.requireNonNull(observationId, "observationId");
    }
}
