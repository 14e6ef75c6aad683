package com.recalc.core.service.recalc;

import java.time.Instant;

/**
 * Calibration recalculation operations of the backing store.
 *
 * Implementations participate in the transaction opened by the caller on the
 * current thread; they decide what a recalculation produces.
 */
public interface RecalculationService {

    /**
     * Whether the observation is a generated calibration rather than a science observation.
     */
    boolean isCalibration(String observationId);

    /**
     * Recomputes the calibrations of a program as of the given reference instant.
     */
    void recalculateCalibrations(String programId, Instant asOf);

    /**
     * Recomputes the target of one calibration observation.
     */
    void recalculateCalibrationTarget(String programId, String observationId);
}
