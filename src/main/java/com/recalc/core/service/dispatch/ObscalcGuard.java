package com.recalc.core.service.dispatch;

import com.recalc.core.service.model.CalculationState;
import com.recalc.core.service.model.ObscalcElement;

/**
 * Decides whether an observation calculation change warrants recalculating
 * the program's calibrations.
 *
 * Only a genuine transition into {@code READY}, produced by a creation or an
 * update, of a non-calibration observation qualifies. Calibration observations
 * are excluded because they are themselves produced by the recalculation.
 */
public final class ObscalcGuard {

    private ObscalcGuard() {
    }

    /**
     * The part of the guard that depends on the element alone.
     */
    public static boolean isReadyTransition(ObscalcElement element) {
        return element.newState().filter(s -> s == CalculationState.READY).isPresent()
                && !element.oldState().equals(element.newState())
                && element.editType().isCreateOrUpdate();
    }

    /**
     * The full guard.
     *
     * @param element       the received element
     * @param isCalibration whether the element's observation is a calibration
     */
    public static boolean shouldRecalculate(ObscalcElement element, boolean isCalibration) {
        return !isCalibration && isReadyTransition(element);
    }
}
