package com.recalc.core.service.dispatch;

import com.recalc.core.service.model.CalibrationTimeElement;
import com.recalc.core.service.recalc.RecalculationService;
import com.recalc.core.service.session.PrivilegedTransactionRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Recalculates the target of a calibration observation whenever its
 * calibration time changes. Every element is acted on.
 */
@Slf4j
@RequiredArgsConstructor
public class CalibrationTimeHandler implements ElementHandler<CalibrationTimeElement> {

    private final RecalculationService recalculationService;
    private final PrivilegedTransactionRunner transactions;

    @Override
    public boolean accepts(CalibrationTimeElement element) {
        return true;
    }

    @Override
    public void handle(CalibrationTimeElement element) {
        log.debug("Recalculating calibration target for {}", element.observationId());
        try {
            transactions.runVoid(() -> {
                recalculationService.recalculateCalibrationTarget(element.programId(), element.observationId());
                return null;
            });
        } catch (RecalcException e) {
            throw e;
        } catch (Exception e) {
            throw new RecalculationFailedException(
                    "Failed to recalculate calibration target: " + e.getMessage(),
                    element.observationId(),
                    e
            );
        }
    }

    @Override
    public String describe(CalibrationTimeElement element) {
        return "calibration " + element.observationId() + " (program " + element.programId() + ")";
    }
}
