package com.recalc.core.service.telluric;

import com.recalc.core.service.dispatch.ElementHandler;
import com.recalc.core.service.dispatch.RecalcException;
import com.recalc.core.service.dispatch.RecalculationFailedException;
import com.recalc.core.service.model.CalculationState;
import com.recalc.core.service.model.ObscalcElement;
import com.recalc.core.service.recalc.RecalculationService;
import com.recalc.core.service.session.PrivilegedTransactionRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Rechecks resolved telluric targets when the calculation of a science
 * observation completes. Calibration observations are skipped.
 */
@Slf4j
@RequiredArgsConstructor
public class TelluricRecheckHandler implements ElementHandler<ObscalcElement> {

    private final TelluricWorkSource workSource;
    private final RecalculationService recalculationService;
    private final PrivilegedTransactionRunner transactions;

    /**
     * Any create or update that leaves the observation ready qualifies, whatever the previous state.
     */
    static boolean isReady(ObscalcElement element) {
        return element.editType().isCreateOrUpdate()
                && element.newState().filter(s -> s == CalculationState.READY).isPresent();
    }

    @Override
    public boolean accepts(ObscalcElement element) {
        if (!isReady(element)) {
            return false;
        }
        return !transactions.run(() -> recalculationService.isCalibration(element.observationId()));
    }

    @Override
    public void handle(ObscalcElement element) {
        log.info("Science observation {} changed, rechecking telluric targets", element.observationId());
        try {
            transactions.runNonTransactionally(session -> {
                workSource.recheckForScienceObservation(element.observationId());
                return null;
            });
        } catch (RecalcException e) {
            throw e;
        } catch (Exception e) {
            throw new RecalculationFailedException(
                    "Failed to recheck telluric targets: " + e.getMessage(),
                    element.observationId(),
                    e
            );
        }
    }

    @Override
    public String describe(ObscalcElement element) {
        return "science observation " + element.observationId();
    }
}
