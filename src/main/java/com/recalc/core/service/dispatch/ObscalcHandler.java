package com.recalc.core.service.dispatch;

import com.recalc.core.service.model.ObscalcElement;
import com.recalc.core.service.recalc.RecalculationService;
import com.recalc.core.service.session.PrivilegedTransactionRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Recalculates a program's calibrations when one of its science observations
 * becomes ready.
 *
 * Recalculations are anchored to midnight UTC of the processing day, so every
 * trigger on the same day uses the same reference instant.
 */
@Slf4j
@RequiredArgsConstructor
public class ObscalcHandler implements ElementHandler<ObscalcElement> {

    private final RecalculationService recalculationService;
    private final PrivilegedTransactionRunner transactions;
    private final Clock clock;

    @Override
    public boolean accepts(ObscalcElement element) {
        if (!ObscalcGuard.isReadyTransition(element)) {
            return false;
        }
        boolean calibration = transactions.run(() -> recalculationService.isCalibration(element.observationId()));
        return ObscalcGuard.shouldRecalculate(element, calibration);
    }

    @Override
    public void handle(ObscalcElement element) {
        Instant asOf = midnightUtc(clock);
        log.info("Recalculating calibrations for program {} as of {} (triggered by {})",
                element.programId(), asOf, element.observationId());
        try {
            transactions.runVoid(() -> {
                recalculationService.recalculateCalibrations(element.programId(), asOf);
                return null;
            });
        } catch (RecalcException e) {
            throw e;
        } catch (Exception e) {
            throw new RecalculationFailedException(
                    "Failed to recalculate calibrations for program " + element.programId() + ": " + e.getMessage(),
                    element.observationId(),
                    e
            );
        }
    }

    @Override
    public String describe(ObscalcElement element) {
        return "observation " + element.observationId() + " (program " + element.programId() + ", "
                + element.editType() + " " + element.oldState().orElse(null) + " -> " + element.newState().orElse(null) + ")";
    }

    /**
     * Start of the current UTC day according to the given clock.
     */
    public static Instant midnightUtc(Clock clock) {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC)).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
