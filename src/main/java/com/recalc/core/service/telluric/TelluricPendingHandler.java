package com.recalc.core.service.telluric;

import com.recalc.core.service.dispatch.ElementHandler;
import com.recalc.core.service.model.TelluricTargetElement;
import com.recalc.core.service.session.PrivilegedTransactionRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Feeds telluric entries that just became pending straight to the polling
 * daemon's worker pool instead of waiting for the next tick.
 */
@Slf4j
@RequiredArgsConstructor
public class TelluricPendingHandler implements ElementHandler<TelluricTargetElement> {

    private final TelluricWorkSource workSource;
    private final TelluricPollingDaemon daemon;
    private final PrivilegedTransactionRunner transactions;

    @Override
    public boolean accepts(TelluricTargetElement element) {
        return element.isTransitionToPending();
    }

    @Override
    public void handle(TelluricTargetElement element) {
        daemon.claimAndSubmit(() -> transactions.run(() -> workSource.loadForObservation(element.observationId())))
                .ifPresentOrElse(
                        item -> log.debug("Queued telluric entry {}", item.observationId()),
                        () -> log.debug("Telluric entry for {} not queued; polling picks it up if still pending",
                                element.observationId())
                );
    }

    @Override
    public String describe(TelluricTargetElement element) {
        return "telluric entry " + element.observationId();
    }
}
