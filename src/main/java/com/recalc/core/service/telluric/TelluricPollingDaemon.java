package com.recalc.core.service.telluric;

import com.recalc.core.service.config.MetricsConfig;
import com.recalc.core.service.dispatch.RecalcException;
import com.recalc.core.service.model.TelluricBatchItem;
import com.recalc.core.service.session.PrivilegedTransactionRunner;
import com.recalc.core.service.supervisor.CancellationToken;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Fixed-period batch processor for pending telluric resolutions.
 *
 * Every {@code pollPeriod} it claims up to {@code batchSize} items and
 * processes them on a worker pool of {@code connectionsLimit} threads, each
 * item in its own privileged transaction. Batches never overlap: ticks that
 * fall due while a batch is still running are skipped and logged.
 *
 * The pool holds at most {@link TelluricSettings#workerSlots()} items. Batch
 * items wait for a free slot; items pushed from the event path are only
 * claimed when a slot is free, otherwise they are left for the next poll.
 *
 * Before the first tick it resets interrupted items and, when enabled,
 * drains the pending backlog batch by batch.
 */
@Slf4j
public class TelluricPollingDaemon implements AutoCloseable {

    private final TelluricWorkSource workSource;
    private final TelluricRecalculator recalculator;
    private final PrivilegedTransactionRunner transactions;
    private final TelluricSettings settings;
    private final MetricsConfig metrics;
    private final ExecutorService workers;
    private final Semaphore slots;

    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicLong batchesRun = new AtomicLong();
    private final AtomicLong ticksMissed = new AtomicLong();

    public TelluricPollingDaemon(TelluricWorkSource workSource, TelluricRecalculator recalculator,
                                 PrivilegedTransactionRunner transactions, TelluricSettings settings,
                                 MetricsConfig metrics, ExecutorService workers) {
        this.workSource = workSource;
        this.recalculator = recalculator;
        this.transactions = transactions;
        this.settings = settings;
        this.metrics = metrics;
        this.workers = workers;
        this.slots = new Semaphore(settings.workerSlots());
    }

    // ==================== Main Loop ====================

    /**
     * Runs the startup phase, then polls until cancelled.
     */
    public void run(CancellationToken token) {
        startup(token);
        log.info("Telluric polling started: period={}, batchSize={}, connectionsLimit={}",
                settings.pollPeriod(), settings.batchSize(), settings.connectionsLimit());

        long periodNanos = settings.pollPeriod().toNanos();
        long nextTick = System.nanoTime() + periodNanos;
        while (!token.isCancelled()) {
            if (!token.sleep(Duration.ofNanos(nextTick - System.nanoTime()))) {
                break;
            }
            runBatch();
            nextTick = skipMissedTicks(nextTick + periodNanos, periodNanos);
        }
        log.info("Telluric polling stopped after {} batch(es)", batchesRun.get());
    }

    /**
     * Advances past ticks that fell due while the last batch was running.
     *
     * @return the next tick that is still in the future
     */
    long skipMissedTicks(long nextTick, long periodNanos) {
        long now = System.nanoTime();
        if (now < nextTick) {
            return nextTick;
        }
        long missed = (now - nextTick) / periodNanos + 1;
        ticksMissed.addAndGet(missed);
        metrics.getTelluricTicksMissed().increment(missed);
        log.warn("Telluric batch overran poll period {}; {} tick(s) missed", settings.pollPeriod(), missed);
        return nextTick + missed * periodNanos;
    }

    /**
     * Claims and processes one batch.
     *
     * @return number of items processed successfully, or -1 if the fetch failed
     */
    int runBatch() {
        List<TelluricBatchItem> batch;
        try {
            batch = transactions.run(() -> workSource.fetchBatch(settings.batchSize()));
        } catch (Exception e) {
            log.error("Failed to fetch telluric batch", e);
            return -1;
        }
        batchesRun.incrementAndGet();
        if (batch.isEmpty()) {
            log.debug("No pending telluric resolutions");
            return 0;
        }
        log.debug("Loaded {} pending telluric resolution(s)", batch.size());
        Timer.Sample sample = Timer.start();
        try {
            return processAll(batch);
        } finally {
            sample.stop(metrics.getTelluricBatchTimer());
        }
    }

    // ==================== Startup ====================

    private void startup(CancellationToken token) {
        log.info("Resetting 'calculating' telluric entries to 'pending'");
        int reset = transactions.run(workSource::resetInterrupted);
        log.info("Reset {} interrupted telluric resolution(s)", reset);

        if (!settings.startupDrainEnabled()) {
            return;
        }
        log.info("Starting batch processing of all pending telluric resolutions");
        int processed = 0;
        while (!token.isCancelled()) {
            List<TelluricBatchItem> batch = transactions.run(() -> workSource.fetchBatch(settings.batchSize()));
            if (batch.isEmpty()) {
                break;
            }
            int succeeded = processAll(batch);
            processed += batch.size();
            if (succeeded == 0) {
                log.warn("No telluric resolution in the last startup batch succeeded; leaving the rest to polling");
                break;
            }
            log.info("Processed {} resolutions on startup, continuing", processed);
        }
        log.info("Startup batch processing complete, processed {} total resolution(s)", processed);
    }

    // ==================== Item Processing ====================

    /**
     * Processes items with at most {@code connectionsLimit} in flight and waits for all of them.
     *
     * @return number processed successfully
     */
    int processAll(List<TelluricBatchItem> items) {
        List<CompletableFuture<Boolean>> futures = new ArrayList<>(items.size());
        for (TelluricBatchItem item : items) {
            try {
                slots.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while queueing telluric batch; {} item(s) not started", items.size() - futures.size());
                break;
            }
            try {
                futures.add(CompletableFuture.supplyAsync(() -> processInSlot(item), workers));
            } catch (RejectedExecutionException e) {
                slots.release();
                log.warn("Telluric worker pool rejected {}; it stays pending", item.observationId());
            }
        }
        int succeeded = 0;
        for (CompletableFuture<Boolean> future : futures) {
            if (future.join()) {
                succeeded++;
            }
        }
        return succeeded;
    }

    /**
     * Claims a single item and queues it without waiting for it to be processed.
     * Nothing is claimed when every worker slot is taken.
     *
     * @param claim claims the item in the store; empty if there is nothing to claim
     * @return the queued item, or empty if there was no free slot or nothing was claimed
     */
    public Optional<TelluricBatchItem> claimAndSubmit(Supplier<Optional<TelluricBatchItem>> claim) {
        if (!slots.tryAcquire()) {
            log.debug("All {} telluric worker slots taken; leaving item for the next poll", settings.workerSlots());
            return Optional.empty();
        }
        Optional<TelluricBatchItem> claimed;
        try {
            claimed = claim.get();
        } catch (RuntimeException e) {
            slots.release();
            throw e;
        }
        if (claimed.isEmpty()) {
            slots.release();
            return claimed;
        }
        TelluricBatchItem item = claimed.get();
        try {
            workers.execute(() -> processInSlot(item));
            return claimed;
        } catch (RejectedExecutionException e) {
            slots.release();
            log.warn("Telluric worker pool rejected {}; it is reset on next startup", item.observationId());
            return Optional.empty();
        }
    }

    private boolean processInSlot(TelluricBatchItem item) {
        try {
            return processOne(item);
        } finally {
            slots.release();
        }
    }

    private boolean processOne(TelluricBatchItem item) {
        inFlight.incrementAndGet();
        try {
            transactions.runVoid(() -> {
                recalculator.process(item);
                return null;
            });
            metrics.getTelluricProcessed().increment();
            log.debug("Resolved telluric for {}", item.observationId());
            return true;
        } catch (RecalcException e) {
            metrics.getTelluricFailed().increment();
            log.error("Telluric resolution failed for {}: {} [{}]", item.observationId(), e.getMessage(), e.getErrorCode(), e);
            return false;
        } catch (Exception e) {
            metrics.getTelluricFailed().increment();
            log.error("Unexpected error resolving telluric for {}", item.observationId(), e);
            return false;
        } finally {
            inFlight.decrementAndGet();
        }
    }

    // ==================== Lifecycle ====================

    /**
     * Stops accepting items and waits for those in flight.
     */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Forcing shutdown of telluric workers");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    // ==================== Monitoring ====================

    public int getInFlightCount() {
        return inFlight.get();
    }

    public int getFreeSlots() {
        return slots.availablePermits();
    }

    public long getBatchesRun() {
        return batchesRun.get();
    }

    public long getTicksMissed() {
        return ticksMissed.get();
    }

    public TelluricSettings getSettings() {
        return settings;
    }
}
