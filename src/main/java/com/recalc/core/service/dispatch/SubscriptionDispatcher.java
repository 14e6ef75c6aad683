package com.recalc.core.service.dispatch;

import com.recalc.core.service.config.MetricsConfig.DispatcherMeters;
import com.recalc.core.service.supervisor.CancellationToken;
import com.recalc.core.service.topic.Subscription;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Drains one {@link Subscription}, one element at a time in arrival order.
 *
 * A single dispatcher never runs two handlers concurrently, so there is at
 * most one recalculation in flight per subscription. Failures on one element
 * are logged and the loop moves on to the next. Errors are not caught here;
 * they end the loop and the supervising task group restarts it.
 *
 * @param <T> element type
 */
@Slf4j
public class SubscriptionDispatcher<T> {

    private final String name;
    private final Subscription<T> subscription;
    private final ElementHandler<T> handler;
    private final DispatcherMeters meters;
    private final long pollTimeoutMs;

    private final AtomicReference<DispatcherState> state = new AtomicReference<>(DispatcherState.IDLE);

    public SubscriptionDispatcher(String name, Subscription<T> subscription, ElementHandler<T> handler,
                                  DispatcherMeters meters, long pollTimeoutMs) {
        this.name = name;
        this.subscription = subscription;
        this.handler = handler;
        this.meters = meters;
        this.pollTimeoutMs = pollTimeoutMs;
    }

    // ==================== Processing Loop ====================

    /**
     * Processes elements until the token is cancelled. An element already being
     * processed when cancellation arrives is finished first.
     */
    public void run(CancellationToken token) {
        log.info("Dispatcher {} started", name);
        try {
            while (!token.isCancelled()) {
                state.set(DispatcherState.IDLE);
                subscription.next(pollTimeoutMs).ifPresent(this::process);
            }
        } finally {
            state.set(DispatcherState.CANCELLED);
            log.info("Dispatcher {} stopped", name);
        }
    }

    /**
     * Runs one element through guard and recalculation. Never throws.
     */
    void process(T element) {
        state.set(DispatcherState.RECEIVING);
        meters.received().increment();
        try {
            state.set(DispatcherState.EVALUATING);
            if (!handler.accepts(element)) {
                meters.rejected().increment();
                log.debug("{} skipped {}", name, handler.describe(element));
                return;
            }
            state.set(DispatcherState.RECOMPUTING);
            meters.duration().record(() -> handler.handle(element));
            meters.succeeded().increment();
        } catch (RecalcException e) {
            meters.failed().increment();
            log.error("{} failed for {}: {} [{}]", name, handler.describe(element), e.getMessage(), e.getErrorCode(), e);
        } catch (Exception e) {
            meters.failed().increment();
            log.error("Unexpected error in {} processing {}", name, handler.describe(element), e);
        } finally {
            state.set(DispatcherState.IDLE);
        }
    }

    // ==================== Monitoring ====================

    public String getName() {
        return name;
    }

    public DispatcherState getState() {
        return state.get();
    }

    public Subscription<T> getSubscription() {
        return subscription;
    }
}
