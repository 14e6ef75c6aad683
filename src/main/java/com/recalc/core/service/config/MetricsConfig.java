package com.recalc.core.service.config;

import com.recalc.core.service.topic.Subscription;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the recalc core service.
 *
 * Provides per-dispatcher meters tagged by dispatcher name and the telluric daemon meters.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    private final Counter telluricProcessed;
    private final Counter telluricFailed;
    private final Counter telluricTicksMissed;

    private final Timer telluricBatchTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.telluricProcessed = Counter.builder("recalc.telluric.processed")
                .description("Telluric resolutions completed")
                .register(registry);

        this.telluricFailed = Counter.builder("recalc.telluric.failed")
                .description("Telluric resolutions that failed")
                .register(registry);

        this.telluricTicksMissed = Counter.builder("recalc.telluric.ticks.missed")
                .description("Poll ticks skipped because a batch overran the period")
                .register(registry);

        this.telluricBatchTimer = Timer.builder("recalc.telluric.batch.duration")
                .description("Time taken to process a telluric batch")
                .register(registry);
    }

    /**
     * Creates or looks up the meters of one dispatcher.
     *
     * @param dispatcher dispatcher name, used as the {@code dispatcher} tag
     */
    public DispatcherMeters dispatcherMeters(String dispatcher) {
        return new DispatcherMeters(
                dispatcherCounter("recalc.dispatch.received", "Elements received", dispatcher),
                dispatcherCounter("recalc.dispatch.rejected", "Elements rejected by the guard", dispatcher),
                dispatcherCounter("recalc.dispatch.succeeded", "Recalculations completed", dispatcher),
                dispatcherCounter("recalc.dispatch.failed", "Elements whose processing failed", dispatcher),
                Timer.builder("recalc.dispatch.duration")
                        .description("Time taken for a recalculation")
                        .tag("dispatcher", dispatcher)
                        .register(registry)
        );
    }

    /**
     * Registers backlog and drop meters for a subscription.
     *
     * @param dispatcher   dispatcher name, used as the {@code dispatcher} tag
     * @param subscription the subscription to observe
     */
    public void registerSubscriptionGauges(String dispatcher, Subscription<?> subscription) {
        Gauge.builder("recalc.subscription.backlog", subscription, Subscription::backlog)
                .description("Elements waiting in a dispatcher subscription")
                .tag("dispatcher", dispatcher)
                .register(registry);
        FunctionCounter.builder("recalc.subscription.dropped", subscription, Subscription::getDroppedCount)
                .description("Elements dropped because the dispatcher fell behind")
                .tag("dispatcher", dispatcher)
                .register(registry);
    }

    private Counter dispatcherCounter(String name, String description, String dispatcher) {
        return Counter.builder(name)
                .description(description)
                .tag("dispatcher", dispatcher)
                .register(registry);
    }

    /**
     * Meters of one dispatcher.
     */
    public record DispatcherMeters(
            Counter received,
            Counter rejected,
            Counter succeeded,
            Counter failed,
            Timer duration
    ) {
    }
}
