package com.recalc.core.service.api.health;

import com.recalc.core.service.config.DaemonConfig;
import com.recalc.core.service.daemon.RecalcDaemon;
import com.recalc.core.service.dispatch.SubscriptionDispatcher;
import com.recalc.core.service.session.SessionProvider;
import com.recalc.core.service.supervisor.TaskGroup;
import com.recalc.core.service.supervisor.TaskStatus;
import com.recalc.core.service.topic.Subscription;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the background loops.
 *
 * Reports DOWN when a supervised task is not running or a dispatcher
 * subscription is backed up past the backpressure threshold.
 */
@Component
@RequiredArgsConstructor
public class RecalcDaemonHealthIndicator implements HealthIndicator {

    private final RecalcDaemon daemon;
    private final TaskGroup taskGroup;
    private final SessionProvider sessionProvider;
    private final DaemonConfig config;

    @Override
    public Health health() {
        int threshold = config.getDispatcher().getBackpressureThreshold();
        boolean healthy = !taskGroup.isClosed();

        Map<String, Object> tasks = new LinkedHashMap<>();
        for (Map.Entry<String, TaskStatus> entry : taskGroup.getStatuses().entrySet()) {
            tasks.put(entry.getKey(), entry.getValue());
            healthy &= entry.getValue() == TaskStatus.RUNNING;
        }

        Map<String, Object> subscriptions = new LinkedHashMap<>();
        for (SubscriptionDispatcher<?> dispatcher : daemon.getDispatchers()) {
            Subscription<?> subscription = dispatcher.getSubscription();
            int utilization = subscription.getUtilizationPercent();
            healthy &= utilization < threshold;
            subscriptions.put(dispatcher.getName(), Map.of(
                    "state", dispatcher.getState(),
                    "backlog", subscription.backlog(),
                    "capacity", subscription.getCapacity(),
                    "utilizationPercent", utilization,
                    "dropped", subscription.getDroppedCount()
            ));
        }

        Health.Builder builder = healthy ? Health.up() : Health.down();
        return builder
                .withDetail("tasks", tasks)
                .withDetail("subscriptions", subscriptions)
                .withDetail("activeSessions", sessionProvider.getActiveConnections())
                .withDetail("maxSessions", sessionProvider.getMaxConnections())
                .withDetail("backpressureThreshold", threshold)
                .build();
    }
}
