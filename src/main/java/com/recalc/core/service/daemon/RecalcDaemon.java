package com.recalc.core.service.daemon;

import com.recalc.core.service.config.DaemonConfig;
import com.recalc.core.service.config.MetricsConfig;
import com.recalc.core.service.config.RecalcConfig;
import com.recalc.core.service.dispatch.CalibrationTimeHandler;
import com.recalc.core.service.dispatch.ElementHandler;
import com.recalc.core.service.dispatch.ObscalcHandler;
import com.recalc.core.service.dispatch.StartupException;
import com.recalc.core.service.dispatch.SubscriptionDispatcher;
import com.recalc.core.service.model.CalibrationTimeElement;
import com.recalc.core.service.model.ObscalcElement;
import com.recalc.core.service.model.TelluricTargetElement;
import com.recalc.core.service.recalc.RecalculationService;
import com.recalc.core.service.session.PrivilegedTransactionRunner;
import com.recalc.core.service.session.SessionProvider;
import com.recalc.core.service.supervisor.TaskGroup;
import com.recalc.core.service.telluric.TelluricPendingHandler;
import com.recalc.core.service.telluric.TelluricPollingDaemon;
import com.recalc.core.service.telluric.TelluricRecheckHandler;
import com.recalc.core.service.telluric.TelluricWorkSource;
import com.recalc.core.service.topic.ChangeFeed;
import com.recalc.core.service.topic.Topic;
import com.recalc.core.service.topic.TopicBridge;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Owns the background loops: one dispatcher per change stream, the bridges
 * feeding their topics, and the telluric polling daemon.
 *
 * Startup verifies a session can be opened before any loop starts. Shutdown
 * cancels all loops together and waits for them before closing bridges.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecalcDaemon {

    public static final String OBSCALC = "obscalc";
    public static final String CALIBRATION_TIME = "calibration-time";
    public static final String TELLURIC_EVENTS = "telluric-events";
    public static final String TELLURIC_RECHECK = "telluric-recheck";
    public static final String TELLURIC_POLL = "telluric-poll";

    private final RecalcConfig recalcConfig;
    private final DaemonConfig daemonConfig;
    private final MetricsConfig metricsConfig;
    private final TaskGroup taskGroup;
    private final SessionProvider sessionProvider;
    private final PrivilegedTransactionRunner transactions;
    private final RecalculationService recalculationService;
    private final Clock clock;

    private final Topic<ObscalcElement> obscalcTopic;
    private final Topic<CalibrationTimeElement> calibrationTimeTopic;
    private final Topic<TelluricTargetElement> telluricTargetTopic;

    private final ObjectProvider<ChangeFeed<ObscalcElement>> obscalcFeed;
    private final ObjectProvider<ChangeFeed<CalibrationTimeElement>> calibrationTimeFeed;
    private final ObjectProvider<ChangeFeed<TelluricTargetElement>> telluricTargetFeed;
    private final ObjectProvider<TelluricPollingDaemon> telluricDaemon;
    private final ObjectProvider<TelluricWorkSource> telluricWorkSource;

    private final List<SubscriptionDispatcher<?>> dispatchers = new ArrayList<>();
    private final List<TopicBridge<?>> bridges = new ArrayList<>();

    // ==================== Lifecycle ====================

    @PostConstruct
    void start() {
        if (!recalcConfig.isEnabled()) {
            log.info("Recalc daemon disabled");
            return;
        }
        verifySession();

        RecalcConfig.Features features = recalcConfig.getFeatures();
        if (features.isObscalcEnabled()) {
            startDispatcher(OBSCALC, obscalcTopic,
                    new ObscalcHandler(recalculationService, transactions, clock));
        }
        if (features.isCalibrationTimeEnabled()) {
            startDispatcher(CALIBRATION_TIME, calibrationTimeTopic,
                    new CalibrationTimeHandler(recalculationService, transactions));
        }
        TelluricPollingDaemon daemon = features.isTelluricEnabled() ? telluricDaemon.getIfAvailable() : null;
        if (daemon != null) {
            if (features.isTelluricEventsEnabled()) {
                startDispatcher(TELLURIC_EVENTS, telluricTargetTopic,
                        new TelluricPendingHandler(telluricWorkSource.getObject(), daemon, transactions));
            }
            if (features.isTelluricRecheckEnabled()) {
                startDispatcher(TELLURIC_RECHECK, obscalcTopic,
                        new TelluricRecheckHandler(telluricWorkSource.getObject(), recalculationService, transactions));
            }
            taskGroup.start(TELLURIC_POLL, daemon::run);
        }

        startBridge(obscalcFeed, obscalcTopic);
        startBridge(calibrationTimeFeed, calibrationTimeTopic);
        startBridge(telluricTargetFeed, telluricTargetTopic);

        log.info("Recalc daemon started with {} dispatcher(s), {} bridge(s), telluric daemon {}",
                dispatchers.size(), bridges.size(), daemon != null ? "on" : "off");
    }

    @PreDestroy
    void stop() {
        taskGroup.close();
        telluricDaemon.ifAvailable(TelluricPollingDaemon::close);
        bridges.forEach(TopicBridge::close);
        dispatchers.forEach(d -> d.getSubscription().close());
        log.info("Recalc daemon stopped");
    }

    // ==================== Startup ====================

    private void verifySession() {
        try {
            sessionProvider.withSession(session -> {
                session.validate();
                return null;
            });
        } catch (RuntimeException e) {
            log.error("Cannot establish initial database session", e);
            throw new StartupException("Cannot establish initial database session: " + e.getMessage(), e);
        }
        log.info("Initial database session verified (max {} connections)", sessionProvider.getMaxConnections());
    }

    private <T> void startDispatcher(String name, Topic<T> topic, ElementHandler<T> handler) {
        DaemonConfig.DispatcherConfig config = daemonConfig.getDispatcher();
        var subscription = topic.subscribe(config.getQueueDepth());
        metricsConfig.registerSubscriptionGauges(name, subscription);
        var dispatcher = new SubscriptionDispatcher<>(
                name, subscription, handler, metricsConfig.dispatcherMeters(name), config.getPollTimeoutMs());
        dispatchers.add(dispatcher);
        taskGroup.start(name, dispatcher::run);
    }

    private <T> void startBridge(ObjectProvider<ChangeFeed<T>> feed, Topic<T> topic) {
        ChangeFeed<T> changeFeed = feed.getIfAvailable();
        if (changeFeed == null) {
            log.warn("No change feed configured for topic {}", topic.getName());
            return;
        }
        var bridge = new TopicBridge<>(changeFeed, topic, daemonConfig.getTopic().getBacklogSize());
        bridges.add(bridge);
        long pollTimeoutMs = daemonConfig.getDispatcher().getPollTimeoutMs();
        taskGroup.start(topic.getName() + "-bridge", token -> bridge.pump(token::isCancelled, pollTimeoutMs));
        bridge.start();
    }

    // ==================== Monitoring ====================

    public List<SubscriptionDispatcher<?>> getDispatchers() {
        return Collections.unmodifiableList(dispatchers);
    }

    public List<TopicBridge<?>> getBridges() {
        return Collections.unmodifiableList(bridges);
    }
}
