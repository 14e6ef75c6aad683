package com.recalc.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for topics, dispatchers, sessions and the telluric daemon.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "recalc.daemon")
public class DaemonConfig {

    private TopicConfig topic = new TopicConfig();

    private DispatcherConfig dispatcher = new DispatcherConfig();

    private SessionConfig session = new SessionConfig();

    private TelluricConfig telluric = new TelluricConfig();

    private SupervisorConfig supervisor = new SupervisorConfig();

    @Getter
    @Setter
    public static class TopicConfig {

        /**
         * Elements buffered between a change feed and its topic.
         */
        private int backlogSize = 1024;
    }

    @Getter
    @Setter
    public static class DispatcherConfig {

        /**
         * Elements buffered per dispatcher subscription before the oldest is dropped.
         */
        private int queueDepth = 100;

        /**
         * How long a dispatcher waits for an element before re-checking for shutdown.
         */
        private long pollTimeoutMs = 100;

        /**
         * Subscription backlog percentage at which health reports DOWN.
         */
        private int backpressureThreshold = 80;
    }

    @Getter
    @Setter
    public static class SessionConfig {

        /**
         * Maximum sessions checked out at once across all loops.
         */
        private int maxConnections = 8;

        /**
         * How long to wait for a free session before failing the element.
         */
        private Duration acquireTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class TelluricConfig {

        /**
         * Maximum telluric items processed concurrently.
         */
        private int connectionsLimit = 4;

        /**
         * Time between batch fetches.
         */
        private Duration pollPeriod = Duration.ofSeconds(30);

        /**
         * Maximum items claimed per fetch.
         */
        private int batchSize = 10;

        /**
         * Items that may wait for a free worker on top of those being processed.
         */
        private int queueCapacity = 100;

        /**
         * Drain all pending items at startup before polling.
         */
        private boolean startupDrainEnabled = true;
    }

    @Getter
    @Setter
    public static class SupervisorConfig {

        /**
         * Restart a crashed loop instead of leaving it down.
         */
        private boolean restartOnFailure = true;

        /**
         * Delay before a crashed loop is restarted.
         */
        private Duration restartDelay = Duration.ofSeconds(5);

        /**
         * How long shutdown waits for in-flight work before interrupting it.
         */
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }
}
