package com.recalc.core.service.config;

import com.recalc.core.service.model.CalibrationTimeElement;
import com.recalc.core.service.model.ObscalcElement;
import com.recalc.core.service.model.TelluricTargetElement;
import com.recalc.core.service.session.ElevatedContext;
import com.recalc.core.service.session.PooledSessionProvider;
import com.recalc.core.service.session.PrivilegedTransactionRunner;
import com.recalc.core.service.session.ServiceIdentityResolver;
import com.recalc.core.service.session.ServiceUserElevatedContext;
import com.recalc.core.service.session.SessionFactory;
import com.recalc.core.service.session.SessionProvider;
import com.recalc.core.service.telluric.TelluricPollingDaemon;
import com.recalc.core.service.telluric.TelluricRecalculator;
import com.recalc.core.service.telluric.TelluricSettings;
import com.recalc.core.service.telluric.TelluricWorkSource;
import com.recalc.core.service.topic.BroadcastTopic;
import com.recalc.core.service.topic.Topic;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Wires the deployment-supplied collaborators ({@link SessionFactory},
 * {@link ServiceIdentityResolver}, work sources) into the core components.
 */
@Configuration
@RequiredArgsConstructor
public class DaemonWiringConfig {

    private final DaemonConfig daemonConfig;

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ==================== Topics ====================

    @Bean
    public Topic<ObscalcElement> obscalcTopic() {
        return new BroadcastTopic<>("obscalc");
    }

    @Bean
    public Topic<CalibrationTimeElement> calibrationTimeTopic() {
        return new BroadcastTopic<>("calibration-time");
    }

    @Bean
    public Topic<TelluricTargetElement> telluricTargetTopic() {
        return new BroadcastTopic<>("telluric-target");
    }

    // ==================== Sessions ====================

    @Bean
    public SessionProvider sessionProvider(SessionFactory sessionFactory) {
        DaemonConfig.SessionConfig session = daemonConfig.getSession();
        return new PooledSessionProvider(sessionFactory, session.getMaxConnections(), session.getAcquireTimeout());
    }

    /**
     * Resolved once; an unresolvable or non-service identity aborts startup.
     */
    @Bean
    public ElevatedContext elevatedContext(ServiceIdentityResolver resolver) {
        return ServiceUserElevatedContext.resolve(resolver);
    }

    @Bean
    public PrivilegedTransactionRunner privilegedTransactionRunner(SessionProvider sessionProvider,
                                                                   ElevatedContext elevatedContext) {
        return new PrivilegedTransactionRunner(sessionProvider, elevatedContext);
    }

    // ==================== Telluric ====================

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "recalc.features", name = "telluric-enabled", havingValue = "true", matchIfMissing = true)
    public TelluricPollingDaemon telluricPollingDaemon(TelluricWorkSource workSource,
                                                       TelluricRecalculator recalculator,
                                                       PrivilegedTransactionRunner transactions,
                                                       MetricsConfig metricsConfig,
                                                       @Qualifier(AsyncConfig.TELLURIC_WORKERS) ThreadPoolTaskExecutor workers) {
        DaemonConfig.TelluricConfig telluric = daemonConfig.getTelluric();
        TelluricSettings settings = new TelluricSettings(
                telluric.getConnectionsLimit(),
                telluric.getPollPeriod(),
                telluric.getBatchSize(),
                telluric.getQueueCapacity(),
                telluric.isStartupDrainEnabled(),
                daemonConfig.getSupervisor().getShutdownTimeout()
        );
        return new TelluricPollingDaemon(workSource, recalculator, transactions, settings, metricsConfig,
                workers.getThreadPoolExecutor());
    }
}
