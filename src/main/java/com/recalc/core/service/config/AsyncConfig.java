package com.recalc.core.service.config;

import com.recalc.core.service.supervisor.TaskGroup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for the background loops.
 *
 * Supervised loops run on a cached pool owned by the {@link TaskGroup}; telluric
 * items run on a bounded pool sized to the daemon's connection limit.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    public static final String TELLURIC_WORKERS = "telluricWorkers";

    private final DaemonConfig daemonConfig;

    // ==================== Executor Beans ====================

    /**
     * Supervisor for dispatcher, bridge and daemon loops. Closed by
     * {@link com.recalc.core.service.daemon.RecalcDaemon} before the session pool goes away.
     */
    @Bean(destroyMethod = "close")
    public TaskGroup recalcTaskGroup() {
        DaemonConfig.SupervisorConfig supervisor = daemonConfig.getSupervisor();
        log.info("Initializing task group (restartOnFailure={}, restartDelay={})",
                supervisor.isRestartOnFailure(), supervisor.getRestartDelay());
        return new TaskGroup(
                "recalc",
                Executors.newCachedThreadPool(namedThreadFactory("recalc-task-")),
                supervisor.isRestartOnFailure(),
                supervisor.getRestartDelay(),
                supervisor.getShutdownTimeout()
        );
    }

    /**
     * Worker pool for telluric items; its size is the daemon's concurrency ceiling
     * and its queue is bounded.
     */
    @Bean(name = TELLURIC_WORKERS)
    public ThreadPoolTaskExecutor telluricWorkers() {
        DaemonConfig.TelluricConfig telluric = daemonConfig.getTelluric();
        log.info("Initializing telluric worker pool with {} threads and queue capacity {}",
                telluric.getConnectionsLimit(), telluric.getQueueCapacity());
        return createPlatformThreadPool("telluric-worker-", telluric.getConnectionsLimit(),
                telluric.getQueueCapacity(), daemonConfig.getSupervisor().getShutdownTimeout());
    }

    // ==================== Helper Methods ====================

    private ThreadPoolTaskExecutor createPlatformThreadPool(String prefix, int poolSize, int queueCapacity,
                                                             Duration awaitTermination) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationMillis(awaitTermination.toMillis());
        executor.initialize();
        return executor;
    }

    static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable);
            thread.setName(prefix + counter.incrementAndGet());
            return thread;
        };
    }
}
