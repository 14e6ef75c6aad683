package com.recalc.core.service.supervisor;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Supervisor for a fixed set of background loops.
 *
 * Each task runs independently on the shared executor. Anything thrown out of
 * a task, errors included, is caught at the task boundary and logged; siblings
 * keep running.
 * A crashed task is restarted after {@code restartDelay} when
 * {@code restartOnFailure} is set, otherwise it stays down.
 *
 * {@link #close()} cancels every task through one {@link CancellationToken}
 * and waits for them to return, so work in flight completes before the
 * resources it uses are released.
 */
@Slf4j
public class TaskGroup implements AutoCloseable {

    private final String name;
    private final ExecutorService executor;
    private final boolean restartOnFailure;
    private final Duration restartDelay;
    private final Duration shutdownTimeout;

    private final CancellationToken token = new CancellationToken();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Map<String, TaskStatus> statuses = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> crashes = new ConcurrentHashMap<>();

    public TaskGroup(String name, ExecutorService executor, boolean restartOnFailure,
                     Duration restartDelay, Duration shutdownTimeout) {
        this.name = name;
        this.executor = executor;
        this.restartOnFailure = restartOnFailure;
        this.restartDelay = restartDelay;
        this.shutdownTimeout = shutdownTimeout;
    }

    // ==================== Lifecycle ====================

    /**
     * Starts a named task.
     *
     * @throws IllegalStateException if the group is closed or the name is taken
     */
    public void start(String taskName, SupervisedTask task) {
        if (closed.get()) {
            throw new IllegalStateException("Task group " + name + " is closed");
        }
        if (statuses.putIfAbsent(taskName, TaskStatus.RUNNING) != null) {
            throw new IllegalStateException("Task already started: " + taskName);
        }
        crashes.put(taskName, new AtomicInteger());
        try {
            executor.execute(() -> supervise(taskName, task));
        } catch (RejectedExecutionException e) {
            statuses.remove(taskName);
            crashes.remove(taskName);
            throw new IllegalStateException("Executor rejected task " + taskName, e);
        }
        log.info("Started task {} in group {}", taskName, name);
    }

    /**
     * Cancels all tasks and waits up to the shutdown timeout for them to finish.
     * Tasks still running after that are interrupted.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Cancelling {} task(s) in group {}", statuses.size(), name);
        token.cancel();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Forcing shutdown of task group {}", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.info("Task group {} stopped", name);
    }

    // ==================== Supervision ====================

    private void supervise(String taskName, SupervisedTask task) {
        try {
            while (!token.isCancelled()) {
                statuses.put(taskName, TaskStatus.RUNNING);
                try {
                    task.run(token);
                    if (!token.isCancelled()) {
                        log.info("Task {} completed", taskName);
                        statuses.put(taskName, TaskStatus.COMPLETED);
                    }
                    return;
                } catch (Throwable t) {
                    int count = crashes.get(taskName).incrementAndGet();
                    log.error("Task {} crashed (failure #{})", taskName, count, t);
                }
                if (!restartOnFailure) {
                    statuses.put(taskName, TaskStatus.CRASHED);
                    return;
                }
                statuses.put(taskName, TaskStatus.RESTARTING);
                log.warn("Restarting task {} in {}", taskName, restartDelay);
                if (!token.sleep(restartDelay)) {
                    return;
                }
            }
        } finally {
            if (token.isCancelled()) {
                statuses.put(taskName, TaskStatus.CANCELLED);
            }
        }
    }

    // ==================== Monitoring ====================

    public CancellationToken getToken() {
        return token;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Snapshot of task statuses keyed by task name.
     */
    public Map<String, TaskStatus> getStatuses() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
    }

    public TaskStatus getStatus(String taskName) {
        return statuses.get(taskName);
    }

    public int getCrashCount(String taskName) {
        AtomicInteger count = crashes.get(taskName);
        return count == null ? 0 : count.get();
    }
}
