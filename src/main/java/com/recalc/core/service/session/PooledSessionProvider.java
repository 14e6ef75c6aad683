package com.recalc.core.service.session;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link SessionProvider} that caps the number of concurrently open sessions.
 *
 * The cap is the only mutual exclusion shared by the dispatchers and the
 * polling daemon. Callers wait up to {@code acquireTimeout} for a permit.
 */
@Slf4j
public class PooledSessionProvider implements SessionProvider {

    private final SessionFactory factory;
    private final int maxConnections;
    private final Duration acquireTimeout;
    private final Semaphore permits;
    private final AtomicInteger active = new AtomicInteger();

    public PooledSessionProvider(SessionFactory factory, int maxConnections, Duration acquireTimeout) {
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections must be positive: " + maxConnections);
        }
        this.factory = factory;
        this.maxConnections = maxConnections;
        this.acquireTimeout = acquireTimeout;
        this.permits = new Semaphore(maxConnections, true);
    }

    @Override
    public <T> T withSession(SessionWork<T> work) {
        acquirePermit();
        try {
            Session session = openSession();
            active.incrementAndGet();
            try {
                return work.apply(session);
            } finally {
                active.decrementAndGet();
                closeQuietly(session);
            }
        } finally {
            permits.release();
        }
    }

    @Override
    public int getMaxConnections() {
        return maxConnections;
    }

    @Override
    public int getActiveConnections() {
        return active.get();
    }

    private void acquirePermit() {
        boolean acquired;
        try {
            acquired = permits.tryAcquire(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionAcquisitionException("Interrupted while waiting for a session", e);
        }
        if (!acquired) {
            throw new SessionAcquisitionException(
                    "No session available within " + acquireTimeout.toMillis() + "ms (max " + maxConnections + ")");
        }
    }

    private Session openSession() {
        try {
            return factory.open();
        } catch (RuntimeException e) {
            throw new SessionAcquisitionException("Failed to open session: " + e.getMessage(), e);
        }
    }

    private void closeQuietly(Session session) {
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("Failed to release session: {}", e.getMessage());
        }
    }
}
