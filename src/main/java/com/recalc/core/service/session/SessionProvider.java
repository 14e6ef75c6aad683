package com.recalc.core.service.session;

/**
 * Scoped access to pooled sessions.
 *
 * The session handed to the callback is released on every exit path,
 * including when the callback throws.
 */
public interface SessionProvider {

    /**
     * Checks out a session, applies {@code work} to it and releases it.
     *
     * @throws SessionAcquisitionException if no session could be obtained
     */
    <T> T withSession(SessionWork<T> work);

    /**
     * Maximum number of sessions that may be checked out at once.
     */
    int getMaxConnections();

    /**
     * Number of sessions currently checked out.
     */
    int getActiveConnections();

    @FunctionalInterface
    interface SessionWork<T> {
        T apply(Session session);
    }
}
