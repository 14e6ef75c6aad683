package com.recalc.core.service.session;

import lombok.RequiredArgsConstructor;

/**
 * Runs a unit of work as the service user on a freshly checked-out pooled
 * session, by default inside its own transaction.
 */
@RequiredArgsConstructor
public class PrivilegedTransactionRunner {

    private final SessionProvider sessions;
    private final ElevatedContext elevatedContext;

    public <T> T run(Session.TransactionalWork<T> work) {
        return sessions.withSession(session ->
                elevatedContext.runAsPrivileged(() -> session.transactionally(work)));
    }

    public void runVoid(Session.TransactionalWork<?> work) {
        run(work);
    }

    /**
     * Runs work as the service user on a pooled session without opening a
     * transaction; the work manages its own.
     */
    public <T> T runNonTransactionally(SessionProvider.SessionWork<T> work) {
        return sessions.withSession(session ->
                elevatedContext.runAsPrivileged(() -> work.apply(session)));
    }
}
