package com.recalc.core.service.session;

/**
 * A checked-out connection to the backing store.
 *
 * Work passed to {@link #transactionally} runs in its own transaction, which is
 * committed when the work returns and rolled back when it throws.
 */
public interface Session extends AutoCloseable {

    /**
     * Runs the given work inside a new transaction.
     *
     * @param work the work to run
     * @return the work's result
     */
    <T> T transactionally(TransactionalWork<T> work);

    /**
     * Verifies the connection is usable.
     *
     * @throws RuntimeException if it is not
     */
    void validate();

    /**
     * Returns the connection to its pool.
     */
    @Override
    void close();

    @FunctionalInterface
    interface TransactionalWork<T> {
        T run() throws Exception;
    }
}
