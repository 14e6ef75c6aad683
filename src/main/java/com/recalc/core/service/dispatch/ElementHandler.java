package com.recalc.core.service.dispatch;

/**
 * Strategy for handling the elements of one subscription.
 *
 * @param <T> the type of element this handler processes
 */
public interface ElementHandler<T> {

    /**
     * Decides whether the element warrants recalculation.
     *
     * @param element the received element
     * @return true to proceed to {@link #handle}
     */
    boolean accepts(T element);

    /**
     * Performs the recalculation for an accepted element.
     *
     * @param element the element to process
     * @throws RecalcException if processing fails
     */
    void handle(T element);

    /**
     * Identifies the element in log lines.
     */
    String describe(T element);
}
