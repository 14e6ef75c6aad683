package com.recalc.core.service.dispatch;

/**
 * Processing state of a {@link SubscriptionDispatcher}.
 */
public enum DispatcherState {
    IDLE,
    RECEIVING,
    EVALUATING,
    RECOMPUTING,
    CANCELLED
}
