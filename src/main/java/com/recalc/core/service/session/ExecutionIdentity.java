package com.recalc.core.service.session;

import java.util.Optional;

/**
 * Thread-bound holder for the identity work is currently executing as.
 */
public final class ExecutionIdentity {

    private static final ThreadLocal<ServiceUser> CURRENT = new ThreadLocal<>();

    private ExecutionIdentity() {
    }

    public static Optional<ServiceUser> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    static ServiceUser bind(ServiceUser user) {
        ServiceUser previous = CURRENT.get();
        CURRENT.set(user);
        return previous;
    }

    static void restore(ServiceUser previous) {
        if (previous == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(previous);
        }
    }
}
