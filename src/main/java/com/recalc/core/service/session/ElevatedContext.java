package com.recalc.core.service.session;

import java.util.function.Supplier;

/**
 * Runs work under service-level authorization rather than an end user's.
 */
public interface ElevatedContext {

    <T> T runAsPrivileged(Supplier<T> work);

    default void runAsPrivileged(Runnable work) {
        runAsPrivileged(() -> {
            work.run();
            return null;
        });
    }
}
