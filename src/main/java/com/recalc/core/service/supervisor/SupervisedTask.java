package com.recalc.core.service.supervisor;

/**
 * Body of a long-running background loop. Implementations check the token
 * between units of work and return once it is cancelled.
 */
@FunctionalInterface
public interface SupervisedTask {

    void run(CancellationToken token) throws Exception;
}
