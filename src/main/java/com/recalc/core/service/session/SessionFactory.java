package com.recalc.core.service.session;

/**
 * Opens raw sessions against the backing store. Supplied by the deployment.
 */
@FunctionalInterface
public interface SessionFactory {

    Session open();
}
