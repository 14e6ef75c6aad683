package com.recalc.core.service.session;

import java.util.Optional;

/**
 * Resolves the identity this process runs privileged work as, typically by
 * exchanging a configured service credential with the identity provider.
 */
@FunctionalInterface
public interface ServiceIdentityResolver {

    Optional<ServiceUser> resolve();
}
