package com.recalc.core.service.session;

import com.recalc.core.service.dispatch.StartupException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * {@link ElevatedContext} that binds a resolved service user for the duration
 * of each call. Holds no mutable state beyond the immutable identity.
 */
@Slf4j
public class ServiceUserElevatedContext implements ElevatedContext {

    private final ServiceUser serviceUser;

    private ServiceUserElevatedContext(ServiceUser serviceUser) {
        this.serviceUser = serviceUser;
    }

    /**
     * Resolves the service identity once at startup.
     *
     * @throws StartupException if no identity is available or it lacks service access
     */
    public static ServiceUserElevatedContext resolve(ServiceIdentityResolver resolver) {
        ServiceUser user;
        try {
            user = resolver.resolve()
                    .orElseThrow(() -> new StartupException("Failed to get service user"));
        } catch (StartupException e) {
            log.error(e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to resolve service user", e);
            throw new StartupException("Failed to resolve service user: " + e.getMessage(), e);
        }
        if (!user.isService()) {
            log.error("User {} is not allowed to execute this service", user.id());
            throw new StartupException("User " + user.id() + " doesn't have permission to execute");
        }
        log.info("Running privileged work as service user {}", user.id());
        return new ServiceUserElevatedContext(user);
    }

    @Override
    public <T> T runAsPrivileged(Supplier<T> work) {
        ServiceUser previous = ExecutionIdentity.bind(serviceUser);
        try {
            return work.get();
        } finally {
            ExecutionIdentity.restore(previous);
        }
    }

    public ServiceUser getServiceUser() {
        return serviceUser;
    }
}
