package com.recalc.core.service.session;

import java.util.Objects;

/**
 * An authenticated identity that work can be executed as.
 */
public record ServiceUser(String id, String name, Access access) {

    public ServiceUser {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(access, "access");
    }

    public boolean isService() {
        return access == Access.SERVICE;
    }
}
