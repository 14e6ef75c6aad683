package com.recalc.core.service.session;

/**
 * Access level carried by an authenticated identity.
 */
public enum Access {
    GUEST,
    PI,
    NGO,
    STAFF,
    ADMIN,
    SERVICE
}
