package com.recalc.core.service.session;

import com.recalc.core.service.dispatch.RecalcException;

/**
 * Thrown when a pooled session cannot be checked out.
 */
public class SessionAcquisitionException extends RecalcException {

    public static final String ERROR_CODE = "SESSION_UNAVAILABLE";

    public SessionAcquisitionException(String message) {
        super(message, null, ERROR_CODE);
    }

    public SessionAcquisitionException(String message, Throwable cause) {
        super(message, null, ERROR_CODE, cause);
    }
}
