package com.recalc.core.service.dispatch;

/**
 * Thrown when a precondition for steady-state operation cannot be met.
 * Fatal: the application context refuses to start.
 */
public class StartupException extends RecalcException {

    public static final String ERROR_CODE = "STARTUP_FAILED";

    public StartupException(String message) {
        super(message, null, ERROR_CODE);
    }

    public StartupException(String message, Throwable cause) {
        super(message, null, ERROR_CODE, cause);
    }
}
