package com.recalc.core.service.dispatch;

/**
 * Thrown when a recalculation call or its transaction fails.
 */
public class RecalculationFailedException extends RecalcException {

    public static final String ERROR_CODE = "RECALCULATION_FAILED";

    public RecalculationFailedException(String message, String entityId, Throwable cause) {
        super(message, entityId, ERROR_CODE, cause);
    }
}
