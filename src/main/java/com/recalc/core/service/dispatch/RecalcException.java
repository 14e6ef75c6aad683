package com.recalc.core.service.dispatch;

/**
 * Base exception for failures while turning change elements into recalculations.
 */
public class RecalcException extends RuntimeException {

    private final String entityId;
    private final String errorCode;

    public RecalcException(String message) {
        super(message);
        this.entityId = null;
        this.errorCode = "RECALC_ERROR";
    }

    public RecalcException(String message, Throwable cause) {
        super(message, cause);
        this.entityId = null;
        this.errorCode = "RECALC_ERROR";
    }

    public RecalcException(String message, String entityId, String errorCode) {
        super(message);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public RecalcException(String message, String entityId, String errorCode, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
