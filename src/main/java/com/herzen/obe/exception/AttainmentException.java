package com.herzen.obe.exception;

/**
 * Fatal condition raised while computing or configuring attainment. Carries the scope and the
 * entity that has to be fixed before the computation can run.
 */
public class AttainmentException extends RuntimeException {
    private final ErrorCode errorCode;
    private final String scopeKey;
    private final String entityId;

    public AttainmentException(ErrorCode errorCode, String scopeKey, String entityId, String detail) {
        super(errorCode.getMessage() + " [scope=" + scopeKey + ", entity=" + entityId + "]"
                + (detail == null || detail.isBlank() ? "" : ": " + detail));
        this.errorCode = errorCode;
        this.scopeKey = scopeKey;
        this.entityId = entityId;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getScopeKey() {
        return scopeKey;
    }

    public String getEntityId() {
        return entityId;
    }
}
