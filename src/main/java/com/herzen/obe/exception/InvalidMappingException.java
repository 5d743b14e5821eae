package com.herzen.obe.exception;

public class InvalidMappingException extends AttainmentException {
    public InvalidMappingException(String scopeKey, String entityId, String detail) {
        super(ErrorCode.INVALID_MAPPING, scopeKey, entityId, detail);
    }
}
