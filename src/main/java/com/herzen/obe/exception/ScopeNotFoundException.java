package com.herzen.obe.exception;

public class ScopeNotFoundException extends AttainmentException {
    public ScopeNotFoundException(String scopeType, String id) {
        super(ErrorCode.SCOPE_NOT_FOUND, scopeType + ":" + id, id, null);
    }
}
