package com.herzen.obe.exception;

public class LockedScopeException extends AttainmentException {
    public LockedScopeException(String scopeKey, String semesterId) {
        super(ErrorCode.LOCKED_SCOPE, scopeKey, semesterId, null);
    }
}
