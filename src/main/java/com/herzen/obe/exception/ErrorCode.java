package com.herzen.obe.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    INCOMPLETE_MAPPING(HttpStatus.UNPROCESSABLE_ENTITY, "Assessment component has no course outcome mapping"),
    INVALID_MARK(HttpStatus.UNPROCESSABLE_ENTITY, "Student mark outside the component's allowed range"),
    INVALID_MAPPING(HttpStatus.UNPROCESSABLE_ENTITY, "CO to PO mapping is not valid for the course"),
    LOCKED_SCOPE(HttpStatus.LOCKED, "Semester is locked, computation refused"),
    SCOPE_NOT_FOUND(HttpStatus.NOT_FOUND, "Computation scope not found"),
    INVALID_GOVERNANCE(HttpStatus.BAD_REQUEST, "Governance configuration rejected");

    private final HttpStatus status;
    private final String message;

    ErrorCode(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
