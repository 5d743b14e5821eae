package com.herzen.obe.exception;

import java.util.List;

public class IncompleteMappingException extends AttainmentException {
    private final List<String> componentNumbers;

    public IncompleteMappingException(String scopeKey, String assessmentId, List<String> componentNumbers) {
        super(ErrorCode.INCOMPLETE_MAPPING, scopeKey, assessmentId, "components " + componentNumbers);
        this.componentNumbers = List.copyOf(componentNumbers);
    }

    public List<String> getComponentNumbers() {
        return componentNumbers;
    }
}
