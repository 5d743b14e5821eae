package com.herzen.obe.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when any mark of an assessment is out of range or points at an unknown component.
 * The whole assessment is rejected; every offending row is listed.
 */
public class InvalidMarkException extends AttainmentException {
    private final List<InvalidMarkRow> rows;

    public InvalidMarkException(String scopeKey, String assessmentId, List<InvalidMarkRow> rows) {
        super(ErrorCode.INVALID_MARK, scopeKey, assessmentId, rows.stream()
                .map(InvalidMarkRow::describe)
                .collect(Collectors.joining("; ")));
        this.rows = List.copyOf(rows);
    }

    public List<InvalidMarkRow> getRows() {
        return rows;
    }

    public record InvalidMarkRow(String studentId, String componentNumber, double mark, String reason) {
        String describe() {
            return studentId + "/" + componentNumber + "=" + mark + " (" + reason + ")";
        }
    }
}
