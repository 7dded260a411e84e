package com.spreadsheet.formula.exceptions;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Simple DTO to structure error responses with a code and message.
 * For example:
 * {
 *   "code": "CIRCULAR_REFERENCE",
 *   "message": "Circular dependency detected: Sheet1!A1 -> Sheet1!B1 -> Sheet1!A1",
 *   "cycle": ["Sheet1!A1", "Sheet1!B1", "Sheet1!A1"]
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private String code;
    private String message;
    private List<String> cycle;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public ErrorResponse(String code, String message, List<String> cycle) {
        this(code, message);
        this.cycle = cycle;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getCycle() {
        return cycle;
    }
}
