package com.spreadsheet.engine.exceptions;

/**
 * Body of every 4xx/5xx response, for example:
 * {
 *   "code": "INVALID_CELL_REFERENCE",
 *   "message": "Invalid cell id: 1A"
 * }
 */
public class ErrorResponse {
    private final String code;
    private final String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
