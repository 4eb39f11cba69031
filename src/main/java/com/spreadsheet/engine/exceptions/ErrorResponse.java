package com.spreadsheet.engine.exceptions;

/**
 * Error body returned by the REST layer, e.g.
 * {
 *   "status": 400,
 *   "code": "INVALID_CELL_REFERENCE",
 *   "message": "Invalid cell reference: 7B"
 * }
 * Formula errors such as #DIV/0! are cell values and never use this.
 */
public class ErrorResponse {
    private final int status;
    private final String code;
    private final String message;

    public ErrorResponse(int status, String code, String message) {
        this.status = status;
        this.code = code;
        this.message = message;
    }

    public int getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
