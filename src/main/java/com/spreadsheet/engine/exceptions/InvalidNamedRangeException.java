package com.spreadsheet.engine.exceptions;

/**
 * Thrown when a named range is defined with an unusable name
 * (empty, a cell address, a built-in function name) or an unparseable range.
 */
public class InvalidNamedRangeException extends RuntimeException {
    public InvalidNamedRangeException(String message) {
        super(message);
    }
}
