package com.spreadsheet.engine.exceptions;

/**
 * Thrown when a cell address like "B7" cannot be parsed,
 * e.g. "7B" or "A0".
 */
public class InvalidCellReferenceException extends RuntimeException {
    public InvalidCellReferenceException(String message) {
        super(message);
    }
}
