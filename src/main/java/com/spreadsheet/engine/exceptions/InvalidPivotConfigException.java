package com.spreadsheet.engine.exceptions;

/**
 * Thrown when a pivot configuration has no source range,
 * no value fields, or names a field missing from the source header row.
 */
public class InvalidPivotConfigException extends RuntimeException {
    public InvalidPivotConfigException(String message) {
        super(message);
    }
}
