package com.spreadsheet.engine.exceptions;

/**
 * Thrown when a sheet is added with a blank name or one the workbook
 * already uses.
 */
public class InvalidSheetNameException extends RuntimeException {
    public InvalidSheetNameException(String message) {
        super(message);
    }
}
