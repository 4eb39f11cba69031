package com.spreadsheet.engine.exceptions;

/**
 * Thrown when imported workbook text has a malformed frontmatter block,
 * e.g. "sheets: many".
 */
public class WorkbookFormatException extends RuntimeException {
    public WorkbookFormatException(String message) {
        super(message);
    }

    public WorkbookFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
