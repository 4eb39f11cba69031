package com.spreadsheet.engine.exceptions;

/**
 * Thrown when a workbook has no sheet with the requested name.
 */
public class SheetNotFoundException extends RuntimeException {
    private final long workbookId;
    private final String sheetName;

    public SheetNotFoundException(long workbookId, String sheetName) {
        super("Sheet not found: " + sheetName + " in workbook " + workbookId);
        this.workbookId = workbookId;
        this.sheetName = sheetName;
    }

    public long getWorkbookId() {
        return workbookId;
    }

    public String getSheetName() {
        return sheetName;
    }
}
