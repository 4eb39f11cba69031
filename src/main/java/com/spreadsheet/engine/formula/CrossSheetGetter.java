package com.spreadsheet.engine.formula;

/**
 * Reads a cell on another sheet of the same workbook, e.g. {@code Sheet2!A1}.
 */
@FunctionalInterface
public interface CrossSheetGetter {
    String get(String sheetName, String cellRef);
}
