package com.spreadsheet.engine.formula;

/**
 * Reads the current value of a cell on the sheet being evaluated.
 * Returns "" for an absent cell and never mutates anything.
 */
@FunctionalInterface
public interface CellGetter {
    String get(String cellRef);
}
