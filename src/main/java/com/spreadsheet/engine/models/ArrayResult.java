package com.spreadsheet.engine.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of an array formula: a rectangular grid of scalar values
 * (rows x cols) anchored at the cell holding the formula.
 */
public class ArrayResult {
    private final List<List<String>> values;
    private final String sourceCell;

    public ArrayResult(List<List<String>> values, String sourceCell) {
        List<List<String>> copy = new ArrayList<>();
        for (List<String> row : values) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.values = Collections.unmodifiableList(copy);
        this.sourceCell = sourceCell;
    }

    public static ArrayResult single(String value, String sourceCell) {
        return new ArrayResult(List.of(List.of(value)), sourceCell);
    }

    public List<List<String>> getValues() {
        return values;
    }

    public String getSourceCell() {
        return sourceCell;
    }

    public int getRowCount() {
        return values.size();
    }

    public int getColCount() {
        int cols = 0;
        for (List<String> row : values) {
            cols = Math.max(cols, row.size());
        }
        return cols;
    }

    /**
     * Value at (row, col) relative to the anchor, "" outside the grid.
     */
    public String getValue(int row, int col) {
        if (row < 0 || row >= values.size()) {
            return "";
        }
        List<String> r = values.get(row);
        return col >= 0 && col < r.size() ? r.get(col) : "";
    }
}
