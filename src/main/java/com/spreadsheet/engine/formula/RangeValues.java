package com.spreadsheet.engine.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rectangular block of raw cell values passed to a function argument,
 * stored row-major with its geometry so lookups never rescan the formula.
 */
public final class RangeValues {
    private final int rowCount;
    private final int colCount;
    private final List<String> values;

    public RangeValues(int rowCount, int colCount, List<String> values) {
        if (values.size() != rowCount * colCount) {
            throw new IllegalArgumentException(
                    "Expected " + rowCount * colCount + " values for " + rowCount + "x" + colCount + " but got " + values.size());
        }
        this.rowCount = rowCount;
        this.colCount = colCount;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /** Builds a range from a possibly ragged grid; short rows are padded with "". */
    public static RangeValues fromGrid(List<List<String>> grid) {
        int cols = 0;
        for (List<String> row : grid) {
            cols = Math.max(cols, row.size());
        }
        List<String> flat = new ArrayList<>();
        for (List<String> row : grid) {
            for (int c = 0; c < cols; c++) {
                flat.add(c < row.size() ? row.get(c) : "");
            }
        }
        return new RangeValues(grid.size(), cols, flat);
    }

    public static RangeValues single(String value) {
        return new RangeValues(1, 1, List.of(value));
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColCount() {
        return colCount;
    }

    /** Row-major raw values. */
    public List<String> getValues() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public String get(int row, int col) {
        return values.get(row * colCount + col);
    }

    public List<String> getRow(int row) {
        return values.subList(row * colCount, (row + 1) * colCount);
    }

    public List<List<String>> toGrid() {
        List<List<String>> grid = new ArrayList<>();
        for (int r = 0; r < rowCount; r++) {
            grid.add(new ArrayList<>(getRow(r)));
        }
        return grid;
    }

    /**
     * Scalar reading of a whole range: the sum of its numeric members, or the
     * first error among them.
     */
    Object sum() {
        double total = 0;
        for (String raw : values) {
            if (Values.isError(raw)) {
                return raw;
            }
            Double number = Values.tryNumber(raw);
            if (number != null) {
                total += number;
            }
        }
        return total;
    }
}
