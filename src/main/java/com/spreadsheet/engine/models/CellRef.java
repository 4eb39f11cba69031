package com.spreadsheet.engine.models;

import java.util.Objects;

/**
 * A zero-based (column, row) coordinate. Column 0 row 0 is "A1".
 */
public final class CellRef {
    private final int col;
    private final int row;

    public CellRef(int col, int row) {
        this.col = col;
        this.row = row;
    }

    public int getCol() {
        return col;
    }

    public int getRow() {
        return row;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRef)) {
            return false;
        }
        CellRef other = (CellRef) o;
        return col == other.col && row == other.row;
    }

    @Override
    public int hashCode() {
        return Objects.hash(col, row);
    }

    @Override
    public String toString() {
        return "CellRef{col=" + col + ", row=" + row + "}";
    }
}
