package com.spreadsheet.engine.pivot;

import java.util.List;

/**
 * Output table of a pivot: the header row, the body rows (grand total row
 * last when enabled), and the sorted distinct row and column keys.
 */
public class PivotResult {
    private final List<String> headers;
    private final List<List<String>> rows;
    private final List<List<String>> rowKeys;
    private final List<List<String>> colKeys;

    public PivotResult(List<String> headers, List<List<String>> rows,
                       List<List<String>> rowKeys, List<List<String>> colKeys) {
        this.headers = headers;
        this.rows = rows;
        this.rowKeys = rowKeys;
        this.colKeys = colKeys;
    }

    public List<String> getHeaders() {
        return headers;
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public List<List<String>> getRowKeys() {
        return rowKeys;
    }

    public List<List<String>> getColKeys() {
        return colKeys;
    }
}
