package com.spreadsheet.engine.pivot;

import java.util.ArrayList;
import java.util.List;

/**
 * Declares a pivot table over a rectangular source range:
 * - sourceSheet / sourceRange, whose first row holds the field names
 * - rowFields and colFields, the grouping fields
 * - valueFields, what to aggregate and how
 * - filterFields, optional value filters applied first
 * - targetSheet / targetCell, optional top-left cell the table is written to
 */
public class PivotConfig {
    private String id;
    private String sourceSheet;
    private String sourceRange;
    private List<String> rowFields = new ArrayList<>();
    private List<String> colFields = new ArrayList<>();
    private List<ValueField> valueFields = new ArrayList<>();
    private List<FilterField> filterFields = new ArrayList<>();
    private String targetSheet;
    private String targetCell;
    private boolean showGrandTotals;

    public PivotConfig() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSourceSheet() {
        return sourceSheet;
    }

    public void setSourceSheet(String sourceSheet) {
        this.sourceSheet = sourceSheet;
    }

    public String getSourceRange() {
        return sourceRange;
    }

    public void setSourceRange(String sourceRange) {
        this.sourceRange = sourceRange;
    }

    public List<String> getRowFields() {
        return rowFields;
    }

    public void setRowFields(List<String> rowFields) {
        this.rowFields = rowFields == null ? new ArrayList<>() : rowFields;
    }

    public List<String> getColFields() {
        return colFields;
    }

    public void setColFields(List<String> colFields) {
        this.colFields = colFields == null ? new ArrayList<>() : colFields;
    }

    public List<ValueField> getValueFields() {
        return valueFields;
    }

    public void setValueFields(List<ValueField> valueFields) {
        this.valueFields = valueFields == null ? new ArrayList<>() : valueFields;
    }

    public List<FilterField> getFilterFields() {
        return filterFields;
    }

    public void setFilterFields(List<FilterField> filterFields) {
        this.filterFields = filterFields == null ? new ArrayList<>() : filterFields;
    }

    public String getTargetSheet() {
        return targetSheet;
    }

    public void setTargetSheet(String targetSheet) {
        this.targetSheet = targetSheet;
    }

    public String getTargetCell() {
        return targetCell;
    }

    public void setTargetCell(String targetCell) {
        this.targetCell = targetCell;
    }

    public boolean isShowGrandTotals() {
        return showGrandTotals;
    }

    public void setShowGrandTotals(boolean showGrandTotals) {
        this.showGrandTotals = showGrandTotals;
    }
}
