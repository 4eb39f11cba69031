package com.spreadsheet.engine.pivot;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps only source rows whose 'field' is one of 'selectedValues'.
 * An empty selection keeps every row.
 */
public class FilterField {
    private String field;
    private List<String> selectedValues = new ArrayList<>();

    public FilterField() {
    }

    public FilterField(String field, List<String> selectedValues) {
        this.field = field;
        this.selectedValues = selectedValues;
    }

    public String getField() {
        return field;
    }

    public List<String> getSelectedValues() {
        return selectedValues;
    }

    public void setField(String field) {
        this.field = field;
    }

    public void setSelectedValues(List<String> selectedValues) {
        this.selectedValues = selectedValues;
    }
}
