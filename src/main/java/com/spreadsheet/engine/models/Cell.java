package com.spreadsheet.engine.models;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - rawValue, exactly what the user typed ("42", "hello", "=A1+1", "{=SEQUENCE(3)}")
 * - formula, the same text when it is a formula, otherwise null
 * - cachedComputed, the last evaluation result of a formula cell
 * - format, an opaque cell-local formatting payload kept for persistence
 */
public class Cell {
    private String rawValue;
    private String formula;
    // only meaningful while the cell's dependency-graph entry is current
    private String cachedComputed;
    private String format;

    public Cell(String rawValue) {
        setRawValue(rawValue);
    }

    public String getRawValue() {
        return rawValue;
    }

    /**
     * Replaces the content and drops any cached result.
     */
    public void setRawValue(String rawValue) {
        this.rawValue = rawValue == null ? "" : rawValue;
        this.formula = isFormulaText(this.rawValue) ? this.rawValue : null;
        this.cachedComputed = null;
    }

    public String getFormula() {
        return formula;
    }

    public boolean isFormula() {
        return formula != null;
    }

    public boolean isArrayFormula() {
        return formula != null && formula.startsWith("{=") && formula.endsWith("}");
    }

    public String getCachedComputed() {
        return cachedComputed;
    }

    public void setCachedComputed(String cachedComputed) {
        if (formula == null) {
            throw new IllegalStateException("Plain cells never hold a computed value");
        }
        this.cachedComputed = cachedComputed;
    }

    /**
     * Marks the cached result stale. Called whenever the cell's
     * dependency-graph entry is rewritten.
     */
    public void invalidate() {
        this.cachedComputed = null;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    /**
     * The value other cells and the UI see: the computed result for formulas,
     * the literal text otherwise.
     */
    public String getDisplayValue() {
        if (formula == null) {
            return rawValue;
        }
        return cachedComputed == null ? "" : cachedComputed;
    }

    /**
     * True when the cell occupies grid space, i.e. it would block a spill.
     */
    public boolean isOccupied() {
        return formula != null || !rawValue.isEmpty();
    }

    static boolean isFormulaText(String text) {
        return text.startsWith("=") || (text.startsWith("{=") && text.endsWith("}"));
    }
}
