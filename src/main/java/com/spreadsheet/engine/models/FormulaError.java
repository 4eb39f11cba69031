package com.spreadsheet.engine.models;

/**
 * The closed set of error sentinels a formula can evaluate to.
 * Errors are ordinary cell values: they flow through operators and
 * function arguments instead of being thrown.
 */
public enum FormulaError {
    REF("#REF!"),
    NAME("#NAME?"),
    VALUE("#VALUE!"),
    DIV0("#DIV/0!"),
    NA("#N/A"),
    NULL("#NULL!"),
    SPILL("#SPILL!"),
    CIRCULAR("#CIRCULAR!"),
    ERROR("#ERROR!");

    private final String text;

    FormulaError(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    /**
     * Shape test used by the error-checking UI: starts with '#' and ends
     * with '!' or '?'. Note that "#N/A" does not match this shape.
     */
    public static boolean matchesErrorShape(String value) {
        return value != null
                && value.startsWith("#")
                && (value.endsWith("!") || value.endsWith("?"));
    }

    /**
     * True for any value the evaluator treats as an error operand:
     * everything that matches the shape, plus "#N/A".
     */
    public static boolean isErrorValue(String value) {
        return matchesErrorShape(value) || NA.text.equals(value);
    }
}
