package com.spreadsheet.engine.formula;

import java.util.regex.Pattern;

/**
 * Criteria of the COUNTIF family: "&gt;=10", "&lt;&gt;done", "=apple", "a*",
 * or a plain value compared for equality.
 */
final class CriteriaMatcher {

    private enum Kind { GREATER_EQUAL, LESS_EQUAL, NOT_EQUAL, GREATER, LESS, EQUAL, WILDCARD }

    private final Kind kind;
    private final String operand;
    private final Double number;
    private final Pattern wildcard;

    private CriteriaMatcher(Kind kind, String operand, Pattern wildcard) {
        this.kind = kind;
        this.operand = operand;
        this.number = Values.tryNumber(operand);
        this.wildcard = wildcard;
    }

    static CriteriaMatcher of(Object criteria) {
        String text = Values.toText(criteria);
        if (text.startsWith(">=")) {
            return new CriteriaMatcher(Kind.GREATER_EQUAL, text.substring(2), null);
        }
        if (text.startsWith("<=")) {
            return new CriteriaMatcher(Kind.LESS_EQUAL, text.substring(2), null);
        }
        if (text.startsWith("<>")) {
            return new CriteriaMatcher(Kind.NOT_EQUAL, text.substring(2), null);
        }
        if (text.startsWith(">")) {
            return new CriteriaMatcher(Kind.GREATER, text.substring(1), null);
        }
        if (text.startsWith("<")) {
            return new CriteriaMatcher(Kind.LESS, text.substring(1), null);
        }
        if (text.startsWith("=")) {
            return new CriteriaMatcher(Kind.EQUAL, text.substring(1), null);
        }
        if (text.contains("*") || text.contains("?")) {
            return new CriteriaMatcher(Kind.WILDCARD, text, toPattern(text));
        }
        return new CriteriaMatcher(Kind.EQUAL, text, null);
    }

    boolean matches(String cellValue) {
        String cell = cellValue == null ? "" : cellValue;
        switch (kind) {
            case GREATER_EQUAL:
                return number != null && numeric(cell) >= number;
            case LESS_EQUAL:
                return number != null && numeric(cell) <= number;
            case GREATER:
                return number != null && numeric(cell) > number;
            case LESS:
                return number != null && numeric(cell) < number;
            case NOT_EQUAL:
                return !Values.looselyEquals(cell, operand);
            case WILDCARD:
                return wildcard.matcher(cell).matches();
            case EQUAL:
            default:
                return Values.looselyEquals(cell, operand);
        }
    }

    // blank and non-numeric cells read as 0 against a relational operator
    private static double numeric(String cell) {
        Double value = Values.tryNumber(cell);
        return value == null ? 0 : value;
    }

    private static Pattern toPattern(String text) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : text.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }
}
