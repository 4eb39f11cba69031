package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.FormulaError;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Coercion rules shared by the evaluator. Intermediate values are either a
 * {@link Double} or a {@link String}; error sentinels are strings.
 */
final class Values {

    private static final Pattern NUMERIC =
            Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");

    private Values() {}

    static boolean isError(Object value) {
        return value instanceof String && FormulaError.isErrorValue((String) value);
    }

    static boolean isErrorOrNaN(Object value) {
        if (value instanceof Double) {
            return ((Double) value).isNaN();
        }
        return isError(value) || "NaN".equals(value);
    }

    /**
     * Strict numeric reading of text: the whole trimmed string must be a
     * decimal literal. Also accepts the special values this engine renders.
     */
    static Double tryNumber(String text) {
        if (text == null) {
            return null;
        }
        String t = text.trim();
        if (t.isEmpty()) {
            return null;
        }
        if (NUMERIC.matcher(t).matches()) {
            return Double.parseDouble(t);
        }
        switch (t) {
            case "NaN":
                return Double.NaN;
            case "Infinity":
                return Double.POSITIVE_INFINITY;
            case "-Infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                return null;
        }
    }

    static Double tryNumber(Object value) {
        if (value instanceof Double) {
            return (Double) value;
        }
        return value instanceof String ? tryNumber((String) value) : null;
    }

    /** What a cell reference evaluates to: a number when the text is numeric, the text otherwise. */
    static Object fromCell(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        Double number = tryNumber(raw);
        return number != null ? number : raw;
    }

    /** Arithmetic reading: non-numeric text counts as 0. */
    static double toNumber(Object value) {
        Double number = tryNumber(value);
        return number == null ? 0 : number;
    }

    static String toText(Object value) {
        if (value instanceof Double) {
            return format((Double) value);
        }
        return value == null ? "" : value.toString();
    }

    static boolean isTruthy(Object value) {
        if (value instanceof Double) {
            return (Double) value != 0;
        }
        return value != null && !value.toString().isEmpty();
    }

    static Double bool(boolean b) {
        return b ? 1.0 : 0.0;
    }

    /**
     * Shortest round-trip decimal text with no locale and no trailing ".0":
     * 14, 2.5, 0.30000000000000004, -2. Very large and very small magnitudes
     * use exponent form such as 1e+21 or 1.5e-7.
     */
    static String format(double d) {
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "Infinity" : "-Infinity";
        }
        if (d == 0) {
            return "0";
        }
        BigDecimal value = BigDecimal.valueOf(d).stripTrailingZeros();
        double magnitude = Math.abs(d);
        if (magnitude >= 1e-6 && magnitude < 1e21) {
            return value.toPlainString();
        }
        String digits = value.unscaledValue().abs().toString();
        int exponent = digits.length() - value.scale() - 1;
        StringBuilder sb = new StringBuilder();
        if (d < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent >= 0 ? '+' : '-').append(Math.abs(exponent));
        return sb.toString();
    }

    /**
     * Total order used by the comparison operators: numeric when both sides
     * are numeric (a blank against a number counts as 0), otherwise
     * case-insensitive lexicographic on the text forms.
     */
    static int compare(Object left, Object right) {
        Double l = numericForCompare(left, right);
        Double r = numericForCompare(right, left);
        if (l != null && r != null) {
            return Double.compare(l, r);
        }
        return toText(left).toLowerCase(Locale.ROOT).compareTo(toText(right).toLowerCase(Locale.ROOT));
    }

    /** Equality used by lookups and criteria: numeric when both are numeric, else case-insensitive text. */
    static boolean looselyEquals(Object left, Object right) {
        Double l = tryNumber(left);
        Double r = tryNumber(right);
        if (l != null && r != null) {
            return l.doubleValue() == r.doubleValue();
        }
        return toText(left).equalsIgnoreCase(toText(right));
    }

    private static Double numericForCompare(Object value, Object other) {
        Double number = tryNumber(value);
        if (number != null) {
            return number;
        }
        if ("".equals(value) && tryNumber(other) != null) {
            return 0.0;
        }
        return null;
    }
}
