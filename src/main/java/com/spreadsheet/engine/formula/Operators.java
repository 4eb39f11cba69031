package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.FormulaError;

/**
 * Binary operator semantics. For every operator the left-most error operand
 * is the result.
 */
final class Operators {

    private Operators() {}

    static boolean isArithmetic(String op) {
        switch (op) {
            case "+":
            case "-":
            case "*":
            case "/":
            case "^":
                return true;
            default:
                return false;
        }
    }

    static boolean isComparison(String op) {
        switch (op) {
            case "=":
            case "==":
            case "<":
            case ">":
            case "<=":
            case ">=":
            case "<>":
            case "!=":
                return true;
            default:
                return false;
        }
    }

    static boolean isBinary(String op) {
        return isArithmetic(op) || isComparison(op) || "&".equals(op);
    }

    static Object apply(String op, Object left, Object right) {
        if ("&".equals(op)) {
            return concat(left, right);
        }
        if (isComparison(op)) {
            return compare(op, left, right);
        }
        return arithmetic(op, left, right);
    }

    static Object arithmetic(String op, Object left, Object right) {
        Object error = firstError(left, right);
        if (error != null) {
            return error;
        }
        double l = Values.toNumber(left);
        double r = Values.toNumber(right);
        switch (op) {
            case "+":
                return l + r;
            case "-":
                return l - r;
            case "*":
                return l * r;
            case "/":
                return r == 0 ? FormulaError.DIV0.text() : l / r;
            case "^":
                return Math.pow(l, r);
            default:
                throw new FormulaParseException("Unknown arithmetic operator " + op);
        }
    }

    static Object concat(Object left, Object right) {
        Object error = firstError(left, right);
        if (error != null) {
            return error;
        }
        return Values.toText(left) + Values.toText(right);
    }

    static Object compare(String op, Object left, Object right) {
        Object error = firstError(left, right);
        if (error != null) {
            return error;
        }
        boolean notEqual = "<>".equals(op) || "!=".equals(op);
        if (isNaN(left) || isNaN(right)) {
            return Values.bool(notEqual);
        }
        int cmp = Values.compare(left, right);
        switch (op) {
            case "=":
            case "==":
                return Values.bool(cmp == 0);
            case "<>":
            case "!=":
                return Values.bool(cmp != 0);
            case "<":
                return Values.bool(cmp < 0);
            case ">":
                return Values.bool(cmp > 0);
            case "<=":
                return Values.bool(cmp <= 0);
            case ">=":
                return Values.bool(cmp >= 0);
            default:
                throw new FormulaParseException("Unknown comparison operator " + op);
        }
    }

    static Object negate(Object value) {
        if (Values.isError(value)) {
            return value;
        }
        return -Values.toNumber(value);
    }

    static Object firstError(Object left, Object right) {
        if (Values.isError(left)) {
            return left;
        }
        return Values.isError(right) ? right : null;
    }

    private static boolean isNaN(Object value) {
        Double number = Values.tryNumber(value);
        return number != null && number.isNaN();
    }
}
