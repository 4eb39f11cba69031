package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.FormulaError;

import java.util.*;

/**
 * Grid-producing functions. Scalar evaluation of these functions reads
 * element [0][0] of the same grid, so both modes always agree.
 */
final class ArrayFunctions {

    static final int MAX_SEQUENCE_CELLS = 1_000_000;

    private ArrayFunctions() {}

    static List<List<String>> compute(FunctionName fn, Arguments args) {
        List<List<String>> grid;
        switch (fn) {
            case SEQUENCE:
                grid = sequence(args);
                break;
            case UNIQUE:
                grid = unique(args);
                break;
            case SORT:
                grid = sort(args);
                break;
            case FILTER:
                grid = filter(args);
                break;
            case TRANSPOSE:
                grid = transpose(args);
                break;
            case FLATTEN:
                grid = flatten(args);
                break;
            case ARRAYFORMULA:
                grid = args.range(0).toGrid();
                break;
            case MAP:
                grid = map(args);
                break;
            default:
                throw new IllegalArgumentException(fn + " does not produce a grid");
        }
        return normalize(grid);
    }

    static List<List<String>> error(FormulaError error) {
        return single(error.text());
    }

    static List<List<String>> single(String value) {
        List<List<String>> grid = new ArrayList<>();
        grid.add(new ArrayList<>(List.of(value)));
        return grid;
    }

    // ------------------------
    // Individual functions
    // ------------------------

    private static List<List<String>> sequence(Arguments args) {
        Object error = args.firstError();
        if (error != null) {
            return single(error.toString());
        }
        double rows = Math.floor(args.number(0, 1));
        double cols = Math.floor(args.number(1, 1));
        double start = args.number(2, 1);
        double step = args.number(3, 1);
        if (!(rows >= 1) || !(cols >= 1) || rows * cols > MAX_SEQUENCE_CELLS) {
            return error(FormulaError.VALUE);
        }
        List<List<String>> grid = new ArrayList<>();
        for (int r = 0; r < (int) rows; r++) {
            List<String> row = new ArrayList<>();
            for (int c = 0; c < (int) cols; c++) {
                row.add(Values.format(start + (r * cols + c) * step));
            }
            grid.add(row);
        }
        return grid;
    }

    private static List<List<String>> unique(Arguments args) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String value : args.range(0).getValues()) {
            if (!value.isEmpty()) {
                distinct.add(value);
            }
        }
        return column(distinct);
    }

    private static List<List<String>> sort(Arguments args) {
        RangeValues range = args.range(0);
        Object error = Operators.firstError(args.scalar(1), args.scalar(2));
        if (error != null) {
            return single(error.toString());
        }
        int sortCol = (int) Math.floor(args.number(1, 1));
        boolean ascending = !args.has(2) || "".equals(args.scalar(2)) || Values.isTruthy(args.scalar(2));
        if (sortCol < 1 || sortCol > range.getColCount()) {
            return error(FormulaError.VALUE);
        }
        List<List<String>> rows = new ArrayList<>();
        for (List<String> row : range.toGrid()) {
            if (!isBlankRow(row)) {
                rows.add(row);
            }
        }
        int index = sortCol - 1;
        Comparator<List<String>> byColumn =
                (a, b) -> Values.compare(Values.fromCell(a.get(index)), Values.fromCell(b.get(index)));
        rows.sort(ascending ? byColumn : byColumn.reversed());
        return rows;
    }

    private static List<List<String>> filter(Arguments args) {
        RangeValues range = args.range(0);
        RangeValues condition = args.range(1);
        CriteriaMatcher criteria = args.has(2) ? CriteriaMatcher.of(args.scalar(2)) : null;
        List<String> conditions = condition.getValues();

        List<List<String>> kept = new ArrayList<>();
        for (int r = 0; r < range.getRowCount(); r++) {
            String flag = r < conditions.size() ? conditions.get(r) : "";
            boolean keep = criteria != null ? criteria.matches(flag) : isTrueFlag(flag);
            if (keep) {
                kept.add(new ArrayList<>(range.getRow(r)));
            }
        }
        if (kept.isEmpty()) {
            return error(FormulaError.NA);
        }
        return kept;
    }

    private static List<List<String>> transpose(Arguments args) {
        RangeValues range = args.range(0);
        List<List<String>> grid = new ArrayList<>();
        for (int c = 0; c < range.getColCount(); c++) {
            List<String> row = new ArrayList<>();
            for (int r = 0; r < range.getRowCount(); r++) {
                row.add(range.get(r, c));
            }
            grid.add(row);
        }
        return grid;
    }

    private static List<List<String>> flatten(Arguments args) {
        List<String> values = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            for (String value : args.range(i).getValues()) {
                if (!value.isEmpty()) {
                    values.add(value);
                }
            }
        }
        return column(values);
    }

    private static List<List<String>> map(Arguments args) {
        RangeValues range = args.range(0);
        String op = args.text(1, "").trim().toUpperCase(Locale.ROOT);
        if (!isKnownMapOperation(op)) {
            return error(FormulaError.VALUE);
        }
        List<List<String>> grid = new ArrayList<>();
        for (int r = 0; r < range.getRowCount(); r++) {
            List<String> row = new ArrayList<>();
            for (String value : range.getRow(r)) {
                row.add(value.isEmpty() ? "" : Values.toText(mapValue(op, Values.fromCell(value))));
            }
            grid.add(row);
        }
        return grid;
    }

    /**
     * Folds the numeric members of a range onto an initial value with SUM
     * ("+"), PRODUCT ("*"), MAX or MIN. Unknown or missing operations sum.
     */
    static Object reduce(Arguments args) {
        Object initial = args.scalar(0);
        if (Values.isError(initial)) {
            return initial;
        }
        String op = args.text(2, "SUM").trim().toUpperCase(Locale.ROOT);
        double acc = Values.toNumber(initial);
        for (String raw : args.range(1).getValues()) {
            if (Values.isError(raw)) {
                return raw;
            }
            Double value = Values.tryNumber(raw);
            if (value == null) {
                continue;
            }
            switch (op) {
                case "PRODUCT":
                case "*":
                    acc *= value;
                    break;
                case "MAX":
                    acc = Math.max(acc, value);
                    break;
                case "MIN":
                    acc = Math.min(acc, value);
                    break;
                default:
                    acc += value;
                    break;
            }
        }
        return acc;
    }

    // ------------------------
    // Helpers
    // ------------------------

    private static boolean isKnownMapOperation(String op) {
        switch (op) {
            case "ABS":
            case "SQRT":
            case "INT":
            case "UPPER":
            case "LOWER":
            case "TRIM":
            case "LEN":
            case "NOT":
                return true;
            default:
                return op.length() > 1
                        && Operators.isArithmetic(op.substring(0, 1))
                        && Values.tryNumber(op.substring(1)) != null;
        }
    }

    private static Object mapValue(String op, Object value) {
        if (Values.isError(value)) {
            return value;
        }
        switch (op) {
            case "ABS":
                return Math.abs(Values.toNumber(value));
            case "SQRT":
                return Math.sqrt(Values.toNumber(value));
            case "INT":
                return Math.floor(Values.toNumber(value));
            case "UPPER":
                return Values.toText(value).toUpperCase(Locale.ROOT);
            case "LOWER":
                return Values.toText(value).toLowerCase(Locale.ROOT);
            case "TRIM":
                return Values.toText(value).trim();
            case "LEN":
                return (double) Values.toText(value).length();
            case "NOT":
                return Values.bool(!Values.isTruthy(value));
            default:
                return Operators.arithmetic(op.substring(0, 1), value, Values.tryNumber(op.substring(1)));
        }
    }

    private static boolean isTrueFlag(String flag) {
        if (flag.isEmpty() || "FALSE".equalsIgnoreCase(flag)) {
            return false;
        }
        Double number = Values.tryNumber(flag);
        return number == null || number != 0;
    }

    private static boolean isBlankRow(List<String> row) {
        for (String value : row) {
            if (!value.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static List<List<String>> column(Collection<String> values) {
        List<List<String>> grid = new ArrayList<>();
        for (String value : values) {
            grid.add(new ArrayList<>(List.of(value)));
        }
        return grid;
    }

    // an empty result still occupies its anchor
    private static List<List<String>> normalize(List<List<String>> grid) {
        if (grid.isEmpty() || grid.get(0).isEmpty()) {
            return single("");
        }
        return grid;
    }
}
