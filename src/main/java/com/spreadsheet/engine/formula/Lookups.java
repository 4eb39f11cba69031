package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.FormulaError;

import java.util.ArrayList;
import java.util.List;

/**
 * Lookup and conditional-aggregate functions over {@link RangeValues}.
 * Lookups are exact: numeric equality when both sides are numeric,
 * case-insensitive text equality otherwise. An index outside the range
 * geometry is #REF!, a value that is not found is #N/A.
 */
final class Lookups {

    private Lookups() {}

    static Object vlookup(Arguments args) {
        Object error = scalarError(args, 0, 2);
        if (error != null) {
            return error;
        }
        Object key = args.scalar(0);
        RangeValues table = args.range(1);
        int col = (int) args.number(2, 1);
        if (col < 1 || col > table.getColCount()) {
            return FormulaError.REF.text();
        }
        for (int r = 0; r < table.getRowCount(); r++) {
            if (Values.looselyEquals(Values.fromCell(table.get(r, 0)), key)) {
                return Values.fromCell(table.get(r, col - 1));
            }
        }
        return FormulaError.NA.text();
    }

    static Object hlookup(Arguments args) {
        Object error = scalarError(args, 0, 2);
        if (error != null) {
            return error;
        }
        Object key = args.scalar(0);
        RangeValues table = args.range(1);
        int row = (int) args.number(2, 1);
        if (row < 1 || row > table.getRowCount()) {
            return FormulaError.REF.text();
        }
        for (int c = 0; c < table.getColCount(); c++) {
            if (Values.looselyEquals(Values.fromCell(table.get(0, c)), key)) {
                return Values.fromCell(table.get(row - 1, c));
            }
        }
        return FormulaError.NA.text();
    }

    static Object index(Arguments args) {
        Object error = scalarError(args, 1, 2);
        if (error != null) {
            return error;
        }
        RangeValues range = args.range(0);
        int row = (int) args.number(1, 1);
        int col = (int) args.number(2, 1);
        // INDEX(A1:E1, 3) addresses the third column of a single-row range
        if (range.getRowCount() == 1 && !args.has(2)) {
            col = row;
            row = 1;
        }
        if (row < 1 || col < 1 || row > range.getRowCount() || col > range.getColCount()) {
            return FormulaError.REF.text();
        }
        return Values.fromCell(range.get(row - 1, col - 1));
    }

    static Object match(Arguments args) {
        Object key = args.scalar(0);
        if (Values.isError(key)) {
            return key;
        }
        List<String> values = args.range(1).getValues();
        for (int i = 0; i < values.size(); i++) {
            if (Values.looselyEquals(Values.fromCell(values.get(i)), key)) {
                return (double) (i + 1);
            }
        }
        return FormulaError.NA.text();
    }

    // ------------------------
    // Conditional aggregates
    // ------------------------

    static Object countIf(Arguments args) {
        Object criteria = args.scalar(1);
        if (Values.isError(criteria)) {
            return criteria;
        }
        CriteriaMatcher matcher = CriteriaMatcher.of(criteria);
        int count = 0;
        for (String value : args.range(0).getValues()) {
            if (matcher.matches(value)) {
                count++;
            }
        }
        return (double) count;
    }

    /**
     * SUMIF and AVERAGEIF. The sum range defaults to the criteria range and
     * is read position by position. AVERAGEIF with no match is 0.
     */
    static Object sumIf(Arguments args, boolean average) {
        Object criteria = args.scalar(1);
        if (Values.isError(criteria)) {
            return criteria;
        }
        CriteriaMatcher matcher = CriteriaMatcher.of(criteria);
        List<String> tested = args.range(0).getValues();
        List<String> summed = args.has(2) ? args.range(2).getValues() : tested;
        double total = 0;
        int count = 0;
        for (int i = 0; i < tested.size(); i++) {
            if (!matcher.matches(tested.get(i))) {
                continue;
            }
            String raw = i < summed.size() ? summed.get(i) : "";
            if (Values.isError(raw)) {
                return raw;
            }
            total += Values.toNumber(raw);
            count++;
        }
        if (average) {
            return count == 0 ? 0.0 : total / count;
        }
        return total;
    }

    /** COUNTIFS(range1, criteria1, [range2, criteria2] ...). */
    static Object countIfs(Arguments args) {
        if (args.size() < 2 || args.size() % 2 != 0) {
            return FormulaError.VALUE.text();
        }
        List<boolean[]> masks = new ArrayList<>();
        Object error = criteriaMasks(args, 0, masks);
        if (error != null) {
            return error;
        }
        int count = 0;
        for (int i = 0; i < masks.get(0).length; i++) {
            if (allMatch(masks, i)) {
                count++;
            }
        }
        return (double) count;
    }

    /** SUMIFS(sumRange, range1, criteria1, [range2, criteria2] ...). */
    static Object sumIfs(Arguments args) {
        if (args.size() < 3 || (args.size() - 1) % 2 != 0) {
            return FormulaError.VALUE.text();
        }
        List<String> summed = args.range(0).getValues();
        List<boolean[]> masks = new ArrayList<>();
        Object error = criteriaMasks(args, 1, masks);
        if (error != null) {
            return error;
        }
        double total = 0;
        for (int i = 0; i < summed.size(); i++) {
            if (!allMatch(masks, i)) {
                continue;
            }
            if (Values.isError(summed.get(i))) {
                return summed.get(i);
            }
            total += Values.toNumber(summed.get(i));
        }
        return total;
    }

    private static Object criteriaMasks(Arguments args, int from, List<boolean[]> masks) {
        for (int i = from; i + 1 < args.size(); i += 2) {
            Object criteria = args.scalar(i + 1);
            if (Values.isError(criteria)) {
                return criteria;
            }
            CriteriaMatcher matcher = CriteriaMatcher.of(criteria);
            List<String> values = args.range(i).getValues();
            boolean[] mask = new boolean[values.size()];
            for (int j = 0; j < values.size(); j++) {
                mask[j] = matcher.matches(values.get(j));
            }
            masks.add(mask);
        }
        return null;
    }

    // positions past the end of a shorter range never match
    private static boolean allMatch(List<boolean[]> masks, int index) {
        for (boolean[] mask : masks) {
            if (index >= mask.length || !mask[index]) {
                return false;
            }
        }
        return true;
    }

    private static Object scalarError(Arguments args, int... slots) {
        for (int slot : slots) {
            Object value = args.scalar(slot);
            if (Values.isError(value)) {
                return value;
            }
        }
        return null;
    }
}
