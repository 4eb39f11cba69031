package com.spreadsheet.engine.formula;

import java.util.List;

/**
 * Evaluated arguments of one function call. A slot holds a {@link Double},
 * a {@link String} or, for whole-range arguments, a {@link RangeValues}.
 */
final class Arguments {
    private final List<Object> values;

    Arguments(List<Object> values) {
        this.values = values;
    }

    int size() {
        return values.size();
    }

    boolean has(int index) {
        return index < values.size();
    }

    List<Object> all() {
        return values;
    }

    Object raw(int index) {
        return has(index) ? values.get(index) : "";
    }

    /** Slot read as a single value; a range collapses to its sum. */
    Object scalar(int index) {
        Object value = raw(index);
        return value instanceof RangeValues ? ((RangeValues) value).sum() : value;
    }

    /** Slot read as a range; a scalar becomes a 1x1 range. */
    RangeValues range(int index) {
        Object value = raw(index);
        if (value instanceof RangeValues) {
            return (RangeValues) value;
        }
        return RangeValues.single(Values.toText(value));
    }

    /** Numeric slot; a missing or empty argument takes the default. */
    double number(int index, double defaultValue) {
        Object value = scalar(index);
        if (!has(index) || "".equals(value)) {
            return defaultValue;
        }
        return Values.toNumber(value);
    }

    String text(int index, String defaultValue) {
        return has(index) ? Values.toText(scalar(index)) : defaultValue;
    }

    /** Left-most error among the scalar readings of every slot, or null. */
    Object firstError() {
        for (int i = 0; i < values.size(); i++) {
            Object value = scalar(i);
            if (Values.isError(value)) {
                return value;
            }
        }
        return null;
    }
}
