package com.spreadsheet.engine.pivot;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.List;
import java.util.Locale;

/**
 * How a pivot bucket of numbers is reduced to one value:
 * SUM, COUNT, AVERAGE, MIN, MAX. An empty bucket is always 0.
 */
public enum AggregationType {
    SUM,
    COUNT,
    AVERAGE,
    MIN,
    MAX;

    /**
     * Allows case-insensitive JSON input, e.g. "sum" -> SUM.
     */
    @JsonCreator
    public static AggregationType fromValue(String value) {
        return AggregationType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public double aggregate(List<Double> values) {
        if (values.isEmpty()) {
            return 0;
        }
        switch (this) {
            case COUNT:
                return values.size();
            case AVERAGE:
                return sum(values) / values.size();
            case MIN:
                double min = Double.POSITIVE_INFINITY;
                for (double v : values) {
                    min = Math.min(min, v);
                }
                return min;
            case MAX:
                double max = Double.NEGATIVE_INFINITY;
                for (double v : values) {
                    max = Math.max(max, v);
                }
                return max;
            case SUM:
            default:
                return sum(values);
        }
    }

    private static double sum(List<Double> values) {
        double total = 0;
        for (double v : values) {
            total += v;
        }
        return total;
    }
}
