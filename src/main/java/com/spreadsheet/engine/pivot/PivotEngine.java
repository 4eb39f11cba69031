package com.spreadsheet.engine.pivot;

import com.spreadsheet.engine.formula.CellReferences;
import com.spreadsheet.engine.formula.FormulaEngine;
import com.spreadsheet.engine.models.CellRef;
import com.spreadsheet.engine.models.Sheet;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Groups tabular records by row and column fields and aggregates the value
 * fields of every (row key, column key) bucket.
 *
 * Records are plain maps of field name to text; a field a record lacks reads
 * as "". Values that are not numbers aggregate as 0.
 */
public class PivotEngine {

    public static final String GRAND_TOTAL = "Grand Total";

    private static final String KEY_SEPARATOR = "|||";
    private static final Pattern LEADING_NUMBER =
            Pattern.compile("^\\s*([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)");

    public PivotResult buildPivot(List<Map<String, String>> data, PivotConfig config) {
        List<Map<String, String>> filtered = applyFilters(data, config.getFilterFields());
        List<String> rowFields = config.getRowFields();
        List<String> colFields = config.getColFields();
        List<ValueField> valueFields = config.getValueFields();
        // a field aggregated two ways is still read once per record
        Set<String> valueFieldNames = new LinkedHashSet<>();
        for (ValueField vf : valueFields) {
            valueFieldNames.add(vf.getField());
        }

        Map<String, List<String>> rowKeyMap = new LinkedHashMap<>();
        Map<String, List<String>> colKeyMap = new LinkedHashMap<>();
        // row key -> column key -> value field -> numbers
        Map<String, Map<String, Map<String, List<Double>>>> buckets = new LinkedHashMap<>();

        for (Map<String, String> record : filtered) {
            String rk = groupKey(record, rowFields);
            String ck = groupKey(record, colFields);
            rowKeyMap.computeIfAbsent(rk, k -> keyValues(record, rowFields));
            colKeyMap.computeIfAbsent(ck, k -> keyValues(record, colFields));

            Map<String, List<Double>> bucket = buckets
                    .computeIfAbsent(rk, k -> new LinkedHashMap<>())
                    .computeIfAbsent(ck, k -> new LinkedHashMap<>());
            for (String field : valueFieldNames) {
                bucket.computeIfAbsent(field, k -> new ArrayList<>()).add(toNumber(record.get(field)));
            }
        }

        List<List<String>> rowKeys = sortedKeys(rowKeyMap.values());
        List<List<String>> colKeys = sortedKeys(colKeyMap.values());
        boolean hasColumns = !colFields.isEmpty();

        List<String> headers = buildHeaders(config, colKeys);
        List<List<String>> rows = new ArrayList<>();
        // column key + value field -> numbers, for the grand total row
        Map<String, List<Double>> columnTotals = new LinkedHashMap<>();

        for (List<String> rowKey : rowKeys) {
            List<String> row = new ArrayList<>(rowKey);
            Map<String, Map<String, List<Double>>> rowBucket =
                    buckets.getOrDefault(String.join(KEY_SEPARATOR, rowKey), Collections.emptyMap());

            if (hasColumns) {
                Map<String, List<Double>> rowTotals = new LinkedHashMap<>();
                for (List<String> colKey : colKeys) {
                    String ck = String.join(KEY_SEPARATOR, colKey);
                    Map<String, List<Double>> bucket = rowBucket.getOrDefault(ck, Collections.emptyMap());
                    for (ValueField vf : valueFields) {
                        List<Double> values = bucket.getOrDefault(vf.getField(), Collections.emptyList());
                        row.add(aggregate(values, vf));
                        rowTotals.computeIfAbsent(vf.getField(), k -> new ArrayList<>()).addAll(values);
                        columnTotals.computeIfAbsent(ck + KEY_SEPARATOR + vf.getField(), k -> new ArrayList<>())
                                .addAll(values);
                    }
                }
                if (config.isShowGrandTotals()) {
                    for (ValueField vf : valueFields) {
                        row.add(aggregate(rowTotals.getOrDefault(vf.getField(), Collections.emptyList()), vf));
                    }
                }
            } else {
                for (ValueField vf : valueFields) {
                    row.add(aggregate(collect(rowBucket.values(), vf.getField()), vf));
                }
            }
            rows.add(row);
        }

        if (config.isShowGrandTotals()) {
            rows.add(grandTotalRow(config, colKeys, columnTotals, buckets));
        }
        return new PivotResult(headers, rows, rowKeys, colKeys);
    }

    /**
     * Reads a rectangular range of a sheet as records. The first row holds
     * the field names (a blank header becomes the column letter); every later
     * row with at least one non-blank value becomes a record. Computed values
     * are used for formula cells.
     */
    public SourceData extractDataFromRange(Sheet sheet, String range) {
        CellRef[] corners = CellReferences.parseRange(range);
        if (!CellReferences.isWithinLimit(corners)) {
            return new SourceData(Collections.emptyList(), Collections.emptyList());
        }
        int minCol = corners[0].getCol();
        int minRow = corners[0].getRow();
        int maxCol = corners[1].getCol();
        int maxRow = corners[1].getRow();

        List<String> headers = new ArrayList<>();
        for (int c = minCol; c <= maxCol; c++) {
            String value = sheet.getValue(CellReferences.cellId(c, minRow));
            headers.add(value.isEmpty() ? CellReferences.indexToCol(c) : value);
        }

        List<Map<String, String>> data = new ArrayList<>();
        for (int r = minRow + 1; r <= maxRow; r++) {
            Map<String, String> record = new LinkedHashMap<>();
            boolean hasData = false;
            for (int c = minCol; c <= maxCol; c++) {
                String value = sheet.getValue(CellReferences.cellId(c, r));
                record.put(headers.get(c - minCol), value);
                if (!value.isEmpty()) {
                    hasData = true;
                }
            }
            if (hasData) {
                data.add(record);
            }
        }
        return new SourceData(headers, data);
    }

    // ------------------------
    // Internal helpers
    // ------------------------

    private static List<Map<String, String>> applyFilters(List<Map<String, String>> data, List<FilterField> filters) {
        List<Map<String, String>> filtered = data;
        for (FilterField filter : filters) {
            List<String> selected = filter.getSelectedValues();
            if (selected == null || selected.isEmpty()) {
                continue;
            }
            Set<String> allowed = new HashSet<>(selected);
            List<Map<String, String>> kept = new ArrayList<>();
            for (Map<String, String> record : filtered) {
                if (allowed.contains(record.getOrDefault(filter.getField(), ""))) {
                    kept.add(record);
                }
            }
            filtered = kept;
        }
        return filtered;
    }

    private static List<String> buildHeaders(PivotConfig config, List<List<String>> colKeys) {
        List<String> headers = new ArrayList<>(config.getRowFields());
        if (!config.getColFields().isEmpty()) {
            for (List<String> colKey : colKeys) {
                String label = String.join(" / ", colKey);
                for (ValueField vf : config.getValueFields()) {
                    headers.add(label.isEmpty() ? valueHeader(vf) : valueHeader(vf) + " - " + label);
                }
            }
            if (config.isShowGrandTotals()) {
                for (ValueField vf : config.getValueFields()) {
                    headers.add(vf.getField() + " " + GRAND_TOTAL);
                }
            }
        } else {
            for (ValueField vf : config.getValueFields()) {
                headers.add(valueHeader(vf));
            }
        }
        return headers;
    }

    private static List<String> grandTotalRow(PivotConfig config, List<List<String>> colKeys,
                                              Map<String, List<Double>> columnTotals,
                                              Map<String, Map<String, Map<String, List<Double>>>> buckets) {
        List<String> row = new ArrayList<>();
        for (int i = 0; i < config.getRowFields().size(); i++) {
            row.add(i == 0 ? GRAND_TOTAL : "");
        }
        if (!config.getColFields().isEmpty()) {
            for (List<String> colKey : colKeys) {
                String ck = String.join(KEY_SEPARATOR, colKey);
                for (ValueField vf : config.getValueFields()) {
                    row.add(aggregate(columnTotals.getOrDefault(ck + KEY_SEPARATOR + vf.getField(),
                            Collections.emptyList()), vf));
                }
            }
            for (ValueField vf : config.getValueFields()) {
                List<Double> all = new ArrayList<>();
                for (Map.Entry<String, List<Double>> entry : columnTotals.entrySet()) {
                    if (entry.getKey().endsWith(KEY_SEPARATOR + vf.getField())) {
                        all.addAll(entry.getValue());
                    }
                }
                row.add(aggregate(all, vf));
            }
        } else {
            for (ValueField vf : config.getValueFields()) {
                List<Double> all = new ArrayList<>();
                for (Map<String, Map<String, List<Double>>> rowBucket : buckets.values()) {
                    all.addAll(collect(rowBucket.values(), vf.getField()));
                }
                row.add(aggregate(all, vf));
            }
        }
        return row;
    }

    private static List<Double> collect(Collection<Map<String, List<Double>>> columnBuckets, String field) {
        List<Double> values = new ArrayList<>();
        for (Map<String, List<Double>> bucket : columnBuckets) {
            values.addAll(bucket.getOrDefault(field, Collections.emptyList()));
        }
        return values;
    }

    private static String aggregate(List<Double> values, ValueField vf) {
        AggregationType type = vf.getAggregation() == null ? AggregationType.SUM : vf.getAggregation();
        return FormulaEngine.formatNumber(type.aggregate(values));
    }

    private static String valueHeader(ValueField vf) {
        AggregationType type = vf.getAggregation() == null ? AggregationType.SUM : vf.getAggregation();
        return vf.getField() + " (" + type.name() + ")";
    }

    private static String groupKey(Map<String, String> record, List<String> fields) {
        return String.join(KEY_SEPARATOR, keyValues(record, fields));
    }

    private static List<String> keyValues(Map<String, String> record, List<String> fields) {
        List<String> values = new ArrayList<>(fields.size());
        for (String field : fields) {
            values.add(record.getOrDefault(field, ""));
        }
        return values;
    }

    private static List<List<String>> sortedKeys(Collection<List<String>> keys) {
        List<List<String>> sorted = new ArrayList<>(keys);
        sorted.sort(Comparator.comparing((List<String> key) -> String.join("", key)));
        return sorted;
    }

    // leading numeric prefix, so "12 units" counts as 12
    static double toNumber(String text) {
        if (text == null) {
            return 0;
        }
        Matcher m = LEADING_NUMBER.matcher(text);
        if (m.find()) {
            return Double.parseDouble(m.group(1));
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("Infinity") || trimmed.startsWith("+Infinity")) {
            return Double.POSITIVE_INFINITY;
        }
        if (trimmed.startsWith("-Infinity")) {
            return Double.NEGATIVE_INFINITY;
        }
        return 0;
    }

    /**
     * Header row and records read from a sheet range.
     */
    public static class SourceData {
        private final List<String> headers;
        private final List<Map<String, String>> data;

        public SourceData(List<String> headers, List<Map<String, String>> data) {
            this.headers = headers;
            this.data = data;
        }

        public List<String> getHeaders() {
            return headers;
        }

        public List<Map<String, String>> getData() {
            return data;
        }
    }
}
