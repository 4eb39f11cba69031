package com.spreadsheet.engine.pivot;

/**
 * A source column to aggregate, e.g. { "field": "Sales", "aggregation": "SUM" }.
 */
public class ValueField {
    private String field;
    private AggregationType aggregation = AggregationType.SUM;

    // Default constructor needed for JSON (de)serialization
    public ValueField() {
    }

    public ValueField(String field, AggregationType aggregation) {
        this.field = field;
        this.aggregation = aggregation;
    }

    public String getField() {
        return field;
    }

    public AggregationType getAggregation() {
        return aggregation;
    }

    public void setField(String field) {
        this.field = field;
    }

    public void setAggregation(AggregationType aggregation) {
        this.aggregation = aggregation;
    }
}
