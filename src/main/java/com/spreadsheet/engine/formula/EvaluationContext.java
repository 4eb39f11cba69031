package com.spreadsheet.engine.formula;

import java.util.Collections;
import java.util.Map;

/**
 * Everything a formula may see besides its own sheet: the named ranges in
 * effect and an optional getter for cross-sheet references.
 */
public class EvaluationContext {

    public static final EvaluationContext EMPTY = new EvaluationContext(Collections.emptyMap(), null);

    private final Map<String, String> namedRanges;
    private final CrossSheetGetter crossSheetGetter;

    public EvaluationContext(Map<String, String> namedRanges, CrossSheetGetter crossSheetGetter) {
        this.namedRanges = namedRanges == null ? Collections.emptyMap() : namedRanges;
        this.crossSheetGetter = crossSheetGetter;
    }

    public Map<String, String> getNamedRanges() {
        return namedRanges;
    }

    public CrossSheetGetter getCrossSheetGetter() {
        return crossSheetGetter;
    }
}
