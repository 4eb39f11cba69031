package com.spreadsheet.engine.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An array formula's placement on the grid: the anchor, the computed result,
 * every cell the result covers, and the cell blocking the spill (if any).
 */
public class SpillRange {
    private final String sourceCell;
    private final ArrayResult result;
    private final List<String> footprint;
    private final String blockedBy;
    // footprint cell -> value, in the row-major order the footprint was enumerated
    private final Map<String, String> valuesByCell;

    public SpillRange(String sourceCell, ArrayResult result, List<String> footprint, String blockedBy) {
        this.sourceCell = sourceCell;
        this.result = result;
        this.footprint = List.copyOf(footprint);
        this.blockedBy = blockedBy;

        Map<String, String> byCell = new LinkedHashMap<>();
        int i = 0;
        for (List<String> row : result.getValues()) {
            for (String value : row) {
                if (i < this.footprint.size()) {
                    byCell.put(this.footprint.get(i++), value);
                }
            }
        }
        this.valuesByCell = Collections.unmodifiableMap(byCell);
    }

    public String getSourceCell() {
        return sourceCell;
    }

    public ArrayResult getResult() {
        return result;
    }

    public List<String> getFootprint() {
        return footprint;
    }

    public String getBlockedBy() {
        return blockedBy;
    }

    public boolean isBlocked() {
        return blockedBy != null;
    }

    public boolean covers(String cellId) {
        return valuesByCell.containsKey(cellId);
    }

    /**
     * Spilled value shown at the given footprint cell, or null when the
     * spill is blocked or the cell lies outside the footprint.
     */
    public String spilledValueAt(String cellId) {
        return isBlocked() ? null : valuesByCell.get(cellId);
    }
}
