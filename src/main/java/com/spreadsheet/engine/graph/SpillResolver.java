package com.spreadsheet.engine.graph;

import com.spreadsheet.engine.formula.CellReferences;
import com.spreadsheet.engine.models.ArrayResult;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellRef;
import com.spreadsheet.engine.models.SpillRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Places array results on the grid: which cells a result covers, and
 * which occupied cell (if any) keeps it from spilling.
 */
public class SpillResolver {

    /**
     * Footprint of a result anchored at 'sourceCell', row-major, anchor first.
     * Empty when the anchor is not a valid cell reference.
     */
    public List<String> getSpillRange(String sourceCell, ArrayResult result) {
        CellRef anchor = CellReferences.parseCellRef(sourceCell);
        if (anchor == null) {
            return Collections.emptyList();
        }
        List<String> footprint = new ArrayList<>();
        for (int r = 0; r < result.getRowCount(); r++) {
            for (int c = 0; c < result.getColCount(); c++) {
                footprint.add(CellReferences.cellId(anchor.getCol() + c, anchor.getRow() + r));
            }
        }
        return footprint;
    }

    /**
     * First footprint cell, anchor excluded, that already holds a value or a
     * formula; null when the result can spill.
     */
    public String checkSpillConflict(String sourceCell, ArrayResult result, Map<String, Cell> existingCells) {
        return checkSpillConflict(sourceCell, result, existingCells, Collections.emptyMap());
    }

    /**
     * Same as above, but a cell already showing another anchor's spilled
     * value blocks too. Blocked spills show nothing and never block.
     */
    public String checkSpillConflict(String sourceCell, ArrayResult result, Map<String, Cell> existingCells,
                                     Map<String, SpillRange> activeSpills) {
        String anchor = CellReferences.normalize(sourceCell);
        for (String id : getSpillRange(sourceCell, result)) {
            if (id.equals(anchor)) {
                continue;
            }
            Cell cell = existingCells.get(id);
            if (cell != null && cell.isOccupied()) {
                return id;
            }
            for (SpillRange other : activeSpills.values()) {
                if (!other.getSourceCell().equals(anchor) && other.spilledValueAt(id) != null) {
                    return id;
                }
            }
        }
        return null;
    }
}
