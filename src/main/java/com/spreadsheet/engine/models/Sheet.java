package com.spreadsheet.engine.models;

import com.spreadsheet.engine.graph.DependencyGraph;

import java.util.*;

/**
 * Represents one worksheet:
 * - A name, unique inside its workbook
 * - A map of cellId ("B3") -> Cell, in insertion order
 * - The dependency graph of its formula cells
 * - The spill placements of its array formulas, keyed by anchor
 * - The formula cells currently parked as circular
 */
public class Sheet {

    private final String name;
    private final Map<String, Cell> cells = new LinkedHashMap<>();
    private final DependencyGraph graph = new DependencyGraph();
    private final Map<String, SpillRange> spills = new LinkedHashMap<>();
    private final Set<String> circularCells = new LinkedHashSet<>();

    public Sheet(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Map<String, Cell> getCells() {
        return cells;
    }

    public Cell getCell(String cellId) {
        return cells.get(cellId);
    }

    public void setCell(String cellId, Cell cell) {
        cells.put(cellId, cell);
    }

    public Cell removeCell(String cellId) {
        return cells.remove(cellId);
    }

    /**
     * Cell getter used by formulas: the cell's own value when it holds
     * anything, else the value spilled into it, else "".
     */
    public String getValue(String cellId) {
        Cell cell = cells.get(cellId);
        if (cell != null && cell.isOccupied()) {
            return cell.getDisplayValue();
        }
        for (SpillRange spill : spills.values()) {
            String spilled = spill.spilledValueAt(cellId);
            if (spilled != null) {
                return spilled;
            }
        }
        return "";
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    // ------------------------
    // Spills
    // ------------------------

    public Map<String, SpillRange> getSpills() {
        return Collections.unmodifiableMap(spills);
    }

    public void putSpill(SpillRange spill) {
        spills.put(spill.getSourceCell(), spill);
    }

    public SpillRange removeSpill(String anchor) {
        return spills.remove(anchor);
    }

    /**
     * Anchor of a spill (active or blocked) whose footprint contains the cell,
     * the anchor itself excluded; null when none does.
     */
    public String findSpillAnchorCovering(String cellId) {
        for (SpillRange spill : spills.values()) {
            if (!spill.getSourceCell().equals(cellId) && spill.covers(cellId)) {
                return spill.getSourceCell();
            }
        }
        return null;
    }

    // ------------------------
    // Circular bookkeeping
    // ------------------------

    public Set<String> getCircularCells() {
        return Collections.unmodifiableSet(circularCells);
    }

    public void markCircular(String cellId) {
        circularCells.add(cellId);
    }

    public void clearCircular(String cellId) {
        circularCells.remove(cellId);
    }
}
