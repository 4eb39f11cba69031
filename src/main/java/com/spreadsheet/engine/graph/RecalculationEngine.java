package com.spreadsheet.engine.graph;

import com.spreadsheet.engine.formula.CellReferences;
import com.spreadsheet.engine.formula.EvaluationContext;
import com.spreadsheet.engine.formula.FormulaEngine;
import com.spreadsheet.engine.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Keeps a sheet's computed values consistent after edits.
 *
 * Per edit: evaluate the edited cell, then every transitive dependent in
 * topological order. A formula that would close a cycle shows #CIRCULAR!,
 * loses its outgoing edges and is retried after every later edit until the
 * cycle is broken. Volatile formulas are refreshed after every edit.
 */
public class RecalculationEngine {

    private static final Logger log = LoggerFactory.getLogger(RecalculationEngine.class);

    public static final int DEFAULT_MAX_PASSES = 10;

    private final int maxPasses;
    private final SpillResolver spillResolver = new SpillResolver();

    public RecalculationEngine() {
        this(DEFAULT_MAX_PASSES);
    }

    public RecalculationEngine(int maxPasses) {
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be at least 1, got " + maxPasses);
        }
        this.maxPasses = maxPasses;
    }

    public int getMaxPasses() {
        return maxPasses;
    }

    /**
     * Recalculates after 'changedCell' was written (or removed) in 'sheet'.
     * Returns the cells that were re-evaluated, in evaluation order.
     */
    public List<String> recalculate(Sheet sheet, String changedCell, EvaluationContext context) {
        List<String> evaluated = new ArrayList<>();
        Set<String> roots = new LinkedHashSet<>();
        roots.add(changedCell);

        Cell cell = sheet.getCell(changedCell);
        if (cell != null && cell.isFormula()) {
            List<String> refs = refsOf(cell.getFormula(), context);
            if (sheet.getGraph().hasCircular(changedCell, refs)) {
                markCircular(sheet, changedCell, cell);
                evaluated.add(changedCell);
                return evaluated;
            }
            sheet.getGraph().setDependencies(changedCell, refs);
            sheet.clearCircular(changedCell);
            cell.invalidate();
            roots.addAll(evaluate(sheet, changedCell, context));
            evaluated.add(changedCell);
        } else {
            sheet.getGraph().removeDependencies(changedCell);
            sheet.clearCircular(changedCell);
            roots.addAll(dropSpill(sheet, changedCell));
        }

        // a write into a spill footprint blocks or unblocks the anchor
        String anchor = sheet.findSpillAnchorCovering(changedCell);
        if (anchor != null && sheet.getCell(anchor) != null && sheet.getCell(anchor).isFormula()) {
            roots.add(anchor);
            roots.addAll(evaluate(sheet, anchor, context));
            evaluated.add(anchor);
        }

        roots.addAll(retryCircular(sheet, changedCell, context, evaluated));
        roots.addAll(refreshVolatile(sheet, changedCell, context, evaluated));

        propagate(sheet, roots, context, evaluated);
        return evaluated;
    }

    /**
     * Re-evaluates every formula cell until no value changes, at most
     * maxPasses times. Volatile cells are only evaluated in the first pass.
     * Returns the number of passes run.
     */
    public int recalcAll(Sheet sheet, EvaluationContext context) {
        for (int pass = 1; pass <= maxPasses; pass++) {
            boolean changed = false;
            for (Map.Entry<String, Cell> entry : new ArrayList<>(sheet.getCells().entrySet())) {
                String id = entry.getKey();
                Cell cell = entry.getValue();
                if (!cell.isFormula()) {
                    continue;
                }
                if (sheet.getCircularCells().contains(id)) {
                    if (!FormulaError.CIRCULAR.text().equals(cell.getCachedComputed())) {
                        cell.setCachedComputed(FormulaError.CIRCULAR.text());
                        changed = true;
                    }
                    continue;
                }
                if (pass > 1 && FormulaEngine.isVolatile(cell.getFormula())) {
                    continue;
                }
                String before = cell.getCachedComputed();
                Set<String> spillChanges = evaluate(sheet, id, context);
                if (!Objects.equals(before, cell.getCachedComputed()) || !spillChanges.isEmpty()) {
                    changed = true;
                }
            }
            if (!changed) {
                return pass;
            }
        }
        log.warn("Sheet '{}' still changing after {} recalculation passes", sheet.getName(), maxPasses);
        return maxPasses;
    }

    /**
     * Rebuilds the dependency graph from the stored formulas, then
     * recalculates everything. Used after import.
     */
    public int rebuild(Sheet sheet, EvaluationContext context) {
        DependencyGraph graph = sheet.getGraph();
        graph.clear();
        for (String id : new ArrayList<>(sheet.getCircularCells())) {
            sheet.clearCircular(id);
        }
        for (Map.Entry<String, Cell> entry : sheet.getCells().entrySet()) {
            Cell cell = entry.getValue();
            if (!cell.isFormula()) {
                continue;
            }
            cell.invalidate();
            List<String> refs = refsOf(cell.getFormula(), context);
            if (graph.hasCircular(entry.getKey(), refs)) {
                markCircular(sheet, entry.getKey(), cell);
            } else {
                graph.setDependencies(entry.getKey(), refs);
            }
        }
        log.debug("Rebuilt dependency graph of sheet '{}': {} formula cells", sheet.getName(),
                graph.getForwardGraph().size());
        return recalcAll(sheet, context);
    }

    /** Same-sheet cells a formula reads, after named-range substitution. */
    public static List<String> refsOf(String formula, EvaluationContext context) {
        String body = FormulaEngine.stripArrayBraces(formula);
        return CellReferences.extractRefs(FormulaEngine.resolveNamedRanges(body, context.getNamedRanges()));
    }

    // ------------------------
    // Internal helpers
    // ------------------------

    private void propagate(Sheet sheet, Set<String> roots, EvaluationContext context, List<String> evaluated) {
        Set<String> wave = roots;
        for (int round = 0; round < maxPasses && !wave.isEmpty(); round++) {
            List<String> order = sheet.getGraph().getDependents(wave);
            if (order.equals(DependencyGraph.CIRCULAR)) {
                log.warn("Cycle reached while propagating from {} in sheet '{}'", wave, sheet.getName());
                return;
            }
            // blocked anchors may be able to spill once the cells they wait on change
            List<String> toEvaluate = new ArrayList<>(order);
            for (String anchor : blockedAnchorsTouching(sheet, wave)) {
                if (!toEvaluate.contains(anchor) && !evaluated.contains(anchor)) {
                    toEvaluate.add(anchor);
                }
            }
            Set<String> next = new LinkedHashSet<>();
            for (String dependent : toEvaluate) {
                Cell cell = sheet.getCell(dependent);
                if (cell == null || !cell.isFormula() || sheet.getCircularCells().contains(dependent)) {
                    continue;
                }
                next.addAll(evaluate(sheet, dependent, context));
                evaluated.add(dependent);
            }
            // spilled values that moved feed another wave
            wave = next;
        }
    }

    private static Set<String> blockedAnchorsTouching(Sheet sheet, Set<String> cells) {
        Set<String> anchors = new LinkedHashSet<>();
        for (SpillRange spill : sheet.getSpills().values()) {
            if (!spill.isBlocked() || cells.contains(spill.getSourceCell())) {
                continue;
            }
            for (String id : cells) {
                if (spill.covers(id)) {
                    anchors.add(spill.getSourceCell());
                    break;
                }
            }
        }
        return anchors;
    }

    private Set<String> retryCircular(Sheet sheet, String changedCell, EvaluationContext context,
                                      List<String> evaluated) {
        Set<String> healed = new LinkedHashSet<>();
        for (String id : new ArrayList<>(sheet.getCircularCells())) {
            Cell cell = sheet.getCell(id);
            if (id.equals(changedCell) || cell == null || !cell.isFormula()) {
                if (cell == null || !cell.isFormula()) {
                    sheet.clearCircular(id);
                }
                continue;
            }
            List<String> refs = refsOf(cell.getFormula(), context);
            if (!sheet.getGraph().hasCircular(id, refs)) {
                sheet.getGraph().setDependencies(id, refs);
                sheet.clearCircular(id);
                cell.invalidate();
                healed.add(id);
                healed.addAll(evaluate(sheet, id, context));
                evaluated.add(id);
                log.debug("Circular reference at {} in sheet '{}' resolved", id, sheet.getName());
            }
        }
        return healed;
    }

    private Set<String> refreshVolatile(Sheet sheet, String changedCell, EvaluationContext context,
                                        List<String> evaluated) {
        Set<String> refreshed = new LinkedHashSet<>();
        for (Map.Entry<String, Cell> entry : new ArrayList<>(sheet.getCells().entrySet())) {
            String id = entry.getKey();
            Cell cell = entry.getValue();
            if (id.equals(changedCell) || !cell.isFormula() || sheet.getCircularCells().contains(id)) {
                continue;
            }
            if (FormulaEngine.isVolatile(cell.getFormula())) {
                refreshed.add(id);
                refreshed.addAll(evaluate(sheet, id, context));
                evaluated.add(id);
            }
        }
        return refreshed;
    }

    private void markCircular(Sheet sheet, String id, Cell cell) {
        log.warn("Circular reference at {} in sheet '{}'", id, sheet.getName());
        sheet.getGraph().removeDependencies(id);
        sheet.markCircular(id);
        dropSpill(sheet, id);
        cell.invalidate();
        cell.setCachedComputed(FormulaError.CIRCULAR.text());
    }

    /**
     * Evaluates one formula cell and stores its result. For array formulas
     * the spill is placed too; returns the footprint cells whose visible
     * value changed, the anchor excluded.
     */
    private Set<String> evaluate(Sheet sheet, String id, EvaluationContext context) {
        Cell cell = sheet.getCell(id);
        if (cell == null || !cell.isFormula()) {
            return Collections.emptySet();
        }
        if (cell.isArrayFormula()) {
            ArrayResult result = FormulaEngine.evaluateArrayFormula(cell.getFormula(), id, sheet::getValue, context);
            return placeSpill(sheet, id, cell, result);
        }
        String value = FormulaEngine.evaluateFormula(cell.getFormula(), sheet::getValue, context);
        cell.setCachedComputed(value);
        log.debug("Evaluated {}!{} = {}", sheet.getName(), id, value);
        return dropSpill(sheet, id);
    }

    private Set<String> placeSpill(Sheet sheet, String id, Cell cell, ArrayResult result) {
        SpillRange old = sheet.removeSpill(id);
        List<String> footprint = spillResolver.getSpillRange(id, result);
        String blocker = spillResolver.checkSpillConflict(id, result, sheet.getCells(), sheet.getSpills());
        SpillRange spill = new SpillRange(id, result, footprint, blocker);
        sheet.putSpill(spill);

        if (blocker != null) {
            log.warn("Array formula at {} in sheet '{}' cannot spill: {} is occupied", id, sheet.getName(), blocker);
            cell.setCachedComputed(FormulaError.SPILL.text());
        } else {
            cell.setCachedComputed(result.getValue(0, 0));
        }
        log.debug("Evaluated array {}!{} as {}x{}", sheet.getName(), id, result.getRowCount(), result.getColCount());
        return changedSpillCells(id, old, spill);
    }

    private Set<String> dropSpill(Sheet sheet, String id) {
        SpillRange old = sheet.removeSpill(id);
        return old == null ? Collections.emptySet() : changedSpillCells(id, old, null);
    }

    private static Set<String> changedSpillCells(String anchor, SpillRange before, SpillRange after) {
        Set<String> cells = new LinkedHashSet<>();
        if (before != null) {
            cells.addAll(before.getFootprint());
        }
        if (after != null) {
            cells.addAll(after.getFootprint());
        }
        cells.remove(anchor);
        Set<String> changed = new LinkedHashSet<>();
        for (String id : cells) {
            String was = before == null ? null : before.spilledValueAt(id);
            String now = after == null ? null : after.spilledValueAt(id);
            if (!Objects.equals(was, now)) {
                changed.add(id);
            }
        }
        return changed;
    }
}
