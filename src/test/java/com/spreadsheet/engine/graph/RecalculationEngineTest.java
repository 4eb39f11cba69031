package com.spreadsheet.engine.graph;

import com.spreadsheet.engine.formula.EvaluationContext;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.Sheet;
import com.spreadsheet.engine.models.SpillRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for edit-driven and full recalculation on a single sheet.
 */
class RecalculationEngineTest {

    private RecalculationEngine engine;
    private Sheet sheet;

    @BeforeEach
    void setUp() {
        engine = new RecalculationEngine();
        sheet = new Sheet("Sheet1");
    }

    private List<String> set(String cellId, String raw) {
        return set(cellId, raw, EvaluationContext.EMPTY);
    }

    private List<String> set(String cellId, String raw, EvaluationContext context) {
        if (raw.isEmpty()) {
            sheet.removeCell(cellId);
        } else if (sheet.getCell(cellId) == null) {
            sheet.setCell(cellId, new Cell(raw));
        } else {
            sheet.getCell(cellId).setRawValue(raw);
        }
        return engine.recalculate(sheet, cellId, context);
    }

    @Test
    void chainPropagatesInOrder() {
        set("A1", "10");
        set("B1", "=A1+5");
        set("C1", "=B1+1");
        assertEquals("15", sheet.getValue("B1"));
        assertEquals("16", sheet.getValue("C1"));

        List<String> evaluated = set("A1", "20");
        assertEquals(Arrays.asList("B1", "C1"), evaluated);
        assertEquals("25", sheet.getValue("B1"));
        assertEquals("26", sheet.getValue("C1"));
    }

    @Test
    void editingAFormulaRewiresItsEdges() {
        set("A1", "1");
        set("A2", "2");
        set("B1", "=A1*10");
        assertEquals(Set.of("B1"), sheet.getGraph().getDirectDependents("A1"));

        set("B1", "=A2*10");
        assertEquals("20", sheet.getValue("B1"));
        assertTrue(sheet.getGraph().getDirectDependents("A1").isEmpty());

        set("A1", "100");
        assertEquals("20", sheet.getValue("B1"));
    }

    @Test
    void cycleIsParkedAndHealsWhenBroken() {
        set("A1", "=B1");
        set("B1", "=A1");
        assertEquals("#CIRCULAR!", sheet.getValue("B1"));
        assertTrue(sheet.getCircularCells().contains("B1"));
        assertTrue(sheet.getGraph().getDependencies("B1").isEmpty());

        set("A1", "5");
        assertFalse(sheet.getCircularCells().contains("B1"));
        assertEquals("5", sheet.getValue("B1"));
    }

    @Test
    void selfReferenceIsCircular() {
        List<String> evaluated = set("A1", "=A1+1");
        assertEquals(List.of("A1"), evaluated);
        assertEquals("#CIRCULAR!", sheet.getValue("A1"));
    }

    @Test
    void volatileCellsRefreshOnEveryEdit() {
        set("B1", "=RAND()");
        List<String> evaluated = set("A1", "1");
        assertTrue(evaluated.contains("B1"));
    }

    @Test
    void arrayFormulaSpillsIntoNeighbours() {
        set("A1", "{=SEQUENCE(3)}");
        assertEquals("1", sheet.getValue("A1"));
        assertEquals("2", sheet.getValue("A2"));
        assertEquals("3", sheet.getValue("A3"));
        SpillRange spill = sheet.getSpills().get("A1");
        assertEquals(Arrays.asList("A1", "A2", "A3"), spill.getFootprint());
        assertFalse(spill.isBlocked());
    }

    @Test
    void occupiedCellBlocksSpillUntilCleared() {
        set("A1", "{=SEQUENCE(3)}");
        set("A2", "x");

        assertEquals("#SPILL!", sheet.getValue("A1"));
        assertEquals("A2", sheet.getSpills().get("A1").getBlockedBy());
        assertEquals("x", sheet.getValue("A2"));
        assertEquals("", sheet.getValue("A3"));

        set("A2", "");
        assertEquals("1", sheet.getValue("A1"));
        assertEquals("2", sheet.getValue("A2"));
        assertEquals("3", sheet.getValue("A3"));
    }

    @Test
    void overlappingSpillIsBlockedUntilTheFirstIsCleared() {
        set("A2", "{=SEQUENCE(1, 3, 10)}");
        set("B1", "{=SEQUENCE(3, 1, 100)}");

        assertEquals("#SPILL!", sheet.getValue("B1"));
        assertEquals("B2", sheet.getSpills().get("B1").getBlockedBy());
        assertFalse(sheet.getSpills().get("A2").isBlocked());
        assertEquals("11", sheet.getValue("B2"));
        assertEquals("", sheet.getValue("B3"));

        set("A2", "");
        assertEquals("100", sheet.getValue("B1"));
        assertEquals("101", sheet.getValue("B2"));
        assertEquals("102", sheet.getValue("B3"));
        assertEquals("", sheet.getValue("C2"));
    }

    @Test
    void formulasReadingSpilledCellsFollowTheSpill() {
        set("A1", "{=SEQUENCE(3)}");
        set("B1", "=A3*10");
        assertEquals("30", sheet.getValue("B1"));

        set("A1", "{=SEQUENCE(3, 1, 5)}");
        assertEquals("70", sheet.getValue("B1"));
    }

    @Test
    void replacingAnArrayFormulaWithAValueRemovesTheSpill() {
        set("A1", "{=SEQUENCE(2)}");
        set("B1", "=A2+1");
        assertEquals("3", sheet.getValue("B1"));

        set("A1", "7");
        assertTrue(sheet.getSpills().isEmpty());
        assertEquals("", sheet.getValue("A2"));
        assertEquals("1", sheet.getValue("B1"));
    }

    @Test
    void namedRangesCreateDependencyEdges() {
        Map<String, String> names = new HashMap<>();
        names.put("Base", "A1");
        EvaluationContext context = new EvaluationContext(names, null);

        set("A1", "4", context);
        set("B1", "=Base*2", context);
        assertEquals("8", sheet.getValue("B1"));
        assertEquals(Set.of("A1"), sheet.getGraph().getDependencies("B1"));

        set("A1", "5", context);
        assertEquals("10", sheet.getValue("B1"));
    }

    @Test
    void recalcAllSettlesInOnePassWhenNothingChanges() {
        set("A1", "10");
        set("B1", "=A1+5");
        assertEquals(1, engine.recalcAll(sheet, EvaluationContext.EMPTY));
    }

    @Test
    void rebuildRestoresGraphAndValues() {
        // inserted dependents-first, so values need several passes to settle
        sheet.setCell("C1", new Cell("=B1+1"));
        sheet.setCell("B1", new Cell("=A1+5"));
        sheet.setCell("A1", new Cell("10"));

        int passes = engine.rebuild(sheet, EvaluationContext.EMPTY);
        assertEquals(3, passes);
        assertEquals("15", sheet.getValue("B1"));
        assertEquals("16", sheet.getValue("C1"));
        assertEquals(Set.of("B1"), sheet.getGraph().getDependencies("C1"));
    }

    @Test
    void recalcAllStopsAtThePassCap() {
        RecalculationEngine capped = new RecalculationEngine(1);
        sheet.setCell("C1", new Cell("=B1+1"));
        sheet.setCell("B1", new Cell("=A1+5"));
        sheet.setCell("A1", new Cell("10"));

        assertEquals(1, capped.rebuild(sheet, EvaluationContext.EMPTY));
        assertEquals("1", sheet.getValue("C1"));
    }

    @Test
    void rebuildMarksCyclesFromStoredFormulas() {
        sheet.setCell("A1", new Cell("=B1"));
        sheet.setCell("B1", new Cell("=A1"));

        engine.rebuild(sheet, EvaluationContext.EMPTY);
        assertEquals("#CIRCULAR!", sheet.getValue("B1"));
        assertTrue(sheet.getCircularCells().contains("B1"));
    }

    @Test
    void passCapMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new RecalculationEngine(0));
        assertEquals(RecalculationEngine.DEFAULT_MAX_PASSES, engine.getMaxPasses());
    }
}
