package com.spreadsheet.engine.graph;

import com.spreadsheet.engine.models.ArrayResult;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.SpillRange;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SpillResolverTest {

    private final SpillResolver resolver = new SpillResolver();

    private static ArrayResult result(String anchor, List<List<String>> values) {
        return new ArrayResult(values, anchor);
    }

    @Test
    void footprintIsRowMajorFromTheAnchor() {
        ArrayResult twoByTwo = result("B2", Arrays.asList(List.of("1", "2"), List.of("3", "4")));
        assertEquals(Arrays.asList("B2", "C2", "B3", "C3"), resolver.getSpillRange("B2", twoByTwo));
    }

    @Test
    void invalidAnchorHasNoFootprint() {
        ArrayResult single = result("??", List.of(List.of("1")));
        assertTrue(resolver.getSpillRange("??", single).isEmpty());
    }

    @Test
    void firstOccupiedCellBlocksTheSpill() {
        ArrayResult column = result("A1", Arrays.asList(List.of("1"), List.of("2"), List.of("3")));
        Map<String, Cell> cells = new HashMap<>();
        cells.put("A1", new Cell("{=SEQUENCE(3)}"));
        cells.put("A2", new Cell("x"));
        cells.put("A3", new Cell("y"));

        assertEquals("A2", resolver.checkSpillConflict("A1", column, cells));
    }

    @Test
    void anchorAndEmptyCellsDoNotBlock() {
        ArrayResult column = result("A1", Arrays.asList(List.of("1"), List.of("2")));
        Map<String, Cell> cells = new HashMap<>();
        cells.put("A1", new Cell("{=SEQUENCE(2)}"));
        cells.put("A2", new Cell(""));

        assertNull(resolver.checkSpillConflict("a1", column, cells));
    }

    @Test
    void cellShowingAnotherSpillBlocks() {
        ArrayResult row = result("A2", List.of(List.of("10", "11", "12")));
        Map<String, SpillRange> spills = new HashMap<>();
        spills.put("A2", new SpillRange("A2", row, resolver.getSpillRange("A2", row), null));

        ArrayResult column = result("B1", Arrays.asList(List.of("100"), List.of("101"), List.of("102")));
        assertEquals("B2", resolver.checkSpillConflict("B1", column, new HashMap<>(), spills));
    }

    @Test
    void blockedSpillAndOwnPreviousSpillDoNotBlock() {
        ArrayResult row = result("A2", List.of(List.of("10", "11", "12")));
        ArrayResult column = result("B1", Arrays.asList(List.of("100"), List.of("101")));
        Map<String, SpillRange> spills = new HashMap<>();
        spills.put("A2", new SpillRange("A2", row, resolver.getSpillRange("A2", row), "C2"));
        spills.put("B1", new SpillRange("B1", column, resolver.getSpillRange("B1", column), null));

        assertNull(resolver.checkSpillConflict("B1", column, new HashMap<>(), spills));
    }
}
