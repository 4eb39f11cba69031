package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.ArrayResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArrayFormulaTest {

    private final Map<String, String> cells = new HashMap<>();
    private final CellGetter get = ref -> cells.getOrDefault(ref, "");

    @BeforeEach
    void setUp() {
        cells.put("A1", "1");
        cells.put("A2", "2");
        cells.put("A3", "3");
        cells.put("B1", "10");
        cells.put("B2", "20");
        cells.put("B3", "30");
        cells.put("C1", "100");
        cells.put("C2", "200");
        cells.put("G1", "a");
        cells.put("G2", "b");
        cells.put("G3", "a");
        cells.put("G4", "c");
        cells.put("H1", "1");
        cells.put("H2", "0");
        cells.put("H3", "TRUE");
    }

    private List<List<String>> grid(String formula) {
        return FormulaEngine.evaluateArrayFormula(formula, "E1", get).getValues();
    }

    private static List<List<String>> column(String... values) {
        List<List<String>> rows = new java.util.ArrayList<>();
        for (String value : values) {
            rows.add(List.of(value));
        }
        return rows;
    }

    @Test
    void sequenceFillsRowsThenColumns() {
        assertEquals(column("1", "2", "3"), grid("{=SEQUENCE(3)}"));
        assertEquals(Arrays.asList(List.of("1", "2", "3"), List.of("4", "5", "6")), grid("=SEQUENCE(2, 3)"));
        assertEquals(column("10", "15", "20"), grid("=SEQUENCE(3, 1, 10, 5)"));
        assertEquals(column("#VALUE!"), grid("=SEQUENCE(0)"));
    }

    @Test
    void rangeArithmeticIsElementWise() {
        assertEquals(column("2", "4", "6"), grid("=A1:A3*2"));
        assertEquals(column("9", "8", "7"), grid("=10-A1:A3"));
        assertEquals(column("11", "22", "33"), grid("=A1:A3+B1:B3"));
        assertEquals(column("1", "1", "1"), grid("=B1:B3>A1:A3"));
    }

    @Test
    void mismatchedShapesProduceOneColumnPaddedWithZero() {
        assertEquals(column("101", "202", "3"), grid("=A1:A3+C1:C2"));
    }

    @Test
    void reshapingFunctions() {
        assertEquals(List.of(List.of("1", "2", "3")), grid("=TRANSPOSE(A1:A3)"));
        assertEquals(column("1", "10", "2", "20"), grid("=FLATTEN(A1:B2)"));
        assertEquals(column("a", "b", "c"), grid("=UNIQUE(G1:G4)"));
    }

    @Test
    void sortOrdersByColumn() {
        assertEquals(column("3", "2", "1"), grid("=SORT(A1:A3, 1, FALSE)"));
        assertEquals(Arrays.asList(List.of("3", "30"), List.of("2", "20"), List.of("1", "10")),
                grid("=SORT(A1:B3, 2, FALSE)"));
        assertEquals(column("a", "a", "b", "c"), grid("=SORT(G1:G4)"));
    }

    @Test
    void filterKeepsFlaggedRows() {
        assertEquals(column("1", "3"), grid("=FILTER(A1:A3, H1:H3)"));
        assertEquals(column("2", "3"), grid("=FILTER(A1:A3, A1:A3, \">1\")"));
        assertEquals(column("#N/A"), grid("=FILTER(A1:A3, A1:A3, \">5\")"));
    }

    @Test
    void mapAppliesANamedOrArithmeticOperation() {
        assertEquals(column("2", "4", "6"), grid("=MAP(A1:A3, \"*2\")"));
        assertEquals(column("A", "B", "A", "C"), grid("=MAP(G1:G4, \"upper\")"));
        assertEquals(column("#VALUE!"), grid("=MAP(A1:A3, \"frobnicate\")"));
    }

    @Test
    void arrayFormulaWrapsAnElementWiseExpression() {
        assertEquals(column("10", "20", "30"), grid("=ARRAYFORMULA(A1:A3*10)"));
    }

    @Test
    void scalarExpressionsBecomeOneCell() {
        ArrayResult result = FormulaEngine.evaluateArrayFormula("=1+2", "E1", get);
        assertEquals(1, result.getRowCount());
        assertEquals(1, result.getColCount());
        assertEquals("3", result.getValue(0, 0));
        assertEquals("E1", result.getSourceCell());
    }

    @Test
    void brokenArrayFormulaIsOneErrorCell() {
        assertEquals(column("#ERROR!"), grid("{=1+}"));
    }

    @Test
    void scalarEvaluationReadsTheTopLeftElement() {
        assertEquals("1", FormulaEngine.evaluateFormula("=SEQUENCE(3)", get));
        assertEquals("3", FormulaEngine.evaluateFormula("=SORT(A1:A3, 1, FALSE)", get));
        assertEquals("10", FormulaEngine.evaluateFormula("=SUM(SEQUENCE(4))", get));
        assertEquals("3", FormulaEngine.evaluateFormula("=COUNT(UNIQUE(A1:A3))", get));
    }

    @Test
    void reduceFoldsARange() {
        assertEquals("6", FormulaEngine.evaluateFormula("=REDUCE(0, A1:A3)", get));
        assertEquals("6", FormulaEngine.evaluateFormula("=REDUCE(1, A1:A3, \"PRODUCT\")", get));
        assertEquals("30", FormulaEngine.evaluateFormula("=REDUCE(0, B1:B3, \"MAX\")", get));
    }

    @Test
    void isArrayFormulaNeedsBraces() {
        assertTrue(FormulaEngine.isArrayFormula("{=SEQUENCE(3)}"));
        assertFalse(FormulaEngine.isArrayFormula("=SEQUENCE(3)"));
        assertEquals("=SEQUENCE(3)", FormulaEngine.stripArrayBraces("{=SEQUENCE(3)}"));
        assertEquals("=A1", FormulaEngine.stripArrayBraces("=A1"));
    }
}
