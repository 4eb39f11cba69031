package com.spreadsheet.engine.formula;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Scalar evaluation through the public entry points, against a small
 * in-memory grid:
 *   A1..A3 = 1, 2, 3     B1 = "hello"
 *   E1:F3  = x/10, y/20, z/30
 */
class FormulaEngineTest {

    private final Map<String, String> cells = new HashMap<>();
    private final CellGetter get = ref -> cells.getOrDefault(ref, "");

    @BeforeEach
    void setUp() {
        cells.put("A1", "1");
        cells.put("A2", "2");
        cells.put("A3", "3");
        cells.put("B1", "hello");
        cells.put("E1", "x");
        cells.put("F1", "10");
        cells.put("E2", "y");
        cells.put("F2", "20");
        cells.put("E3", "z");
        cells.put("F3", "30");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "=2+3*4           | 14",
            "=(2+3)*4         | 20",
            "=10-2-3          | 5",
            "=2^3             | 8",
            "=-2^2            | 4",
            "=7/2             | 3.5",
            "=0.1+0.2         | 0.30000000000000004",
            "=A1+A2*A3        | 7",
            "=SUM(A1:A3)      | 6",
            "=SUM(C3:A1)      | 6",
            "=AVERAGE(A1:A3)  | 2",
            "=AVERAGE(D1:D3)  | 0",
            "=MAX(A1:A3, 10)  | 10",
            "=COUNT(A1:A3, B1) | 3",
            "=MEDIAN(A1:A3)   | 2",
            "=ROUND(2.345, 2) | 2.35",
            "=MOD(-3, 2)      | 1",
            "=ABS(-4)         | 4",
            "=POWER(2, 10)    | 1024",
            "=A3>2            | 1",
            "=A3<2            | 0",
            "=1e21            | 1e+21"
    })
    void evaluatesArithmeticAndAggregates(String formula, String expected) {
        assertEquals(expected, FormulaEngine.evaluateFormula(formula, get));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "=\"a\"&\"b\"                     | ab",
            "=B1&\" world\"                   | hello world",
            "=UPPER(B1)                       | HELLO",
            "=LEFT(B1, 2)                     | he",
            "=MID(B1, 2, 3)                   | ell",
            "=LEN(B1)                         | 5",
            "=CONCATENATE(\"a\", A1, \"b\")   | a1b",
            "=SUBSTITUTE(\"a-b-c\", \"-\", \"+\") | a+b+c",
            "=PROPER(\"big red dog\")         | Big Red Dog",
            "=IF(A3>2, \"big\", \"small\")    | big",
            "=IF(A1>2, \"big\", \"small\")    | small",
            "=AND(A1, A2)                     | 1",
            "=OR(0, 0)                        | 0",
            "=IFERROR(1/0, \"fallback\")      | fallback",
            "=VLOOKUP(\"y\", E1:F3, 2)        | 20",
            "=MATCH(\"z\", E1:E3)             | 3",
            "=COUNTIF(A1:A3, \">1\")          | 2",
            "=SUMIF(A1:A3, \">=2\")           | 5",
            "=SUMIF(E1:E3, \"<>y\", F1:F3)    | 40",
            "=TEXT(3.14159, \"0.00\")         | 3.14"
    })
    void evaluatesTextLogicAndLookups(String formula, String expected) {
        assertEquals(expected, FormulaEngine.evaluateFormula(formula, get));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "=STDEV(1, 3)                                   | 1.4142135623730951",
            "=VAR(2, 4, 4, 4, 5, 5, 7, 9)                   | 4.571428571428571",
            "=STDEV(A1:A3)                                  | 1",
            "=STDEV(5)                                      | #DIV/0!",
            "=VAR(A1)                                       | #DIV/0!",
            "=LARGE(A1:A3, 1)                               | 3",
            "=LARGE(F1:F3, 2)                               | 20",
            "=SMALL(F1:F3, 3)                               | 30",
            "=RANK(2, A1:A3)                                | 2",
            "=RANK(3, A1:A3, 1)                             | 3",
            "=HLOOKUP(\"x\", E1:F3, 3)                      | z",
            "=HLOOKUP(10, E1:F3, 2)                         | 20",
            "=HLOOKUP(\"x\", E1:F3, 4)                      | #REF!",
            "=INDEX(E1:F3, 2, 2)                            | 20",
            "=INDEX(A1:A3, 3)                               | 3",
            "=INDEX(E1:F3, 4, 1)                            | #REF!",
            "=INDEX(E1:F3, 1, 3)                            | #REF!",
            "=VLOOKUP(\"y\", E1:F3, 3)                      | #REF!",
            "=FIND(\"l\", B1)                               | 3",
            "=FIND(\"l\", B1, 4)                            | 4",
            "=FIND(\"z\", B1)                               | #VALUE!",
            "=SUBSTITUTE(\"a-b-c\", \"-\", \"+\", 2)          | a-b+c",
            "=SUBSTITUTE(\"aaa\", \"a\", \"b\", 3)            | aab",
            "=SUBSTITUTE(\"a-b\", \"-\", \"+\", 5)            | a-b",
            "=COUNTIFS(E1:E3, \"<>y\", F1:F3, \">10\")        | 1",
            "=SUMIFS(F1:F3, E1:E3, \"<>y\", F1:F3, \">=10\")  | 40",
            "=AVERAGEIF(A1:A3, \">1\")                      | 2.5",
            "=AVERAGEIF(E1:E3, \"y\", F1:F3)                | 20",
            "=COUNTIF(B1, \"h*o\")                          | 1",
            "=COUNTIF(B1, \"h?llo\")                        | 1",
            "=COUNTIF(B1, \"h?lo\")                         | 0",
            "=SUMIF(E1:E3, \"*\", F1:F3)                    | 60",
            "=ISBLANK(C9)                                   | 1",
            "=ISBLANK(A1)                                   | 0",
            "=ISNA(VLOOKUP(\"q\", E1:F3, 2))                | 1",
            "=ISNA(A1)                                      | 0",
            "=IFERROR(SQRT(-1), \"x\")                      | x",
            "=IFERROR(SQRT(16), \"x\")                      | 4",
            "=SUM (A1:A3)                                   | #NAME?"
    })
    void evaluatesStatisticsLookupsAndCriteria(String formula, String expected) {
        assertEquals(expected, FormulaEngine.evaluateFormula(formula, get));
    }

    @Test
    void oversizedRangesReadAsRefError() {
        assertEquals("#REF!", FormulaEngine.evaluateFormula("=SUM(A1:ZZ2000000)", get));
        assertEquals("#REF!", FormulaEngine.evaluateFormula("=SUM(A1:XFD1048576)", get));
    }

    @Test
    void errorsAreValuesNotExceptions() {
        assertEquals("#DIV/0!", FormulaEngine.evaluateFormula("=1/0", get));
        assertEquals("#DIV/0!", FormulaEngine.evaluateFormula("=1/0+5", get));
        assertEquals("#N/A", FormulaEngine.evaluateFormula("=VLOOKUP(\"missing\", E1:F3, 2)", get));
        assertEquals("#NAME?", FormulaEngine.evaluateFormula("=NOSUCHFUNCTION(1, 2)", get));
        assertEquals("#ERROR!", FormulaEngine.evaluateFormula("=1+", get));
        assertEquals("#ERROR!", FormulaEngine.evaluateFormula("=)", get));
    }

    @Test
    void leftMostErrorWins() {
        cells.put("C1", "#REF!");
        assertEquals("#REF!", FormulaEngine.evaluateFormula("=C1+1/0", get));
        assertEquals("#DIV/0!", FormulaEngine.evaluateFormula("=1/0+C1", get));
        assertEquals("#REF!", FormulaEngine.evaluateFormula("=SUM(A1:A3, C1)", get));
    }

    @Test
    void leadingEqualsIsOptional() {
        assertEquals("14", FormulaEngine.evaluateFormula("2+3*4", get));
    }

    @Test
    void isFormulaErrorChecksTheErrorShape() {
        assertTrue(FormulaEngine.isFormulaError("#DIV/0!"));
        assertTrue(FormulaEngine.isFormulaError("#NAME?"));
        assertFalse(FormulaEngine.isFormulaError("#N/A"));
        assertFalse(FormulaEngine.isFormulaError("hello"));
        assertFalse(FormulaEngine.isFormulaError(null));
    }

    @Test
    void detectsVolatileFormulas() {
        assertTrue(FormulaEngine.isVolatile("=NOW()"));
        assertTrue(FormulaEngine.isVolatile("=RAND()*10"));
        assertTrue(FormulaEngine.isVolatile("=A1+today()"));
        assertFalse(FormulaEngine.isVolatile("=A1+1"));
        assertFalse(FormulaEngine.isVolatile("=\"NOW()\""));
    }

    @Test
    void randBetweenStaysWithinBounds() {
        for (int i = 0; i < 50; i++) {
            double value = Double.parseDouble(FormulaEngine.evaluateFormula("=RANDBETWEEN(1, 6)", get));
            assertTrue(value >= 1 && value <= 6, "out of range: " + value);
            assertEquals(Math.floor(value), value);
        }
    }

    @Test
    void resolvesNamedRangesLongestFirst() {
        Map<String, String> names = new LinkedHashMap<>();
        names.put("Sales", "A1:A3");
        names.put("SalesTotal", "Data!B1");

        assertEquals("=SUM(A1:A3)", FormulaEngine.resolveNamedRanges("=SUM(Sales)", names));
        assertEquals("=B1+A1:A3", FormulaEngine.resolveNamedRanges("=SalesTotal+sales", names));
        // only whole identifiers are replaced
        assertEquals("=MySales", FormulaEngine.resolveNamedRanges("=MySales", names));
    }

    @Test
    void evaluatesWithNamedRangesAndOtherSheets() {
        Map<String, String> names = new HashMap<>();
        names.put("Sales", "A1:A3");
        Map<String, String> data = new HashMap<>();
        data.put("A1", "5");
        data.put("A2", "6");
        CrossSheetGetter crossSheet = (sheet, ref) -> "Data".equals(sheet) ? data.getOrDefault(ref, "") : "#REF!";

        assertEquals("6", FormulaEngine.evaluateFormula("=SUM(Sales)", get, names, crossSheet));
        assertEquals("11", FormulaEngine.evaluateFormula("=SUM(Data!A1:A2)", get, names, crossSheet));
        assertEquals("10", FormulaEngine.evaluateFormula("=Data!A1*2", get, names, crossSheet));
        assertEquals("#REF!", FormulaEngine.evaluateFormula("=Other!A1", get, names, crossSheet));
    }

    @Test
    void crossSheetReferenceWithoutResolverIsRefError() {
        assertEquals("#REF!", FormulaEngine.evaluateFormula("=Data!A1", get));
    }

    @Test
    void formatsNumbersLikeDisplayText() {
        assertEquals("14", FormulaEngine.formatNumber(14));
        assertEquals("2.5", FormulaEngine.formatNumber(2.5));
        assertEquals("-0.001", FormulaEngine.formatNumber(-0.001));
        assertEquals("1e-7", FormulaEngine.formatNumber(1e-7));
        assertEquals("1e+21", FormulaEngine.formatNumber(1e21));
    }
}
