package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellRef;
import com.spreadsheet.engine.models.FormulaError;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cell coordinate helpers: "B3" <-> (1, 2), range expansion and reference
 * extraction for dependency tracking.
 */
public final class CellReferences {

    private static final Pattern CELL_REF = Pattern.compile("^([A-Za-z]+)(\\d+)$");
    private static final Pattern RANGE_REF =
            Pattern.compile("(?<![A-Za-z0-9_.])([A-Za-z]+\\d+):([A-Za-z]+\\d+)(?![A-Za-z0-9_(])");
    private static final Pattern BARE_REF =
            Pattern.compile("(?<![A-Za-z0-9_.])[A-Za-z]+\\d+(?![A-Za-z0-9_(])");
    private static final Pattern QUOTED_SHEET_REF =
            Pattern.compile("'([^']+)'!([A-Za-z]+\\d+(?::[A-Za-z]+\\d+)?)");
    private static final Pattern BARE_SHEET_REF =
            Pattern.compile("(?<![A-Za-z0-9_'])([A-Za-z0-9_]+)!([A-Za-z]+\\d+(?::[A-Za-z]+\\d+)?)");

    /** Largest range, in cells, that is ever expanded. Bigger ranges read as #REF!. */
    public static final long MAX_RANGE_CELLS = 1_000_000;

    private CellReferences() {}

    /** Column letters to 0-based index: A=0, Z=25, AA=26. Returns -1 for anything that is not letters. */
    public static int colToIndex(String letters) {
        if (letters == null || letters.isBlank()) {
            return -1;
        }
        String col = letters.trim().toUpperCase(Locale.ROOT);
        long index = 0;
        for (int i = 0; i < col.length(); i++) {
            char c = col.charAt(i);
            if (c < 'A' || c > 'Z') {
                return -1;
            }
            index = index * 26 + (c - 'A' + 1);
            if (index - 1 > Integer.MAX_VALUE) {
                return -1;
            }
        }
        return (int) (index - 1);
    }

    /** 0-based index to column letters: 0=A, 25=Z, 26=AA. Negative input yields "". */
    public static String indexToCol(int index) {
        if (index < 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        long col = (long) index + 1;
        while (col > 0) {
            long remainder = (col - 1) % 26;
            sb.insert(0, (char) ('A' + remainder));
            col = (col - 1) / 26;
        }
        return sb.toString();
    }

    /**
     * Parses "B3" into (1, 2). Returns null, never throws, on malformed input
     * such as "1A", "A0" or arbitrary text.
     */
    public static CellRef parseCellRef(String text) {
        if (text == null) {
            return null;
        }
        Matcher m = CELL_REF.matcher(text.trim());
        if (!m.matches()) {
            return null;
        }
        int col = colToIndex(m.group(1));
        int row;
        try {
            row = Integer.parseInt(m.group(2)) - 1;
        } catch (NumberFormatException e) {
            return null;
        }
        if (col < 0 || row < 0) {
            return null;
        }
        return new CellRef(col, row);
    }

    /** (1, 2) -> "B3". Negative coordinates have no text form and yield #REF!. */
    public static String cellId(int col, int row) {
        if (col < 0 || row < 0 || row == Integer.MAX_VALUE) {
            return FormulaError.REF.text();
        }
        return indexToCol(col) + (row + 1);
    }

    public static String cellId(CellRef ref) {
        return cellId(ref.getCol(), ref.getRow());
    }

    /** Upper-cased canonical id, or null when the text is not a cell reference. */
    public static String normalize(String text) {
        CellRef ref = parseCellRef(text);
        return ref == null ? null : cellId(ref);
    }

    /**
     * The two normalized corners (top-left, bottom-right) of "C3:A1"-style
     * text, or null when the text is not a range.
     */
    public static CellRef[] parseRange(String range) {
        if (range == null) {
            return null;
        }
        String[] parts = range.split(":", -1);
        if (parts.length != 2) {
            return null;
        }
        CellRef start = parseCellRef(parts[0]);
        CellRef end = parseCellRef(parts[1]);
        if (start == null || end == null) {
            return null;
        }
        return new CellRef[] {
                new CellRef(Math.min(start.getCol(), end.getCol()), Math.min(start.getRow(), end.getRow())),
                new CellRef(Math.max(start.getCol(), end.getCol()), Math.max(start.getRow(), end.getRow()))
        };
    }

    /** Cells spanned by normalized corners; counted in long since A1:XFD1048576 overflows int. */
    public static long cellCount(CellRef[] corners) {
        long rows = (long) corners[1].getRow() - corners[0].getRow() + 1;
        long cols = (long) corners[1].getCol() - corners[0].getCol() + 1;
        return rows * cols;
    }

    public static boolean isWithinLimit(CellRef[] corners) {
        return corners != null && cellCount(corners) <= MAX_RANGE_CELLS;
    }

    /** Row-major member cells of a range; empty for malformed or oversized input. */
    public static List<String> expandRange(String range) {
        CellRef[] corners = parseRange(range);
        if (!isWithinLimit(corners)) {
            return Collections.emptyList();
        }
        List<String> refs = new ArrayList<>();
        for (int r = corners[0].getRow(); r <= corners[1].getRow(); r++) {
            for (int c = corners[0].getCol(); c <= corners[1].getCol(); c++) {
                refs.add(cellId(c, r));
            }
        }
        return refs;
    }

    /**
     * Every same-sheet cell a formula reads. Ranges are matched first and
     * their spans excluded from the bare-reference scan; string literals and
     * cross-sheet references are not same-sheet reads.
     */
    public static List<String> extractRefs(String formula) {
        if (formula == null || formula.isEmpty()) {
            return Collections.emptyList();
        }
        char[] text = maskNonLocal(formula);
        String masked = new String(text);

        Set<String> refs = new LinkedHashSet<>();
        Matcher ranges = RANGE_REF.matcher(masked);
        while (ranges.find()) {
            refs.addAll(expandRange(ranges.group()));
            Arrays.fill(text, ranges.start(), ranges.end(), ' ');
        }

        Matcher bare = BARE_REF.matcher(new String(text));
        while (bare.find()) {
            String id = normalize(bare.group());
            if (id != null) {
                refs.add(id);
            }
        }
        return new ArrayList<>(refs);
    }

    /**
     * Cross-sheet reads grouped per occurrence: {@code 'My Sheet'!A1:B2} and
     * {@code Sheet2!C3}.
     */
    public static List<CrossSheetRefs> extractCrossSheetRefs(String formula) {
        List<CrossSheetRefs> results = new ArrayList<>();
        if (formula == null) {
            return results;
        }
        Matcher quoted = QUOTED_SHEET_REF.matcher(formula);
        while (quoted.find()) {
            results.add(new CrossSheetRefs(quoted.group(1), expandRef(quoted.group(2))));
        }
        Matcher bare = BARE_SHEET_REF.matcher(formula);
        while (bare.find()) {
            results.add(new CrossSheetRefs(bare.group(1), expandRef(bare.group(2))));
        }
        return results;
    }

    /**
     * Splits "Sheet2!A1" or "'My Sheet'!A1:B10" into sheet and reference.
     */
    public static CrossSheetRef parseCrossSheetRef(String text) {
        if (text == null) {
            return null;
        }
        int bang = text.lastIndexOf('!');
        if (bang <= 0 || bang == text.length() - 1) {
            return null;
        }
        String sheet = text.substring(0, bang);
        String ref = text.substring(bang + 1);
        if (sheet.length() >= 2 && sheet.startsWith("'") && sheet.endsWith("'")) {
            sheet = sheet.substring(1, sheet.length() - 1);
        } else if (!sheet.matches("[A-Za-z0-9_]+")) {
            return null;
        }
        return new CrossSheetRef(sheet, ref.toUpperCase(Locale.ROOT));
    }

    private static List<String> expandRef(String ref) {
        String upper = ref.toUpperCase(Locale.ROOT);
        return upper.contains(":") ? expandRange(upper) : List.of(upper);
    }

    /**
     * Blanks out string literals and sheet-qualified references so that only
     * same-sheet references remain visible to the scanners.
     */
    private static char[] maskNonLocal(String formula) {
        char[] out = formula.toCharArray();
        int i = 0;
        while (i < out.length) {
            char c = formula.charAt(i);
            if (c == '"' || c == '\'') {
                int end = formula.indexOf(c, i + 1);
                if (end < 0) {
                    end = formula.length() - 1;
                }
                int stop = end;
                if (c == '\'' && end + 1 < formula.length() && formula.charAt(end + 1) == '!') {
                    stop = end + 1;
                    while (stop + 1 < formula.length() && isRefChar(formula.charAt(stop + 1))) {
                        stop++;
                    }
                }
                Arrays.fill(out, i, stop + 1, ' ');
                i = stop + 1;
                continue;
            }
            i++;
        }
        Matcher bare = BARE_SHEET_REF.matcher(new String(out));
        while (bare.find()) {
            Arrays.fill(out, bare.start(), bare.end(), ' ');
        }
        return out;
    }

    static boolean isRefChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == ':';
    }

    /** A sheet-qualified reference split into its parts. */
    public static final class CrossSheetRef {
        private final String sheetName;
        private final String cellRef;

        public CrossSheetRef(String sheetName, String cellRef) {
            this.sheetName = sheetName;
            this.cellRef = cellRef;
        }

        public String getSheetName() {
            return sheetName;
        }

        public String getCellRef() {
            return cellRef;
        }
    }

    /** The cells one cross-sheet reference reads on its sheet. */
    public static final class CrossSheetRefs {
        private final String sheetName;
        private final List<String> refs;

        public CrossSheetRefs(String sheetName, List<String> refs) {
            this.sheetName = sheetName;
            this.refs = refs;
        }

        public String getSheetName() {
            return sheetName;
        }

        public List<String> getRefs() {
            return refs;
        }
    }
}
