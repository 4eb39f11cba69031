package com.spreadsheet.engine.io;

import com.spreadsheet.engine.exceptions.WorkbookFormatException;
import com.spreadsheet.engine.formula.CellReferences;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellRef;
import com.spreadsheet.engine.models.Sheet;
import com.spreadsheet.engine.models.Workbook;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text form of a workbook: a frontmatter block followed by one TSV block
 * per sheet.
 *
 * <pre>
 * ---
 * sheets: 2
 * activeSheet: 0
 * sheet0Name: "Data"
 * sheet1Name: "Summary"
 * namedRange.Sales: "B2:B10"
 * ---
 * Region	Sales
 * East	=100+200
 * ===SHEET===
 * =SUM(Data!B2:B3)
 * </pre>
 *
 * Cells hold the raw text (formulas with their "=" or "{=...}"); an optional
 * format payload follows a U+0001 separator. Backslash, tab and newline are
 * escaped. Text without frontmatter is read as a single TSV sheet.
 * Only raw content is restored; callers rebuild the dependency graphs.
 */
public class WorkbookSerializer {

    static final String FRONTMATTER_FENCE = "---";
    static final String SHEET_SEPARATOR = "===SHEET===";
    static final char FORMAT_SEPARATOR = '\u0001';

    private static final String NAMED_RANGE_PREFIX = "namedRange.";
    private static final Pattern FRONTMATTER = Pattern.compile("^---\\n(.*?)\\n---\\n(.*)$", Pattern.DOTALL);
    private static final Pattern ENTRY = Pattern.compile("^([^:]+):\\s*(.*)$");

    private final String defaultSheetName;

    public WorkbookSerializer() {
        this("Sheet1");
    }

    public WorkbookSerializer(String defaultSheetName) {
        this.defaultSheetName = defaultSheetName;
    }

    public String serialize(Workbook workbook) {
        List<String> lines = new ArrayList<>();
        List<Sheet> sheets = workbook.getSheets();

        lines.add(FRONTMATTER_FENCE);
        lines.add("sheets: " + sheets.size());
        lines.add("activeSheet: " + workbook.getActiveSheet());
        for (int i = 0; i < sheets.size(); i++) {
            lines.add("sheet" + i + "Name: " + quote(sheets.get(i).getName()));
        }
        for (Map.Entry<String, String> named : workbook.getNamedRanges().entrySet()) {
            lines.add(NAMED_RANGE_PREFIX + named.getKey() + ": " + quote(named.getValue()));
        }
        lines.add(FRONTMATTER_FENCE);

        for (int i = 0; i < sheets.size(); i++) {
            if (i > 0) {
                lines.add(SHEET_SEPARATOR);
            }
            writeSheet(sheets.get(i), lines);
        }
        return String.join("\n", lines);
    }

    public Workbook deserialize(String text) {
        Workbook workbook = new Workbook();
        String normalized = text == null ? "" : text.replace("\r\n", "\n");

        Matcher fm = FRONTMATTER.matcher(normalized);
        if (!fm.matches()) {
            readSheet(workbook.addSheet(defaultSheetName), Arrays.asList(normalized.split("\n", -1)));
            return workbook;
        }

        Map<String, String> entries = readFrontmatter(fm.group(1));
        int sheetCount = intEntry(entries, "sheets", 1);
        if (sheetCount < 1) {
            throw new WorkbookFormatException("Workbook must have at least one sheet, got " + sheetCount);
        }
        for (int i = 0; i < sheetCount; i++) {
            String name = entries.get("sheet" + i + "Name");
            workbook.addSheet(name == null || name.isEmpty() ? "Sheet" + (i + 1) : name);
        }
        int active = intEntry(entries, "activeSheet", 0);
        workbook.setActiveSheet(active >= 0 && active < sheetCount ? active : 0);

        for (Map.Entry<String, String> entry : entries.entrySet()) {
            if (entry.getKey().startsWith(NAMED_RANGE_PREFIX)) {
                String name = entry.getKey().substring(NAMED_RANGE_PREFIX.length());
                if (!name.isEmpty()) {
                    workbook.getNamedRanges().put(name, entry.getValue());
                }
            }
        }

        List<List<String>> blocks = new ArrayList<>();
        List<String> current = new ArrayList<>();
        blocks.add(current);
        for (String line : fm.group(2).split("\n", -1)) {
            if (line.equals(SHEET_SEPARATOR)) {
                current = new ArrayList<>();
                blocks.add(current);
            } else {
                current.add(line);
            }
        }
        for (int i = 0; i < blocks.size() && i < sheetCount; i++) {
            readSheet(workbook.getSheets().get(i), blocks.get(i));
        }
        return workbook;
    }

    // ------------------------
    // Internal helpers
    // ------------------------

    private static void writeSheet(Sheet sheet, List<String> lines) {
        int maxRow = 0;
        int maxCol = 0;
        for (String id : sheet.getCells().keySet()) {
            CellRef ref = CellReferences.parseCellRef(id);
            if (ref != null) {
                maxRow = Math.max(maxRow, ref.getRow());
                maxCol = Math.max(maxCol, ref.getCol());
            }
        }
        for (int r = 0; r <= maxRow; r++) {
            StringJoiner row = new StringJoiner("\t");
            for (int c = 0; c <= maxCol; c++) {
                Cell cell = sheet.getCell(CellReferences.cellId(c, r));
                row.add(cell == null ? "" : encodeCell(cell));
            }
            lines.add(row.toString());
        }
    }

    private static void readSheet(Sheet sheet, List<String> rows) {
        for (int r = 0; r < rows.size(); r++) {
            String[] cols = rows.get(r).split("\t", -1);
            for (int c = 0; c < cols.length; c++) {
                if (cols[c].isEmpty()) {
                    continue;
                }
                String value = cols[c];
                String format = null;
                int sep = value.indexOf(FORMAT_SEPARATOR);
                if (sep >= 0) {
                    format = unescape(value.substring(sep + 1));
                    value = value.substring(0, sep);
                }
                Cell cell = new Cell(unescape(value));
                cell.setFormat(format);
                sheet.setCell(CellReferences.cellId(c, r), cell);
            }
        }
    }

    private static String encodeCell(Cell cell) {
        String encoded = escape(cell.getRawValue());
        if (cell.getFormat() != null && !cell.getFormat().isEmpty()) {
            encoded += FORMAT_SEPARATOR + escape(cell.getFormat());
        }
        return encoded;
    }

    private static Map<String, String> readFrontmatter(String block) {
        Map<String, String> entries = new LinkedHashMap<>();
        for (String line : block.split("\n")) {
            if (line.trim().isEmpty()) {
                continue;
            }
            Matcher m = ENTRY.matcher(line);
            if (!m.matches()) {
                throw new WorkbookFormatException("Malformed frontmatter line: " + line);
            }
            entries.put(m.group(1).trim(), unquote(m.group(2).trim()));
        }
        return entries;
    }

    private static int intEntry(Map<String, String> entries, String key, int defaultValue) {
        String value = entries.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new WorkbookFormatException("Expected a number for '" + key + "', got: " + value, e);
        }
    }

    private static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).replace("\\\"", "\"").replace("\\\\", "\\");
        }
        return value;
    }

    static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                default:
                    sb.append(ch);
            }
        }
        return sb.toString();
    }

    static String unescape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '\\' && i + 1 < value.length()) {
                char next = value.charAt(i + 1);
                if (next == 't') {
                    sb.append('\t');
                    i++;
                    continue;
                }
                if (next == 'n') {
                    sb.append('\n');
                    i++;
                    continue;
                }
                if (next == '\\') {
                    sb.append('\\');
                    i++;
                    continue;
                }
            }
            sb.append(ch);
        }
        return sb.toString();
    }
}
