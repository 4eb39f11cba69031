package com.spreadsheet.engine.models;

import com.spreadsheet.engine.formula.CrossSheetGetter;
import com.spreadsheet.engine.formula.EvaluationContext;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an entire workbook:
 * - Has a unique ID
 * - An ordered list of sheets and the active sheet index
 * - Workbook-level named ranges (name -> range text)
 * - A read/write lock so one edit fully propagates before the next starts
 */
public class Workbook {

    // Generates unique IDs for newly created workbooks
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final List<Sheet> sheets = new ArrayList<>();
    private int activeSheet;
    private final Map<String, String> namedRanges = new LinkedHashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Workbook() {
        this.id = ID_GENERATOR.getAndIncrement();
    }

    public long getId() {
        return id;
    }

    public List<Sheet> getSheets() {
        return sheets;
    }

    public Sheet addSheet(String name) {
        Sheet sheet = new Sheet(name);
        sheets.add(sheet);
        return sheet;
    }

    /**
     * Looks a sheet up by exact name first, then case-insensitively.
     */
    public Sheet getSheet(String name) {
        for (Sheet sheet : sheets) {
            if (sheet.getName().equals(name)) {
                return sheet;
            }
        }
        for (Sheet sheet : sheets) {
            if (sheet.getName().equalsIgnoreCase(name)) {
                return sheet;
            }
        }
        return null;
    }

    public int getActiveSheet() {
        return activeSheet;
    }

    public void setActiveSheet(int activeSheet) {
        this.activeSheet = activeSheet;
    }

    public Map<String, String> getNamedRanges() {
        return namedRanges;
    }

    /**
     * Resolves "OtherSheet!B2" against the sheets of this workbook.
     * An unknown sheet yields #REF!.
     */
    public CrossSheetGetter crossSheetGetter() {
        return (sheetName, ref) -> {
            Sheet sheet = getSheet(sheetName);
            return sheet == null ? FormulaError.REF.text() : sheet.getValue(ref);
        };
    }

    public EvaluationContext evaluationContext() {
        return new EvaluationContext(namedRanges, crossSheetGetter());
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
