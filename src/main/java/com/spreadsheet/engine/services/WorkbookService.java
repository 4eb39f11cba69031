package com.spreadsheet.engine.services;

import com.spreadsheet.engine.config.FormulaEngineProperties;
import com.spreadsheet.engine.exceptions.*;
import com.spreadsheet.engine.formula.CellReferences;
import com.spreadsheet.engine.formula.EvaluationContext;
import com.spreadsheet.engine.formula.FunctionName;
import com.spreadsheet.engine.graph.RecalculationEngine;
import com.spreadsheet.engine.io.WorkbookSerializer;
import com.spreadsheet.engine.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.regex.Pattern;

/**
 * Main business logic for creating workbooks, setting cell values,
 * recalculating dependents and moving workbooks in and out of text form.
 * Every edit runs under the workbook's write lock, so it fully propagates
 * before the next one starts.
 */
@Service
public class WorkbookService {

    private static final Logger log = LoggerFactory.getLogger(WorkbookService.class);

    // Identifier rule for named ranges: "Sales", "tax_rate"
    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    // All workbooks live here in memory; no persistent store
    private final Map<Long, Workbook> workbooks = new ConcurrentHashMap<>();

    private final FormulaEngineProperties properties;
    private final RecalculationEngine recalculationEngine;
    private final WorkbookSerializer serializer;

    @Autowired
    public WorkbookService(FormulaEngineProperties properties) {
        this.properties = properties;
        this.recalculationEngine = new RecalculationEngine(properties.getMaxRecalcPasses());
        this.serializer = new WorkbookSerializer(properties.getDefaultSheetName());
    }

    /**
     * Creates a workbook with the given sheets (or the default sheet when
     * none are named) and returns its ID.
     */
    public long createWorkbook(List<String> sheetNames) {
        Workbook workbook = new Workbook();
        if (sheetNames == null || sheetNames.isEmpty()) {
            workbook.addSheet(properties.getDefaultSheetName());
        } else {
            for (String name : sheetNames) {
                validateNewSheetName(workbook, name);
                workbook.addSheet(name.trim());
            }
        }
        workbooks.put(workbook.getId(), workbook);
        log.info("Created workbook {} with sheets {}", workbook.getId(), sheetNames(workbook));
        return workbook.getId();
    }

    /**
     * Retrieves a Workbook by ID. Throws if not found.
     */
    public Workbook getWorkbook(long workbookId) {
        Workbook workbook = workbooks.get(workbookId);
        if (workbook == null) {
            throw new WorkbookNotFoundException("Workbook not found: " + workbookId);
        }
        return workbook;
    }

    public Sheet getSheet(long workbookId, String sheetName) {
        return requireSheet(getWorkbook(workbookId), sheetName);
    }

    public void addSheet(long workbookId, String sheetName) {
        Workbook workbook = getWorkbook(workbookId);
        Lock lock = workbook.getLock().writeLock();
        lock.lock();
        try {
            validateNewSheetName(workbook, sheetName);
            workbook.addSheet(sheetName.trim());
            // formulas that pointed at the missing sheet showed #REF! until now
            refreshSheetsReferencing(workbook, sheetName.trim(), new HashSet<>());
            log.info("Added sheet '{}' to workbook {}", sheetName.trim(), workbookId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sets a cell's raw content and recalculates:
     * 1) Normalize the address ("b7" -> "B7"), else InvalidCellReferenceException.
     * 2) Store the content; an empty value clears the cell.
     * 3) Recalculate the cell and its dependents in the same sheet.
     * 4) Refresh other sheets whose formulas read this sheet.
     * Returns the cells re-evaluated in the edited sheet.
     */
    public List<String> setCellValue(long workbookId, String sheetName, String cellRef, String rawValue) {
        Workbook workbook = getWorkbook(workbookId);
        String cellId = CellReferences.normalize(cellRef);
        if (cellId == null) {
            throw new InvalidCellReferenceException("Invalid cell reference: " + cellRef);
        }

        Lock lock = workbook.getLock().writeLock();
        lock.lock();
        try {
            Sheet sheet = requireSheet(workbook, sheetName);
            if (rawValue == null || rawValue.isEmpty()) {
                sheet.removeCell(cellId);
            } else {
                Cell cell = sheet.getCell(cellId);
                if (cell == null) {
                    sheet.setCell(cellId, new Cell(rawValue));
                } else {
                    cell.setRawValue(rawValue);
                }
            }
            List<String> evaluated = recalculationEngine.recalculate(sheet, cellId, workbook.evaluationContext());
            log.debug("Set {}!{}; re-evaluated {}", sheet.getName(), cellId, evaluated);

            Set<String> refreshed = new HashSet<>();
            refreshed.add(sheet.getName());
            refreshSheetsReferencing(workbook, sheet.getName(), refreshed);
            return evaluated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the visible values of a sheet, spilled cells included,
     * in the format: { "A1": "10", "B1": "15", ... }.
     */
    public Map<String, String> getSheetData(long workbookId, String sheetName) {
        Workbook workbook = getWorkbook(workbookId);
        Lock lock = workbook.getLock().readLock();
        lock.lock();
        try {
            Sheet sheet = requireSheet(workbook, sheetName);
            Map<String, String> data = new LinkedHashMap<>();
            for (Map.Entry<String, Cell> entry : sheet.getCells().entrySet()) {
                if (entry.getValue().isOccupied()) {
                    data.put(entry.getKey(), entry.getValue().getDisplayValue());
                }
            }
            for (SpillRange spill : sheet.getSpills().values()) {
                for (String id : spill.getFootprint()) {
                    String value = spill.spilledValueAt(id);
                    if (value != null && !data.containsKey(id)) {
                        data.put(id, value);
                    }
                }
            }
            return data;
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Set<String>> getForwardDependencies(long workbookId, String sheetName) {
        Workbook workbook = getWorkbook(workbookId);
        Lock lock = workbook.getLock().readLock();
        lock.lock();
        try {
            return requireSheet(workbook, sheetName).getGraph().getForwardGraph();
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Set<String>> getReverseDependencies(long workbookId, String sheetName) {
        Workbook workbook = getWorkbook(workbookId);
        Lock lock = workbook.getLock().readLock();
        lock.lock();
        try {
            return requireSheet(workbook, sheetName).getGraph().getReverseGraph();
        } finally {
            lock.unlock();
        }
    }

    public List<SpillRange> getSpills(long workbookId, String sheetName) {
        Workbook workbook = getWorkbook(workbookId);
        Lock lock = workbook.getLock().readLock();
        lock.lock();
        try {
            return new ArrayList<>(requireSheet(workbook, sheetName).getSpills().values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-evaluates every formula of the sheet until values settle.
     * Returns the number of passes run.
     */
    public int recalculateSheet(long workbookId, String sheetName) {
        Workbook workbook = getWorkbook(workbookId);
        Lock lock = workbook.getLock().writeLock();
        lock.lock();
        try {
            return recalculationEngine.recalcAll(requireSheet(workbook, sheetName), workbook.evaluationContext());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Defines (or redefines) a workbook-level name such as "Sales" for
     * "B2:B10" or "Data!B2:B10", then rebuilds every sheet since any formula
     * may use the name.
     */
    public void setNamedRange(long workbookId, String name, String range) {
        Workbook workbook = getWorkbook(workbookId);
        validateNamedRange(name, range);
        Lock lock = workbook.getLock().writeLock();
        lock.lock();
        try {
            workbook.getNamedRanges().put(name, range.trim());
            rebuildAll(workbook);
            log.debug("Named range {} -> {} in workbook {}", name, range.trim(), workbookId);
        } finally {
            lock.unlock();
        }
    }

    public void removeNamedRange(long workbookId, String name) {
        Workbook workbook = getWorkbook(workbookId);
        Lock lock = workbook.getLock().writeLock();
        lock.lock();
        try {
            if (workbook.getNamedRanges().remove(name) == null) {
                throw new InvalidNamedRangeException("Named range not defined: " + name);
            }
            rebuildAll(workbook);
        } finally {
            lock.unlock();
        }
    }

    public Map<String, String> getNamedRanges(long workbookId) {
        Workbook workbook = getWorkbook(workbookId);
        Lock lock = workbook.getLock().readLock();
        lock.lock();
        try {
            return new LinkedHashMap<>(workbook.getNamedRanges());
        } finally {
            lock.unlock();
        }
    }

    public String exportWorkbook(long workbookId) {
        Workbook workbook = getWorkbook(workbookId);
        Lock lock = workbook.getLock().readLock();
        lock.lock();
        try {
            return serializer.serialize(workbook);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reads a serialized workbook, rebuilds its dependency graphs and
     * computed values, and stores it under a new ID.
     */
    public long importWorkbook(String text) {
        Workbook workbook = serializer.deserialize(text);
        rebuildAll(workbook);
        workbooks.put(workbook.getId(), workbook);
        log.info("Imported workbook {} with sheets {}", workbook.getId(), sheetNames(workbook));
        return workbook.getId();
    }

    // ------------------------
    // Internal helpers
    // ------------------------

    private Sheet requireSheet(Workbook workbook, String sheetName) {
        Sheet sheet = sheetName == null ? null : workbook.getSheet(sheetName);
        if (sheet == null) {
            throw new SheetNotFoundException(workbook.getId(), sheetName);
        }
        return sheet;
    }

    private static void validateNewSheetName(Workbook workbook, String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidSheetNameException("Sheet name must not be blank");
        }
        if (workbook.getSheet(name.trim()) != null) {
            throw new InvalidSheetNameException("Sheet already exists: " + name.trim());
        }
    }

    private static void validateNamedRange(String name, String range) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new InvalidNamedRangeException("Invalid name: " + name);
        }
        if (CellReferences.normalize(name) != null || FunctionName.isBuiltIn(name)
                || name.equalsIgnoreCase("TRUE") || name.equalsIgnoreCase("FALSE")) {
            throw new InvalidNamedRangeException("Name clashes with a cell address or function: " + name);
        }
        if (range == null || range.trim().isEmpty()) {
            throw new InvalidNamedRangeException("Range must not be blank for name " + name);
        }
        String target = range.trim();
        int bang = target.lastIndexOf('!');
        if (bang >= 0) {
            target = target.substring(bang + 1);
        }
        if (CellReferences.parseRange(target) == null && CellReferences.normalize(target) == null) {
            throw new InvalidNamedRangeException("Invalid range for name " + name + ": " + range);
        }
    }

    private void rebuildAll(Workbook workbook) {
        EvaluationContext context = workbook.evaluationContext();
        for (Sheet sheet : workbook.getSheets()) {
            recalculationEngine.rebuild(sheet, context);
        }
        // a second sweep settles formulas that read sheets rebuilt after them
        if (workbook.getSheets().size() > 1) {
            for (Sheet sheet : workbook.getSheets()) {
                recalculationEngine.recalcAll(sheet, context);
            }
        }
    }

    /**
     * Recalculates every sheet whose formulas read 'changedSheet', then the
     * sheets reading those, each at most once per edit.
     */
    private void refreshSheetsReferencing(Workbook workbook, String changedSheet, Set<String> refreshed) {
        Deque<String> pending = new ArrayDeque<>();
        pending.add(changedSheet);
        EvaluationContext context = workbook.evaluationContext();
        while (!pending.isEmpty()) {
            String source = pending.poll();
            for (Sheet sheet : workbook.getSheets()) {
                if (refreshed.contains(sheet.getName()) || !readsSheet(sheet, source)) {
                    continue;
                }
                refreshed.add(sheet.getName());
                int passes = recalculationEngine.recalcAll(sheet, context);
                log.debug("Refreshed sheet '{}' after change in '{}' ({} passes)", sheet.getName(), source, passes);
                pending.add(sheet.getName());
            }
        }
    }

    private static boolean readsSheet(Sheet sheet, String sheetName) {
        for (Cell cell : sheet.getCells().values()) {
            if (!cell.isFormula()) {
                continue;
            }
            for (CellReferences.CrossSheetRefs refs : CellReferences.extractCrossSheetRefs(cell.getFormula())) {
                if (refs.getSheetName().equalsIgnoreCase(sheetName)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static List<String> sheetNames(Workbook workbook) {
        List<String> names = new ArrayList<>();
        for (Sheet sheet : workbook.getSheets()) {
            names.add(sheet.getName());
        }
        return names;
    }
}
