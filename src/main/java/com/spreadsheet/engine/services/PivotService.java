package com.spreadsheet.engine.services;

import com.spreadsheet.engine.exceptions.InvalidCellReferenceException;
import com.spreadsheet.engine.exceptions.InvalidPivotConfigException;
import com.spreadsheet.engine.formula.CellReferences;
import com.spreadsheet.engine.models.CellRef;
import com.spreadsheet.engine.models.Sheet;
import com.spreadsheet.engine.models.Workbook;
import com.spreadsheet.engine.pivot.FilterField;
import com.spreadsheet.engine.pivot.PivotConfig;
import com.spreadsheet.engine.pivot.PivotEngine;
import com.spreadsheet.engine.pivot.PivotResult;
import com.spreadsheet.engine.pivot.ValueField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;

/**
 * Builds pivot tables from workbook ranges and optionally writes the
 * resulting table back into a sheet.
 */
@Service
public class PivotService {

    private static final Logger log = LoggerFactory.getLogger(PivotService.class);

    private final WorkbookService workbookService;
    private final PivotEngine pivotEngine = new PivotEngine();

    @Autowired
    public PivotService(WorkbookService workbookService) {
        this.workbookService = workbookService;
    }

    /**
     * Validates the config, reads the source range (computed values) and
     * aggregates it. When a target cell is configured the table is written
     * there, headers first; every written cell is recalculated as an edit.
     */
    public PivotResult buildPivot(long workbookId, PivotConfig config) {
        Workbook workbook = workbookService.getWorkbook(workbookId);
        PivotResult result;

        Lock lock = workbook.getLock().readLock();
        lock.lock();
        try {
            Sheet source = sourceSheet(workbook, config);
            if (config.getSourceRange() == null
                    || !CellReferences.isWithinLimit(CellReferences.parseRange(config.getSourceRange()))) {
                throw new InvalidPivotConfigException("Invalid source range: " + config.getSourceRange());
            }
            if (config.getValueFields().isEmpty()) {
                throw new InvalidPivotConfigException("At least one value field is required");
            }
            PivotEngine.SourceData sourceData = pivotEngine.extractDataFromRange(source, config.getSourceRange());
            validateFields(config, sourceData.getHeaders());
            result = pivotEngine.buildPivot(sourceData.getData(), config);
            log.debug("Pivot {} over {}!{}: {} rows, {} columns", config.getId(), source.getName(),
                    config.getSourceRange(), result.getRows().size(), result.getHeaders().size());
        } finally {
            lock.unlock();
        }

        if (config.getTargetCell() != null && !config.getTargetCell().isEmpty()) {
            writeResult(workbookId, workbook, config, result);
        }
        return result;
    }

    private Sheet sourceSheet(Workbook workbook, PivotConfig config) {
        if (config.getSourceSheet() == null || config.getSourceSheet().isEmpty()) {
            int active = workbook.getActiveSheet();
            return workbook.getSheets().get(active >= 0 && active < workbook.getSheets().size() ? active : 0);
        }
        Sheet sheet = workbook.getSheet(config.getSourceSheet());
        if (sheet == null) {
            throw new InvalidPivotConfigException("Source sheet not found: " + config.getSourceSheet());
        }
        return sheet;
    }

    private static void validateFields(PivotConfig config, List<String> headers) {
        List<String> used = new ArrayList<>(config.getRowFields());
        used.addAll(config.getColFields());
        for (ValueField vf : config.getValueFields()) {
            used.add(vf.getField());
        }
        for (FilterField filter : config.getFilterFields()) {
            used.add(filter.getField());
        }
        for (String field : used) {
            if (field == null || !headers.contains(field)) {
                throw new InvalidPivotConfigException("Field not in source header row: " + field
                        + " (available: " + headers + ")");
            }
        }
    }

    private void writeResult(long workbookId, Workbook workbook, PivotConfig config, PivotResult result) {
        CellRef origin = CellReferences.parseCellRef(config.getTargetCell());
        if (origin == null) {
            throw new InvalidCellReferenceException("Invalid pivot target cell: " + config.getTargetCell());
        }
        String targetSheet = config.getTargetSheet() != null && !config.getTargetSheet().isEmpty()
                ? config.getTargetSheet()
                : sourceSheet(workbook, config).getName();

        List<List<String>> table = new ArrayList<>();
        table.add(result.getHeaders());
        table.addAll(result.getRows());
        for (int r = 0; r < table.size(); r++) {
            List<String> row = table.get(r);
            for (int c = 0; c < row.size(); c++) {
                String id = CellReferences.cellId(origin.getCol() + c, origin.getRow() + r);
                workbookService.setCellValue(workbookId, targetSheet, id, row.get(c));
            }
        }
        log.info("Wrote pivot {} to {}!{}", config.getId(), targetSheet, config.getTargetCell());
    }
}
