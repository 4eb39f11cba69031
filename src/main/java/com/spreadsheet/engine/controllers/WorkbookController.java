package com.spreadsheet.engine.controllers;

import com.spreadsheet.engine.models.SpillRange;
import com.spreadsheet.engine.pivot.PivotConfig;
import com.spreadsheet.engine.pivot.PivotResult;
import com.spreadsheet.engine.services.PivotService;
import com.spreadsheet.engine.services.WorkbookService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for managing workbooks, their sheets and cells.
 * "/workbook" is the base path.
 */
@RestController
@RequestMapping("/workbook")
public class WorkbookController {

    @Autowired
    private WorkbookService workbookService;

    @Autowired
    private PivotService pivotService;

    /**
     * POST /workbook
     * Optional JSON body { "sheets": ["Data", "Summary"] }.
     * Creates a new Workbook, returns its id.
     */
    @PostMapping
    public ResponseEntity<Long> createWorkbook(@RequestBody(required = false) Map<String, List<String>> request) {
        List<String> sheets = request == null ? null : request.get("sheets");
        long workbookId = workbookService.createWorkbook(sheets);
        return ResponseEntity.ok(workbookId);
    }

    /**
     * POST /workbook/{workbookId}/sheet
     * Body: the new sheet's name.
     */
    @PostMapping("/{workbookId}/sheet")
    public ResponseEntity<Void> addSheet(@PathVariable long workbookId, @RequestBody String sheetName) {
        workbookService.addSheet(workbookId, sheetName);
        return ResponseEntity.ok().build();
    }

    /**
     * PUT /workbook/{workbookId}/sheet/{sheetName}/cell/{cellRef}
     * Body: raw content ("42", "hello", "=A1*2", "{=SEQUENCE(3)}").
     * Returns the cells that were re-evaluated.
     */
    @PutMapping("/{workbookId}/sheet/{sheetName}/cell/{cellRef}")
    public ResponseEntity<List<String>> setCellValue(
            @PathVariable long workbookId,
            @PathVariable String sheetName,
            @PathVariable String cellRef,
            @RequestBody(required = false) String rawValue
    ) {
        return ResponseEntity.ok(workbookService.setCellValue(workbookId, sheetName, cellRef, rawValue));
    }

    /**
     * DELETE /workbook/{workbookId}/sheet/{sheetName}/cell/{cellRef}
     * Clears the cell.
     */
    @DeleteMapping("/{workbookId}/sheet/{sheetName}/cell/{cellRef}")
    public ResponseEntity<List<String>> clearCell(
            @PathVariable long workbookId,
            @PathVariable String sheetName,
            @PathVariable String cellRef
    ) {
        return ResponseEntity.ok(workbookService.setCellValue(workbookId, sheetName, cellRef, null));
    }

    /**
     * GET /workbook/{workbookId}/sheet/{sheetName}
     * Returns the visible values, spilled cells included:
     * { "A1": "10", "B1": "15", ... }.
     */
    @GetMapping("/{workbookId}/sheet/{sheetName}")
    public ResponseEntity<Map<String, String>> getSheet(@PathVariable long workbookId,
                                                        @PathVariable String sheetName) {
        return ResponseEntity.ok(workbookService.getSheetData(workbookId, sheetName));
    }

    /**
     * GET /workbook/{workbookId}/sheet/{sheetName}/forwardDependencies
     * For each formula cell, the set of cells it reads.
     */
    @GetMapping("/{workbookId}/sheet/{sheetName}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable long workbookId,
                                                                              @PathVariable String sheetName) {
        return ResponseEntity.ok(workbookService.getForwardDependencies(workbookId, sheetName));
    }

    /**
     * GET /workbook/{workbookId}/sheet/{sheetName}/reverseDependencies
     * For each referenced cell, the set of formula cells reading it.
     */
    @GetMapping("/{workbookId}/sheet/{sheetName}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable long workbookId,
                                                                              @PathVariable String sheetName) {
        return ResponseEntity.ok(workbookService.getReverseDependencies(workbookId, sheetName));
    }

    @GetMapping("/{workbookId}/sheet/{sheetName}/spills")
    public ResponseEntity<List<SpillRange>> getSpills(@PathVariable long workbookId,
                                                      @PathVariable String sheetName) {
        return ResponseEntity.ok(workbookService.getSpills(workbookId, sheetName));
    }

    /**
     * POST /workbook/{workbookId}/sheet/{sheetName}/recalc
     * Full recalculation; returns the number of passes it took.
     */
    @PostMapping("/{workbookId}/sheet/{sheetName}/recalc")
    public ResponseEntity<Integer> recalculate(@PathVariable long workbookId, @PathVariable String sheetName) {
        return ResponseEntity.ok(workbookService.recalculateSheet(workbookId, sheetName));
    }

    @GetMapping("/{workbookId}/namedRange")
    public ResponseEntity<Map<String, String>> getNamedRanges(@PathVariable long workbookId) {
        return ResponseEntity.ok(workbookService.getNamedRanges(workbookId));
    }

    /**
     * PUT /workbook/{workbookId}/namedRange/{name}
     * Body: the range, e.g. "B2:B10" or "Data!B2:B10".
     */
    @PutMapping("/{workbookId}/namedRange/{name}")
    public ResponseEntity<Void> setNamedRange(@PathVariable long workbookId,
                                              @PathVariable String name,
                                              @RequestBody String range) {
        workbookService.setNamedRange(workbookId, name, range);
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/{workbookId}/namedRange/{name}")
    public ResponseEntity<Void> removeNamedRange(@PathVariable long workbookId, @PathVariable String name) {
        workbookService.removeNamedRange(workbookId, name);
        return ResponseEntity.ok().build();
    }

    /**
     * POST /workbook/{workbookId}/pivot
     * Body: a pivot configuration; returns the aggregated table.
     */
    @PostMapping("/{workbookId}/pivot")
    public ResponseEntity<PivotResult> buildPivot(@PathVariable long workbookId, @RequestBody PivotConfig config) {
        return ResponseEntity.ok(pivotService.buildPivot(workbookId, config));
    }

    /**
     * GET /workbook/{workbookId}/export
     * Returns the workbook as frontmatter + TSV text.
     */
    @GetMapping(value = "/{workbookId}/export", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> exportWorkbook(@PathVariable long workbookId) {
        return ResponseEntity.ok(workbookService.exportWorkbook(workbookId));
    }

    /**
     * POST /workbook/import
     * Body: text produced by export (or a bare TSV). Returns the new workbook id.
     */
    @PostMapping(value = "/import", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<Long> importWorkbook(@RequestBody String text) {
        return ResponseEntity.ok(workbookService.importWorkbook(text));
    }
}
