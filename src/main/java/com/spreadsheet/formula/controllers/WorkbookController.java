package com.spreadsheet.formula.controllers;

import com.spreadsheet.formula.models.CellEdit;
import com.spreadsheet.formula.models.FunctionInfo;
import com.spreadsheet.formula.models.GraphSnapshot;
import com.spreadsheet.formula.models.WorkbookDocument;
import com.spreadsheet.formula.models.WorkbookSummary;
import com.spreadsheet.formula.services.WorkbookService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for workbooks and their cells.
 * "/workbooks" is the base path; cells are addressed A1-style
 * within a sheet, e.g. /workbooks/budget/sheets/Sheet1/cells/B3.
 */
@RestController
@RequestMapping("/workbooks")
public class WorkbookController {

    @Autowired
    private WorkbookService workbookService;

    /**
     * POST /workbooks
     * Body: { "name": "...", "worksheets": { "Sheet1": { "A1": "5", "B1": "=A1*2" } } }
     * Creates the workbook (201) or replaces the one with the same name (200).
     * A circular reference anywhere in the document is a 400.
     */
    @PostMapping
    public ResponseEntity<WorkbookDocument> saveWorkbook(@RequestBody WorkbookDocument document) {
        boolean created = workbookService.saveWorkbook(document);
        WorkbookDocument saved = workbookService.getDocument(document.getName().trim());
        return new ResponseEntity<>(saved, created ? HttpStatus.CREATED : HttpStatus.OK);
    }

    /**
     * GET /workbooks
     * Names and timestamps of every stored workbook.
     */
    @GetMapping
    public ResponseEntity<List<WorkbookSummary>> listWorkbooks() {
        return ResponseEntity.ok(workbookService.listWorkbooks());
    }

    /**
     * GET /workbooks/functions?prefix=SU&limit=5
     * Built-in functions whose names start with the prefix (a leading "=" is ignored),
     * with description and syntax. No prefix lists them all.
     * This literal path takes precedence over /workbooks/{name}.
     */
    @GetMapping("/functions")
    public ResponseEntity<List<FunctionInfo>> suggestFunctions(
            @RequestParam(required = false, defaultValue = "") String prefix,
            @RequestParam(required = false) Integer limit
    ) {
        return ResponseEntity.ok(workbookService.suggestFunctions(prefix, limit));
    }

    /**
     * GET /workbooks/{name}
     * The workbook's raw contents in the same shape it was saved in.
     */
    @GetMapping("/{name}")
    public ResponseEntity<WorkbookDocument> getWorkbook(@PathVariable String name) {
        return ResponseEntity.ok(workbookService.getDocument(name));
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> deleteWorkbook(@PathVariable String name) {
        workbookService.deleteWorkbook(name);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /workbooks/{name}/values
     * Computed value of every cell with content, e.g. { "Sheet1!A1": "5", "Sheet1!B1": 10.0 }.
     */
    @GetMapping("/{name}/values")
    public ResponseEntity<Map<String, Object>> getValues(@PathVariable String name) {
        return ResponseEntity.ok(workbookService.getValues(name));
    }

    /**
     * PUT /workbooks/{name}/sheets/{sheet}/cells/{cell}
     * Body: raw value (literal or "=formula").
     * Returns the cell's address and its new computed value.
     * A circular reference is turned into a 400 by the GlobalExceptionHandler.
     */
    @PutMapping("/{name}/sheets/{sheet}/cells/{cell}")
    public ResponseEntity<Map<String, Object>> setCell(
            @PathVariable String name,
            @PathVariable String sheet,
            @PathVariable String cell,
            @RequestBody String rawValue
    ) {
        Object value = workbookService.setCell(name, sheet, cell, rawValue);
        return ResponseEntity.ok(cellResponse(sheet, cell, value));
    }

    /**
     * GET /workbooks/{name}/sheets/{sheet}/cells/{cell}
     * Computed value of one cell, or its "#ERROR: ..." / "#N/A" marker.
     */
    @GetMapping("/{name}/sheets/{sheet}/cells/{cell}")
    public ResponseEntity<Map<String, Object>> getCell(
            @PathVariable String name,
            @PathVariable String sheet,
            @PathVariable String cell
    ) {
        Object value = workbookService.getCellValue(name, sheet, cell);
        return ResponseEntity.ok(cellResponse(sheet, cell, value));
    }

    @DeleteMapping("/{name}/sheets/{sheet}/cells/{cell}")
    public ResponseEntity<Void> clearCell(
            @PathVariable String name,
            @PathVariable String sheet,
            @PathVariable String cell
    ) {
        workbookService.clearCell(name, sheet, cell);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /workbooks/{name}/sheets/{sheet}/cells/{cell}/dependents
     * Cells whose formulas read this cell.
     */
    @GetMapping("/{name}/sheets/{sheet}/cells/{cell}/dependents")
    public ResponseEntity<Set<String>> getDependents(
            @PathVariable String name,
            @PathVariable String sheet,
            @PathVariable String cell
    ) {
        return ResponseEntity.ok(workbookService.getDependents(name, sheet, cell));
    }

    /**
     * GET /workbooks/{name}/sheets/{sheet}/cells/{cell}/dependencies
     * Cells this cell's formula reads.
     */
    @GetMapping("/{name}/sheets/{sheet}/cells/{cell}/dependencies")
    public ResponseEntity<Set<String>> getDependencies(
            @PathVariable String name,
            @PathVariable String sheet,
            @PathVariable String cell
    ) {
        return ResponseEntity.ok(workbookService.getDependencies(name, sheet, cell));
    }

    /**
     * POST /workbooks/{name}/edits
     * Body: [ { "sheet": "Sheet1", "column": 0, "row": 0, "rawValue": "5" }, ... ]
     * Applies the edits in order and returns the cells recalculated, in order.
     */
    @PostMapping("/{name}/edits")
    public ResponseEntity<List<String>> applyEdits(@PathVariable String name, @RequestBody List<CellEdit> edits) {
        return ResponseEntity.ok(workbookService.applyEdits(name, edits));
    }

    /**
     * POST /workbooks/{name}/recalculate
     * Body: addresses changed elsewhere, e.g. [ "Sheet1!A1" ].
     * Returns the cells recalculated, in order.
     */
    @PostMapping("/{name}/recalculate")
    public ResponseEntity<List<String>> recalculate(@PathVariable String name, @RequestBody List<String> changed) {
        return ResponseEntity.ok(workbookService.recalculate(name, changed));
    }

    /**
     * GET /workbooks/{name}/graph
     * Every node and source -> dependent edge of the dependency graph.
     */
    @GetMapping("/{name}/graph")
    public ResponseEntity<GraphSnapshot> getDependencyGraph(@PathVariable String name) {
        return ResponseEntity.ok(workbookService.getDependencyGraph(name));
    }

    private static Map<String, Object> cellResponse(String sheet, String cell, Object value) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sheet", sheet);
        body.put("cell", cell);
        body.put("value", value);
        return body;
    }
}
