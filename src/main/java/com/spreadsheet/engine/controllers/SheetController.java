package com.spreadsheet.engine.controllers;

import com.spreadsheet.engine.models.CellSnapshot;
import com.spreadsheet.engine.models.CellView;
import com.spreadsheet.engine.models.EvaluationResponse;
import com.spreadsheet.engine.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for spreadsheets and their cells.
 * "/sheet" is the base path.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Creates an empty sheet, returns the sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet() {
        return ResponseEntity.ok(sheetService.createSheet());
    }

    /**
     * PUT /sheet/{sheetId}/cell/{cellId}
     * Body: the raw text, e.g. "42", "hello" or "=SUM(A1:A3)".
     * The optional "formula" parameter overrides the leading "=" check.
     * Returns every cell of the sheet after recalculation. Formula errors such as
     * #DIV/0! are cell values and still answer 200; a malformed cellId is a 400.
     */
    @PutMapping(value = "/{sheetId}/cell/{cellId}", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<Map<String, CellSnapshot>> setCellValue(
            @PathVariable long sheetId,
            @PathVariable String cellId,
            @RequestParam(name = "formula", required = false) Boolean formula,
            @RequestBody(required = false) String rawValue
    ) {
        return ResponseEntity.ok(sheetService.setCellValue(sheetId, cellId, rawValue, formula));
    }

    /**
     * GET /sheet/{sheetId}
     * Returns { "A1": { "value": "=1+2", "formula": "=1+2", "calculatedValue": 3.0 }, ... }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, CellSnapshot>> getSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getSheetData(sheetId));
    }

    @GetMapping("/{sheetId}/cell/{cellId}")
    public ResponseEntity<CellView> getCell(@PathVariable long sheetId, @PathVariable String cellId) {
        return ResponseEntity.ok(sheetService.getCell(sheetId, cellId));
    }

    /**
     * POST /sheet/{sheetId}/evaluate
     * Body: formula text. Evaluates it against the sheet without changing it.
     */
    @PostMapping(value = "/{sheetId}/evaluate", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<EvaluationResponse> evaluate(@PathVariable long sheetId, @RequestBody String formula) {
        return ResponseEntity.ok(EvaluationResponse.of(sheetService.evaluateFormula(sheetId, formula)));
    }

    /**
     * GET /sheet/{sheetId}/forwardDependencies
     * For each cell, the set of cells it references.
     */
    @GetMapping("/{sheetId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getForwardGraph(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/reverseDependencies
     * For each cell, the set of cells that reference it.
     */
    @GetMapping("/{sheetId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getReverseGraph(sheetId));
    }
}
