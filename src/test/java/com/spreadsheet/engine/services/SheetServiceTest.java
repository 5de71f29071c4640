package com.spreadsheet.engine.services;

import com.spreadsheet.engine.config.FormulaProperties;
import com.spreadsheet.engine.exceptions.InvalidCellReferenceException;
import com.spreadsheet.engine.exceptions.SheetNotFoundException;
import com.spreadsheet.engine.functions.FunctionLibrary;
import com.spreadsheet.engine.models.CellSnapshot;
import com.spreadsheet.engine.models.CellView;
import com.spreadsheet.engine.values.ErrorKind;
import com.spreadsheet.engine.values.EvaluationResult;
import com.spreadsheet.engine.values.NumberValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SheetService logic, using an in-memory approach
 * (no HTTP or external server).
 */
class SheetServiceTest {

    private SheetService sheetService;
    private long sheetId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        sheetService = new SheetService(FunctionLibrary.standard(clock), new FormulaProperties(), clock);
        sheetId = sheetService.createSheet();
    }

    @Test
    void testSetLiteralValues() {
        sheetService.setCellValue(sheetId, "A1", "hello", null);
        sheetService.setCellValue(sheetId, "B1", "42", null);

        Map<String, CellSnapshot> data = sheetService.getSheetData(sheetId);
        assertEquals("hello", data.get("A1").getValue());
        assertNull(data.get("A1").getFormula());
        assertEquals("42", data.get("B1").getValue());
    }

    /**
     * A leading "=" makes a formula unless the caller says otherwise.
     */
    @Test
    void testFormulaDetection() {
        Map<String, CellSnapshot> data = sheetService.setCellValue(sheetId, "A1", "=2*21", null);
        assertEquals(42.0, data.get("A1").getCalculatedValue());

        data = sheetService.setCellValue(sheetId, "A2", "=2*21", false);
        assertNull(data.get("A2").getFormula());
        assertNull(data.get("A2").getCalculatedValue());
    }

    /**
     * B1 -> A1. Then A1 -> B1 => cycle => #REF! on A1, the sheet keeps working.
     */
    @Test
    void testCycleBecomesRefError() {
        sheetService.setCellValue(sheetId, "B1", "=A1", null);
        sheetService.setCellValue(sheetId, "A1", "=B1", null);

        CellView a1 = sheetService.getCell(sheetId, "A1");
        assertEquals("#REF!", a1.getError());
        assertEquals("#REF!", a1.getDisplay());
        assertEquals("=B1", a1.getRaw());
        assertEquals("#REF!", sheetService.getCell(sheetId, "B1").getError());
    }

    @Test
    void testPartialReEvaluation() {
        sheetService.setCellValue(sheetId, "A1", "2", null);
        sheetService.setCellValue(sheetId, "C1", "=A1*10", null);
        assertEquals("20", sheetService.getCell(sheetId, "C1").getDisplay());

        sheetService.setCellValue(sheetId, "A1", "3", null);
        assertEquals("30", sheetService.getCell(sheetId, "C1").getDisplay());
    }

    @Test
    void testChangeFormulaToLiteral() {
        sheetService.setCellValue(sheetId, "A1", "hello", null);
        sheetService.setCellValue(sheetId, "C1", "=A1", null);
        assertEquals("hello", sheetService.getCell(sheetId, "C1").getDisplay());

        sheetService.setCellValue(sheetId, "C1", "newLiteral", null);
        assertEquals("newLiteral", sheetService.getCell(sheetId, "C1").getDisplay());
        assertTrue(sheetService.getForwardGraph(sheetId).isEmpty());
    }

    @Test
    void testDependencyViews() {
        sheetService.setCellValue(sheetId, "B1", "=C2", null);
        sheetService.setCellValue(sheetId, "A1", "=B1+C2", null);

        Map<String, Set<String>> forward = sheetService.getForwardGraph(sheetId);
        assertEquals(Set.of("C2"), forward.get("B1"));
        assertEquals(Set.of("B1", "C2"), forward.get("A1"));

        Map<String, Set<String>> reverse = sheetService.getReverseGraph(sheetId);
        assertEquals(Set.of("A1", "B1"), reverse.get("C2"));
        assertEquals(Set.of("A1"), reverse.get("B1"));
    }

    @Test
    void testEvaluatePreviewLeavesSheetUntouched() {
        sheetService.setCellValue(sheetId, "A1", "4", null);

        EvaluationResult result = sheetService.evaluateFormula(sheetId, "=A1*A1");
        assertEquals(NumberValue.of(16), result.getValue());
        assertEquals(ErrorKind.NAME, sheetService.evaluateFormula(sheetId, "=NOPE()").getError());
        assertEquals(1, sheetService.getSheetData(sheetId).size());
    }

    @Test
    void testUnknownSheetAndBadCellId() {
        assertThrows(SheetNotFoundException.class, () -> sheetService.getSheetData(999_999L));
        assertThrows(InvalidCellReferenceException.class,
                () -> sheetService.setCellValue(sheetId, "not-a-cell", "1", null));
    }

    @Test
    void testGetCellOfUnwrittenCell() {
        CellView view = sheetService.getCell(sheetId, "z9");
        assertEquals("Z9", view.getCellId());
        assertEquals("", view.getRaw());
        assertEquals("", view.getDisplay());
        assertNull(view.getError());
    }

    /**
     * Many threads writing to one sheet: every write is applied and the
     * formula reading them all ends up consistent.
     */
    @Test
    void testConcurrentCellUpdates() throws InterruptedException {
        sheetService.setCellValue(sheetId, "B1", "=SUM(A1:A20)", null);

        List<Thread> threads = new ArrayList<>();
        for (int row = 1; row <= 20; row++) {
            String cellId = "A" + row;
            String value = String.valueOf(row);
            threads.add(new Thread(() -> sheetService.setCellValue(sheetId, cellId, value, null)));
        }
        for (Thread thread : threads) {
            thread.start();
        }
        for (Thread thread : threads) {
            thread.join();
        }

        assertEquals("210", sheetService.getCell(sheetId, "B1").getDisplay());
        assertEquals(21, sheetService.getSheetData(sheetId).size());
    }
}
