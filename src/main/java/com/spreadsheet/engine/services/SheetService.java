package com.spreadsheet.engine.services;

import com.spreadsheet.engine.config.FormulaProperties;
import com.spreadsheet.engine.evaluation.RecalculationEngine;
import com.spreadsheet.engine.exceptions.SheetNotFoundException;
import com.spreadsheet.engine.functions.FunctionLibrary;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellSnapshot;
import com.spreadsheet.engine.models.CellView;
import com.spreadsheet.engine.models.Sheet;
import com.spreadsheet.engine.values.EvaluationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;

/**
 * Creates sheets and routes every read and write to the sheet's recalculation engine
 * under the sheet's lock: writes hold the write lock for the whole recalculation,
 * reads and formula previews share the read lock.
 */
@Service
public class SheetService {

    private static final Logger LOG = LoggerFactory.getLogger(SheetService.class);

    // All sheets live here in memory; there is no persistence
    private final Map<Long, RecalculationEngine> engines = new ConcurrentHashMap<>();

    private final FunctionLibrary functionLibrary;
    private final FormulaProperties properties;
    private final Clock clock;

    public SheetService(FunctionLibrary functionLibrary, FormulaProperties properties, Clock clock) {
        this.functionLibrary = functionLibrary;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Creates an empty sheet and returns its ID.
     */
    public long createSheet() {
        Sheet sheet = new Sheet();
        engines.put(sheet.getId(), new RecalculationEngine(sheet, functionLibrary, properties, clock));
        LOG.info("Created sheet {}", sheet.getId());
        return sheet.getId();
    }

    public Sheet getSheet(long sheetId) {
        return getEngine(sheetId).getSheet();
    }

    /**
     * Retrieves the engine of a sheet. Throws if not found.
     */
    public RecalculationEngine getEngine(long sheetId) {
        RecalculationEngine engine = engines.get(sheetId);
        if (engine == null) {
            throw new SheetNotFoundException(sheetId);
        }
        return engine;
    }

    /**
     * Writes a cell and returns the settled snapshot of the whole sheet.
     *
     * @param isFormula whether to treat the text as a formula; null means "starts with ="
     */
    public Map<String, CellSnapshot> setCellValue(long sheetId, String cellId, String rawValue, Boolean isFormula) {
        RecalculationEngine engine = getEngine(sheetId);
        String id = CellAddress.normalize(cellId);
        String text = rawValue == null ? "" : rawValue;
        boolean formula = isFormula != null ? isFormula : text.trim().startsWith("=");

        // Prevent race conditions among multiple writers
        Lock lock = engine.getSheet().getLock().writeLock();
        lock.lock();
        try {
            return engine.updateCell(id, text, formula);
        } finally {
            lock.unlock();
        }
    }

    public Map<String, CellSnapshot> getSheetData(long sheetId) {
        RecalculationEngine engine = getEngine(sheetId);
        Lock lock = engine.getSheet().getLock().readLock();
        lock.lock();
        try {
            return engine.getSnapshot();
        } finally {
            lock.unlock();
        }
    }

    public CellView getCell(long sheetId, String cellId) {
        RecalculationEngine engine = getEngine(sheetId);
        String id = CellAddress.normalize(cellId);
        Lock lock = engine.getSheet().getLock().readLock();
        lock.lock();
        try {
            return new CellView(id, engine.getCellRawValue(id), engine.getCellDisplayValue(id), engine.getCellError(id));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Evaluates formula text against the sheet without storing anything.
     */
    public EvaluationResult evaluateFormula(long sheetId, String formulaText) {
        RecalculationEngine engine = getEngine(sheetId);
        Lock lock = engine.getSheet().getLock().readLock();
        lock.lock();
        try {
            return engine.evaluateFormula(formulaText);
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Set<String>> getForwardGraph(long sheetId) {
        RecalculationEngine engine = getEngine(sheetId);
        Lock lock = engine.getSheet().getLock().readLock();
        lock.lock();
        try {
            return engine.getDependencyGraph().getForwardGraph();
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Set<String>> getReverseGraph(long sheetId) {
        RecalculationEngine engine = getEngine(sheetId);
        Lock lock = engine.getSheet().getLock().readLock();
        lock.lock();
        try {
            return engine.getDependencyGraph().getReverseGraph();
        } finally {
            lock.unlock();
        }
    }
}
