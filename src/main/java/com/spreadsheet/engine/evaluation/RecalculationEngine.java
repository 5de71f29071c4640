package com.spreadsheet.engine.evaluation;

import com.spreadsheet.engine.config.FormulaProperties;
import com.spreadsheet.engine.functions.FunctionLibrary;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellSnapshot;
import com.spreadsheet.engine.models.Sheet;
import com.spreadsheet.engine.values.EvaluationResult;
import com.spreadsheet.engine.values.FormulaValue;
import com.spreadsheet.engine.values.NumberValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Owns the cells of one sheet and keeps every formula result consistent with its inputs.
 * <p>
 * Each write re-evaluates the written cell and then every cell that transitively reads it,
 * in dependency order. Writes arriving while a recalculation is running are queued and
 * applied, in order, once it finishes. Callers are expected to serialize writes per sheet
 * (the service holds the sheet's write lock).
 */
public class RecalculationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RecalculationEngine.class);

    private static final Comparator<String> CELL_ORDER = Comparator.comparing(CellAddress::parse);

    private final Sheet sheet;
    private final DependencyGraph graph;
    private final FunctionLibrary functions;
    private final FormulaProperties properties;
    private final FormulaEvaluator evaluator;
    private final ResultCache cache;

    private final Deque<PendingUpdate> pendingUpdates = new ArrayDeque<>();
    private boolean recalculating;

    public RecalculationEngine(Sheet sheet, FunctionLibrary functions, FormulaProperties properties, Clock clock) {
        this.sheet = sheet;
        this.graph = sheet.getDependencyGraph();
        this.functions = functions;
        this.properties = properties;
        this.evaluator = new FormulaEvaluator(sheet, functions, graph, this, properties);
        this.cache = new ResultCache(properties.getCacheTtl(), clock);
    }

    /**
     * Writes a cell and recalculates everything downstream of it.
     *
     * @param cellId    cell to write, any letter case
     * @param text      the raw text; a formula keeps its leading "="
     * @param isFormula whether the text is a formula
     * @return every cell of the sheet after the write settled, in row-major order
     */
    public Map<String, CellSnapshot> updateCell(String cellId, String text, boolean isFormula) {
        PendingUpdate update = new PendingUpdate(CellAddress.normalize(cellId), text == null ? "" : text, isFormula);
        pendingUpdates.addLast(update);
        if (recalculating) {
            LOG.debug("Queued update of {} behind running recalculation", update.cellId);
            return getSnapshot();
        }

        recalculating = true;
        try {
            while (!pendingUpdates.isEmpty()) {
                applyUpdate(pendingUpdates.pollFirst());
            }
        } finally {
            recalculating = false;
            pendingUpdates.clear();
        }
        return getSnapshot();
    }

    private void applyUpdate(PendingUpdate update) {
        String cellId = update.cellId;
        LOG.debug("Updating {} to '{}' (formula={})", cellId, update.text, update.isFormula);

        graph.clearDependencies(cellId);
        cache.invalidateAll(graph.getEvaluationOrder(cellId));

        Cell cell = sheet.getOrCreateCell(cellId);
        cell.setRawValue(update.text);
        cell.setFormula(update.isFormula ? update.text : null);
        cell.clearCalculation();

        Set<String> settled = new HashSet<>();
        Deque<String> retries = new ArrayDeque<>();
        recalculate(cellId, update.isFormula, settled, retries);

        // cells that were refused a circular read of something that just changed
        while (!retries.isEmpty()) {
            String reader = retries.pollFirst();
            Cell readerCell = sheet.getCell(reader);
            if (readerCell == null || !readerCell.hasFormula()) {
                continue;
            }
            LOG.debug("Retrying {} after a change to a cell it was refused", reader);
            cache.invalidateAll(graph.getEvaluationOrder(reader));
            readerCell.clearCalculation();
            recalculate(reader, true, settled, retries);
        }
    }

    /**
     * Evaluates 'cellId' when asked to, then every cell that transitively reads it.
     * Rejected readers of any of those cells not yet settled in this update are queued.
     */
    private void recalculate(String cellId, boolean evaluateSelf, Set<String> settled, Deque<String> retries) {
        settled.add(cellId);
        if (evaluateSelf) {
            evaluator.evaluateCell(cellId);
        }

        List<String> order = graph.getEvaluationOrder(cellId);
        order.remove(cellId);
        for (String dependent : order) {
            Cell dependentCell = sheet.getCell(dependent);
            if (dependentCell != null && dependentCell.hasFormula()) {
                dependentCell.clearCalculation();
            }
        }
        for (String dependent : order) {
            Cell dependentCell = sheet.getCell(dependent);
            // an earlier cell in the order may already have pulled this one in
            if (dependentCell != null && dependentCell.isDirty()) {
                evaluator.evaluateCell(dependent);
            }
        }
        if (!order.isEmpty()) {
            LOG.debug("Recalculated {} dependents of {}", order.size(), cellId);
        }
        settled.addAll(order);

        order.add(0, cellId);
        for (String changed : order) {
            for (String reader : graph.getRejectedReaders(changed)) {
                if (!settled.contains(reader) && !retries.contains(reader)) {
                    retries.addLast(reader);
                }
            }
        }
    }

    /**
     * Called by the evaluator with the final value of a formula cell.
     */
    void storeResult(String cellId, FormulaValue value) {
        Cell cell = sheet.getOrCreateCell(cellId);
        cell.setCalculatedValue(value);
        cache.put(cellId, value);
        if (value.isError()) {
            LOG.debug("{} evaluated to {}", cellId, value);
        }
    }

    /**
     * Current value of a cell: the formula result, the parsed plain value, or 0 when empty.
     */
    public FormulaValue getCellValue(String cellId) {
        String id = CellAddress.normalize(cellId);
        FormulaValue cached = cache.get(id);
        if (cached != null) {
            return cached;
        }
        Cell cell = sheet.getCell(id);
        if (cell == null || cell.isEmpty()) {
            return NumberValue.ZERO;
        }
        if (cell.hasFormula() && cell.getCalculatedValue() == null) {
            // not settled yet; compute without storing anything
            return FormulaEvaluator.readOnly(sheet, functions, properties).evaluateCell(id).asValue();
        }
        FormulaValue value = cell.hasFormula() ? cell.getCalculatedValue() : FormulaValue.fromCellText(cell.getRawValue());
        cache.put(id, value);
        return value;
    }

    /**
     * What a cell shows: the error code when errored, the formatted result of a formula,
     * or the raw text of a plain value. Empty for a cell never written.
     */
    public String getCellDisplayValue(String cellId) {
        Cell cell = sheet.getCell(CellAddress.normalize(cellId));
        if (cell == null) {
            return "";
        }
        if (cell.hasError()) {
            return cell.getError();
        }
        if (cell.hasFormula()) {
            FormulaValue value = cell.getCalculatedValue();
            return value == null ? "" : value.toDisplayString();
        }
        return cell.getRawValue();
    }

    public String getCellError(String cellId) {
        Cell cell = sheet.getCell(CellAddress.normalize(cellId));
        return cell == null ? null : cell.getError();
    }

    public String getCellRawValue(String cellId) {
        Cell cell = sheet.getCell(CellAddress.normalize(cellId));
        return cell == null ? "" : cell.getRawValue();
    }

    public boolean cellHasFormula(String cellId) {
        Cell cell = sheet.getCell(CellAddress.normalize(cellId));
        return cell != null && cell.hasFormula();
    }

    public boolean cellHasError(String cellId) {
        Cell cell = sheet.getCell(CellAddress.normalize(cellId));
        return cell != null && cell.hasError();
    }

    /**
     * Evaluates formula text against the current cells without changing anything.
     */
    public EvaluationResult evaluateFormula(String formulaText) {
        return FormulaEvaluator.readOnly(sheet, functions, properties).evaluateFormula(formulaText);
    }

    public Map<String, CellSnapshot> getSnapshot() {
        Map<String, CellSnapshot> snapshot = new TreeMap<>(CELL_ORDER);
        for (Cell cell : sheet.getCells().values()) {
            snapshot.put(cell.getCellId(), CellSnapshot.of(cell));
        }
        return Collections.unmodifiableMap(snapshot);
    }

    public Sheet getSheet() {
        return sheet;
    }

    public DependencyGraph getDependencyGraph() {
        return graph;
    }

    private static final class PendingUpdate {
        private final String cellId;
        private final String text;
        private final boolean isFormula;

        private PendingUpdate(String cellId, String text, boolean isFormula) {
            this.cellId = cellId;
            this.text = text;
            this.isFormula = isFormula;
        }
    }
}
