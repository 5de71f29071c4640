package com.spreadsheet.engine.evaluation;

import com.spreadsheet.engine.config.FormulaProperties;
import com.spreadsheet.engine.exceptions.CircularReferenceException;
import com.spreadsheet.engine.functions.FunctionDefinition;
import com.spreadsheet.engine.functions.FunctionLibrary;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.Sheet;
import com.spreadsheet.engine.parser.BinaryOperationNode;
import com.spreadsheet.engine.parser.CellReferenceNode;
import com.spreadsheet.engine.parser.ErrorNode;
import com.spreadsheet.engine.parser.FormulaParser;
import com.spreadsheet.engine.parser.FunctionCallNode;
import com.spreadsheet.engine.parser.Node;
import com.spreadsheet.engine.parser.NodeType;
import com.spreadsheet.engine.parser.NumberNode;
import com.spreadsheet.engine.parser.RangeNode;
import com.spreadsheet.engine.parser.StringNode;
import com.spreadsheet.engine.parser.UnaryOperationNode;
import com.spreadsheet.engine.values.ArrayValue;
import com.spreadsheet.engine.values.BlankValue;
import com.spreadsheet.engine.values.ErrorKind;
import com.spreadsheet.engine.values.ErrorValue;
import com.spreadsheet.engine.values.EvaluationResult;
import com.spreadsheet.engine.values.FormulaValue;
import com.spreadsheet.engine.values.NumberValue;
import com.spreadsheet.engine.values.TextValue;
import com.spreadsheet.engine.values.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks a parsed formula tree against one sheet and produces a value.
 * <p>
 * An evaluator bound to an engine records a dependency edge for every cell a formula
 * reads and hands finished cell results back to the engine. A read-only evaluator
 * (see {@link #readOnly}) does neither, so previews never change the sheet.
 * <p>
 * Evaluation errors are values, not exceptions: every failure ends up as an
 * {@link ErrorValue} inside the returned {@link EvaluationResult}.
 */
public class FormulaEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaEvaluator.class);

    private final Sheet sheet;
    private final FunctionLibrary functions;
    private final DependencyGraph graph;
    private final RecalculationEngine engine;
    private final int maxDepth;
    private final int maxRangeCells;

    // Cells whose formulas are currently being evaluated, innermost last.
    private final Deque<String> evaluationStack = new ArrayDeque<>();
    private final Set<String> inProgress = new HashSet<>();

    public FormulaEvaluator(Sheet sheet, FunctionLibrary functions, DependencyGraph graph,
                            RecalculationEngine engine, FormulaProperties properties) {
        this.sheet = sheet;
        this.functions = functions;
        this.graph = graph;
        this.engine = engine;
        this.maxDepth = properties.getMaxEvaluationDepth();
        this.maxRangeCells = properties.getMaxRangeCells();
    }

    /**
     * An evaluator that reads the sheet but never records edges or stores results.
     */
    public static FormulaEvaluator readOnly(Sheet sheet, FunctionLibrary functions, FormulaProperties properties) {
        return new FormulaEvaluator(sheet, functions, null, null, properties);
    }

    /**
     * Parses and evaluates formula text that belongs to no cell.
     */
    public EvaluationResult evaluateFormula(String formulaText) {
        return evaluate(FormulaParser.parse(formulaText), null);
    }

    /**
     * Evaluates a tree on behalf of {@code cellId}; references it makes are recorded
     * as edges from that cell. A null cellId records nothing.
     */
    public EvaluationResult evaluate(Node ast, String cellId) {
        FormulaValue value;
        try {
            value = evaluateNode(ast, cellId);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure evaluating {}", cellId == null ? "formula" : cellId, e);
            value = ErrorValue.of(ErrorKind.ERROR, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        return EvaluationResult.of(finish(value));
    }

    /**
     * Evaluates the formula stored in a cell. When bound to an engine, the cell's
     * outgoing edges are rebuilt from scratch and the result is stored on the cell.
     */
    public EvaluationResult evaluateCell(String cellId) {
        Cell cell = sheet.getCell(cellId);
        if (cell == null || !cell.hasFormula()) {
            FormulaValue plain = cell == null ? BlankValue.INSTANCE : FormulaValue.fromCellText(cell.getRawValue());
            return EvaluationResult.of(finish(plain));
        }
        if (inProgress.contains(cellId)) {
            return EvaluationResult.error(ErrorKind.REF, "Circular reference detected at " + cellId);
        }
        if (evaluationStack.size() >= maxDepth) {
            LOG.warn("Evaluation depth {} exceeded at {}", maxDepth, cellId);
            return EvaluationResult.error(ErrorKind.ERROR, "Maximum evaluation depth exceeded");
        }

        LOG.debug("Evaluating {} = {}", cellId, cell.getFormula());
        EvaluationResult result;
        evaluationStack.push(cellId);
        inProgress.add(cellId);
        try {
            if (graph != null) {
                graph.clearDependencies(cellId);
            }
            result = evaluate(FormulaParser.parse(cell.getFormula()), cellId);
        } finally {
            evaluationStack.pop();
            inProgress.remove(cellId);
        }
        if (engine != null) {
            engine.storeResult(cellId, result.asValue());
        }
        return result;
    }

    private FormulaValue evaluateNode(Node node, String cellId) {
        switch (node.getType()) {
            case NUMBER:
                return NumberValue.of(((NumberNode) node).getValue());
            case STRING:
                return TextValue.of(((StringNode) node).getValue());
            case CELL_REFERENCE:
                return evaluateReference(((CellReferenceNode) node).getCellId(), cellId);
            case RANGE:
                return evaluateRange((RangeNode) node, cellId);
            case UNARY_OPERATION:
                return evaluateUnary((UnaryOperationNode) node, cellId);
            case BINARY_OPERATION:
                return evaluateBinary((BinaryOperationNode) node, cellId);
            case FUNCTION_CALL:
                return evaluateFunction((FunctionCallNode) node, cellId);
            case ERROR:
                return ErrorValue.of(ErrorKind.ERROR, ((ErrorNode) node).getMessage());
            default:
                return ErrorValue.of(ErrorKind.ERROR, "Unknown node type: " + node.getType());
        }
    }

    /**
     * Value of a referenced cell. Absent cells are blank; the numeric and top-level
     * contexts read blank as 0.
     */
    private FormulaValue evaluateReference(String referencedId, String cellId) {
        if (inProgress.contains(referencedId)) {
            if (cellId != null && graph != null) {
                graph.recordRejectedRead(cellId, referencedId);
            }
            return ErrorValue.of(ErrorKind.REF, "Circular reference detected at " + referencedId);
        }
        if (cellId != null && graph != null) {
            try {
                graph.addDependency(cellId, referencedId);
            } catch (CircularReferenceException e) {
                LOG.warn("Rejected reference from {} to {}: {}", cellId, referencedId, e.getMessage());
                graph.recordRejectedRead(cellId, referencedId);
                return ErrorValue.of(ErrorKind.REF, e.getMessage());
            }
        }
        Cell cell = sheet.getCell(referencedId);
        if (cell == null || cell.isEmpty()) {
            return BlankValue.INSTANCE;
        }
        if (!cell.hasFormula()) {
            return FormulaValue.fromCellText(cell.getRawValue());
        }
        FormulaValue calculated = cell.getCalculatedValue();
        if (calculated == null) {
            calculated = evaluateCell(referencedId).asValue();
        }
        return calculated;
    }

    private FormulaValue evaluateRange(RangeNode range, String cellId) {
        if (range.getCellCount() > maxRangeCells) {
            return ErrorValue.of(ErrorKind.REF, "Range too large: " + range);
        }
        List<List<FormulaValue>> rows = new ArrayList<>();
        for (int row = range.getMinRow(); row <= range.getMaxRow(); row++) {
            List<FormulaValue> values = new ArrayList<>();
            for (int column = range.getMinColumn(); column <= range.getMaxColumn(); column++) {
                FormulaValue value = evaluateReference(CellAddress.of(column, row).toId(), cellId);
                if (value.isError()) {
                    return value;
                }
                values.add(value);
            }
            rows.add(values);
        }
        return ArrayValue.of(rows);
    }

    private FormulaValue evaluateUnary(UnaryOperationNode node, String cellId) {
        FormulaValue operand = evaluateNode(node.getOperand(), cellId);
        if (operand.isError()) {
            return operand;
        }
        Double number = asNumber(operand);
        if (number == null) {
            return ErrorValue.of(ErrorKind.VALUE, "Operand of unary " + node.getOperator() + " is not a number");
        }
        return "-".equals(node.getOperator()) ? NumberValue.of(-number) : NumberValue.of(number);
    }

    /**
     * Folds a left-deep operator chain such as {@code 1+2+3+...} in a loop, so the
     * length of the chain never turns into recursion depth.
     */
    private FormulaValue evaluateBinary(BinaryOperationNode node, String cellId) {
        Deque<BinaryOperationNode> chain = new ArrayDeque<>();
        Node leftmost = node;
        while (leftmost.getType() == NodeType.BINARY_OPERATION) {
            BinaryOperationNode binary = (BinaryOperationNode) leftmost;
            chain.push(binary);
            leftmost = binary.getLeft();
        }

        FormulaValue accumulated = evaluateNode(leftmost, cellId);
        while (!chain.isEmpty() && !accumulated.isError()) {
            BinaryOperationNode step = chain.pop();
            FormulaValue right = evaluateNode(step.getRight(), cellId);
            accumulated = applyOperator(step.getOperator(), accumulated, right);
        }
        return accumulated;
    }

    private FormulaValue applyOperator(String operator, FormulaValue left, FormulaValue right) {
        if (right.isError()) {
            return right;
        }
        Double a = asNumber(left);
        Double b = asNumber(right);
        if (a == null || b == null) {
            return ErrorValue.of(ErrorKind.VALUE, "Operands of " + operator + " must be numbers");
        }

        double result;
        switch (operator) {
            case "+":
                result = a + b;
                break;
            case "-":
                result = a - b;
                break;
            case "*":
                result = a * b;
                break;
            case "/":
                if (b == 0) {
                    return ErrorValue.of(ErrorKind.DIV_ZERO, "Division by zero");
                }
                result = a / b;
                break;
            case "%":
                if (b == 0) {
                    return ErrorValue.of(ErrorKind.DIV_ZERO, "Modulo by zero");
                }
                result = a % b;
                break;
            case "^":
                result = Math.pow(a, b);
                break;
            default:
                return ErrorValue.of(ErrorKind.ERROR, "Unknown operator: " + operator);
        }
        return numeric(result);
    }

    private FormulaValue evaluateFunction(FunctionCallNode node, String cellId) {
        FunctionDefinition definition = functions.get(node.getName());
        if (definition == null) {
            return ErrorValue.of(ErrorKind.NAME, "Unknown function: " + node.getName());
        }
        List<FormulaValue> arguments = new ArrayList<>(node.getArguments().size());
        for (Node argument : node.getArguments()) {
            FormulaValue value = evaluateNode(argument, cellId);
            if (value.isError()) {
                return value;
            }
            arguments.add(value);
        }
        FormulaValue result;
        try {
            result = definition.invoke(arguments);
        } catch (RuntimeException e) {
            LOG.debug("Function {} failed", definition.getName(), e);
            return ErrorValue.of(ErrorKind.ERROR, definition.getName() + ": " + e.getMessage());
        }
        if (result.getType() == ValueType.NUMBER) {
            return numeric(result.toNumber());
        }
        return result;
    }

    /**
     * Numeric reading of an operand, or null when it has none.
     * Blank is 0, booleans are 1/0, text must look like a number.
     */
    private static Double asNumber(FormulaValue value) {
        switch (value.getType()) {
            case NUMBER:
            case BOOLEAN:
            case BLANK:
                return value.toNumber();
            case TEXT:
                return NumberValue.parse(value.toText());
            default:
                return null;
        }
    }

    private static FormulaValue numeric(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return ErrorValue.of(ErrorKind.NUM, "Numeric result out of range");
        }
        return NumberValue.of(value);
    }

    // A formula that evaluates to an empty cell shows 0.
    private static FormulaValue finish(FormulaValue value) {
        if (value.isBlank()) {
            return NumberValue.ZERO;
        }
        if (value.getType() == ValueType.NUMBER) {
            return numeric(value.toNumber());
        }
        return value;
    }
}
