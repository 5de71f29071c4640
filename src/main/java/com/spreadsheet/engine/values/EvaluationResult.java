package com.spreadsheet.engine.values;

import java.util.Objects;

/**
 * Outcome of evaluating a formula: either a value, or an error kind with a message.
 * Never both.
 */
public final class EvaluationResult {

    private final FormulaValue value;

    private EvaluationResult(FormulaValue value) {
        this.value = value;
    }

    /**
     * Wraps an evaluated value; an {@link ErrorValue} makes this an error result.
     */
    public static EvaluationResult of(FormulaValue value) {
        return new EvaluationResult(Objects.requireNonNull(value, "value"));
    }

    public static EvaluationResult error(ErrorKind kind, String message) {
        return new EvaluationResult(ErrorValue.of(kind, message));
    }

    public boolean isError() {
        return value.isError();
    }

    /**
     * The successful value, or null for an error result.
     */
    public FormulaValue getValue() {
        return value.isError() ? null : value;
    }

    /**
     * The error kind, or null for a successful result.
     */
    public ErrorKind getError() {
        return value.isError() ? ((ErrorValue) value).getKind() : null;
    }

    public String getMessage() {
        return value.isError() ? ((ErrorValue) value).getMessage() : null;
    }

    /**
     * The underlying value, including an {@link ErrorValue} for an error result.
     */
    public FormulaValue asValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EvaluationResult)) return false;
        return value.equals(((EvaluationResult) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return isError() ? "EvaluationResult{error=" + getError().getCode() + ", message=" + getMessage() + "}"
                : "EvaluationResult{value=" + value + "}";
    }
}
