package com.spreadsheet.engine.values;

import java.util.Objects;

/**
 * A formula error carried as a value. Once produced, it is the result of every
 * expression that consumes it.
 */
public final class ErrorValue extends FormulaValue {

    private final ErrorKind kind;
    private final String message;

    private ErrorValue(ErrorKind kind, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message == null ? "" : message;
    }

    public static ErrorValue of(ErrorKind kind, String message) {
        return new ErrorValue(kind, message);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public String getCode() {
        return kind.getCode();
    }

    @Override
    public ValueType getType() {
        return ValueType.ERROR;
    }

    @Override
    public boolean isNumeric() {
        return false;
    }

    @Override
    public double toNumber() {
        return 0;
    }

    @Override
    public String toText() {
        return kind.getCode();
    }

    @Override
    public boolean toBoolean() {
        return false;
    }

    @Override
    public Object toJavaObject() {
        return kind.getCode();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ErrorValue)) return false;
        ErrorValue other = (ErrorValue) o;
        return kind == other.kind && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message);
    }

    @Override
    public String toString() {
        return "Error(" + kind.getCode() + ": " + message + ")";
    }
}
