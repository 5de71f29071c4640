package com.spreadsheet.engine.values;

/**
 * Error taxonomy surfaced to the user. Each kind carries the display code
 * a spreadsheet shows in the offending cell.
 */
public enum ErrorKind {
    DIV_ZERO("#DIV/0!"),
    NAME("#NAME?"),
    VALUE("#VALUE!"),
    REF("#REF!"),
    NUM("#NUM!"),
    NA("#N/A"),
    ERROR("#ERROR!");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Reverse lookup from a display code like "#DIV/0!".
     * Returns null for an unknown code.
     */
    public static ErrorKind fromCode(String code) {
        for (ErrorKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        return null;
    }
}
