package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.spreadsheet.engine.values.EvaluationResult;

/**
 * JSON form of a one-off formula evaluation:
 * { "value": 6.0 } or { "error": "#DIV/0!", "message": "Division by zero" }.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EvaluationResponse {
    private final Object value;
    private final String error;
    private final String message;

    public EvaluationResponse(Object value, String error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static EvaluationResponse of(EvaluationResult result) {
        if (result.isError()) {
            return new EvaluationResponse(null, result.getError().getCode(), result.getMessage());
        }
        return new EvaluationResponse(result.getValue().toJavaObject(), null, null);
    }

    public Object getValue() {
        return value;
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }
}
