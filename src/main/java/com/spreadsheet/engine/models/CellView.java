package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What the presentation layer needs to render one cell.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CellView {
    private final String cellId;
    private final String raw;
    private final String display;
    private final String error;

    public CellView(String cellId, String raw, String display, String error) {
        this.cellId = cellId;
        this.raw = raw;
        this.display = display;
        this.error = error;
    }

    public String getCellId() {
        return cellId;
    }

    public String getRaw() {
        return raw;
    }

    public String getDisplay() {
        return display;
    }

    public String getError() {
        return error;
    }
}
