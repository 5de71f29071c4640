package com.spreadsheet.engine.models;

import com.spreadsheet.engine.exceptions.InvalidCellReferenceException;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A cell location in A1 notation.
 * Columns are 0-indexed internally (A = 0, Z = 25, AA = 26); rows are 1-indexed.
 */
public final class CellAddress implements Comparable<CellAddress> {

    // Same bounds as the common desktop spreadsheets: XFD1048576 is the last cell
    public static final int MAX_COLUMNS = 16_384;
    public static final int MAX_ROWS = 1_048_576;

    private static final Pattern CELL_ID = Pattern.compile("([A-Za-z]{1,3})([0-9]{1,7})");

    private final int column;
    private final int row;

    private CellAddress(int column, int row) {
        this.column = column;
        this.row = row;
    }

    /**
     * @param column 0-based column index
     * @param row    1-based row number
     */
    public static CellAddress of(int column, int row) {
        if (column < 0 || column >= MAX_COLUMNS) {
            throw new InvalidCellReferenceException("Column index out of range: " + column);
        }
        if (row < 1 || row > MAX_ROWS) {
            throw new InvalidCellReferenceException("Row out of range: " + row);
        }
        return new CellAddress(column, row);
    }

    /**
     * Parses "A1", "b12", "XFD1048576". Case-insensitive.
     */
    public static CellAddress parse(String cellId) {
        if (cellId == null) {
            throw new InvalidCellReferenceException("Cell id is required");
        }
        Matcher matcher = CELL_ID.matcher(cellId.trim());
        if (!matcher.matches()) {
            throw new InvalidCellReferenceException("Invalid cell id: " + cellId);
        }
        String letters = matcher.group(1).toUpperCase(Locale.ROOT);
        String digits = matcher.group(2);
        if (digits.charAt(0) == '0') {
            throw new InvalidCellReferenceException("Invalid cell id: " + cellId);
        }
        return of(columnLetterToIndex(letters), Integer.parseInt(digits));
    }

    /**
     * Canonical upper-case id for any accepted spelling of a cell id.
     */
    public static String normalize(String cellId) {
        return parse(cellId).toId();
    }

    public static boolean isValid(String cellId) {
        try {
            parse(cellId);
            return true;
        } catch (InvalidCellReferenceException e) {
            return false;
        }
    }

    // "A" -> 0, "Z" -> 25, "AA" -> 26
    public static int columnLetterToIndex(String letters) {
        int index = 0;
        for (int i = 0; i < letters.length(); i++) {
            index = index * 26 + (Character.toUpperCase(letters.charAt(i)) - 'A' + 1);
        }
        return index - 1;
    }

    // 0 -> "A", 25 -> "Z", 26 -> "AA"
    public static String columnIndexToLetter(int index) {
        StringBuilder letters = new StringBuilder();
        int remaining = index + 1;
        while (remaining > 0) {
            int remainder = (remaining - 1) % 26;
            letters.insert(0, (char) ('A' + remainder));
            remaining = (remaining - 1) / 26;
        }
        return letters.toString();
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    public String getColumnLetters() {
        return columnIndexToLetter(column);
    }

    public String toId() {
        return getColumnLetters() + row;
    }

    /**
     * Row-major ordering: A1, B1, ..., A2, B2.
     */
    @Override
    public int compareTo(CellAddress other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellAddress)) return false;
        CellAddress that = (CellAddress) o;
        return column == that.column && row == that.row;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, row);
    }

    @Override
    public String toString() {
        return toId();
    }
}
