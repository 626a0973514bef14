package model;

import java.util.Locale;
import java.util.Objects;

import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.formula.SheetNameFormatter;
import org.apache.poi.ss.util.CellReference;

/**
 * Address of a single cell: sheet (optional), column letters, row number.
 * Immutable value object; column letters are always kept uppercase.
 * Columns and rows are bounded by the xlsx grid (A..XFD, 1..1048576).
 */
public final class CellAddress implements Reference {

    public static final int MAX_COLUMN_LETTERS = 3;

    public static final SpreadsheetVersion GRID = SpreadsheetVersion.EXCEL2007;

    private final String sheet;   // null = sheet of the formula
    private final String column;
    private final int row;

    public CellAddress(String sheet, String column, int row) {
        if (column == null || column.isEmpty() || column.length() > MAX_COLUMN_LETTERS) {
            throw new IllegalArgumentException("Invalid column: " + column);
        }
        if (!isRowInGrid(row)) {
            throw new IllegalArgumentException("Row out of range: " + row);
        }
        int number = columnNumber(column);
        if (!isColumnInGrid(number)) {
            throw new IllegalArgumentException("Column out of range: " + column);
        }
        this.sheet = sheet;
        this.column = column.toUpperCase(Locale.ROOT);
        this.row = row;
    }

    public CellAddress(String sheet, int columnNumber, int row) {
        this(sheet, columnLetters(columnNumber), row);
    }

    /**
     * Parses a coordinate such as {@code B12} (no sheet; {@code $} markers allowed).
     */
    public static CellAddress parse(String sheet, String coordinate) {
        if (coordinate == null) throw new IllegalArgumentException("Coordinate is null");

        String text = coordinate.trim();
        if (text.isEmpty()
                || CellReference.classifyCellReference(text, GRID) != CellReference.NameType.CELL) {
            throw new IllegalArgumentException("Not a cell coordinate: " + coordinate);
        }
        CellReference ref = new CellReference(text);
        return new CellAddress(sheet, ref.getCol() + 1, ref.getRow() + 1);
    }

    public static boolean isRowInGrid(long row) {
        return row >= 1 && row <= GRID.getMaxRows();
    }

    public static boolean isColumnInGrid(long columnNumber) {
        return columnNumber >= 1 && columnNumber <= GRID.getMaxColumns();
    }

    // ===========================
    // Column letters <-> number (1-based)
    // ===========================

    public static int columnNumber(String letters) {
        if (letters == null || letters.isEmpty()) throw new IllegalArgumentException("Invalid column: " + letters);
        for (char ch : letters.toCharArray()) {
            if ((ch < 'A' || ch > 'Z') && (ch < 'a' || ch > 'z')) throw new IllegalArgumentException("Invalid column: " + letters);
        }
        return CellReference.convertColStringToIndex(letters) + 1;
    }

    public static String columnLetters(int number) {
        if (number < 1) throw new IllegalArgumentException("Column number must be positive: " + number);
        return CellReference.convertNumToColString(number - 1);
    }

    // ===========================
    // Sheet names
    // ===========================

    /** Sheet prefix as written in a formula: quoted only when the name needs it. */
    public static String formatSheet(String sheet) {
        return SheetNameFormatter.format(sheet);
    }

    static String sheetKey(String sheet) {
        return sheet == null ? null : sheet.toUpperCase(Locale.ROOT);
    }

    // ===========================

    @Override
    public String getSheet() { return sheet; }

    public String getColumn() { return column; }
    public int getColumnNumber() { return columnNumber(column); }
    public int getRow() { return row; }

    /** Coordinate without sheet, e.g. {@code AZ120}. */
    public String getCoordinate() { return column + row; }

    @Override
    public CellAddress qualify(String sheetName) {
        if (sheet != null) return this;
        return new CellAddress(sheetName, column, row);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellAddress)) return false;
        CellAddress other = (CellAddress) o;
        return row == other.row
                && column.equals(other.column)
                && Objects.equals(sheetKey(sheet), sheetKey(other.sheet));
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheetKey(sheet), column, row);
    }

    @Override
    public String toString() {
        return sheet == null ? getCoordinate() : formatSheet(sheet) + "!" + getCoordinate();
    }
}
