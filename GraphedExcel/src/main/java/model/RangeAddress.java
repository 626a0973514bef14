package model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rectangular block of cells on one sheet.
 * Corners are normalised on construction: {@code B3:A1} becomes {@code A1:B3}.
 */
public final class RangeAddress implements Reference {

    private final String sheet;
    private final CellAddress startCell;  // top-left
    private final CellAddress endCell;    // bottom-right

    public RangeAddress(String sheet, CellAddress first, CellAddress second) {
        this.sheet = sheet;

        int minCol = Math.min(first.getColumnNumber(), second.getColumnNumber());
        int maxCol = Math.max(first.getColumnNumber(), second.getColumnNumber());
        int minRow = Math.min(first.getRow(), second.getRow());
        int maxRow = Math.max(first.getRow(), second.getRow());

        this.startCell = new CellAddress(sheet, minCol, minRow);
        this.endCell = new CellAddress(sheet, maxCol, maxRow);
    }

    /** Parses {@code A1:B2} (no sheet prefix). */
    public static RangeAddress parse(String sheet, String text) {
        if (text == null) throw new IllegalArgumentException("Range is null");

        int colon = text.indexOf(':');
        if (colon < 0) throw new IllegalArgumentException("Not a range: " + text);

        return new RangeAddress(sheet,
                CellAddress.parse(null, text.substring(0, colon)),
                CellAddress.parse(null, text.substring(colon + 1)));
    }

    @Override
    public String getSheet() { return sheet; }

    public CellAddress getStartCell() { return startCell; }
    public CellAddress getEndCell() { return endCell; }

    public int getColumnCount() {
        return endCell.getColumnNumber() - startCell.getColumnNumber() + 1;
    }

    public int getRowCount() {
        return endCell.getRow() - startCell.getRow() + 1;
    }

    /** Number of member cells; long because whole-sheet ranges overflow an int. */
    public long getCellCount() {
        return (long) getColumnCount() * getRowCount();
    }

    /**
     * Member cells, columns outer and rows inner: {@code A1:B2 -> A1, A2, B1, B2}.
     * Members carry the same sheet as the range (possibly none).
     */
    public List<CellAddress> cells() {
        List<CellAddress> out = new ArrayList<>();
        for (int c = startCell.getColumnNumber(); c <= endCell.getColumnNumber(); c++) {
            for (int r = startCell.getRow(); r <= endCell.getRow(); r++) {
                out.add(new CellAddress(sheet, c, r));
            }
        }
        return out;
    }

    @Override
    public RangeAddress qualify(String sheetName) {
        if (sheet != null) return this;
        return new RangeAddress(sheetName, startCell, endCell);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RangeAddress)) return false;
        RangeAddress other = (RangeAddress) o;
        return startCell.equals(other.startCell) && endCell.equals(other.endCell);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startCell, endCell);
    }

    @Override
    public String toString() {
        String body = startCell.getCoordinate() + ":" + endCell.getCoordinate();
        return sheet == null ? body : CellAddress.formatSheet(sheet) + "!" + body;
    }
}
