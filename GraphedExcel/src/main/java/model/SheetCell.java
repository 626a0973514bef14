package model;

/** One cell as delivered by the workbook loader. */
public class SheetCell {

    private final String sheetName;
    private final String coordinate;  // e.g. "B12"
    private final Object value;       // Double / String / Boolean / null; formulas as "=..."

    public SheetCell(String sheetName, String coordinate, Object value) {
        this.sheetName = sheetName;
        this.coordinate = coordinate;
        this.value = value;
    }

    public String getSheetName() { return sheetName; }
    public String getCoordinate() { return coordinate; }
    public Object getValue() { return value; }

    public boolean isFormula() {
        return value instanceof String && ((String) value).startsWith("=");
    }

    public String getFormula() {
        return isFormula() ? (String) value : null;
    }

    @Override
    public String toString() {
        return sheetName + "!" + coordinate + "=" + value;
    }
}
