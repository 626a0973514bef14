package model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sheets of a workbook in workbook order, each with its cells in row-major order.
 */
public class WorkbookContents {

    private final String name;
    private final Map<String, List<SheetCell>> sheets = new LinkedHashMap<>();

    public WorkbookContents(String name) {
        this.name = name;
    }

    public String getName() { return name; }

    public void addSheet(String sheetName) {
        sheets.putIfAbsent(sheetName, new ArrayList<>());
    }

    public void addCell(String sheetName, String coordinate, Object value) {
        addSheet(sheetName);
        sheets.get(sheetName).add(new SheetCell(sheetName, coordinate, value));
    }

    public List<String> getSheetNames() {
        return new ArrayList<>(sheets.keySet());
    }

    public List<SheetCell> getCells(String sheetName) {
        List<SheetCell> cells = sheets.get(sheetName);
        if (cells == null) throw new IllegalArgumentException("Unknown sheet: " + sheetName);
        return Collections.unmodifiableList(cells);
    }

    /** All cells of all sheets, sheet by sheet. */
    public List<SheetCell> allCells() {
        List<SheetCell> out = new ArrayList<>();
        sheets.values().forEach(out::addAll);
        return out;
    }

    public int cellCount() {
        return sheets.values().stream().mapToInt(List::size).sum();
    }
}
