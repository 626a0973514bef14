package repository;

import java.io.File;
import java.io.IOException;

import model.WorkbookContents;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

/**
 * Reads .xlsx / .xls files with Apache POI.
 * The file is opened read-only: the original is never modified or locked for writing.
 * <p>
 * Cell values: formula -> {@code "=" + formula}, numeric -> Double, string -> String,
 * boolean -> Boolean, error -> error code text (e.g. {@code #DIV/0!}), blank -> null.
 */
public class ExcelRepository implements WorkbookLoader {

    private static final Logger log = LogManager.getLogger(ExcelRepository.class);

    @Override
    public WorkbookContents load(File file) throws WorkbookLoadException {
        if (file == null) throw new WorkbookLoadException("No workbook file given.");
        if (!file.isFile()) {
            throw new WorkbookLoadException("Workbook not found: " + file.getAbsolutePath());
        }
        if (file.length() == 0) {
            throw new WorkbookLoadException("Workbook is empty (0 bytes): " + file.getAbsolutePath());
        }

        log.info("Loading workbook: {} ({} bytes)", file.getAbsolutePath(), file.length());

        try (Workbook wb = WorkbookFactory.create(file, null, true)) {
            WorkbookContents contents = new WorkbookContents(file.getName());

            for (Sheet sheet : wb) {
                String sheetName = sheet.getSheetName();
                contents.addSheet(sheetName);

                for (Row row : sheet) {
                    for (Cell cell : row) {
                        contents.addCell(sheetName, cell.getAddress().formatAsString(), readValue(cell));
                    }
                }
                log.debug("Sheet '{}': {} cells", sheetName, contents.getCells(sheetName).size());
            }

            log.info("Workbook loaded: {} sheets, {} cells", contents.getSheetNames().size(), contents.cellCount());
            return contents;

        } catch (IOException ex) {
            throw new WorkbookLoadException("Cannot read workbook " + file.getName() + ": " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            // POI reports corrupt or non-Office files with unchecked exceptions
            throw new WorkbookLoadException("Invalid workbook " + file.getName() + ": " + ex.getMessage(), ex);
        }
    }

    Object readValue(Cell cell) {
        CellType type = cell.getCellType();
        switch (type) {
            case FORMULA:
                return readFormula(cell);
            case NUMERIC:
                return cell.getNumericCellValue();
            case STRING:
                return cell.getStringCellValue();
            case BOOLEAN:
                return cell.getBooleanCellValue();
            case ERROR:
                return FormulaError.forInt(cell.getErrorCellValue()).getString();
            default:
                return null;
        }
    }

    private String readFormula(Cell cell) {
        try {
            return "=" + cell.getCellFormula();
        } catch (RuntimeException ex) {
            log.warn("Unreadable formula in {}!{}: kept as empty formula",
                    cell.getSheet().getSheetName(), cell.getAddress().formatAsString(), ex);
            return "=";
        }
    }
}
