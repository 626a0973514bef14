package repository;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import model.SheetCell;
import model.WorkbookContents;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loads workbooks written with POI into a temp directory.
 */
class ExcelRepositoryTest {

    @TempDir
    Path tmp;

    private final ExcelRepository repo = new ExcelRepository();

    private File writeSample() throws IOException {
        File f = tmp.resolve("sample.xlsx").toFile();
        try (Workbook wb = new XSSFWorkbook()) {
            Sheet s1 = wb.createSheet("Sheet1");
            Sheet s2 = wb.createSheet("Sheet2");

            Row r1 = s1.createRow(0);
            r1.createCell(0).setCellValue(5);
            r1.createCell(1).setCellValue("label");
            Row r2 = s1.createRow(1);
            r2.createCell(0).setCellValue(true);
            r2.createCell(1).setCellFormula("A1+Sheet2!C3");
            Row r4 = s1.createRow(3);
            r4.createCell(3).setCellFormula("SUM($A$1:$A$2)");

            s2.createRow(2).createCell(2).setCellValue(7);

            try (OutputStream out = new FileOutputStream(f)) {
                wb.write(out);
            }
        }
        return f;
    }

    @Test
    void testLoadKeepsSheetAndRowOrder() throws IOException {
        WorkbookContents contents = repo.load(writeSample());

        assertEquals("sample.xlsx", contents.getName());
        assertEquals(List.of("Sheet1", "Sheet2"), contents.getSheetNames());

        List<SheetCell> cells = contents.getCells("Sheet1");
        assertEquals(5, cells.size());
        assertEquals("A1", cells.get(0).getCoordinate());
        assertEquals(5.0, cells.get(0).getValue());
        assertEquals("label", cells.get(1).getValue());
        assertEquals(Boolean.TRUE, cells.get(2).getValue());
        assertEquals("B2", cells.get(3).getCoordinate());
        assertEquals("=A1+Sheet2!C3", cells.get(3).getValue());
        assertTrue(cells.get(3).isFormula());
        assertEquals("D4", cells.get(4).getCoordinate());
        assertEquals("=SUM($A$1:$A$2)", cells.get(4).getValue());

        assertEquals(1, contents.getCells("Sheet2").size());
        assertEquals("C3", contents.getCells("Sheet2").get(0).getCoordinate());
    }

    @Test
    void testMissingFileIsLoadError() {
        File missing = tmp.resolve("nope.xlsx").toFile();
        WorkbookLoadException ex = assertThrows(WorkbookLoadException.class, () -> repo.load(missing));
        assertTrue(ex.getMessage().contains("not found"));
    }

    @Test
    void testEmptyFileIsLoadError() throws IOException {
        File empty = Files.createFile(tmp.resolve("empty.xlsx")).toFile();
        assertThrows(WorkbookLoadException.class, () -> repo.load(empty));
    }

    @Test
    void testCorruptFileIsLoadError() throws IOException {
        File junk = tmp.resolve("junk.xlsx").toFile();
        Files.write(junk.toPath(), "this is not a spreadsheet".getBytes(StandardCharsets.UTF_8));

        assertThrows(WorkbookLoadException.class, () -> repo.load(junk));
    }

    @Test
    void testNullFileIsLoadError() {
        assertThrows(WorkbookLoadException.class, () -> repo.load(null));
    }
}
