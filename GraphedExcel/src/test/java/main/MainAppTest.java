package main;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import model.AppConfig;
import model.AppModel;
import org.apache.commons.cli.ParseException;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Command line parsing and exit codes.
 */
class MainAppTest {

    @TempDir
    Path tmp;

    private ByteArrayOutputStream buf;
    private PrintStream out;
    private final AppConfig config = AppConfig.defaults();

    @BeforeEach
    void setUp() {
        buf = new ByteArrayOutputStream();
        out = new PrintStream(buf, true, StandardCharsets.UTF_8);
    }

    @Test
    void testDefaults() throws ParseException {
        AppModel model = MainApp.parseArgs(new String[0], config);

        assertEquals(new File("Book1.xlsx"), model.getWorkbookFile());
        assertFalse(model.isVerbose());
        assertTrue(model.isVisualize());
        assertFalse(model.isKeepDirection());
    }

    @Test
    void testFlagsAndPositionalPath() throws ParseException {
        AppModel model = MainApp.parseArgs(
                new String[] {"budget.xlsx", "--verbose", "--no-visualize", "--keep-direction"}, config);

        assertEquals(new File("budget.xlsx"), model.getWorkbookFile());
        assertTrue(model.isVerbose());
        assertFalse(model.isVisualize());
        assertTrue(model.isKeepDirection());
    }

    @Test
    void testHelpReturnsNoModel() throws ParseException {
        assertNull(MainApp.parseArgs(new String[] {"--help"}, config));
        assertEquals(MainApp.EXIT_OK, MainApp.run(new String[] {"-h"}, config, out));
        assertTrue(buf.toString(StandardCharsets.UTF_8).contains("--no-visualize"));
    }

    @Test
    void testBadCommandLine() {
        assertThrows(ParseException.class, () -> MainApp.parseArgs(new String[] {"--colour"}, config));
        assertThrows(ParseException.class, () -> MainApp.parseArgs(new String[] {"a.xlsx", "b.xlsx"}, config));
        assertEquals(MainApp.EXIT_USAGE, MainApp.run(new String[] {"a.xlsx", "b.xlsx"}, config, out));
    }

    @Test
    void testMissingWorkbookExitsWithLoadError() {
        String missing = tmp.resolve("missing.xlsx").toString();

        assertEquals(MainApp.EXIT_LOAD_ERROR, MainApp.run(new String[] {missing, "--no-visualize"}, config, out));
        assertTrue(buf.toString(StandardCharsets.UTF_8).startsWith("Error: "));
    }

    @Test
    void testEndToEndReport() throws IOException {
        File book = tmp.resolve("Book1.xlsx").toFile();
        try (Workbook wb = new XSSFWorkbook()) {
            Sheet s = wb.createSheet("Sheet1");
            wb.createSheet("Sheet2");
            Row r = s.createRow(0);
            r.createCell(0).setCellValue(5);
            r.createCell(1).setCellFormula("A1+Sheet2!C3");
            s.createRow(3).createCell(3).setCellFormula("SUM(A1:A2)+SUM(B1:B2)");
            try (OutputStream os = new FileOutputStream(book)) {
                wb.write(os);
            }
        }

        int code = MainApp.run(new String[] {book.getPath(), "--no-visualize"}, config, out);
        String report = buf.toString(StandardCharsets.UTF_8);

        assertEquals(MainApp.EXIT_OK, code);
        assertTrue(report.startsWith("=== Dependency Graph Summary ==="));
        assertTrue(report.contains(String.format("%-28s%5d", "SUM", 2)));
        assertTrue(report.contains("Sheet1!B1"));
    }
}
