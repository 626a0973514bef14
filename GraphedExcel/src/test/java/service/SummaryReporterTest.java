package service;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import model.AnalysisResult;
import model.CellAddress;
import model.DependencyGraph;
import model.FunctionUsageTable;
import model.Reference;
import model.WorkbookContents;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Report layout and ordering.
 */
class SummaryReporterTest {

    private static String row(String label, int n) {
        return String.format("%-28s%5d%n", label, n).replace(System.lineSeparator(), "\n");
    }

    @Test
    void testReportForRangeFormula() {
        WorkbookContents book = new WorkbookContents("b.xlsx");
        book.addCell("Sheet1", "D4", "=SUM(A1:A2)");
        AnalysisResult result = new DependencyGraphBuilder().build(book.allCells());

        String report = new SummaryReporter().render(result.getGraph(), result.getFunctionUsage());

        String expected = "=== Dependency Graph Summary ===\n"
                + row("Cell/Node count", 4)
                + row("Dependency count", 3)
                + "\n"
                + "=== Nodes with the highest degree ===\n"
                + row("Sheet1!A1:A2", 3)
                + row("Sheet1!D4", 1)
                + row("Sheet1!A1", 1)
                + row("Sheet1!A2", 1)
                + "\n"
                + "=== Formula functions by count ===\n"
                + row("SUM", 1);
        assertEquals(expected, report);
    }

    @Test
    void testLabelsLeftAndNumbersRightJustified() {
        assertEquals("Cell/Node count                12\n", SummaryReporter.line("Cell/Node count", 12));
        assertEquals("A_very_long_label_that_overflows_width123456\n",
                SummaryReporter.line("A_very_long_label_that_overflows_width", 123456));
    }

    @Test
    void testTopNodesLimitedAndTiesInInsertionOrder() {
        DependencyGraph g = new DependencyGraph();
        for (int r = 1; r <= 15; r++) {
            g.addNode(CellAddress.parse("S", "A" + r), "S");
        }
        g.addEdge(CellAddress.parse("S", "A15"), CellAddress.parse("S", "A14"));

        SummaryReporter reporter = new SummaryReporter(10);
        List<Map.Entry<Reference, Integer>> top = reporter.topByDegree(g);

        assertEquals(10, top.size());
        assertEquals("S!A14", top.get(0).getKey().toString());
        assertEquals("S!A15", top.get(1).getKey().toString());
        assertEquals("S!A1", top.get(2).getKey().toString());
        assertEquals("S!A8", top.get(9).getKey().toString());
    }

    @Test
    void testFunctionsSortedByCountDescending() {
        FunctionUsageTable usage = new FunctionUsageTable();
        usage.add("IF", 1);
        usage.add("SUM", 4);
        usage.add("MAX", 1);

        String report = new SummaryReporter().render(new DependencyGraph(), usage);
        String functions = report.substring(report.indexOf(SummaryReporter.HEADER_FUNCTIONS));

        assertEquals(SummaryReporter.HEADER_FUNCTIONS + "\n" + row("SUM", 4) + row("IF", 1) + row("MAX", 1),
                functions);
    }

    @Test
    void testEmptyGraphStillPrintsAllSections() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        new SummaryReporter().print(new DependencyGraph(), new FunctionUsageTable(),
                new PrintStream(buf, true, StandardCharsets.UTF_8));
        String out = buf.toString(StandardCharsets.UTF_8);

        int a = out.indexOf(SummaryReporter.HEADER_SUMMARY);
        int b = out.indexOf(SummaryReporter.HEADER_DEGREE);
        int c = out.indexOf(SummaryReporter.HEADER_FUNCTIONS);
        assertTrue(a == 0 && a < b && b < c, out);
        assertTrue(out.contains(row("Cell/Node count", 0)));
    }
}
