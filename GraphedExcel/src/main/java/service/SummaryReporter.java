package service;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import model.DependencyGraph;
import model.FunctionUsageTable;
import model.Reference;

/**
 * Text report of a finished analysis: graph size, highest-degree nodes, function usage.
 * Labels are left-justified to {@value #LABEL_WIDTH} chars, numbers right-justified to {@value #NUMBER_WIDTH}.
 */
public class SummaryReporter {

    static final int LABEL_WIDTH = 28;
    static final int NUMBER_WIDTH = 5;

    public static final String HEADER_SUMMARY = "=== Dependency Graph Summary ===";
    public static final String HEADER_DEGREE = "=== Nodes with the highest degree ===";
    public static final String HEADER_FUNCTIONS = "=== Formula functions by count ===";

    private final int topNodes;

    public SummaryReporter(int topNodes) {
        if (topNodes < 0) throw new IllegalArgumentException("topNodes must not be negative");
        this.topNodes = topNodes;
    }

    public SummaryReporter() {
        this(10);
    }

    public void print(DependencyGraph graph, FunctionUsageTable usage, PrintStream out) {
        out.print(render(graph, usage));
        out.flush();
    }

    public String render(DependencyGraph graph, FunctionUsageTable usage) {
        StringBuilder sb = new StringBuilder();

        sb.append(HEADER_SUMMARY).append('\n');
        sb.append(line("Cell/Node count", graph.nodeCount()));
        sb.append(line("Dependency count", graph.edgeCount()));
        sb.append('\n');

        sb.append(HEADER_DEGREE).append('\n');
        for (Map.Entry<Reference, Integer> e : topByDegree(graph)) {
            sb.append(line(e.getKey().toString(), e.getValue()));
        }

        sb.append('\n');
        sb.append(HEADER_FUNCTIONS).append('\n');
        for (Map.Entry<String, Integer> e : usage.sortedByCount()) {
            sb.append(line(e.getKey(), e.getValue()));
        }

        return sb.toString();
    }

    /** Nodes by descending degree, ties in insertion order, at most {@code topNodes}. */
    public List<Map.Entry<Reference, Integer>> topByDegree(DependencyGraph graph) {
        List<Map.Entry<Reference, Integer>> all = new ArrayList<>();
        for (Reference node : graph.nodes()) {
            all.add(Map.entry(node, graph.degree(node)));
        }
        all.sort(Map.Entry.<Reference, Integer>comparingByValue(Comparator.reverseOrder()));
        return all.subList(0, Math.min(topNodes, all.size()));
    }

    static String line(String label, int value) {
        return padRight(label, LABEL_WIDTH) + padLeft(String.valueOf(value), NUMBER_WIDTH) + "\n";
    }

    private static String padRight(String s, int width) {
        StringBuilder sb = new StringBuilder(s);
        while (sb.length() < width) sb.append(' ');
        return sb.toString();
    }

    private static String padLeft(String s, int width) {
        StringBuilder sb = new StringBuilder();
        while (sb.length() + s.length() < width) sb.append(' ');
        return sb.append(s).toString();
    }
}
