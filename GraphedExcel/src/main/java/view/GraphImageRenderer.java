package view;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Stroke;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Path2D;
import java.awt.geom.Point2D;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;

import model.DependencyGraph;
import model.DependencyGraph.Edge;
import model.Reference;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.annotations.XYLineAnnotation;
import org.jfree.chart.annotations.XYShapeAnnotation;
import org.jfree.chart.annotations.XYTextAnnotation;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.chart.ui.TextAnchor;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Draws the dependency graph to a PNG with JFreeChart: nodes as points of a scatter plot,
 * edges as line annotations (with an arrow head when the direction is kept).
 */
public class GraphImageRenderer {

    private static final Logger log = LogManager.getLogger(GraphImageRenderer.class);

    static final String TITLE = "Excel Cell Dependency Graph";

    private static final double ARROW_SIZE = 0.015;
    private static final double LOOP_RADIUS = 0.012;
    private static final Stroke EDGE_STROKE = new BasicStroke(1.0f);
    private static final Color EDGE_COLOR = Color.GRAY;
    private static final Color NODE_COLOR = Color.BLACK;
    private static final Font LABEL_FONT = new Font("SansSerif", Font.PLAIN, 9);

    private final SpringLayout layout;
    private final int width;
    private final int height;

    public GraphImageRenderer(SpringLayout layout, int width, int height) {
        this.layout = layout;
        this.width = width;
        this.height = height;
    }

    /**
     * Writes the image to {@code output}, creating parent directories.
     * @param directed false collapses {@code a -> b} and {@code b -> a} into one undirected line
     */
    public File render(DependencyGraph graph, File output, boolean directed) throws IOException {
        List<Edge> edges = directed ? graph.edges() : graph.undirectedEdges();
        log.info("Rendering {} nodes, {} edges ({}) to {}",
                graph.nodeCount(), edges.size(), directed ? "directed" : "undirected", output.getPath());

        Map<Reference, Point2D.Double> pos = layout.layout(graph.nodes(), edges);
        JFreeChart chart = createChart(pos, edges, directed);

        File parent = output.getAbsoluteFile().getParentFile();
        if (parent != null) Files.createDirectories(parent.toPath());

        ChartUtils.saveChartAsPNG(output, chart, width, height);
        log.info("Graph image saved: {} ({} bytes)", output.getAbsolutePath(), output.length());
        return output;
    }

    JFreeChart createChart(Map<Reference, Point2D.Double> pos, List<Edge> edges, boolean directed) {
        XYSeries nodes = new XYSeries("Cells", false, true);
        pos.values().forEach(p -> nodes.add(p.x, p.y));

        JFreeChart chart = ChartFactory.createScatterPlot(
                TITLE, null, null,
                new XYSeriesCollection(nodes),
                PlotOrientation.VERTICAL,
                false, false, false
        );
        chart.setBackgroundPaint(Color.WHITE);

        XYPlot plot = chart.getXYPlot();
        plot.setBackgroundPaint(Color.WHITE);
        plot.setOutlineVisible(false);
        plot.setDomainGridlinesVisible(false);
        plot.setRangeGridlinesVisible(false);
        plot.getDomainAxis().setVisible(false);
        plot.getRangeAxis().setVisible(false);

        XYLineAndShapeRenderer r = (XYLineAndShapeRenderer) plot.getRenderer();
        r.setSeriesPaint(0, NODE_COLOR);
        r.setSeriesShape(0, new Ellipse2D.Double(-2.5, -2.5, 5, 5));

        for (Edge e : edges) {
            Point2D.Double from = pos.get(e.getFrom());
            Point2D.Double to = pos.get(e.getTo());
            if (from == null || to == null) continue;

            if (e.getFrom().equals(e.getTo())) {
                plot.addAnnotation(new XYShapeAnnotation(
                        new Ellipse2D.Double(from.x, from.y, LOOP_RADIUS * 2, LOOP_RADIUS * 2),
                        EDGE_STROKE, EDGE_COLOR));
                continue;
            }

            plot.addAnnotation(new XYLineAnnotation(from.x, from.y, to.x, to.y, EDGE_STROKE, EDGE_COLOR));
            if (directed) {
                plot.addAnnotation(new XYShapeAnnotation(arrowHead(from, to), EDGE_STROKE, EDGE_COLOR, EDGE_COLOR));
            }
        }

        pos.forEach((node, p) -> {
            XYTextAnnotation label = new XYTextAnnotation(node.toString(), p.x, p.y);
            label.setFont(LABEL_FONT);
            label.setPaint(NODE_COLOR);
            label.setTextAnchor(TextAnchor.BOTTOM_CENTER);
            plot.addAnnotation(label);
        });

        return chart;
    }

    /** Triangle with its tip on {@code to}, pointing away from {@code from}. */
    static Path2D arrowHead(Point2D.Double from, Point2D.Double to) {
        double dx = to.x - from.x;
        double dy = to.y - from.y;
        double len = Math.hypot(dx, dy);

        Path2D.Double p = new Path2D.Double();
        if (len == 0) return p;

        double ux = dx / len;
        double uy = dy / len;
        double baseX = to.x - ux * ARROW_SIZE;
        double baseY = to.y - uy * ARROW_SIZE;
        double half = ARROW_SIZE / 2;

        p.moveTo(to.x, to.y);
        p.lineTo(baseX - uy * half, baseY + ux * half);
        p.lineTo(baseX + uy * half, baseY - ux * half);
        p.closePath();
        return p;
    }
}
