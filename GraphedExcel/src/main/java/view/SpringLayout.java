package view;

import java.awt.geom.Point2D;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import model.DependencyGraph.Edge;
import model.Reference;

/**
 * Force-directed placement (Fruchterman-Reingold) in the unit square.
 * The seed makes the layout reproducible for the same graph.
 */
public class SpringLayout {

    private static final double MIN_DISTANCE = 0.01;

    private final int iterations;
    private final long seed;

    public SpringLayout(int iterations, long seed) {
        if (iterations < 1) throw new IllegalArgumentException("iterations must be positive");
        this.iterations = iterations;
        this.seed = seed;
    }

    public Map<Reference, Point2D.Double> layout(List<Reference> nodes, List<Edge> edges) {
        Map<Reference, Point2D.Double> pos = new LinkedHashMap<>();
        int n = nodes.size();
        if (n == 0) return pos;

        Random rnd = new Random(seed);
        for (Reference node : nodes) {
            pos.put(node, new Point2D.Double(rnd.nextDouble(), rnd.nextDouble()));
        }
        if (n == 1) return pos;

        double k = Math.sqrt(1.0 / n);
        double temperature = 0.1;
        double cooling = temperature / (iterations + 1);

        Reference[] idx = nodes.toArray(new Reference[0]);
        Map<Reference, double[]> disp = new HashMap<>();

        for (int it = 0; it < iterations; it++) {
            for (Reference node : idx) disp.put(node, new double[2]);

            // repulsion between every pair
            for (int i = 0; i < n; i++) {
                Point2D.Double pi = pos.get(idx[i]);
                for (int j = i + 1; j < n; j++) {
                    Point2D.Double pj = pos.get(idx[j]);
                    double dx = pi.x - pj.x;
                    double dy = pi.y - pj.y;
                    double dist = Math.max(MIN_DISTANCE, Math.hypot(dx, dy));
                    double force = k * k / dist;
                    double fx = dx / dist * force;
                    double fy = dy / dist * force;
                    disp.get(idx[i])[0] += fx;
                    disp.get(idx[i])[1] += fy;
                    disp.get(idx[j])[0] -= fx;
                    disp.get(idx[j])[1] -= fy;
                }
            }

            // attraction along edges
            for (Edge e : edges) {
                if (e.getFrom().equals(e.getTo())) continue;
                Point2D.Double pf = pos.get(e.getFrom());
                Point2D.Double pt = pos.get(e.getTo());
                if (pf == null || pt == null) continue;

                double dx = pf.x - pt.x;
                double dy = pf.y - pt.y;
                double dist = Math.max(MIN_DISTANCE, Math.hypot(dx, dy));
                double force = dist * dist / k;
                double fx = dx / dist * force;
                double fy = dy / dist * force;
                disp.get(e.getFrom())[0] -= fx;
                disp.get(e.getFrom())[1] -= fy;
                disp.get(e.getTo())[0] += fx;
                disp.get(e.getTo())[1] += fy;
            }

            for (Reference node : idx) {
                double[] d = disp.get(node);
                double len = Math.hypot(d[0], d[1]);
                if (len > 0) {
                    double step = Math.min(len, temperature);
                    Point2D.Double p = pos.get(node);
                    p.x += d[0] / len * step;
                    p.y += d[1] / len * step;
                }
            }
            temperature -= cooling;
        }
        return pos;
    }
}
