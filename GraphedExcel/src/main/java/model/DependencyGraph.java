package model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Simple directed graph over cell and range references.
 * <p>
 * An edge {@code from -> to} means "from is computed from to". Duplicate edges collapse,
 * self-edges and cycles are kept as they are. Nodes remember insertion order.
 */
public class DependencyGraph {

    private static class NodeData {
        String sheet;
        final Set<Reference> successors = new LinkedHashSet<>();
        int inDegree;
    }

    /** Directed edge; for the undirected view the direction is just the first one seen. */
    public static final class Edge {
        private final Reference from;
        private final Reference to;

        public Edge(Reference from, Reference to) {
            this.from = Objects.requireNonNull(from, "from");
            this.to = Objects.requireNonNull(to, "to");
        }

        public Reference getFrom() { return from; }
        public Reference getTo() { return to; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Edge)) return false;
            Edge e = (Edge) o;
            return from.equals(e.from) && to.equals(e.to);
        }

        @Override
        public int hashCode() {
            return Objects.hash(from, to);
        }

        @Override
        public String toString() {
            return from + " -> " + to;
        }
    }

    private final Map<Reference, NodeData> nodes = new LinkedHashMap<>();
    private int edgeCount;

    // ===========================
    // Mutation
    // ===========================

    /**
     * Adds a node, or sets its sheet attribute if the node exists without one.
     * @return true if the node was not in the graph
     */
    public boolean addNode(Reference ref, String sheet) {
        Objects.requireNonNull(ref, "ref");

        NodeData data = nodes.get(ref);
        boolean added = false;
        if (data == null) {
            data = new NodeData();
            nodes.put(ref, data);
            added = true;
        }
        if (data.sheet == null && sheet != null) data.sheet = sheet;
        return added;
    }

    public boolean addNode(Reference ref) {
        return addNode(ref, null);
    }

    /**
     * Adds {@code from -> to}, creating missing nodes.
     * @return false if the edge was already present
     */
    public boolean addEdge(Reference from, Reference to) {
        addNode(from);
        addNode(to);

        if (!nodes.get(from).successors.add(to)) return false;
        nodes.get(to).inDegree++;
        edgeCount++;
        return true;
    }

    /** Adds every node (with its sheet attribute) and edge of {@code other}; returns this. */
    public DependencyGraph merge(DependencyGraph other) {
        other.nodes.forEach((ref, data) -> addNode(ref, data.sheet));
        for (Edge e : other.edges()) {
            addEdge(e.getFrom(), e.getTo());
        }
        return this;
    }

    // ===========================
    // Queries
    // ===========================

    public int nodeCount() { return nodes.size(); }
    public int edgeCount() { return edgeCount; }

    public boolean containsNode(Reference ref) {
        return nodes.containsKey(ref);
    }

    public boolean containsEdge(Reference from, Reference to) {
        NodeData data = nodes.get(from);
        return data != null && data.successors.contains(to);
    }

    /** Nodes in insertion order. */
    public List<Reference> nodes() {
        return new ArrayList<>(nodes.keySet());
    }

    public String sheetOf(Reference ref) {
        NodeData data = nodes.get(ref);
        return data == null ? null : data.sheet;
    }

    public Set<Reference> successors(Reference ref) {
        NodeData data = nodes.get(ref);
        if (data == null) return Collections.emptySet();
        return Collections.unmodifiableSet(data.successors);
    }

    public int outDegree(Reference ref) {
        NodeData data = nodes.get(ref);
        return data == null ? 0 : data.successors.size();
    }

    public int inDegree(Reference ref) {
        NodeData data = nodes.get(ref);
        return data == null ? 0 : data.inDegree;
    }

    /** In-degree plus out-degree; a self-edge counts twice. */
    public int degree(Reference ref) {
        return inDegree(ref) + outDegree(ref);
    }

    public List<Edge> edges() {
        List<Edge> out = new ArrayList<>(edgeCount);
        nodes.forEach((ref, data) -> data.successors.forEach(to -> out.add(new Edge(ref, to))));
        return out;
    }

    /** Edges with direction dropped: {@code a -> b} and {@code b -> a} become one edge. */
    public List<Edge> undirectedEdges() {
        List<Edge> out = new ArrayList<>();
        Set<Set<Reference>> seen = new HashSet<>();
        for (Edge e : edges()) {
            Set<Reference> pair = new HashSet<>();
            pair.add(e.getFrom());
            pair.add(e.getTo());
            if (seen.add(pair)) out.add(e);
        }
        return out;
    }

    @Override
    public String toString() {
        return "DependencyGraph[nodes=" + nodeCount() + ", edges=" + edgeCount + "]";
    }
}
