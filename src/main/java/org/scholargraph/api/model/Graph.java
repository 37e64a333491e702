package org.scholargraph.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A weighted citation or collaboration graph with attributed nodes.
 * <p>
 * Nodes and edges keep insertion order. Self-loops are rejected. Adding an edge between
 * an existing pair adds to its weight; on undirected graphs the pair is stored with the
 * lexicographically smaller id first, so (a, b) and (b, a) address the same edge.
 * Adding an edge with an unknown endpoint adds that node without attributes.
 */
public final class Graph {

    private final GraphKind kind;
    private final boolean directed;
    private final Map<String, NodeAttributes> nodes = new LinkedHashMap<>();
    private final Map<Pair, Long> edges = new LinkedHashMap<>();

    public Graph(GraphKind kind) {
        this(kind, kind.isDirected());
    }

    private Graph(GraphKind kind, boolean directed) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.directed = directed;
    }

    public GraphKind kind() {
        return kind;
    }

    /**
     * @return Whether edges are directed. False for the undirected projection of a citation graph.
     */
    public boolean isDirected() {
        return directed;
    }

    /**
     * Adds a node, or replaces the attributes of an existing one.
     */
    public void addNode(String id, NodeAttributes attributes) {
        nodes.put(Objects.requireNonNull(id, "id"), Objects.requireNonNull(attributes, "attributes"));
    }

    /**
     * Adds an edge or increases the weight of an existing one.
     *
     * @throws IllegalArgumentException on a self-loop or a weight below 1.
     */
    public void addEdge(String source, String target, long weight) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        if (source.equals(target)) {
            throw new IllegalArgumentException("Self-loops are not allowed: " + source);
        }
        if (weight < 1) {
            throw new IllegalArgumentException("Edge weight must be at least 1, got " + weight);
        }
        nodes.putIfAbsent(source, NodeAttributes.none());
        nodes.putIfAbsent(target, NodeAttributes.none());
        edges.merge(pair(source, target), weight, Long::sum);
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public boolean hasEdge(String source, String target) {
        return edges.containsKey(pair(source, target));
    }

    /**
     * @return The edge weight, or 0 if there is no such edge.
     */
    public long weight(String source, String target) {
        return edges.getOrDefault(pair(source, target), 0L);
    }

    public NodeAttributes attributes(String id) {
        return nodes.get(id);
    }

    public Set<String> nodeIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public List<Edge> edges() {
        List<Edge> result = new ArrayList<>(edges.size());
        for (Map.Entry<Pair, Long> entry : edges.entrySet()) {
            result.add(new Edge(entry.getKey().source(), entry.getKey().target(), entry.getValue()));
        }
        return result;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Drops edge direction. Reciprocal edges collapse into one edge whose weight is the sum
     * of both, so a mutual citation counts twice; neither direction's weight is discarded
     * in favour of the other. Node attributes are copied. Returns this graph if it is
     * already undirected.
     */
    public Graph toUndirected() {
        if (!isDirected()) {
            return this;
        }
        Graph undirected = new Graph(kind, false);
        nodes.forEach(undirected::addNode);
        for (Map.Entry<Pair, Long> entry : edges.entrySet()) {
            undirected.addEdge(entry.getKey().source(), entry.getKey().target(), entry.getValue());
        }
        return undirected;
    }

    private Pair pair(String source, String target) {
        if (!isDirected() && source.compareTo(target) > 0) {
            return new Pair(target, source);
        }
        return new Pair(source, target);
    }

    private record Pair(String source, String target) {
    }

    @Override
    public String toString() {
        return "Graph[" + kind + (directed == kind.isDirected() ? "" : ", undirected") + ", nodes=" + nodes.size() + ", edges=" + edges.size() + "]";
    }
}
