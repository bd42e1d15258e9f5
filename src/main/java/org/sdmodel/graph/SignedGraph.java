package org.sdmodel.graph;

import org.sdmodel.topology.Connection;
import org.sdmodel.topology.TypedModel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed graph over variable names whose edges carry a polarity.
 *
 * Parallel edges between the same ordered pair are kept as distinct edges, ordered by
 * the sketch position of their arrows. Nodes and successors iterate in name order so
 * that every traversal is deterministic.
 */
public final class SignedGraph {

    private final SortedSet<String> nodes = new TreeSet<>();
    private final Map<String, Map<String, List<SignedEdge>>> adjacency = new TreeMap<>();
    private final List<SignedEdge> edges = new ArrayList<>();

    // ==================== Construction ====================

    public static SignedGraph of(TypedModel model) {
        return of(model.connections());
    }

    public static SignedGraph of(Collection<Connection> connections) {
        SignedGraph graph = new SignedGraph();
        for (Connection c : connections) {
            graph.addEdge(new SignedEdge(c.fromVariable(), c.toVariable(), c.polarity(), c.sketchOrder()));
        }
        return graph;
    }

    public SignedGraph addNode(String name) {
        nodes.add(name);
        adjacency.computeIfAbsent(name, k -> new TreeMap<>());
        return this;
    }

    public SignedGraph addEdge(SignedEdge edge) {
        addNode(edge.from());
        addNode(edge.to());
        List<SignedEdge> parallel = adjacency.get(edge.from()).computeIfAbsent(edge.to(), k -> new ArrayList<>());
        parallel.add(edge);
        parallel.sort((a, b) -> Integer.compare(a.sketchOrder(), b.sketchOrder()));
        edges.add(edge);
        return this;
    }

    // ==================== Queries ====================

    public SortedSet<String> nodes() {
        return Collections.unmodifiableSortedSet(nodes);
    }

    /**
     * All edges in insertion order, parallel edges included.
     */
    public List<SignedEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Successor names in name order.
     */
    public Collection<String> successors(String node) {
        Map<String, List<SignedEdge>> out = adjacency.get(node);
        return out == null ? List.of() : Collections.unmodifiableSet(out.keySet());
    }

    /**
     * All edges from one node to another, earliest arrow first.
     */
    public List<SignedEdge> edgesBetween(String from, String to) {
        Map<String, List<SignedEdge>> out = adjacency.get(from);
        if (out == null) {
            return List.of();
        }
        return Collections.unmodifiableList(out.getOrDefault(to, List.of()));
    }

    /**
     * The edge that represents the pair inside a cycle: the one whose arrow appeared first.
     */
    public SignedEdge representativeEdge(String from, String to) {
        List<SignedEdge> parallel = edgesBetween(from, to);
        if (parallel.isEmpty()) {
            throw new IllegalArgumentException("No edge " + from + " -> " + to);
        }
        return parallel.get(0);
    }

    public boolean hasEdge(String from, String to) {
        return !edgesBetween(from, to).isEmpty();
    }
}
