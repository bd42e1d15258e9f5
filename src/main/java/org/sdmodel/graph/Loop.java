package org.sdmodel.graph;

import java.util.Comparator;
import java.util.List;

/**
 * A simple directed cycle {@code v0 -> v1 -> ... -> v(n-1) -> v0} of the causal graph.
 *
 * @param nodes             Variable names in cycle order, starting at the smallest name
 * @param edges             The edge taken between each consecutive pair, closing edge last
 * @param negativeEdgeCount Number of negative edges on the cycle
 * @param type              Reinforcing iff the negative edge count is even
 */
public record Loop(List<String> nodes, List<SignedEdge> edges, int negativeEdgeCount, LoopType type) {

    /**
     * Length first, then the node-name sequence.
     */
    public static final Comparator<Loop> REPORT_ORDER = Comparator
            .comparingInt(Loop::length)
            .thenComparing(Loop::nodes, Loop::compareNames);

    public Loop {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public static Loop of(List<String> nodes, List<SignedEdge> edges) {
        int negative = 0;
        for (SignedEdge edge : edges) {
            if (edge.isNegative()) {
                negative++;
            }
        }
        return new Loop(nodes, edges, negative, LoopType.ofNegativeEdges(negative));
    }

    public int length() {
        return nodes.size();
    }

    public boolean contains(String variable) {
        return nodes.contains(variable);
    }

    /**
     * {@code A -> B -> C -> A}
     */
    public String describe() {
        return String.join(" -> ", nodes) + " -> " + nodes.get(0);
    }

    private static int compareNames(List<String> a, List<String> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    }
}
