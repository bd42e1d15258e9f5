package org.sdmodel.graph;

import org.junit.jupiter.api.Test;
import org.sdmodel.ModelFixtures;
import org.sdmodel.mdl.MdlParser;
import org.sdmodel.topology.Polarity;
import org.sdmodel.topology.TopologyResolver;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignedGraphTest {

    @Test
    void nodesAndSuccessorsIterateInNameOrder() {
        SignedGraph graph = new SignedGraph()
                .addEdge(new SignedEdge("Zeta", "Alpha", Polarity.POSITIVE, 0))
                .addEdge(new SignedEdge("Zeta", "Mid", Polarity.NEGATIVE, 1))
                .addNode("Beta");

        assertEquals(List.of("Alpha", "Beta", "Mid", "Zeta"), List.copyOf(graph.nodes()));
        assertEquals(List.of("Alpha", "Mid"), List.copyOf(graph.successors("Zeta")));
        assertTrue(graph.successors("Beta").isEmpty());
        assertTrue(graph.successors("Unknown").isEmpty());
    }

    @Test
    void parallelEdgesAreOrderedBySketchPosition() {
        SignedGraph graph = new SignedGraph()
                .addEdge(new SignedEdge("A", "B", Polarity.NEGATIVE, 7))
                .addEdge(new SignedEdge("A", "B", Polarity.POSITIVE, 2));

        assertEquals(2, graph.edgeCount());
        assertEquals(2, graph.edgesBetween("A", "B").size());
        assertEquals(Polarity.POSITIVE, graph.representativeEdge("A", "B").polarity());
        assertEquals(1, graph.successors("A").size());
    }

    @Test
    void representativeEdgeRequiresAnEdge() {
        SignedGraph graph = new SignedGraph().addEdge(new SignedEdge("A", "B", Polarity.POSITIVE, 0));
        assertFalse(graph.hasEdge("B", "A"));
        assertThrows(IllegalArgumentException.class, () -> graph.representativeEdge("B", "A"));
    }

    @Test
    void builtFromClassifiedModel() {
        SignedGraph graph = SignedGraph.of(new TopologyResolver()
                .classify(MdlParser.parse(ModelFixtures.load(ModelFixtures.WORKFORCE))));

        assertEquals(6, graph.nodeCount());
        assertEquals(8, graph.edgeCount());
        assertEquals(Polarity.NEGATIVE, graph.representativeEdge("Burnout", "Productivity").polarity());
        assertEquals(Polarity.POSITIVE, graph.representativeEdge("Hiring (net)", "Staff").polarity());
    }

    @Test
    void plumbingIsNotPartOfTheGraph() {
        SignedGraph graph = SignedGraph.of(new TopologyResolver()
                .classify(MdlParser.parse(ModelFixtures.load(ModelFixtures.POPULATION))));

        assertEquals(4, graph.edgeCount());
        assertFalse(graph.hasEdge("Births", "Population"));
    }
}
