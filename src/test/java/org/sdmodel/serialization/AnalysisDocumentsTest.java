package org.sdmodel.serialization;

import org.junit.jupiter.api.Test;
import org.sdmodel.ModelFixtures;
import org.sdmodel.graph.LoopEnumerator;
import org.sdmodel.graph.LoopSearchLimits;
import org.sdmodel.graph.LoopSearchResult;
import org.sdmodel.graph.SignedGraph;
import org.sdmodel.mdl.MdlParser;
import org.sdmodel.topology.TopologyResolver;
import org.sdmodel.topology.TypedModel;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisDocumentsTest {

    private final TypedModel workforce = new TopologyResolver()
            .classify(MdlParser.parse(ModelFixtures.load(ModelFixtures.WORKFORCE)));

    @Test
    @SuppressWarnings("unchecked")
    void connectionsDocument() {
        Map<String, Object> doc = (Map<String, Object>) ModelJson.parse(AnalysisDocuments.connectionsJson(workforce));
        List<Object> connections = ModelJson.getList(doc, "connections");

        assertEquals(8, connections.size());
        assertEquals(Map.of("from", "Workload", "to", "Burnout", "relationship", "positive"), connections.get(0));
        assertEquals(Map.of("from", "Burnout", "to", "Productivity", "relationship", "negative"), connections.get(1));
    }

    @Test
    @SuppressWarnings("unchecked")
    void variablesDocument() {
        List<Object> variables = ModelJson.getList(AnalysisDocuments.variables(workforce), "variables");

        assertEquals(7, variables.size());
        Map<String, Object> first = (Map<String, Object>) variables.get(0);
        assertEquals("Workload", first.get("name"));
        assertEquals("Auxiliary", first.get("type"));
        assertEquals(300, first.get("x"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void plumbingDocument() {
        TypedModel population = new TopologyResolver()
                .classify(MdlParser.parse(ModelFixtures.load(ModelFixtures.POPULATION)));
        Map<String, Object> doc = (Map<String, Object>) ModelJson.parse(AnalysisDocuments.plumbingJson(population));

        assertEquals(2, ModelJson.getList(doc, "valves").size());
        assertEquals(List.of(Map.of("id", 2L), Map.of("id", 9L)), ModelJson.getList(doc, "clouds"));

        List<Object> flows = ModelJson.getList(doc, "flows");
        assertEquals(2, flows.size());
        Map<String, Object> births = (Map<String, Object>) flows.get(0);
        assertEquals(5L, births.get("valve_id"));
        assertEquals("Births", births.get("name"));
        assertEquals(Map.of("kind", "cloud", "ref", 2L), births.get("from"));
        assertEquals(Map.of("kind", "stock", "ref", "Population"), births.get("to"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void loopsDocument() {
        LoopSearchResult result = new LoopEnumerator(SignedGraph.of(workforce)).findLoops();
        Map<String, Object> doc = (Map<String, Object>) ModelJson.parse(AnalysisDocuments.loopsJson(result));

        assertEquals(3, ModelJson.getInt(doc, "total_loops"));
        Map<String, Object> loop = (Map<String, Object>) ModelJson.getList(doc, "loops").get(2);
        assertEquals(List.of("Hiring (net)", "Staff", "Workload"), loop.get("nodes"));
        assertEquals("B", loop.get("type"));
        assertEquals(1L, loop.get("negative_edges"));
        assertEquals(3L, loop.get("length"));
        assertEquals(3, ((List<Object>) loop.get("edges")).size());

        Map<String, Object> summary = ModelJson.getObject(doc, "summary");
        assertEquals(2, ModelJson.getInt(summary, "reinforcing_loops"));
        assertEquals(1, ModelJson.getInt(summary, "balancing_loops"));
        assertEquals(3, ModelJson.getInt(summary, "shortest_loop"));
        assertEquals(3, ModelJson.getInt(summary, "longest_loop"));
        assertFalse(summary.containsKey("truncated"));
    }

    @Test
    void truncatedSearchIsMarked() {
        LoopSearchResult result = LoopEnumerator.findLoops(SignedGraph.of(workforce),
                LoopSearchLimits.unbounded().withMaxLoops(1));
        Map<String, Object> summary = ModelJson.getObject(AnalysisDocuments.loops(result), "summary");

        assertEquals(true, summary.get("truncated"));
        assertEquals("MAX_LOOPS", summary.get("stopped_by"));
    }
}
