package org.sdmodel;

import org.junit.jupiter.api.Test;
import org.sdmodel.edit.EditOperationReader;
import org.sdmodel.edit.EditResult;
import org.sdmodel.graph.Loop;
import org.sdmodel.graph.LoopSearchLimits;
import org.sdmodel.graph.LoopSearchResult;
import org.sdmodel.graph.LoopType;
import org.sdmodel.mdl.MdlModel;
import org.sdmodel.mdl.SketchRecord.RawLine;
import org.sdmodel.mdl.SketchSection;
import org.sdmodel.topology.TypedModel;
import org.sdmodel.topology.VariableKind;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs over the fixture models.
 */
class SketchAnalyzerTest {

    private final SketchAnalyzer analyzer = new SketchAnalyzer();

    @Test
    void findsAndClassifiesTheWorkforceLoops() {
        TypedModel model = analyzer.classifyTopology(analyzer.parse(ModelFixtures.load(ModelFixtures.WORKFORCE)));
        LoopSearchResult result = analyzer.findLoops(model);

        assertEquals(3, result.totalLoops());
        List<Loop> loops = result.loops();
        assertEquals(List.of("Burnout", "Productivity", "Workload"), loops.get(0).nodes());
        assertEquals(LoopType.REINFORCING, loops.get(0).type());
        assertEquals(List.of("Burnout", "Staff", "Workload"), loops.get(1).nodes());
        assertEquals(LoopType.REINFORCING, loops.get(1).type());
        assertEquals(List.of("Hiring (net)", "Staff", "Workload"), loops.get(2).nodes());
        assertEquals(LoopType.BALANCING, loops.get(2).type());
        assertEquals(1, loops.get(2).negativeEdgeCount());
    }

    @Test
    void stockAndFlowModelHasNoCausalLoops() {
        TypedModel model = analyzer.classifyTopology(analyzer.parse(ModelFixtures.load(ModelFixtures.POPULATION)));
        assertEquals(List.of("Population"),
                model.variablesOfKind(VariableKind.STOCK).stream().map(v -> v.name()).toList());
        assertEquals(2, model.variablesOfKind(VariableKind.FLOW).size());
        assertTrue(analyzer.findLoops(model).loops().isEmpty());
    }

    @Test
    void optionsLimitTheSearch() {
        SketchAnalyzer bounded = new SketchAnalyzer(
                AnalysisOptions.defaults().withLimits(LoopSearchLimits.unbounded().withMaxLoops(2)));
        LoopSearchResult result = bounded.findLoops(
                bounded.classifyTopology(bounded.parse(ModelFixtures.load(ModelFixtures.WORKFORCE))));

        assertEquals(2, result.totalLoops());
        assertTrue(result.isTruncated());
    }

    @Test
    void editsFromJsonAreAppliedAndReclassified() {
        MdlModel model = analyzer.parse(ModelFixtures.load(ModelFixtures.WORKFORCE));
        EditResult result = analyzer.applyEdits(model, EditOperationReader.read("""
                [
                  {"operation": "add_variable",
                   "variable": {"name": "Peer Support", "type": "Auxiliary", "position": {"x": 700, "y": 250}},
                   "mdl_comment": "Mentoring"},
                  {"operation": "add_connection",
                   "connection": {"from": "Burnout", "to": "Peer Support", "relationship": "negative"}},
                  {"operation": "add_connection",
                   "connection": {"from": "Peer Support", "to": "Burnout", "relationship": "negative"}},
                  {"operation": "remove_connection",
                   "connection": {"from": "Morale", "to": "Burnout"}}
                ]
                """));

        assertEquals(3, result.succeededCount());
        assertEquals(1, result.failedCount());
        assertFalse(result.allSucceeded());
        assertEquals("Mentoring", result.changes().get(0).mdlComment());
        assertTrue(result.model().variable("Peer Support").isPresent());

        LoopSearchResult loops = analyzer.findLoops(result.model());
        assertEquals(4, loops.totalLoops());
        Loop peer = loops.loops().get(0);
        assertEquals(List.of("Burnout", "Peer Support"), peer.nodes());
        assertEquals(LoopType.REINFORCING, peer.type());

        assertTrue(analyzer.selfCheck(model).passed());
    }

    @Test
    void selfCheckPassesForUneditedModels() {
        SketchAnalyzer.SelfCheck check = analyzer.selfCheck(analyzer.parse(ModelFixtures.load(ModelFixtures.POPULATION)));
        assertTrue(check.passed(), () -> check.problems().toString());
        assertTrue(check.problems().isEmpty());
    }

    @Test
    void selfCheckCatchesRecordsThatDoNotSurviveRendering() {
        MdlModel model = analyzer.parse(ModelFixtures.load(ModelFixtures.WORKFORCE));
        SketchSection sketch = model.sketch();
        // a raw line that reads back as a variable record
        sketch.replace(sketch.records().get(sketch.records().size() - 1),
                new RawLine("10,99,Ghost,1,1,1,1,8", -1));

        SketchAnalyzer.SelfCheck check = analyzer.selfCheck(model);
        assertFalse(check.passed());
        assertFalse(check.problems().isEmpty());
    }

    @Test
    void renderReproducesTheInput() {
        String text = ModelFixtures.load(ModelFixtures.WORKFORCE);
        assertEquals(text, analyzer.render(analyzer.parse(text)));
    }
}
