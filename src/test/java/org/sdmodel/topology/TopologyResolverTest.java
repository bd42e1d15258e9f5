package org.sdmodel.topology;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.sdmodel.ModelFixtures;
import org.sdmodel.mdl.Diagnostic;
import org.sdmodel.mdl.MdlParser;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.sdmodel.ModelFixtures.arrow;
import static org.sdmodel.ModelFixtures.cloud;
import static org.sdmodel.ModelFixtures.equation;
import static org.sdmodel.ModelFixtures.model;
import static org.sdmodel.ModelFixtures.pipe;
import static org.sdmodel.ModelFixtures.sketchOnly;
import static org.sdmodel.ModelFixtures.valve;
import static org.sdmodel.ModelFixtures.valveLabel;
import static org.sdmodel.ModelFixtures.variable;

class TopologyResolverTest {

    private final TopologyResolver resolver = new TopologyResolver();

    private TypedModel classify(String text) {
        return resolver.classify(MdlParser.parse(text));
    }

    private static VariableKind kindOf(TypedModel model, String name) {
        return model.variable(name).orElseThrow().kind();
    }

    // ── Stock and flow model ──

    @Nested
    @DisplayName("population.mdl")
    class Population {

        private final TypedModel model = classify(ModelFixtures.load(ModelFixtures.POPULATION));

        @Test
        void kinds() {
            assertEquals(VariableKind.STOCK, kindOf(model, "Population"));
            assertEquals(VariableKind.FLOW, kindOf(model, "Births"));
            assertEquals(VariableKind.FLOW, kindOf(model, "Deaths"));
            assertEquals(VariableKind.AUXILIARY, kindOf(model, "Birth Rate"));
            assertEquals(VariableKind.AUXILIARY, kindOf(model, "Average Lifetime"));
            assertEquals(Set.of(1), model.stockIds());
            assertEquals(Set.of(5, 7), model.valveIds());
        }

        @Test
        void pipesArePlumbing() {
            assertEquals(4, model.plumbing().size());
            assertEquals(4, model.connections().size());
        }

        @Test
        @DisplayName("Births fills Population from a cloud, Deaths drains it into a cloud")
        void flowsResolveSourceAndDestination() {
            List<MaterialFlow> flows = model.flows();
            assertEquals(2, flows.size());

            MaterialFlow births = flows.get(0);
            assertEquals(5, births.valveId());
            assertEquals("Births", births.name());
            assertEquals(new MaterialFlow.Endpoint(MaterialFlow.EndpointKind.CLOUD, 2, null), births.from());
            assertEquals(new MaterialFlow.Endpoint(MaterialFlow.EndpointKind.STOCK, 1, "Population"), births.to());
            assertTrue(births.fills("population"));
            assertFalse(births.drains("Population"));

            MaterialFlow deaths = flows.get(1);
            assertEquals(7, deaths.valveId());
            assertEquals("Deaths", deaths.name());
            assertTrue(deaths.drains("Population"));
            assertEquals(MaterialFlow.EndpointKind.CLOUD, deaths.to().kind());
            assertEquals(9, deaths.to().id());
        }

        @Test
        void causalConnectionsCarryPolarity() {
            List<Connection> connections = model.connections();
            assertEquals("Population", connections.get(0).fromVariable());
            assertEquals("Births", connections.get(0).toVariable());
            assertEquals(Polarity.POSITIVE, connections.get(0).polarity());

            Connection lifetime = connections.get(3);
            assertEquals("Average Lifetime", lifetime.fromVariable());
            assertEquals("Deaths", lifetime.toVariable());
            assertTrue(lifetime.isNegative());
        }

        @Test
        void variablesCarryTheirEquations() {
            Variable population = model.variable("Population").orElseThrow();
            assertTrue(population.equationText().contains("INTEG"));
            assertEquals(4, population.declarationOrder());
            assertTrue(population.hasEquation());
        }

        @Test
        void noDiagnostics() {
            assertTrue(model.diagnostics().isEmpty(), () -> model.diagnostics().toString());
        }
    }

    // ── Topology rules ──

    @Test
    @DisplayName("valve 11 feeding node 1 and valve 12: only node 1 is a Stock")
    void valveToValveCreatesNoStock() {
        TypedModel model = classify(sketchOnly(
                variable(1, "Level"),
                valve(11),
                valve(12),
                pipe(20, 11, 1),
                pipe(21, 11, 12)));

        assertEquals(Set.of(1), model.stockIds());
        assertEquals(VariableKind.STOCK, kindOf(model, "Level"));
        assertEquals(2, model.plumbing().size());
        assertTrue(model.connections().isEmpty());
    }

    @Test
    void pipeIntoACloudCreatesNoStock() {
        TypedModel model = classify(sketchOnly(valve(3), cloud(4), pipe(5, 3, 4)));
        assertTrue(model.stockIds().isEmpty());
        assertEquals(1, model.plumbing().size());
    }

    @Test
    @DisplayName("without a tail marker the first pipe in the sketch is the source")
    void stockToStockFlowFollowsSketchOrder() {
        TypedModel model = classify(sketchOnly(
                variable(1, "Raw"),
                variable(2, "Finished"),
                valve(3),
                pipe(5, 3, 1),
                pipe(6, 3, 2),
                valve(7),
                pipe(8, 7, 1)));

        assertEquals(1, model.flows().size(), "a valve with a single pipe is not assembled");
        MaterialFlow flow = model.flows().get(0);
        assertNull(flow.name());
        assertTrue(flow.drains("Raw"));
        assertTrue(flow.fills("Finished"));
    }

    @Test
    void valveLabelWithoutEquationIsAuxiliary() {
        TypedModel model = classify(sketchOnly(valve(3), valveLabel(4, "Outflow")));
        assertEquals(VariableKind.AUXILIARY, kindOf(model, "Outflow"));
    }

    @Test
    void valveLabelWithEquationIsFlow() {
        TypedModel model = classify(model(equation("Outflow", "5"), valve(3), valveLabel(4, "Outflow")));
        assertEquals(VariableKind.FLOW, kindOf(model, "Outflow"));
    }

    @Test
    void idSharedByValveAndVariableIsAStockWithWarning() {
        TypedModel model = classify(sketchOnly(variable(4, "Tank"), valve(3), valve(4), pipe(5, 3, 4)));

        assertEquals(VariableKind.STOCK, kindOf(model, "Tank"));
        assertTrue(model.diagnostics().stream()
                .anyMatch(d -> d.kind() == Diagnostic.Kind.CONSISTENCY && d.message().contains("valve")));
    }

    @Test
    void shadowCopiesShareTheKindOfTheirName() {
        TypedModel model = classify(ModelFixtures.load(ModelFixtures.WORKFORCE));

        assertEquals(7, model.variables().size());
        assertEquals(6, model.distinctVariables().size());
        assertEquals(model.variable(5).orElseThrow().kind(), model.variable(15).orElseThrow().kind());
    }

    @Test
    void arrowsFromShadowsUseThePrimaryName() {
        TypedModel model = classify(sketchOnly(
                variable(1, "Staff"), variable(2, "Workload"), variable(3, "staff"), arrow(4, 3, 2, "45")));

        assertEquals("Staff", model.connections().get(0).fromVariable());
    }

    // ── Polarity ──

    @Test
    void unrecognizedMarkerReadsAsPositiveWithDiagnostic() {
        TypedModel model = classify(sketchOnly(variable(1, "A"), variable(2, "B"), arrow(3, 1, 2, "44")));

        assertEquals(Polarity.POSITIVE, model.connections().get(0).polarity());
        assertEquals(1, model.diagnostics().size());
        assertEquals(Diagnostic.Kind.UNRECOGNIZED_POLARITY, model.diagnostics().get(0).kind());
    }

    @Test
    void customNegativeMarker() {
        String text = sketchOnly(variable(1, "A"), variable(2, "B"), arrow(3, 1, 2, "1"), arrow(4, 2, 1, "45"));
        TypedModel model = new TopologyResolver(PolarityConvention.withNegativeMarker("1"))
                .classify(MdlParser.parse(text));

        assertEquals(Polarity.NEGATIVE, model.connections().get(0).polarity());
        assertEquals(Polarity.POSITIVE, model.connections().get(1).polarity());
    }

    @Test
    void danglingArrowIsDropped() {
        TypedModel model = classify(sketchOnly(variable(1, "A"), arrow(2, 1, 99, "0")));

        assertTrue(model.connections().isEmpty());
        assertEquals(Diagnostic.Kind.DANGLING_REFERENCE, model.diagnostics().get(0).kind());
    }
}
