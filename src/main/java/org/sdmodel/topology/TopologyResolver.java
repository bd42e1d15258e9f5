package org.sdmodel.topology;

import org.sdmodel.mdl.Diagnostic;
import org.sdmodel.mdl.EquationBlock;
import org.sdmodel.mdl.EquationSection;
import org.sdmodel.mdl.MdlModel;
import org.sdmodel.mdl.SketchRecord;
import org.sdmodel.mdl.SketchRecord.CloudRecord;
import org.sdmodel.mdl.SketchRecord.ConnectionRecord;
import org.sdmodel.mdl.SketchRecord.ValveRecord;
import org.sdmodel.mdl.SketchRecord.VariableRecord;
import org.sdmodel.mdl.SketchSection;
import org.sdmodel.mdl.VariableNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies sketch variables as Stock, Flow or Auxiliary and splits arrows into
 * plumbing and causal connections, using connection topology only.
 *
 * <ul>
 *   <li>An arrow from a valve to a non-valve is plumbing and makes its target a Stock.</li>
 *   <li>Valve-to-valve arrows and arrows touching a valve or cloud are plumbing and
 *       classify nothing.</li>
 *   <li>Arrows between two variables are causal; their sign comes from the
 *       {@link PolarityConvention}.</li>
 *   <li>A variable is a Flow when it stands for a valve (same id, or the label record
 *       Vensim writes right after the valve) and has an equation block of the same name.</li>
 * </ul>
 */
public final class TopologyResolver {

    private static final Logger LOG = LoggerFactory.getLogger(TopologyResolver.class);

    private final PolarityConvention convention;

    public TopologyResolver() {
        this(PolarityConvention.defaults());
    }

    public TopologyResolver(PolarityConvention convention) {
        this.convention = convention;
    }

    public TypedModel classify(MdlModel model) {
        SketchSection sketch = model.sketch();
        EquationSection equations = model.equations();
        List<Diagnostic> diagnostics = new ArrayList<>(model.diagnostics());

        // Pass 1: node id sets
        Set<Integer> valveIds = new LinkedHashSet<>();
        for (ValveRecord valve : sketch.valves()) {
            valveIds.add(valve.id());
        }
        Set<Integer> cloudIds = new HashSet<>();
        for (CloudRecord cloud : sketch.clouds()) {
            cloudIds.add(cloud.id());
        }
        Map<Integer, VariableRecord> variableRecords = new HashMap<>();
        Map<String, String> primaryNames = new HashMap<>();
        for (VariableRecord v : sketch.variables()) {
            variableRecords.putIfAbsent(v.id(), v);
            primaryNames.putIfAbsent(VariableNames.canonical(v.name()), v.name());
        }

        // Pass 2: arrows
        Set<Integer> stockIds = new LinkedHashSet<>();
        List<ConnectionRecord> plumbing = new ArrayList<>();
        List<Connection> causal = new ArrayList<>();
        int sketchOrder = 0;

        for (ConnectionRecord arrow : sketch.connections()) {
            int order = sketchOrder++;
            boolean fromValve = valveIds.contains(arrow.fromId());
            boolean toValve = valveIds.contains(arrow.toId());

            if (fromValve && !toValve) {
                plumbing.add(arrow);
                if (!cloudIds.contains(arrow.toId())) {
                    stockIds.add(arrow.toId());
                }
                continue;
            }
            if (fromValve && variableRecords.containsKey(arrow.toId())) {
                // the id is both a valve and a variable: receiving material wins
                plumbing.add(arrow);
                stockIds.add(arrow.toId());
                diagnostics.add(Diagnostic.consistency(arrow.lineNumber(),
                        "Node " + arrow.toId() + " is both a valve and the target of a valve; classified as Stock"));
                continue;
            }
            if (fromValve || toValve || cloudIds.contains(arrow.fromId()) || cloudIds.contains(arrow.toId())) {
                plumbing.add(arrow);
                continue;
            }

            VariableRecord from = variableRecords.get(arrow.fromId());
            VariableRecord to = variableRecords.get(arrow.toId());
            if (from == null || to == null) {
                diagnostics.add(new Diagnostic(Diagnostic.Kind.DANGLING_REFERENCE, arrow.lineNumber(),
                        "Arrow " + arrow.id() + " references unknown node "
                                + (from == null ? arrow.fromId() : arrow.toId())));
                continue;
            }

            if (!convention.isRecognized(arrow.discriminator())) {
                diagnostics.add(new Diagnostic(Diagnostic.Kind.UNRECOGNIZED_POLARITY, arrow.lineNumber(),
                        "Arrow " + arrow.id() + " has unrecognized polarity marker '" + arrow.discriminator()
                                + "', read as positive"));
            }
            causal.add(new Connection(
                    primaryNames.get(VariableNames.canonical(from.name())),
                    primaryNames.get(VariableNames.canonical(to.name())),
                    convention.polarityOf(arrow.discriminator()),
                    arrow,
                    order));
        }

        // Kinds are per name, so shadow copies agree with their primary record
        Set<String> stockNames = new HashSet<>();
        Set<String> flowNames = new HashSet<>();
        for (VariableRecord v : sketch.variables()) {
            String key = VariableNames.canonical(v.name());
            if (stockIds.contains(v.id())) {
                stockNames.add(key);
            } else if (standsForValve(v, valveIds) && equations.hasBlock(v.name())) {
                flowNames.add(key);
            }
        }

        List<Variable> variables = new ArrayList<>();
        for (VariableRecord v : sketch.variables()) {
            String key = VariableNames.canonical(v.name());
            VariableKind kind = stockNames.contains(key) ? VariableKind.STOCK
                    : flowNames.contains(key) ? VariableKind.FLOW
                    : VariableKind.AUXILIARY;
            Optional<EquationBlock> block = equations.block(v.name());
            variables.add(new Variable(v.id(), v.name(), kind, v.position(), v.size(),
                    block.map(EquationBlock::equationText).orElse(""),
                    block.map(EquationBlock::declarationOrder).orElse(-1)));
        }

        List<MaterialFlow> flows = assembleFlows(sketch, plumbing, valveIds, stockIds, cloudIds,
                variableRecords, primaryNames);

        for (int i = model.diagnostics().size(); i < diagnostics.size(); i++) {
            LOG.warn("{}", diagnostics.get(i));
        }
        LOG.debug("Classified {} variables: {} stocks, {} flows; {} causal and {} plumbing arrows; {} pipes",
                variables.size(), stockNames.size(), flowNames.size(), causal.size(), plumbing.size(), flows.size());

        return new TypedModel(model, variables, causal, plumbing, flows, valveIds, stockIds, diagnostics);
    }

    // ── Pipes ──

    private record PipeEnd(int nodeId, boolean tail) {
    }

    /**
     * Pairs each valve with the two nodes its pipe arrows reach. The end drawn without an
     * arrowhead is the source; when that does not single one out, sketch order decides.
     * Valves with other than two ends are left out.
     */
    private static List<MaterialFlow> assembleFlows(SketchSection sketch, List<ConnectionRecord> plumbing,
                                                    Set<Integer> valveIds, Set<Integer> stockIds,
                                                    Set<Integer> cloudIds,
                                                    Map<Integer, VariableRecord> variableRecords,
                                                    Map<String, String> primaryNames) {
        Map<Integer, List<PipeEnd>> ends = new LinkedHashMap<>();
        for (ConnectionRecord pipe : plumbing) {
            boolean tail = ConnectionRecord.SHAPE_PIPE_TAIL.equals(pipe.field(ConnectionRecord.FIELD_SHAPE).strip());
            if (valveIds.contains(pipe.fromId()) && !valveIds.contains(pipe.toId())) {
                ends.computeIfAbsent(pipe.fromId(), k -> new ArrayList<>()).add(new PipeEnd(pipe.toId(), tail));
            } else if (valveIds.contains(pipe.toId()) && !valveIds.contains(pipe.fromId())) {
                ends.computeIfAbsent(pipe.toId(), k -> new ArrayList<>()).add(new PipeEnd(pipe.fromId(), tail));
            } else if (valveIds.contains(pipe.fromId()) && variableRecords.containsKey(pipe.toId())) {
                ends.computeIfAbsent(pipe.fromId(), k -> new ArrayList<>()).add(new PipeEnd(pipe.toId(), tail));
            }
        }

        List<MaterialFlow> flows = new ArrayList<>();
        for (Map.Entry<Integer, List<PipeEnd>> entry : ends.entrySet()) {
            List<PipeEnd> pair = entry.getValue();
            if (pair.size() != 2) {
                LOG.debug("Valve {} has {} pipe ends; not assembled", entry.getKey(), pair.size());
                continue;
            }
            PipeEnd source = pair.get(0);
            PipeEnd destination = pair.get(1);
            if (!source.tail() && destination.tail()) {
                source = pair.get(1);
                destination = pair.get(0);
            }
            flows.add(new MaterialFlow(entry.getKey(),
                    valveName(sketch, entry.getKey(), valveIds, primaryNames),
                    endpoint(source.nodeId(), stockIds, cloudIds, variableRecords, primaryNames),
                    endpoint(destination.nodeId(), stockIds, cloudIds, variableRecords, primaryNames)));
        }
        return flows;
    }

    private static String valveName(SketchSection sketch, int valveId, Set<Integer> valveIds,
                                    Map<String, String> primaryNames) {
        for (VariableRecord v : sketch.variables()) {
            if ((v.id() == valveId || v.id() == valveId + 1) && standsForValve(v, valveIds)) {
                return primaryNames.get(VariableNames.canonical(v.name()));
            }
        }
        return null;
    }

    private static MaterialFlow.Endpoint endpoint(int nodeId, Set<Integer> stockIds, Set<Integer> cloudIds,
                                                  Map<Integer, VariableRecord> variableRecords,
                                                  Map<String, String> primaryNames) {
        if (stockIds.contains(nodeId) && variableRecords.containsKey(nodeId)) {
            String name = primaryNames.get(VariableNames.canonical(variableRecords.get(nodeId).name()));
            return new MaterialFlow.Endpoint(MaterialFlow.EndpointKind.STOCK, nodeId, name);
        }
        if (cloudIds.contains(nodeId)) {
            return new MaterialFlow.Endpoint(MaterialFlow.EndpointKind.CLOUD, nodeId, null);
        }
        return new MaterialFlow.Endpoint(MaterialFlow.EndpointKind.UNKNOWN, nodeId, null);
    }

    /**
     * Whether a variable record represents a valve: it shares the valve's id, or it is the
     * valve label Vensim writes directly after the valve.
     */
    static boolean standsForValve(SketchRecord.VariableRecord v, Set<Integer> valveIds) {
        if (valveIds.contains(v.id())) {
            return true;
        }
        return v.shapeCode() == VariableRecord.SHAPE_VALVE_LABEL && valveIds.contains(v.id() - 1);
    }
}
