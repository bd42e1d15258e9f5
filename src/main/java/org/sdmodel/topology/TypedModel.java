package org.sdmodel.topology;

import org.sdmodel.mdl.Diagnostic;
import org.sdmodel.mdl.MdlModel;
import org.sdmodel.mdl.SketchRecord.ConnectionRecord;
import org.sdmodel.mdl.VariableNames;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A parsed model together with its topology classification.
 *
 * A snapshot: it is computed from the current records of {@link #model()} and is not
 * updated when the model is edited afterwards. Classify again after editing.
 */
public final class TypedModel {

    private final MdlModel model;
    private final List<Variable> variables;
    private final Map<Integer, Variable> variablesById = new LinkedHashMap<>();
    private final Map<String, Variable> variablesByName = new LinkedHashMap<>();
    private final List<Connection> causalConnections;
    private final List<ConnectionRecord> plumbing;
    private final List<MaterialFlow> flows;
    private final Set<Integer> valveIds;
    private final Set<Integer> stockIds;
    private final List<Diagnostic> diagnostics;

    TypedModel(MdlModel model, List<Variable> variables, List<Connection> causalConnections,
               List<ConnectionRecord> plumbing, List<MaterialFlow> flows, Set<Integer> valveIds, Set<Integer> stockIds,
               List<Diagnostic> diagnostics) {
        this.model = model;
        this.variables = List.copyOf(variables);
        this.causalConnections = List.copyOf(causalConnections);
        this.plumbing = List.copyOf(plumbing);
        this.flows = List.copyOf(flows);
        this.valveIds = Set.copyOf(valveIds);
        this.stockIds = Set.copyOf(stockIds);
        this.diagnostics = List.copyOf(diagnostics);
        for (Variable v : variables) {
            variablesById.put(v.id(), v);
            variablesByName.putIfAbsent(VariableNames.canonical(v.name()), v);
        }
    }

    public MdlModel model() {
        return model;
    }

    /**
     * Variables in sketch order, shadow copies included.
     */
    public List<Variable> variables() {
        return variables;
    }

    public Optional<Variable> variable(int id) {
        return Optional.ofNullable(variablesById.get(id));
    }

    /**
     * The first variable record carrying the name.
     */
    public Optional<Variable> variable(String name) {
        return Optional.ofNullable(variablesByName.get(VariableNames.canonical(name)));
    }

    /**
     * One variable per distinct name, in sketch order.
     */
    public List<Variable> distinctVariables() {
        return new ArrayList<>(variablesByName.values());
    }

    public List<Variable> variablesOfKind(VariableKind kind) {
        List<Variable> result = new ArrayList<>();
        for (Variable v : variablesByName.values()) {
            if (v.kind() == kind) {
                result.add(v);
            }
        }
        return result;
    }

    /**
     * Signed influences between variables, in sketch order.
     */
    public List<Connection> connections() {
        return causalConnections;
    }

    /**
     * Arrows that carry material between stocks, valves and clouds.
     */
    public List<ConnectionRecord> plumbing() {
        return plumbing;
    }

    /**
     * Valves with the source and destination of their pipes, in the order the pipes appear.
     */
    public List<MaterialFlow> flows() {
        return flows;
    }

    public Set<Integer> valveIds() {
        return valveIds;
    }

    public Set<Integer> stockIds() {
        return stockIds;
    }

    /**
     * Parse diagnostics followed by classification diagnostics.
     */
    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }
}
