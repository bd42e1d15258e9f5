package org.sdmodel.topology;

import org.sdmodel.mdl.VariableNames;

/**
 * A valve assembled with the two ends of its pipe: material leaves {@code from} and
 * arrives at {@code to}.
 *
 * @param valveId Sketch id of the valve
 * @param name    Name of the variable standing for the valve, null when the valve is unlabelled
 * @param from    Source end
 * @param to      Destination end
 */
public record MaterialFlow(int valveId, String name, Endpoint from, Endpoint to) {

    public enum EndpointKind {
        STOCK("stock"),
        CLOUD("cloud"),
        UNKNOWN("unknown");

        private final String label;

        EndpointKind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    /**
     * One end of a pipe. {@code name} is set for stocks only.
     */
    public record Endpoint(EndpointKind kind, int id, String name) {
    }

    public boolean drains(String stockName) {
        return from.kind() == EndpointKind.STOCK && VariableNames.same(from.name(), stockName);
    }

    public boolean fills(String stockName) {
        return to.kind() == EndpointKind.STOCK && VariableNames.same(to.name(), stockName);
    }
}
