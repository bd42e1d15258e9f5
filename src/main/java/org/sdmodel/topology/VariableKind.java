package org.sdmodel.topology;

/**
 * Structural role of a variable, derived from connection topology.
 */
public enum VariableKind {
    STOCK("Stock"),
    FLOW("Flow"),
    AUXILIARY("Auxiliary");

    private final String label;

    VariableKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Case-insensitive lookup by label; anything unknown is an auxiliary.
     */
    public static VariableKind fromLabel(String label) {
        if (label != null) {
            for (VariableKind kind : values()) {
                if (kind.label.equalsIgnoreCase(label.strip())) {
                    return kind;
                }
            }
        }
        return AUXILIARY;
    }
}
