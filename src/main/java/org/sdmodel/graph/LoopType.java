package org.sdmodel.graph;

/**
 * Loop polarity class, from the parity of the negative edges on the loop.
 */
public enum LoopType {
    REINFORCING("R"),
    BALANCING("B");

    private final String code;

    LoopType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static LoopType ofNegativeEdges(int negativeEdgeCount) {
        return negativeEdgeCount % 2 == 0 ? REINFORCING : BALANCING;
    }
}
