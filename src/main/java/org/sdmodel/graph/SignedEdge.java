package org.sdmodel.graph;

import org.sdmodel.topology.Polarity;

/**
 * A directed, signed edge of the causal graph.
 *
 * @param from        Source variable name
 * @param to          Target variable name
 * @param polarity    Sign of the influence
 * @param sketchOrder Position of the originating arrow in the sketch; orders parallel edges
 */
public record SignedEdge(String from, String to, Polarity polarity, int sketchOrder) {

    public boolean isNegative() {
        return polarity == Polarity.NEGATIVE;
    }
}
