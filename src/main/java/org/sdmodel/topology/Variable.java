package org.sdmodel.topology;

import org.sdmodel.mdl.Position;
import org.sdmodel.mdl.Size;

/**
 * A sketch variable with its derived kind and its equation.
 *
 * @param id               Sketch id, unique across variables, valves, clouds and arrows
 * @param name             Variable name as written on the sketch
 * @param kind             Stock, Flow or Auxiliary, derived from topology
 * @param position         Sketch position
 * @param size             Sketch size
 * @param equationText     Verbatim equation lines, empty when the variable has no block
 * @param declarationOrder Index of the equation block in the file, -1 when there is none
 */
public record Variable(
        int id,
        String name,
        VariableKind kind,
        Position position,
        Size size,
        String equationText,
        int declarationOrder) {

    public boolean hasEquation() {
        return declarationOrder >= 0;
    }
}
