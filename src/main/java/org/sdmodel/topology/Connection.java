package org.sdmodel.topology;

import org.sdmodel.mdl.SketchRecord.ConnectionRecord;

/**
 * A signed causal influence between two variables, derived from one sketch arrow.
 *
 * @param fromVariable Name of the influencing variable
 * @param toVariable   Name of the influenced variable
 * @param polarity     Sign read from the arrow's discriminator
 * @param record       The arrow this connection was derived from
 * @param sketchOrder  Position of the arrow among all arrows of the sketch
 */
public record Connection(
        String fromVariable,
        String toVariable,
        Polarity polarity,
        ConnectionRecord record,
        int sketchOrder) {

    public int fromId() {
        return record.fromId();
    }

    public int toId() {
        return record.toId();
    }

    public boolean isNegative() {
        return polarity == Polarity.NEGATIVE;
    }
}
