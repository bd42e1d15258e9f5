package org.sdmodel.mdl;

import java.util.List;

/**
 * One line of the sketch section after the header prologue.
 *
 * Every variant keeps its raw line so that untouched records are re-emitted
 * byte-for-byte. Synthesized records carry a line number of -1.
 */
public sealed interface SketchRecord
        permits SketchRecord.Identified, SketchRecord.RawLine {

    /** Type code of variable records. */
    int TYPE_VARIABLE = 10;
    /** Type code of valve (flow rate) records. */
    int TYPE_VALVE = 11;
    /** Type code of cloud and comment records. */
    int TYPE_CLOUD = 12;
    /** Type code of arrow records. */
    int TYPE_CONNECTION = 1;

    String rawLine();

    int lineNumber();

    /**
     * Records that own an entry in the shared id space.
     */
    sealed interface Identified extends SketchRecord
            permits VariableRecord, ValveRecord, CloudRecord, ConnectionRecord {
        int id();
    }

    // ── Nodes ──

    /**
     * A named variable box ({@code 10,id,name,x,y,w,h,shape,...}).
     */
    record VariableRecord(int id, String name, Position position, Size size, int shapeCode,
                          String rawLine, int lineNumber) implements Identified {

        /** Shape code Vensim writes for stock boxes. */
        public static final int SHAPE_STOCK = 3;
        /** Shape code Vensim writes for auxiliaries. */
        public static final int SHAPE_AUXILIARY = 8;
        /** Shape code Vensim writes for the label attached to a valve. */
        public static final int SHAPE_VALVE_LABEL = 40;

        /**
         * Copy with new geometry, rewriting only the position and size fields of the raw line.
         */
        public VariableRecord withGeometry(Position newPosition, Size newSize) {
            List<String> fields = FieldSplitter.splitRaw(rawLine);
            fields.set(3, Integer.toString(newPosition.x()));
            fields.set(4, Integer.toString(newPosition.y()));
            fields.set(5, Integer.toString(newSize.width()));
            fields.set(6, Integer.toString(newSize.height()));
            return new VariableRecord(id, name, newPosition, newSize, shapeCode,
                    String.join(",", fields), lineNumber);
        }
    }

    /**
     * A flow valve ({@code 11,id,...,x,y,...}). Only the id and position are decoded.
     */
    record ValveRecord(int id, Position position, String rawLine, int lineNumber) implements Identified {
    }

    /**
     * A cloud or free-text comment ({@code 12,id,shape,x,y,...}).
     */
    record CloudRecord(int id, int shapeCode, Position position, String rawLine, int lineNumber)
            implements Identified {

        /** Shape code of a source/sink cloud; other codes are comment boxes. */
        public static final int SHAPE_CLOUD = 48;

        public boolean isCloud() {
            return shapeCode == SHAPE_CLOUD;
        }
    }

    // ── Edges ──

    /**
     * An arrow ({@code 1,id,from,to,shape,hidden,polarity,...}). Decoded minimally;
     * everything after the discriminator stays opaque in the raw line.
     */
    record ConnectionRecord(int id, int fromId, int toId, String discriminator,
                            String rawLine, int lineNumber) implements Identified {

        /** Field index of the connector shape; on pipes, {@value #SHAPE_PIPE_TAIL} marks the tail end. */
        public static final int FIELD_SHAPE = 4;
        /** Field index of the polarity discriminator. */
        public static final int FIELD_POLARITY = 6;
        /** Field index of the arrow's drawing-style flags. */
        public static final int FIELD_STYLE = 9;
        /** Field index of the arrow colour. */
        public static final int FIELD_COLOR = 11;
        /** Shape of a pipe drawn without an arrowhead, i.e. the end material leaves from. */
        public static final String SHAPE_PIPE_TAIL = "100";

        /**
         * Raw text of one field, or an empty string when the line is shorter.
         */
        public String field(int index) {
            List<String> fields = FieldSplitter.splitRaw(rawLine);
            return index < fields.size() ? fields.get(index) : "";
        }

        public boolean references(int nodeId) {
            return fromId == nodeId || toId == nodeId;
        }

        /**
         * Copy with one raw field replaced; all other text is kept as is.
         * Returns this record unchanged when the line has too few fields.
         */
        public ConnectionRecord withField(int index, String value) {
            List<String> fields = FieldSplitter.splitRaw(rawLine);
            if (index >= fields.size()) {
                return this;
            }
            fields.set(index, value);
            String newDiscriminator = index == FIELD_POLARITY ? value : discriminator;
            return new ConnectionRecord(id, fromId, toId, newDiscriminator, String.join(",", fields), lineNumber);
        }
    }

    // ── Everything else ──

    /**
     * A line that is not a decoded record: view headers, style lines, other object types,
     * and records too malformed to decode.
     */
    record RawLine(String rawLine, int lineNumber) implements SketchRecord {
    }
}
