package org.sdmodel.edit;

import org.sdmodel.mdl.Position;
import org.sdmodel.mdl.Size;
import org.sdmodel.topology.Polarity;
import org.sdmodel.topology.VariableKind;

/**
 * One step of an edit batch. Each variant carries the free-text {@code mdl_comment}
 * that explains the change and ends up in the change log.
 */
public sealed interface EditOperation
        permits EditOperation.AddVariable, EditOperation.RemoveVariable, EditOperation.ModifyVariable,
        EditOperation.AddConnection, EditOperation.RemoveConnection, EditOperation.ModifyConnection {

    /**
     * Operation name as written in operation lists ({@code add_variable}, ...).
     */
    String operation();

    String mdlComment();

    // ── Variables ──

    /**
     * @param position    Sketch position, null for the default
     * @param size        Sketch size, null for the default
     * @param borderColor {@code r-g-b} border colour, null for an uncoloured record
     * @param equation    Right-hand side; null writes a placeholder
     */
    record AddVariable(String name, VariableKind kind, Position position, Size size, String borderColor,
                       String equation, String units, String description, String mdlComment)
            implements EditOperation {

        public static AddVariable named(String name, VariableKind kind) {
            return new AddVariable(name, kind, null, null, null, null, null, null, "");
        }

        @Override
        public String operation() {
            return "add_variable";
        }
    }

    record RemoveVariable(String name, String mdlComment) implements EditOperation {

        @Override
        public String operation() {
            return "remove_variable";
        }
    }

    /**
     * Moves, resizes or re-defines an existing variable; null fields are left unchanged.
     */
    record ModifyVariable(String name, Position position, Size size, String equation, String mdlComment)
            implements EditOperation {

        @Override
        public String operation() {
            return "modify_variable";
        }
    }

    // ── Connections ──

    /**
     * @param color {@code r-g-b} arrow colour, null for the default
     */
    record AddConnection(String from, String to, Polarity polarity, String color, String mdlComment)
            implements EditOperation {

        @Override
        public String operation() {
            return "add_connection";
        }
    }

    record RemoveConnection(String from, String to, String mdlComment) implements EditOperation {

        @Override
        public String operation() {
            return "remove_connection";
        }
    }

    /**
     * Restyles existing arrows in place; null fields are left unchanged.
     */
    record ModifyConnection(String from, String to, Polarity polarity, String color, String mdlComment)
            implements EditOperation {

        @Override
        public String operation() {
            return "modify_connection";
        }
    }
}
