package org.sdmodel.edit;

import org.sdmodel.edit.EditOperation.AddConnection;
import org.sdmodel.edit.EditOperation.AddVariable;
import org.sdmodel.edit.EditOperation.ModifyConnection;
import org.sdmodel.edit.EditOperation.ModifyVariable;
import org.sdmodel.edit.EditOperation.RemoveConnection;
import org.sdmodel.edit.EditOperation.RemoveVariable;
import org.sdmodel.mdl.Position;
import org.sdmodel.mdl.Size;
import org.sdmodel.serialization.JsonFormatException;
import org.sdmodel.serialization.ModelJson;
import org.sdmodel.topology.Polarity;
import org.sdmodel.topology.VariableKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads an operation list into {@link EditOperation}s.
 *
 * <pre>
 * [
 *   {"operation": "add_variable",
 *    "variable": {"name": "Peer Support", "type": "Auxiliary",
 *                 "position": {"x": 950, "y": 350}, "size": {"width": 70, "height": 26}},
 *    "mdl_comment": "Added: mentoring effect"},
 *   {"operation": "add_connection",
 *    "connection": {"from": "Peer Support", "to": "Retention", "relationship": "positive"},
 *    "mdl_comment": "..."}
 * ]
 * </pre>
 *
 * The list may also be wrapped in an object under {@code model_changes},
 * {@code operations} or {@code improvements}. Operation fields may be nested under
 * {@code variable} / {@code connection} or written at the top level of the operation.
 */
public final class EditOperationReader {

    private static final List<String> LIST_KEYS = List.of("model_changes", "operations", "improvements");

    private EditOperationReader() {
    }

    /**
     * @throws EditOperationException when the document or one of its operations is malformed
     */
    public static List<EditOperation> read(String json) {
        Object doc;
        try {
            doc = ModelJson.parse(json);
        } catch (JsonFormatException e) {
            throw new EditOperationException("Operation list is not valid JSON", e);
        }
        return read(doc);
    }

    @SuppressWarnings("unchecked")
    public static List<EditOperation> read(Object doc) {
        List<Object> items = null;
        if (doc instanceof List<?> list) {
            items = (List<Object>) list;
        } else if (doc instanceof Map<?, ?> map) {
            for (String key : LIST_KEYS) {
                items = ModelJson.getList((Map<String, Object>) map, key);
                if (items != null) {
                    break;
                }
            }
        }
        if (items == null) {
            throw new EditOperationException("Expected an array of operations or an object with one of " + LIST_KEYS);
        }

        List<EditOperation> operations = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            if (!(items.get(i) instanceof Map<?, ?> item)) {
                throw new EditOperationException("Operation is not an object", i);
            }
            operations.add(readOperation((Map<String, Object>) item, i));
        }
        return operations;
    }

    private static EditOperation readOperation(Map<String, Object> op, int index) {
        String name = ModelJson.getString(op, "operation");
        if (name == null) {
            throw new EditOperationException("Missing 'operation'", index);
        }
        String comment = firstString(op, "mdl_comment", "comment");
        if (comment == null) {
            comment = "";
        }

        Map<String, Object> variable = nestedOrSelf(op, "variable");
        Map<String, Object> connection = nestedOrSelf(op, "connection");

        return switch (name) {
            case "add_variable" -> new AddVariable(
                    required(variable, "name", index),
                    VariableKind.fromLabel(ModelJson.getString(variable, "type")),
                    position(variable),
                    size(variable),
                    color(variable, "border"),
                    ModelJson.getString(variable, "equation"),
                    ModelJson.getString(variable, "units"),
                    ModelJson.getString(variable, "description"),
                    comment);
            case "remove_variable" -> new RemoveVariable(required(variable, "name", index), comment);
            case "modify_variable" -> new ModifyVariable(
                    required(variable, "name", index),
                    position(variable),
                    size(variable),
                    ModelJson.getString(variable, "equation"),
                    comment);
            case "add_connection" -> new AddConnection(
                    required(connection, "from", index),
                    required(connection, "to", index),
                    polarity(ModelJson.getString(connection, "relationship"), Polarity.POSITIVE, index),
                    color(connection, "border"),
                    comment);
            case "remove_connection" -> new RemoveConnection(
                    required(connection, "from", index),
                    required(connection, "to", index),
                    comment);
            case "modify_connection" -> {
                String relationship = firstString(connection, "new_relationship", "relationship");
                yield new ModifyConnection(
                        required(connection, "from", index),
                        required(connection, "to", index),
                        polarity(relationship, null, index),
                        color(connection, "border"),
                        comment);
            }
            default -> throw new EditOperationException("Unknown operation '" + name + "'", index);
        };
    }

    // ==================== Field helpers ====================

    private static Map<String, Object> nestedOrSelf(Map<String, Object> op, String key) {
        Map<String, Object> nested = ModelJson.getObject(op, key);
        return nested != null ? nested : op;
    }

    private static String required(Map<String, Object> map, String key, int index) {
        String value = ModelJson.getString(map, key);
        if (value == null || value.isBlank()) {
            throw new EditOperationException("Missing '" + key + "'", index);
        }
        return value;
    }

    private static String firstString(Map<String, Object> map, String... keys) {
        for (String key : keys) {
            String value = ModelJson.getString(map, key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Absent relationships take the fallback; anything other than positive or negative is rejected.
     */
    private static Polarity polarity(String relationship, Polarity fallback, int index) {
        if (relationship == null) {
            return fallback;
        }
        try {
            return Polarity.fromRelationship(relationship);
        } catch (IllegalArgumentException e) {
            throw new EditOperationException(e.getMessage() + ", expected 'positive' or 'negative'", index);
        }
    }

    private static Position position(Map<String, Object> map) {
        Map<String, Object> p = ModelJson.getObject(map, "position");
        if (p == null) {
            return null;
        }
        Integer x = ModelJson.getInt(p, "x");
        Integer y = ModelJson.getInt(p, "y");
        return x == null || y == null ? null : new Position(x, y);
    }

    private static Size size(Map<String, Object> map) {
        Map<String, Object> s = ModelJson.getObject(map, "size");
        if (s == null) {
            return null;
        }
        Integer w = ModelJson.getInt(s, "width");
        Integer h = ModelJson.getInt(s, "height");
        return w == null || h == null ? null : new Size(w, h);
    }

    /**
     * A colour given either as a string or as an object keyed by {@code objectKey}.
     */
    private static String color(Map<String, Object> map, String objectKey) {
        String direct = ModelJson.getString(map, "color");
        if (direct != null) {
            return direct;
        }
        Map<String, Object> nested = ModelJson.getObject(map, "color");
        return nested == null ? null : ModelJson.getString(nested, objectKey);
    }
}
