package org.sdmodel.edit;

import org.sdmodel.edit.EditOperation.AddConnection;
import org.sdmodel.edit.EditOperation.AddVariable;
import org.sdmodel.edit.EditOperation.ModifyConnection;
import org.sdmodel.edit.EditOperation.ModifyVariable;
import org.sdmodel.edit.EditOperation.RemoveConnection;
import org.sdmodel.edit.EditOperation.RemoveVariable;
import org.sdmodel.mdl.EquationBlock;
import org.sdmodel.mdl.EquationSection;
import org.sdmodel.mdl.FieldSplitter;
import org.sdmodel.mdl.MdlModel;
import org.sdmodel.mdl.Position;
import org.sdmodel.mdl.Size;
import org.sdmodel.mdl.SketchRecord;
import org.sdmodel.mdl.SketchRecord.ConnectionRecord;
import org.sdmodel.mdl.SketchRecord.VariableRecord;
import org.sdmodel.mdl.SketchSection;
import org.sdmodel.topology.PolarityConvention;
import org.sdmodel.topology.VariableKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies edit operations to a parsed model in place.
 *
 * Only the records an operation touches change; every other line keeps its original
 * text and position, so rendering the model after an empty batch reproduces the input.
 * A failing operation is recorded in the change log and the batch goes on.
 */
public final class SurgicalEditor {

    private static final Logger LOG = LoggerFactory.getLogger(SurgicalEditor.class);

    static final Position DEFAULT_POSITION = new Position(500, 300);
    static final Size DEFAULT_SIZE = new Size(60, 26);

    /** Style flag set on arrows that carry their own colour. */
    static final String COLORED_STYLE = "192";
    /** Text colour written for coloured records. */
    private static final String FONT_COLOR = "0-0-0";

    private final MdlModel model;
    private final PolarityConvention convention;

    public SurgicalEditor(MdlModel model) {
        this(model, PolarityConvention.defaults());
    }

    public SurgicalEditor(MdlModel model, PolarityConvention convention) {
        this.model = model;
        this.convention = convention;
    }

    public MdlModel model() {
        return model;
    }

    /**
     * Apply the operations in order and return one change-log entry per operation.
     */
    public List<ChangeLogEntry> apply(List<? extends EditOperation> operations) {
        List<ChangeLogEntry> log = new ArrayList<>(operations.size());
        for (EditOperation operation : operations) {
            ChangeLogEntry entry = apply(operation);
            if (entry.succeeded()) {
                LOG.info("{}", entry);
            } else {
                LOG.warn("{}", entry);
            }
            log.add(entry);
        }
        return log;
    }

    public ChangeLogEntry apply(EditOperation operation) {
        if (operation instanceof AddVariable op) {
            return addVariable(op);
        } else if (operation instanceof RemoveVariable op) {
            return removeVariable(op);
        } else if (operation instanceof ModifyVariable op) {
            return modifyVariable(op);
        } else if (operation instanceof AddConnection op) {
            return addConnection(op);
        } else if (operation instanceof RemoveConnection op) {
            return removeConnection(op);
        } else if (operation instanceof ModifyConnection op) {
            return modifyConnection(op);
        }
        throw new IllegalArgumentException("Unsupported operation: " + operation);
    }

    // ==================== Variables ====================

    private ChangeLogEntry addVariable(AddVariable op) {
        SketchSection sketch = model.sketch();
        EquationSection equations = model.equations();
        if (!sketch.variablesNamed(op.name()).isEmpty() || equations.hasBlock(op.name())) {
            return failed(op, op.name(), "a variable named '" + op.name() + "' already exists");
        }

        int id = model.nextId();
        Position position = op.position() != null ? op.position() : DEFAULT_POSITION;
        Size size = op.size() != null ? op.size() : DEFAULT_SIZE;
        int shape = shapeFor(op.kind());
        String line = variableLine(id, op.name(), position, size, shape, normalizeColor(op.borderColor()));

        sketch.addVariable(new VariableRecord(id, op.name(), position, size, shape, line, -1));
        equations.addBlock(EquationBlock.synthesize(op.name(), op.equation(), op.units(), op.description(),
                equations.nextDeclarationOrder()));
        return succeeded(op, op.name(), "added " + op.kind().label() + " with id " + id);
    }

    private ChangeLogEntry removeVariable(RemoveVariable op) {
        SketchSection sketch = model.sketch();
        List<VariableRecord> records = sketch.variablesNamed(op.name());
        if (records.isEmpty()) {
            return failed(op, op.name(), "no variable named '" + op.name() + "'");
        }

        Set<Integer> ids = idsOf(records);
        List<SketchRecord> removedArrows = sketch.removeIf(r -> r instanceof ConnectionRecord c
                && (ids.contains(c.fromId()) || ids.contains(c.toId())));
        sketch.removeIf(r -> r instanceof VariableRecord v && ids.contains(v.id()));
        boolean hadBlock = model.equations().removeBlock(op.name());

        return succeeded(op, op.name(), "removed " + records.size() + " record(s), "
                + removedArrows.size() + " arrow(s)" + (hadBlock ? " and the equation" : ""));
    }

    private ChangeLogEntry modifyVariable(ModifyVariable op) {
        SketchSection sketch = model.sketch();
        List<VariableRecord> records = sketch.variablesNamed(op.name());
        if (records.isEmpty()) {
            return failed(op, op.name(), "no variable named '" + op.name() + "'");
        }
        if (op.position() == null && op.size() == null && op.equation() == null) {
            return failed(op, op.name(), "nothing to change");
        }

        List<String> changed = new ArrayList<>();
        if (op.position() != null || op.size() != null) {
            VariableRecord primary = records.get(0);
            Position position = op.position() != null ? op.position() : primary.position();
            Size size = op.size() != null ? op.size() : primary.size();
            sketch.replace(primary, primary.withGeometry(position, size));
            changed.add("geometry");
        }
        if (op.equation() != null) {
            EquationSection equations = model.equations();
            equations.replaceBlock(equations.block(op.name())
                    .map(block -> block.withRightHandSide(op.equation()))
                    .orElseGet(() -> EquationBlock.synthesize(records.get(0).name(), op.equation(), null, null,
                            equations.nextDeclarationOrder())));
            changed.add("equation");
        }
        return succeeded(op, op.name(), "updated " + String.join(" and ", changed));
    }

    // ==================== Connections ====================

    private ChangeLogEntry addConnection(AddConnection op) {
        String target = op.from() + " -> " + op.to();
        List<VariableRecord> from = model.sketch().variablesNamed(op.from());
        List<VariableRecord> to = model.sketch().variablesNamed(op.to());
        if (from.isEmpty() || to.isEmpty()) {
            return failed(op, target, "unknown variable '" + (from.isEmpty() ? op.from() : op.to()) + "'");
        }

        int id = model.nextId();
        int fromId = from.get(0).id();
        int toId = to.get(0).id();
        String marker = convention.markerFor(op.polarity());
        String line = connectionLine(id, fromId, toId, marker, normalizeColor(op.color()));

        model.sketch().addConnection(new ConnectionRecord(id, fromId, toId, marker, line, -1));
        return succeeded(op, target, "added " + op.polarity().relationship() + " arrow with id " + id);
    }

    private ChangeLogEntry removeConnection(RemoveConnection op) {
        String target = op.from() + " -> " + op.to();
        Set<Integer> fromIds = idsOf(model.sketch().variablesNamed(op.from()));
        Set<Integer> toIds = idsOf(model.sketch().variablesNamed(op.to()));
        if (fromIds.isEmpty() || toIds.isEmpty()) {
            return failed(op, target, "unknown variable '" + (fromIds.isEmpty() ? op.from() : op.to()) + "'");
        }

        List<SketchRecord> removed = model.sketch().removeIf(r -> r instanceof ConnectionRecord c
                && fromIds.contains(c.fromId()) && toIds.contains(c.toId()));
        if (removed.isEmpty()) {
            return failed(op, target, "no arrow between the variables");
        }
        return succeeded(op, target, "removed " + removed.size() + " arrow(s)");
    }

    private ChangeLogEntry modifyConnection(ModifyConnection op) {
        String target = op.from() + " -> " + op.to();
        SketchSection sketch = model.sketch();
        Set<Integer> fromIds = idsOf(sketch.variablesNamed(op.from()));
        Set<Integer> toIds = idsOf(sketch.variablesNamed(op.to()));
        if (fromIds.isEmpty() || toIds.isEmpty()) {
            return failed(op, target, "unknown variable '" + (fromIds.isEmpty() ? op.from() : op.to()) + "'");
        }
        if (op.polarity() == null && op.color() == null) {
            return failed(op, target, "nothing to change");
        }

        String color = normalizeColor(op.color());
        int lastField = color != null ? ConnectionRecord.FIELD_COLOR : ConnectionRecord.FIELD_POLARITY;
        int updated = 0;
        int tooShort = 0;
        for (ConnectionRecord arrow : sketch.connections()) {
            if (!fromIds.contains(arrow.fromId()) || !toIds.contains(arrow.toId())) {
                continue;
            }
            if (FieldSplitter.splitRaw(arrow.rawLine()).size() <= lastField) {
                tooShort++;
                continue;
            }
            ConnectionRecord replacement = arrow;
            if (op.polarity() != null) {
                replacement = replacement.withField(ConnectionRecord.FIELD_POLARITY,
                        convention.markerFor(op.polarity()));
            }
            if (color != null) {
                replacement = replacement
                        .withField(ConnectionRecord.FIELD_STYLE, COLORED_STYLE)
                        .withField(ConnectionRecord.FIELD_COLOR, color);
            }
            sketch.replace(arrow, replacement);
            updated++;
        }
        if (updated == 0) {
            return failed(op, target, tooShort == 0
                    ? "no arrow between the variables"
                    : tooShort + " arrow(s) too short to carry the changed fields");
        }
        String detail = "updated " + updated + " arrow(s)";
        if (tooShort > 0) {
            detail += ", skipped " + tooShort + " too short to carry the changed fields";
        }
        return succeeded(op, target, detail);
    }

    // ==================== Record synthesis ====================

    static int shapeFor(VariableKind kind) {
        return switch (kind) {
            case STOCK -> VariableRecord.SHAPE_STOCK;
            case FLOW -> VariableRecord.SHAPE_VALVE_LABEL;
            case AUXILIARY -> VariableRecord.SHAPE_AUXILIARY;
        };
    }

    static String variableLine(int id, String name, Position position, Size size, int shape, String borderColor) {
        String head = "10," + id + "," + FieldSplitter.quoteIfNeeded(name) + ","
                + position.x() + "," + position.y() + "," + size.width() + "," + size.height() + "," + shape;
        if (borderColor == null) {
            return head + ",3,0,0,-1,0,0,0,0,0,0,0,0,0";
        }
        return head + ",3,0,1,-1,1,0,0," + borderColor + "," + FONT_COLOR + ",|||" + FONT_COLOR + ",0,0,0,0,0,0";
    }

    static String connectionLine(int id, int fromId, int toId, String marker, String color) {
        String head = "1," + id + "," + fromId + "," + toId + ",0,0," + marker + ",22,0,";
        if (color == null) {
            return head + "0,0,-1--1--1,,1|(0,0)|";
        }
        return head + COLORED_STYLE + ",0," + color + ",|||" + FONT_COLOR + ",1|(0,0)|";
    }

    /**
     * Colours are written as {@code r-g-b}; {@code "0,192,0"} and {@code "0 192 0"} are accepted too.
     */
    static String normalizeColor(String color) {
        if (color == null || color.isBlank()) {
            return null;
        }
        return String.join("-", color.strip().split("\\s*[,\\s-]\\s*"));
    }

    // ==================== Helpers ====================

    private static Set<Integer> idsOf(List<VariableRecord> records) {
        Set<Integer> ids = new HashSet<>();
        for (VariableRecord record : records) {
            ids.add(record.id());
        }
        return ids;
    }

    private static ChangeLogEntry succeeded(EditOperation op, String target, String message) {
        return new ChangeLogEntry(op.operation(), target, true, message, op.mdlComment());
    }

    private static ChangeLogEntry failed(EditOperation op, String target, String message) {
        return new ChangeLogEntry(op.operation(), target, false, message, op.mdlComment());
    }
}
