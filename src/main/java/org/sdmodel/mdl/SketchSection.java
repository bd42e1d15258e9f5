package org.sdmodel.mdl;

import org.sdmodel.mdl.SketchRecord.CloudRecord;
import org.sdmodel.mdl.SketchRecord.ConnectionRecord;
import org.sdmodel.mdl.SketchRecord.Identified;
import org.sdmodel.mdl.SketchRecord.ValveRecord;
import org.sdmodel.mdl.SketchRecord.VariableRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * The sketch part of a model description: header prologue, records in source order,
 * and footer. Records are held in one ordered list so that untouched text keeps its
 * position; typed views over the list are computed on demand.
 */
public final class SketchSection {

    private final List<String> header;
    private final List<SketchRecord> records;
    private final List<String> footer;

    public SketchSection(List<String> header, List<SketchRecord> records, List<String> footer) {
        this.header = List.copyOf(header);
        this.records = new ArrayList<>(records);
        this.footer = List.copyOf(footer);
    }

    // ==================== Queries ====================

    public List<String> header() {
        return header;
    }

    public List<SketchRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public List<String> footer() {
        return footer;
    }

    public List<VariableRecord> variables() {
        return ofType(VariableRecord.class);
    }

    public List<ValveRecord> valves() {
        return ofType(ValveRecord.class);
    }

    public List<CloudRecord> clouds() {
        return ofType(CloudRecord.class);
    }

    public List<ConnectionRecord> connections() {
        return ofType(ConnectionRecord.class);
    }

    public Optional<VariableRecord> variable(int id) {
        for (SketchRecord record : records) {
            if (record instanceof VariableRecord v && v.id() == id) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }

    /**
     * All variable records with the name; more than one when the diagram shows shadow copies.
     */
    public List<VariableRecord> variablesNamed(String name) {
        String key = VariableNames.canonical(name);
        List<VariableRecord> result = new ArrayList<>();
        for (VariableRecord v : variables()) {
            if (VariableNames.canonical(v.name()).equals(key)) {
                result.add(v);
            }
        }
        return result;
    }

    /**
     * Highest id in the shared id space, or 0 for an empty sketch.
     */
    public int maxId() {
        int max = 0;
        for (SketchRecord record : records) {
            if (record instanceof Identified identified) {
                max = Math.max(max, identified.id());
            }
        }
        return max;
    }

    private <T extends SketchRecord> List<T> ofType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (SketchRecord record : records) {
            if (type.isInstance(record)) {
                result.add(type.cast(record));
            }
        }
        return result;
    }

    // ==================== Mutation ====================

    /**
     * Insert a variable record right after the last existing one (or at the end of the
     * records when there is none), which keeps variable records in id order.
     */
    public void addVariable(VariableRecord variable) {
        int insertAt = records.size();
        for (int i = records.size() - 1; i >= 0; i--) {
            if (records.get(i) instanceof VariableRecord) {
                insertAt = i + 1;
                break;
            }
        }
        records.add(insertAt, variable);
    }

    public void addConnection(ConnectionRecord connection) {
        records.add(connection);
    }

    /**
     * Remove all records matching the predicate and return them.
     */
    public List<SketchRecord> removeIf(Predicate<SketchRecord> predicate) {
        List<SketchRecord> removed = new ArrayList<>();
        records.removeIf(r -> {
            if (predicate.test(r)) {
                removed.add(r);
                return true;
            }
            return false;
        });
        return removed;
    }

    /**
     * Replace a record in place, keeping its position.
     */
    public void replace(SketchRecord existing, SketchRecord replacement) {
        int index = records.indexOf(existing);
        if (index < 0) {
            throw new IllegalArgumentException("Record is not part of this sketch: " + existing.rawLine());
        }
        records.set(index, replacement);
    }

    // ==================== Rendering ====================

    public List<String> toLines() {
        List<String> lines = new ArrayList<>(header);
        for (SketchRecord record : records) {
            lines.add(record.rawLine());
        }
        lines.addAll(footer);
        return lines;
    }
}
