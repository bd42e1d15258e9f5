package org.sdmodel.edit;

import org.sdmodel.topology.TypedModel;

import java.util.List;

/**
 * The model after an edit batch, classified again, and the change log of the batch.
 */
public record EditResult(TypedModel model, List<ChangeLogEntry> changes) {

    public EditResult {
        changes = List.copyOf(changes);
    }

    public long succeededCount() {
        return changes.stream().filter(ChangeLogEntry::succeeded).count();
    }

    public long failedCount() {
        return changes.size() - succeededCount();
    }

    public boolean allSucceeded() {
        return failedCount() == 0;
    }
}
