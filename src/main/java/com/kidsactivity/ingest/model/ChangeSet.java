package com.kidsactivity.ingest.model;

import com.kidsactivity.ingest.enums.ChangeType;

import java.util.List;

public record ChangeSet(ChangeType type, List<FieldChange> changes) {

    public static ChangeSet create() {
        return new ChangeSet(ChangeType.CREATE, List.of());
    }

    public static ChangeSet of(List<FieldChange> changes) {
        return changes.isEmpty()
                ? new ChangeSet(ChangeType.UNCHANGED, List.of())
                : new ChangeSet(ChangeType.UPDATE, List.copyOf(changes));
    }

    public boolean hasChanges() {
        return type != ChangeType.UNCHANGED;
    }
}
