package com.kidsactivity.ingest.model;

import com.kidsactivity.ingest.entity.Activity;
import com.kidsactivity.ingest.enums.ChangeType;

import java.util.List;

public record UpsertOutcome(ChangeType type, Activity activity, List<FieldChange> changes) {
}
