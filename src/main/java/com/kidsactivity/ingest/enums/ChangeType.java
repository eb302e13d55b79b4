package com.kidsactivity.ingest.enums;

/**
 * Outcome of comparing a freshly extracted candidate with the stored activity.
 */
public enum ChangeType {
    CREATE,
    UPDATE,
    /** Content identical; only lastSeenAt is written. */
    UNCHANGED
}
