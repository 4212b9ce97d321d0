package com.medical.records.model.timeline;

/**
 * Kinds of entries that make up a patient's record.
 * Declaration order is the tie-break precedence used when two entries share a timestamp.
 */
public enum RecordKind {
    VITAL,
    NOTE,
    FILE,
    PRESCRIPTION
}
