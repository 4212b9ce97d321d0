package com.medical.records.model.timeline;

import java.time.LocalDateTime;

/**
 * A single timestamped entry of a patient's record, tagged with its {@link RecordKind}.
 */
public interface RecordEntry {

    RecordKind getKind();

    String getPatientId();

    LocalDateTime getCreatedAt();

    /**
     * Doctor who wrote the entry, or the patient for self-reported data. May be null.
     */
    String getAuthorId();
}
