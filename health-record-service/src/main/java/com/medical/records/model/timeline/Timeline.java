package com.medical.records.model.timeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Request-scoped, time-ordered view over all record entries of one patient. Never persisted.
 */
@Getter
public class Timeline {

    private final String patientId;
    private final List<RecordEntry> entries;

    public Timeline(String patientId, List<RecordEntry> entries) {
        this.patientId = patientId;
        this.entries = Collections.unmodifiableList(entries);
    }

    public static Timeline empty(String patientId) {
        return new Timeline(patientId, Collections.emptyList());
    }

    /**
     * Entries of one kind, in timeline order.
     */
    public <T extends RecordEntry> List<T> entriesOf(RecordKind kind, Class<T> type) {
        return entries.stream()
                .filter(entry -> entry.getKind() == kind)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
