package com.medical.records.service.aggregation;

import com.medical.records.model.timeline.RecordEntry;
import com.medical.records.model.timeline.RecordKind;

import java.util.Iterator;

/**
 * Producer of one kind of record entry for a patient.
 * <p>
 * The returned iterator is finite, single-use and ascending by {@code createdAt};
 * entries sharing a timestamp come in creation order.
 */
public interface RecordSource {

    RecordKind kind();

    Iterator<? extends RecordEntry> fetch(String patientId);
}
