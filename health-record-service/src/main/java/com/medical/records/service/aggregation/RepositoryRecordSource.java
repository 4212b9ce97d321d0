package com.medical.records.service.aggregation;

import com.medical.records.model.timeline.RecordEntry;
import com.medical.records.model.timeline.RecordKind;

import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

/**
 * {@link RecordSource} over a repository finder that already returns entries in ascending order.
 */
public class RepositoryRecordSource implements RecordSource {

    private final RecordKind kind;
    private final Function<String, ? extends List<? extends RecordEntry>> finder;

    public RepositoryRecordSource(RecordKind kind, Function<String, ? extends List<? extends RecordEntry>> finder) {
        this.kind = kind;
        this.finder = finder;
    }

    @Override
    public RecordKind kind() {
        return kind;
    }

    @Override
    public Iterator<? extends RecordEntry> fetch(String patientId) {
        return finder.apply(patientId).iterator();
    }

    @Override
    public String toString() {
        return "RepositoryRecordSource[" + kind + "]";
    }
}
