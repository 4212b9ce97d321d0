package com.medical.records.service.aggregation;

import com.medical.records.TestRecords;
import com.medical.records.exception.PartialDataException;
import com.medical.records.model.entity.ClinicalNote;
import com.medical.records.model.entity.FileRecord;
import com.medical.records.model.entity.Prescription;
import com.medical.records.model.entity.VitalRecord;
import com.medical.records.model.timeline.RecordEntry;
import com.medical.records.model.timeline.RecordKind;
import com.medical.records.model.timeline.Timeline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static com.medical.records.TestRecords.T0;
import static org.junit.jupiter.api.Assertions.*;

class RecordAggregatorTest {

    private static final String PATIENT = "P1";

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void aggregate_patientWithoutRecordsGivesEmptyTimeline() {
        RecordAggregator aggregator = new RecordAggregator(sources(
                List.of(), List.of(), List.of(), List.of()), pool);

        Timeline timeline = aggregator.aggregate(PATIENT);

        assertTrue(timeline.isEmpty());
        assertEquals(PATIENT, timeline.getPatientId());
    }

    @Test
    void aggregate_mergesSortedSourcesIntoOneAscendingSequence() {
        List<VitalRecord> vitals = List.of(
                TestRecords.vital(PATIENT, T0, "120/80", 95.0, 70),
                TestRecords.vital(PATIENT, T0.plusDays(2), "125/82", 101.0, 74),
                TestRecords.vital(PATIENT, T0.plusDays(5), "118/79", 92.0, 68));
        List<ClinicalNote> notes = List.of(
                TestRecords.note(PATIENT, "D1", T0.plusDays(1), "Mild headache"),
                TestRecords.note(PATIENT, "D1", T0.plusDays(3), "Headache resolved"),
                TestRecords.note(PATIENT, "D1", T0.plusDays(4), "Follow-up in a month"),
                TestRecords.note(PATIENT, "D1", T0.plusDays(9), "Routine check"));

        RecordAggregator aggregator = new RecordAggregator(sources(vitals, notes, List.of(), List.of()), pool);
        Timeline timeline = aggregator.aggregate(PATIENT);

        assertEquals(vitals.size() + notes.size(), timeline.size());
        List<RecordEntry> entries = timeline.getEntries();
        for (int i = 1; i < entries.size(); i++) {
            assertFalse(entries.get(i).getCreatedAt().isBefore(entries.get(i - 1).getCreatedAt()),
                    "entry " + i + " is out of order");
        }
        assertEquals(vitals, timeline.entriesOf(RecordKind.VITAL, VitalRecord.class));
        assertEquals(notes, timeline.entriesOf(RecordKind.NOTE, ClinicalNote.class));
    }

    @Test
    void aggregate_breaksTimestampTiesByKindPrecedence() {
        Prescription prescription = TestRecords.prescription(PATIENT, "D1", T0, List.of("Metformin"));
        FileRecord file = TestRecords.file(PATIENT, T0, "blood-panel.pdf");
        ClinicalNote note = TestRecords.note(PATIENT, "D1", T0, "Reviewed panel");
        VitalRecord vital = TestRecords.vital(PATIENT, T0, "120/80", null, 72);

        RecordAggregator aggregator = new RecordAggregator(
                sources(List.of(vital), List.of(note), List.of(file), List.of(prescription)), pool);

        List<RecordKind> kinds = aggregator.aggregate(PATIENT).getEntries().stream()
                .map(RecordEntry::getKind)
                .collect(Collectors.toList());

        assertEquals(List.of(RecordKind.VITAL, RecordKind.NOTE, RecordKind.FILE, RecordKind.PRESCRIPTION), kinds);
    }

    @Test
    void aggregate_keepsSourceOrderForEqualTimestampsWithinOneKind() {
        ClinicalNote first = TestRecords.note(PATIENT, "D1", T0, "first");
        ClinicalNote second = TestRecords.note(PATIENT, "D2", T0, "second");
        ClinicalNote third = TestRecords.note(PATIENT, "D1", T0, "third");

        RecordAggregator aggregator = new RecordAggregator(
                sources(List.of(), List.of(first, second, third), List.of(), List.of()), pool);

        assertEquals(List.of(first, second, third),
                aggregator.aggregate(PATIENT).entriesOf(RecordKind.NOTE, ClinicalNote.class));
    }

    @Test
    void aggregate_failsWholeRequestWhenOneSourceFails() {
        List<RecordSource> sources = new ArrayList<>(sources(
                List.of(TestRecords.vital(PATIENT, T0, "120/80", 95.0, 70)), List.of(), List.of(), List.of()));
        sources.removeIf(source -> source.kind() == RecordKind.FILE);
        sources.add(new RepositoryRecordSource(RecordKind.FILE, patientId -> {
            throw new IllegalStateException("file store unreachable");
        }));

        RecordAggregator aggregator = new RecordAggregator(sources, pool);
        PartialDataException ex = assertThrows(PartialDataException.class, () -> aggregator.aggregate(PATIENT));

        assertEquals(Set.of(RecordKind.FILE), ex.getFailedKinds());
        assertEquals("PARTIAL_DATA", ex.getCode());
        assertTrue(ex.getCause() instanceof IllegalStateException);
    }

    @Test
    void aggregate_failureWhileDrainingLazySourceIsReported() {
        RecordSource broken = new RecordSource() {
            @Override
            public RecordKind kind() {
                return RecordKind.PRESCRIPTION;
            }

            @Override
            public Iterator<? extends RecordEntry> fetch(String patientId) {
                return new Iterator<RecordEntry>() {
                    private boolean served;

                    @Override
                    public boolean hasNext() {
                        return true;
                    }

                    @Override
                    public RecordEntry next() {
                        if (served) {
                            throw new IllegalStateException("cursor closed");
                        }
                        served = true;
                        return TestRecords.prescription(PATIENT, "D1", T0, List.of("Ibuprofen"));
                    }
                };
            }
        };

        RecordAggregator aggregator = new RecordAggregator(List.of(broken), Runnable::run);

        PartialDataException ex = assertThrows(PartialDataException.class, () -> aggregator.aggregate(PATIENT));
        assertEquals(Set.of(RecordKind.PRESCRIPTION), ex.getFailedKinds());
    }

    @Test
    void aggregate_fetchesEachKindOnTheExecutor() {
        Map<RecordKind, String> threads = new ConcurrentHashMap<>();
        List<RecordSource> sources = new ArrayList<>();
        for (RecordKind kind : RecordKind.values()) {
            sources.add(new RepositoryRecordSource(kind, patientId -> {
                threads.put(kind, Thread.currentThread().getName());
                return Collections.emptyList();
            }));
        }
        String caller = Thread.currentThread().getName();

        new RecordAggregator(sources, pool).aggregate(PATIENT);

        assertEquals(RecordKind.values().length, threads.size());
        assertFalse(threads.containsValue(caller));
    }

    @Test
    void constructor_rejectsTwoSourcesForOneKind() {
        RecordSource a = new RepositoryRecordSource(RecordKind.NOTE, patientId -> List.of());
        RecordSource b = new RepositoryRecordSource(RecordKind.NOTE, patientId -> List.of());

        assertThrows(IllegalStateException.class, () -> new RecordAggregator(List.of(a, b), pool));
    }

    private static List<RecordSource> sources(List<VitalRecord> vitals,
                                              List<ClinicalNote> notes,
                                              List<FileRecord> files,
                                              List<Prescription> prescriptions) {
        return List.of(
                new RepositoryRecordSource(RecordKind.PRESCRIPTION, patientId -> prescriptions),
                new RepositoryRecordSource(RecordKind.FILE, patientId -> files),
                new RepositoryRecordSource(RecordKind.NOTE, patientId -> notes),
                new RepositoryRecordSource(RecordKind.VITAL, patientId -> vitals));
    }
}
