package com.medical.records.service.aggregation;

import com.medical.records.exception.PartialDataException;
import com.medical.records.model.timeline.RecordEntry;
import com.medical.records.model.timeline.RecordKind;
import com.medical.records.model.timeline.Timeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Merges every {@link RecordSource} of a patient into one {@link Timeline}.
 * <p>
 * Sources are fetched on {@code recordFetchExecutor} and joined before merging. The merge is a
 * k-way merge over the already sorted sources: ascending by {@code createdAt}, ties across kinds
 * broken by {@link RecordKind} declaration order. If any source fails the whole aggregation fails
 * with {@link PartialDataException}; a timeline missing a kind is never returned.
 */
@Slf4j
@Service
public class RecordAggregator {

    private static final Comparator<Cursor> HEAD_ORDER = Comparator
            .comparing((Cursor cursor) -> cursor.head.getCreatedAt(),
                    Comparator.nullsFirst(Comparator.<LocalDateTime>naturalOrder()))
            .thenComparing(cursor -> cursor.kind);

    private final List<RecordSource> sources;
    private final Executor fetchExecutor;

    public RecordAggregator(List<RecordSource> sources,
                            @Qualifier("recordFetchExecutor") Executor fetchExecutor) {
        Map<RecordKind, RecordSource> byKind = new EnumMap<>(RecordKind.class);
        for (RecordSource source : sources) {
            RecordSource previous = byKind.put(source.kind(), source);
            if (previous != null) {
                throw new IllegalStateException("More than one record source registered for " + source.kind());
            }
        }
        this.sources = List.copyOf(byKind.values());
        this.fetchExecutor = fetchExecutor;
    }

    public Timeline aggregate(String patientId) {
        long start = System.currentTimeMillis();

        Map<RecordKind, CompletableFuture<Iterator<? extends RecordEntry>>> pending = new EnumMap<>(RecordKind.class);
        for (RecordSource source : sources) {
            pending.put(source.kind(), submit(source, patientId));
        }

        Map<RecordKind, Iterator<? extends RecordEntry>> fetched = new EnumMap<>(RecordKind.class);
        Set<RecordKind> failed = EnumSet.noneOf(RecordKind.class);
        Throwable firstFailure = null;
        for (Map.Entry<RecordKind, CompletableFuture<Iterator<? extends RecordEntry>>> entry : pending.entrySet()) {
            try {
                fetched.put(entry.getKey(), entry.getValue().join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("[Aggregator] fetching {} for patient {} failed", entry.getKey(), patientId, cause);
                failed.add(entry.getKey());
                if (firstFailure == null) {
                    firstFailure = cause;
                }
            }
        }
        if (!failed.isEmpty()) {
            throw new PartialDataException(patientId, failed, firstFailure);
        }

        List<RecordEntry> merged = merge(patientId, fetched);
        log.info("[Aggregator] patient {} timeline built: {} entries from {} sources in {}ms",
                patientId, merged.size(), fetched.size(), System.currentTimeMillis() - start);
        return new Timeline(patientId, merged);
    }

    private CompletableFuture<Iterator<? extends RecordEntry>> submit(RecordSource source, String patientId) {
        try {
            return CompletableFuture.supplyAsync(() -> source.fetch(patientId), fetchExecutor);
        } catch (RuntimeException e) {
            // executor rejected the task
            CompletableFuture<Iterator<? extends RecordEntry>> failed = new CompletableFuture<>();
            failed.completeExceptionally(e);
            return failed;
        }
    }

    private List<RecordEntry> merge(String patientId, Map<RecordKind, Iterator<? extends RecordEntry>> fetched) {
        PriorityQueue<Cursor> heads = new PriorityQueue<>(Math.max(1, fetched.size()), HEAD_ORDER);
        for (Map.Entry<RecordKind, Iterator<? extends RecordEntry>> entry : fetched.entrySet()) {
            Cursor cursor = new Cursor(entry.getKey(), entry.getValue());
            if (advance(patientId, cursor)) {
                heads.add(cursor);
            }
        }
        if (heads.isEmpty()) {
            return Collections.emptyList();
        }

        List<RecordEntry> merged = new ArrayList<>();
        while (!heads.isEmpty()) {
            Cursor cursor = heads.poll();
            merged.add(cursor.head);
            if (advance(patientId, cursor)) {
                heads.add(cursor);
            }
        }
        return merged;
    }

    // Lazy sources can still fail while being drained
    private boolean advance(String patientId, Cursor cursor) {
        try {
            return cursor.advance();
        } catch (RuntimeException e) {
            log.error("[Aggregator] reading {} for patient {} failed mid-merge", cursor.kind, patientId, e);
            throw new PartialDataException(patientId, EnumSet.of(cursor.kind), e);
        }
    }

    private static final class Cursor {
        private final RecordKind kind;
        private final Iterator<? extends RecordEntry> remaining;
        private RecordEntry head;

        private Cursor(RecordKind kind, Iterator<? extends RecordEntry> remaining) {
            this.kind = kind;
            this.remaining = remaining;
        }

        private boolean advance() {
            if (!remaining.hasNext()) {
                head = null;
                return false;
            }
            head = remaining.next();
            return true;
        }
    }
}
