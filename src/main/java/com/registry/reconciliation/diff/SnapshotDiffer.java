package com.registry.reconciliation.diff;

import com.registry.reconciliation.core.model.CanonicalRecord;
import com.registry.reconciliation.core.model.ChangeEvent;
import com.registry.reconciliation.core.model.ChangeKind;
import com.registry.reconciliation.logging.LogContext;
import com.registry.reconciliation.metrics.MetricsService;
import com.registry.reconciliation.metrics.NoOpMetricsService;
import com.registry.reconciliation.snapshot.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares two snapshots and produces an ordered change log.
 *
 * <p>The identifiers of both snapshots are paired up in a single merge walk over their sorted
 * key sets, and each pairing is classified by a {@link ChangeClassifier}; only identifiers present
 * on both sides are compared field by field. Output order does not depend on snapshot insertion order:</p>
 * <ol>
 *   <li>{@link ChangeKind#NEW_ENTITY} events, ascending identifier;</li>
 *   <li>{@link ChangeKind#REMOVED_ENTITY} events, ascending identifier;</li>
 *   <li>{@link ChangeKind#FIELD_UPDATED} events, ascending identifier, then canonical field order.</li>
 * </ol>
 *
 * <p>Unchanged identifiers produce no events.</p>
 */
public class SnapshotDiffer {
    private static final Logger log = LoggerFactory.getLogger(SnapshotDiffer.class);

    private final ChangeClassifier classifier;
    private final MetricsService metricsService;

    public SnapshotDiffer() {
        this(new ChangeClassifier(), new NoOpMetricsService());
    }

    public SnapshotDiffer(ChangeClassifier classifier, MetricsService metricsService) {
        this.classifier = Objects.requireNonNull(classifier, "classifier is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Compares two snapshots using the current snapshot's own logical date.
     */
    public ChangeLog detectChanges(Snapshot baseline, Snapshot current) {
        Objects.requireNonNull(current, "current is required");
        return detectChanges(baseline, current, current.getAsOf());
    }

    /**
     * Compares a baseline snapshot with a newer one.
     *
     * @param baseline  older snapshot
     * @param current   newer snapshot
     * @param timestamp logical date of {@code current}, stamped on every event
     * @throws InvalidSnapshotOrderingException if the timestamp is missing, not after the
     *                                          baseline's date, or contradicts the current snapshot's date
     */
    public ChangeLog detectChanges(Snapshot baseline, Snapshot current, LocalDate timestamp) {
        Objects.requireNonNull(baseline, "baseline is required");
        Objects.requireNonNull(current, "current is required");
        validateOrdering(baseline, current, timestamp);

        long started = System.nanoTime();
        try (LogContext ctx = LogContext.forDiff(baseline.getAsOf(), timestamp)) {
            List<ChangeEvent> added = new ArrayList<>();
            List<ChangeEvent> removed = new ArrayList<>();
            List<ChangeEvent> updated = new ArrayList<>();

            Iterator<Map.Entry<String, CanonicalRecord>> oldIt = baseline.asMap().entrySet().iterator();
            Iterator<Map.Entry<String, CanonicalRecord>> newIt = current.asMap().entrySet().iterator();
            Map.Entry<String, CanonicalRecord> oldEntry = next(oldIt);
            Map.Entry<String, CanonicalRecord> newEntry = next(newIt);

            while (oldEntry != null || newEntry != null) {
                int order = oldEntry == null ? 1
                        : newEntry == null ? -1
                        : oldEntry.getKey().compareTo(newEntry.getKey());
                CanonicalRecord oldRecord = order <= 0 ? oldEntry.getValue() : null;
                CanonicalRecord newRecord = order >= 0 ? newEntry.getValue() : null;
                Optional<ChangeClassifier.Classification> change = classifier.classify(oldRecord, newRecord);
                if (change.isPresent()) {
                    switch (change.get().kind()) {
                        case NEW_ENTITY -> added.add(newEvent(newRecord, timestamp));
                        case REMOVED_ENTITY -> removed.add(removedEvent(oldRecord, timestamp));
                        case FIELD_UPDATED -> appendUpdates(newRecord, change.get().differences(), timestamp, updated);
                    }
                }
                if (oldRecord != null) {
                    oldEntry = next(oldIt);
                }
                if (newRecord != null) {
                    newEntry = next(newIt);
                }
            }

            List<ChangeEvent> events = new ArrayList<>(added.size() + removed.size() + updated.size());
            events.addAll(added);
            events.addAll(removed);
            events.addAll(updated);
            ChangeLog changeLog = new ChangeLog(baseline.getAsOf(), timestamp, events);

            metricsService.incrementChangeEvents(ChangeKind.NEW_ENTITY, added.size());
            metricsService.incrementChangeEvents(ChangeKind.REMOVED_ENTITY, removed.size());
            metricsService.incrementChangeEvents(ChangeKind.FIELD_UPDATED, updated.size());
            metricsService.recordDiffDuration(Duration.ofNanos(System.nanoTime() - started));

            log.info("changes.detected baseline={} current={} new={} removed={} updated={}",
                    baseline.getAsOf(), timestamp, added.size(), removed.size(), updated.size());
            return changeLog;
        }
    }

    private void validateOrdering(Snapshot baseline, Snapshot current, LocalDate timestamp) {
        if (timestamp == null) {
            throw new InvalidSnapshotOrderingException("current snapshot has no timestamp");
        }
        if (baseline.getAsOf() != null && !timestamp.isAfter(baseline.getAsOf())) {
            throw new InvalidSnapshotOrderingException("current timestamp " + timestamp
                    + " is not after baseline " + baseline.getAsOf());
        }
        if (current.getAsOf() != null && !current.getAsOf().equals(timestamp)) {
            throw new InvalidSnapshotOrderingException("timestamp " + timestamp
                    + " contradicts current snapshot date " + current.getAsOf());
        }
    }

    private static void appendUpdates(CanonicalRecord newRecord, List<FieldDifference> differences,
                                      LocalDate timestamp, List<ChangeEvent> sink) {
        for (FieldDifference difference : differences) {
            sink.add(ChangeEvent.builder()
                    .identifier(newRecord.identifier())
                    .kind(ChangeKind.FIELD_UPDATED)
                    .timestamp(timestamp)
                    .field(difference.field())
                    .oldValue(difference.oldValue())
                    .newValue(difference.newValue())
                    .displayFrom(newRecord)
                    .build());
        }
    }

    private static ChangeEvent newEvent(CanonicalRecord record, LocalDate timestamp) {
        return ChangeEvent.builder()
                .identifier(record.identifier())
                .kind(ChangeKind.NEW_ENTITY)
                .timestamp(timestamp)
                .displayFrom(record)
                .build();
    }

    private static ChangeEvent removedEvent(CanonicalRecord record, LocalDate timestamp) {
        return ChangeEvent.builder()
                .identifier(record.identifier())
                .kind(ChangeKind.REMOVED_ENTITY)
                .timestamp(timestamp)
                .displayFrom(record)
                .build();
    }

    private static <T> T next(Iterator<T> it) {
        return it.hasNext() ? it.next() : null;
    }
}
