package com.registry.reconciliation.diff;

import com.registry.reconciliation.core.model.ChangeEvent;
import com.registry.reconciliation.snapshot.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Diffs a series of dated snapshots pairwise: each snapshot against its immediate predecessor.
 * A change spanning several snapshots therefore appears once per step in which it happened;
 * events are never folded into a cumulative baseline-to-latest log.
 */
public class SnapshotSequence {
    private static final Logger log = LoggerFactory.getLogger(SnapshotSequence.class);

    private final SnapshotDiffer differ;

    public SnapshotSequence(SnapshotDiffer differ) {
        this.differ = Objects.requireNonNull(differ, "differ is required");
    }

    /**
     * Sorts snapshots by logical date and diffs each adjacent pair.
     *
     * @return one change log per adjacent pair, oldest pair first; empty for fewer than two snapshots
     * @throws InvalidSnapshotOrderingException if a snapshot has no date or two share a date
     */
    public List<ChangeLog> detectAll(List<Snapshot> snapshots) {
        Objects.requireNonNull(snapshots, "snapshots is required");
        for (Snapshot snapshot : snapshots) {
            if (snapshot.getAsOf() == null) {
                throw new InvalidSnapshotOrderingException("every snapshot in a sequence needs a date");
            }
        }
        List<Snapshot> ordered = new ArrayList<>(snapshots);
        ordered.sort(Comparator.comparing(Snapshot::getAsOf));
        for (int i = 1; i < ordered.size(); i++) {
            LocalDate previous = ordered.get(i - 1).getAsOf();
            if (previous.equals(ordered.get(i).getAsOf())) {
                throw new InvalidSnapshotOrderingException("two snapshots dated " + previous);
            }
        }

        List<ChangeLog> logs = new ArrayList<>();
        for (int i = 1; i < ordered.size(); i++) {
            logs.add(differ.detectChanges(ordered.get(i - 1), ordered.get(i)));
        }
        log.info("sequence.processed snapshots={} pairs={} events={}",
                ordered.size(), logs.size(), logs.stream().mapToInt(ChangeLog::size).sum());
        return logs;
    }

    /**
     * Flattens pairwise logs into one event list, oldest pair first.
     */
    public static List<ChangeEvent> flatten(List<ChangeLog> logs) {
        List<ChangeEvent> events = new ArrayList<>();
        logs.forEach(changeLog -> events.addAll(changeLog.events()));
        return events;
    }
}
