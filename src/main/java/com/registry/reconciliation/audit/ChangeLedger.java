package com.registry.reconciliation.audit;

import com.registry.reconciliation.core.model.ChangeEvent;
import com.registry.reconciliation.core.model.ChangeKind;
import com.registry.reconciliation.diff.ChangeLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Append-only ledger of change logs, keyed by the dates of the snapshot pair that produced them.
 * Logs cannot be modified or removed once appended, and each pair may be appended only once.
 */
public class ChangeLedger {
    private static final Logger log = LoggerFactory.getLogger(ChangeLedger.class);

    private final List<ChangeLog> logs = new CopyOnWriteArrayList<>();

    /**
     * Appends the log of one snapshot pair.
     *
     * @throws IllegalStateException if a log for the same pair is already recorded
     */
    public synchronized ChangeLog append(ChangeLog changeLog) {
        Objects.requireNonNull(changeLog, "changeLog is required");
        if (find(changeLog.baselineDate(), changeLog.currentDate()).isPresent()) {
            throw new IllegalStateException("changes for " + changeLog.baselineDate() + " -> "
                    + changeLog.currentDate() + " already recorded");
        }
        logs.add(changeLog);
        log.info("ledger.appended baseline={} current={} events={}",
                changeLog.baselineDate(), changeLog.currentDate(), changeLog.size());
        return changeLog;
    }

    /**
     * Appends the logs of several snapshot pairs, all or none. Nothing is appended when any
     * pair is already recorded or appears twice in {@code changeLogs}.
     *
     * @throws IllegalStateException if a pair is already recorded or repeated
     */
    public synchronized List<ChangeLog> appendAll(List<ChangeLog> changeLogs) {
        Objects.requireNonNull(changeLogs, "changeLogs is required");
        Set<List<LocalDate>> pairs = new HashSet<>();
        for (ChangeLog changeLog : changeLogs) {
            Objects.requireNonNull(changeLog, "changeLog is required");
            if (!pairs.add(Arrays.asList(changeLog.baselineDate(), changeLog.currentDate()))) {
                throw new IllegalStateException("changes for " + changeLog.baselineDate() + " -> "
                        + changeLog.currentDate() + " repeated in batch");
            }
            if (find(changeLog.baselineDate(), changeLog.currentDate()).isPresent()) {
                throw new IllegalStateException("changes for " + changeLog.baselineDate() + " -> "
                        + changeLog.currentDate() + " already recorded");
            }
        }
        logs.addAll(changeLogs);
        log.info("ledger.appended logs={} events={}", changeLogs.size(),
                changeLogs.stream().mapToInt(ChangeLog::size).sum());
        return List.copyOf(changeLogs);
    }

    public Optional<ChangeLog> find(LocalDate baselineDate, LocalDate currentDate) {
        return logs.stream()
                .filter(l -> Objects.equals(l.baselineDate(), baselineDate) && l.currentDate().equals(currentDate))
                .findFirst();
    }

    /**
     * All recorded logs in append order (immutable view).
     */
    public List<ChangeLog> getAllLogs() {
        return Collections.unmodifiableList(new ArrayList<>(logs));
    }

    /**
     * All events in append order.
     */
    public List<ChangeEvent> getAllEvents() {
        return events().collect(Collectors.toList());
    }

    public List<ChangeEvent> getEventsForIdentifier(String identifier) {
        return events()
                .filter(e -> e.identifier().equals(identifier))
                .collect(Collectors.toList());
    }

    public List<ChangeEvent> getEventsByKind(ChangeKind kind) {
        return events()
                .filter(e -> e.kind() == kind)
                .collect(Collectors.toList());
    }

    public List<ChangeEvent> getEventsByState(String state) {
        return events()
                .filter(e -> state.equalsIgnoreCase(e.state()))
                .collect(Collectors.toList());
    }

    public List<ChangeEvent> getEventsByStatus(String status) {
        return events()
                .filter(e -> status.equalsIgnoreCase(e.status()))
                .collect(Collectors.toList());
    }

    /**
     * Events dated within the inclusive range.
     */
    public List<ChangeEvent> getEventsBetween(LocalDate start, LocalDate end) {
        return events()
                .filter(e -> !e.timestamp().isBefore(start) && !e.timestamp().isAfter(end))
                .collect(Collectors.toList());
    }

    public int size() {
        return logs.size();
    }

    public int eventCount() {
        return logs.stream().mapToInt(ChangeLog::size).sum();
    }

    private Stream<ChangeEvent> events() {
        return logs.stream().flatMap(l -> l.events().stream());
    }
}
