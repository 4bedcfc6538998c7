package com.registry.reconciliation.diff;

import com.registry.reconciliation.core.model.ChangeEvent;
import com.registry.reconciliation.core.model.ChangeKind;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable result of comparing a baseline snapshot with a current one.
 * Events are ordered: new entities, then removed entities, then field updates,
 * each group in ascending identifier order.
 *
 * @param baselineDate logical date of the baseline, null when unknown
 * @param currentDate  logical date of the current snapshot
 * @param events       change events
 */
public record ChangeLog(LocalDate baselineDate, LocalDate currentDate, List<ChangeEvent> events) {

    public ChangeLog {
        Objects.requireNonNull(currentDate, "currentDate is required");
        events = events != null ? List.copyOf(events) : List.of();
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public List<ChangeEvent> ofKind(ChangeKind kind) {
        return events.stream().filter(e -> e.kind() == kind).toList();
    }

    /**
     * Identifiers of events of the given kind, in log order, without repeats.
     */
    public List<String> identifiers(ChangeKind kind) {
        return events.stream().filter(e -> e.kind() == kind).map(ChangeEvent::identifier).distinct().toList();
    }

    public List<ChangeEvent> forIdentifier(String identifier) {
        return events.stream().filter(e -> e.identifier().equals(identifier)).toList();
    }

    public ChangeSummary summary() {
        return ChangeSummary.of(events);
    }

    @Override
    public String toString() {
        return "ChangeLog{" + baselineDate + " -> " + currentDate + ", events=" + events.size() + '}';
    }
}
