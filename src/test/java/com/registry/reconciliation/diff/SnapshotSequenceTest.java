package com.registry.reconciliation.diff;

import com.registry.reconciliation.core.model.CanonicalField;
import com.registry.reconciliation.core.model.CanonicalRecord;
import com.registry.reconciliation.core.model.ChangeEvent;
import com.registry.reconciliation.core.model.ChangeKind;
import com.registry.reconciliation.snapshot.Snapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotSequenceTest {

    private static final LocalDate DAY1 = LocalDate.of(2025, 10, 17);
    private static final LocalDate DAY2 = LocalDate.of(2025, 10, 18);
    private static final LocalDate DAY3 = LocalDate.of(2025, 10, 19);

    private final SnapshotSequence sequence = new SnapshotSequence(new SnapshotDiffer());

    private static CanonicalRecord withStatus(String id, String status) {
        return CanonicalRecord.builder().identifier(id).attribute(CanonicalField.STATUS, status).build();
    }

    @Test
    @DisplayName("Diffs each snapshot against its predecessor")
    void testPairwise() {
        Snapshot day1 = Snapshot.of(DAY1, withStatus("U1", "ACTIVE"));
        Snapshot day2 = Snapshot.of(DAY2, withStatus("U1", "DORMANT"));
        Snapshot day3 = Snapshot.of(DAY3, withStatus("U1", "STRIKE OFF"), withStatus("U2", "ACTIVE"));

        List<ChangeLog> logs = sequence.detectAll(List.of(day3, day1, day2));

        assertEquals(2, logs.size());
        assertEquals(DAY1, logs.get(0).baselineDate());
        assertEquals(DAY3, logs.get(1).currentDate());

        ChangeEvent first = logs.get(0).events().get(0);
        assertEquals("ACTIVE", first.oldValue());
        assertEquals("DORMANT", first.newValue());

        List<ChangeEvent> all = SnapshotSequence.flatten(logs);
        assertEquals(3, all.size());
        assertEquals(2, all.stream().filter(e -> e.kind() == ChangeKind.FIELD_UPDATED).count());
        assertEquals(DAY3, all.get(2).timestamp());
    }

    @Test
    @DisplayName("Fewer than two snapshots yield no logs")
    void testSingleSnapshot() {
        assertTrue(sequence.detectAll(List.of(Snapshot.of(DAY1, withStatus("U1", "ACTIVE")))).isEmpty());
    }

    @Test
    @DisplayName("Undated or equally dated snapshots are rejected")
    void testInvalidDates() {
        Snapshot dated = Snapshot.of(DAY1, withStatus("U1", "ACTIVE"));

        assertThrows(InvalidSnapshotOrderingException.class,
                () -> sequence.detectAll(List.of(dated, Snapshot.empty(null))));
        assertThrows(InvalidSnapshotOrderingException.class,
                () -> sequence.detectAll(List.of(dated, Snapshot.empty(DAY1))));
    }
}
