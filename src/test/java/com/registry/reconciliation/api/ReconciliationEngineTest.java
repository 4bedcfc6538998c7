package com.registry.reconciliation.api;

import com.registry.reconciliation.audit.ChangeLedger;
import com.registry.reconciliation.bulk.CsvChangeLogExporter;
import com.registry.reconciliation.bulk.CsvRecordReader;
import com.registry.reconciliation.bulk.ReadResult;
import com.registry.reconciliation.core.model.CanonicalField;
import com.registry.reconciliation.core.model.CanonicalRecord;
import com.registry.reconciliation.core.model.ChangeEvent;
import com.registry.reconciliation.core.model.ChangeKind;
import com.registry.reconciliation.diff.ChangeLog;
import com.registry.reconciliation.diff.InvalidSnapshotOrderingException;
import com.registry.reconciliation.metrics.MicrometerMetricsService;
import com.registry.reconciliation.normalize.ColumnMapping;
import com.registry.reconciliation.normalize.ColumnMappingLoader;
import com.registry.reconciliation.snapshot.BuildResult;
import com.registry.reconciliation.snapshot.Snapshot;
import com.registry.reconciliation.snapshot.SourceBatch;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end reconciliation of two days of state registry extracts.
 */
class ReconciliationEngineTest {

    private static final LocalDate DAY1 = LocalDate.of(2025, 10, 18);
    private static final LocalDate DAY2 = LocalDate.of(2025, 10, 19);

    private static final ColumnMapping MAPPING = new ColumnMappingLoader().loadResource("column-mappings/mca-state.json");

    private SimpleMeterRegistry registry;
    private ChangeLedger ledger;
    private ReconciliationEngine engine;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        ledger = new ChangeLedger();
        engine = ReconciliationEngine.builder()
                .options(ReconciliationOptions.builder()
                        .sourcePriority("gujarat", "maharashtra")
                        .build())
                .metricsService(new MicrometerMetricsService(registry))
                .changeLedger(ledger)
                .build();
    }

    private static SourceBatch load(String sourceTag, String resource) {
        try (InputStream in = ReconciliationEngineTest.class.getClassLoader()
                .getResourceAsStream("fixtures/" + resource)) {
            assertNotNull(in, "missing fixture " + resource);
            ReadResult read = new CsvRecordReader().read(in, null);
            assertFalse(read.hasErrors(), () -> "fixture errors: " + read.errors());
            return new SourceBatch(sourceTag, read.records(), MAPPING);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Snapshot day1() {
        return engine.buildSnapshot(List.of(load("maharashtra", "maharashtra-2025-10-18.csv")), DAY1).snapshot();
    }

    private BuildResult day2() {
        return engine.buildSnapshot(List.of(
                load("maharashtra", "maharashtra-2025-10-19.csv"),
                load("gujarat", "gujarat-2025-10-19.csv")), DAY2);
    }

    @Nested
    @DisplayName("Snapshot building")
    class Building {

        @Test
        @DisplayName("Should reconcile both states into one snapshot")
        void testBuildSummary() {
            BuildResult result = day2();

            assertEquals(7, result.summary().recordsIn());
            assertEquals(1, result.summary().recordsMissingIdentifier());
            assertEquals(1, result.summary().duplicatesCollapsed());
            assertEquals(5, result.snapshot().size());
            assertTrue(result.summary().mappingWarnings().isEmpty());
            assertTrue(result.summary().coercionWarnings().isEmpty());
        }

        @Test
        @DisplayName("Higher-priority state wins a company listed in both files")
        void testCrossStateDuplicate() {
            CanonicalRecord chemengg = day2().snapshot().get("U24299PN2020PTC192446").orElseThrow();

            assertEquals("maharashtra", chemengg.sourceTag());
            assertEquals("Maharashtra", chemengg.get(CanonicalField.STATE));
            assertEquals(0, new BigDecimal("500000")
                    .compareTo((BigDecimal) chemengg.get(CanonicalField.AUTHORIZED_CAPITAL)));
        }

        @Test
        @DisplayName("Empty capital cell is absent, not zero")
        void testAbsentCapital() {
            CanonicalRecord newco = day2().snapshot().get("U24100MH2025PTC400001").orElseThrow();

            assertFalse(newco.isPresent(CanonicalField.PAIDUP_CAPITAL));
            assertEquals(LocalDate.of(2025, 10, 18), newco.get(CanonicalField.REGISTRATION_DATE));
        }

        @Test
        @DisplayName("Should record ingestion metrics per source")
        void testMetrics() {
            day2();

            assertEquals(5.0, registry.find("registry.records.ingested").tag("source", "maharashtra").counter().count());
            assertEquals(2.0, registry.find("registry.records.ingested").tag("source", "gujarat").counter().count());
            assertEquals(1.0, registry.find("registry.records.dropped").counter().count());
        }
    }

    @Nested
    @DisplayName("Change detection")
    class ChangeDetection {

        @Test
        @DisplayName("Should detect incorporations, deregistrations and field updates")
        void testDetectChanges() {
            Snapshot baseline = day1();
            Snapshot current = day2().snapshot();

            ChangeLog changes = engine.detectChanges(baseline, current, DAY2);

            assertEquals(List.of("U24100GJ2025PTC150001", "U24100MH2025PTC400001"),
                    changes.identifiers(ChangeKind.NEW_ENTITY));
            assertEquals(List.of("U74999MH2015PTC262000"), changes.identifiers(ChangeKind.REMOVED_ENTITY));

            List<ChangeEvent> updates = changes.ofKind(ChangeKind.FIELD_UPDATED);
            assertEquals(2, updates.size());

            ChangeEvent struckOff = updates.get(0);
            assertEquals("U24299PN2019PTC187808", struckOff.identifier());
            assertEquals(CanonicalField.STATUS, struckOff.field());
            assertEquals("ACTIVE", struckOff.oldValue());
            assertEquals("STRIKE OFF", struckOff.newValue());
            assertEquals("SKYI FKUR BIOPOLYMERS PRIVATE LIMITED", struckOff.companyName());

            ChangeEvent capital = updates.get(1);
            assertEquals("U24299PN2020PTC192446", capital.identifier());
            assertEquals(CanonicalField.AUTHORIZED_CAPITAL, capital.field());

            ChangeEvent removed = changes.ofKind(ChangeKind.REMOVED_ENTITY).get(0);
            assertEquals("OLDCO PRIVATE LIMITED", removed.companyName());
            assertEquals(5, changes.size());
        }

        @Test
        @DisplayName("Detected changes are appended to the ledger")
        void testLedger() {
            ChangeLog changes = engine.detectChanges(day1(), day2().snapshot());

            assertSame(ledger, engine.getChangeLedger().orElseThrow());
            assertEquals(1, ledger.size());
            assertEquals(changes, ledger.find(DAY1, DAY2).orElseThrow());
            assertEquals(1, ledger.getEventsByStatus("strike off").size());
        }

        @Test
        @DisplayName("Snapshots in the wrong order are rejected and nothing is recorded")
        void testWrongOrder() {
            Snapshot baseline = day1();
            Snapshot current = day2().snapshot();

            assertThrows(InvalidSnapshotOrderingException.class, () -> engine.detectChanges(current, baseline));
            assertEquals(0, ledger.size());
        }

        @Test
        @DisplayName("Should diff a sequence of snapshots pairwise")
        void testDetectAll() {
            Snapshot first = day1();
            Snapshot second = day2().snapshot();
            Snapshot third = second.withAsOf(DAY2.plusDays(1));

            List<ChangeLog> logs = engine.detectAll(List.of(third, first, second));

            assertEquals(2, logs.size());
            assertEquals(5, logs.get(0).size());
            assertTrue(logs.get(1).isEmpty());
            assertEquals(2, ledger.size());
        }

        @Test
        @DisplayName("Sequence overlapping a recorded pair leaves the ledger untouched")
        void testDetectAllOverlappingLedger() {
            Snapshot first = day1();
            Snapshot second = day2().snapshot();
            Snapshot third = second.withAsOf(DAY2.plusDays(1));
            engine.detectChanges(second, third);

            assertThrows(IllegalStateException.class, () -> engine.detectAll(List.of(first, second, third)));
            assertEquals(1, ledger.size());
            assertTrue(ledger.find(DAY1, DAY2).isEmpty());
        }

        @Test
        @DisplayName("Change log exports as CSV")
        void testExport() {
            ChangeLog changes = engine.detectChanges(day1(), day2().snapshot());
            StringWriter out = new StringWriter();

            new CsvChangeLogExporter().export(changes.events(), out, null);

            List<String> lines = out.toString().lines().toList();
            assertEquals(6, lines.size());
            assertTrue(lines.get(1).startsWith("U24100GJ2025PTC150001,New Incorporation,,,,2025-10-19,"));
            assertTrue(lines.contains("U24299PN2020PTC192446,Field Update,Authorized_Capital,100000,500000,"
                    + "2025-10-19,CHEMENGG RESEARCH PRIVATE LIMITED,Maharashtra,ACTIVE"));
        }
    }

    @Test
    @DisplayName("Engine without a ledger still detects changes")
    void testWithoutLedger() {
        ReconciliationEngine plain = ReconciliationEngine.builder().build();
        Snapshot baseline = Snapshot.empty(DAY1);
        Snapshot current = Snapshot.of(DAY2, CanonicalRecord.builder().identifier("U1").build());

        assertTrue(plain.getChangeLedger().isEmpty());
        assertEquals(1, plain.detectChanges(baseline, current).size());
        assertFalse(plain.getOptions().isStrictMode());
    }
}
