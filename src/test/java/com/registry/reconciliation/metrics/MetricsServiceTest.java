package com.registry.reconciliation.metrics;

import com.registry.reconciliation.core.model.ChangeKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordBuildDuration(Duration.ofMillis(100));
                noOp.incrementRecordsIngested("Maharashtra", 10);
                noOp.incrementRecordsDropped(1);
                noOp.incrementDuplicatesCollapsed(2);
                noOp.incrementCoercionWarnings(3);
                noOp.incrementIdentityConflicts(0);
                noOp.recordSnapshotSize(500);
                noOp.recordDiffDuration(Duration.ofMillis(20));
                noOp.incrementChangeEvents(ChangeKind.NEW_ENTITY, 4);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record build and diff durations as timers")
        void recordDurations() {
            metrics.recordBuildDuration(Duration.ofMillis(150));
            metrics.recordBuildDuration(Duration.ofMillis(250));
            metrics.recordDiffDuration(Duration.ofMillis(40));

            Timer build = registry.find("registry.build.duration").timer();
            Timer diff = registry.find("registry.diff.duration").timer();

            assertNotNull(build);
            assertEquals(2, build.count());
            assertNotNull(diff);
            assertEquals(1, diff.count());
        }

        @Test
        @DisplayName("Should count ingested records per source")
        void incrementRecordsIngested() {
            metrics.incrementRecordsIngested("Maharashtra", 100);
            metrics.incrementRecordsIngested("Maharashtra", 50);
            metrics.incrementRecordsIngested("Gujarat", 7);

            Counter maharashtra = registry.find("registry.records.ingested").tag("source", "Maharashtra").counter();
            Counter gujarat = registry.find("registry.records.ingested").tag("source", "Gujarat").counter();

            assertNotNull(maharashtra);
            assertEquals(150.0, maharashtra.count());
            assertNotNull(gujarat);
            assertEquals(7.0, gujarat.count());
        }

        @Test
        @DisplayName("Should count change events per kind")
        void incrementChangeEvents() {
            metrics.incrementChangeEvents(ChangeKind.NEW_ENTITY, 3);
            metrics.incrementChangeEvents(ChangeKind.FIELD_UPDATED, 5);
            metrics.incrementChangeEvents(ChangeKind.FIELD_UPDATED, 1);

            assertEquals(3.0, registry.find("registry.changes").tag("kind", "NEW_ENTITY").counter().count());
            assertEquals(6.0, registry.find("registry.changes").tag("kind", "FIELD_UPDATED").counter().count());
            assertNull(registry.find("registry.changes").tag("kind", "REMOVED_ENTITY").counter());
        }

        @Test
        @DisplayName("Should count data quality findings")
        void incrementDataQualityCounters() {
            metrics.incrementRecordsDropped(2);
            metrics.incrementDuplicatesCollapsed(5);
            metrics.incrementCoercionWarnings(3);
            metrics.incrementIdentityConflicts(1);

            assertEquals(2.0, registry.find("registry.records.dropped").counter().count());
            assertEquals(5.0, registry.find("registry.duplicates.collapsed").counter().count());
            assertEquals(3.0, registry.find("registry.coercion.warnings").counter().count());
            assertEquals(1.0, registry.find("registry.identity.conflicts").counter().count());
        }

        @Test
        @DisplayName("Should record snapshot size as distribution summary")
        void recordSnapshotSize() {
            metrics.recordSnapshotSize(1000);
            metrics.recordSnapshotSize(3000);

            DistributionSummary summary = registry.find("registry.snapshot.size").summary();

            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(4000.0, summary.totalAmount());
        }
    }
}
