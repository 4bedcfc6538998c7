package com.registry.reconciliation.api;

import com.registry.reconciliation.audit.ChangeLedger;
import com.registry.reconciliation.bulk.ProgressCallback;
import com.registry.reconciliation.diff.ChangeClassifier;
import com.registry.reconciliation.diff.ChangeLog;
import com.registry.reconciliation.diff.SnapshotDiffer;
import com.registry.reconciliation.diff.SnapshotSequence;
import com.registry.reconciliation.metrics.MetricsService;
import com.registry.reconciliation.metrics.NoOpMetricsService;
import com.registry.reconciliation.normalize.SchemaNormalizer;
import com.registry.reconciliation.rules.DefaultValueRules;
import com.registry.reconciliation.rules.ValueNormalizationEngine;
import com.registry.reconciliation.snapshot.BuildResult;
import com.registry.reconciliation.snapshot.CanonicalSetBuilder;
import com.registry.reconciliation.snapshot.Snapshot;
import com.registry.reconciliation.snapshot.SourceBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Main entry point: reconciles source batches into snapshots and compares snapshots.
 * Both operations are pure functions of their inputs; the engine holds no dataset state.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * ReconciliationEngine engine = ReconciliationEngine.builder()
 *     .options(ReconciliationOptions.builder().sourcePriority("gujarat", "maharashtra").build())
 *     .build();
 *
 * Snapshot day1 = engine.buildSnapshot(batchesDay1, LocalDate.of(2025, 10, 18)).snapshot();
 * Snapshot day2 = engine.buildSnapshot(batchesDay2, LocalDate.of(2025, 10, 19)).snapshot();
 * ChangeLog changes = engine.detectChanges(day1, day2, day2.getAsOf());
 * </pre>
 */
public class ReconciliationEngine {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final ReconciliationOptions options;
    private final CanonicalSetBuilder setBuilder;
    private final SnapshotDiffer differ;
    private final SnapshotSequence sequence;
    private final ChangeLedger changeLedger;

    private ReconciliationEngine(Builder builder) {
        this.options = builder.options;
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        ValueNormalizationEngine valueEngine = builder.valueEngine != null
                ? builder.valueEngine : DefaultValueRules.createDefaultEngine();

        this.setBuilder = new CanonicalSetBuilder(options, new SchemaNormalizer(valueEngine), metricsService);
        this.differ = new SnapshotDiffer(new ChangeClassifier(), metricsService);
        this.sequence = new SnapshotSequence(differ);
        this.changeLedger = builder.changeLedger;

        log.info("ReconciliationEngine initialized with options: {}", options);
    }

    // ========== Build API ==========

    /**
     * Builds one canonical snapshot from ordered source batches.
     */
    public BuildResult buildSnapshot(List<SourceBatch> batches, LocalDate asOf) {
        return setBuilder.build(batches, asOf);
    }

    public BuildResult buildSnapshot(List<SourceBatch> batches, LocalDate asOf, ProgressCallback callback) {
        return setBuilder.build(batches, asOf, callback);
    }

    // ========== Change detection API ==========

    /**
     * Compares a baseline snapshot with a newer one. When a ledger is configured,
     * the resulting log is appended to it.
     */
    public ChangeLog detectChanges(Snapshot baseline, Snapshot current, LocalDate timestamp) {
        return record(differ.detectChanges(baseline, current, timestamp));
    }

    public ChangeLog detectChanges(Snapshot baseline, Snapshot current) {
        return record(differ.detectChanges(baseline, current));
    }

    /**
     * Diffs a series of dated snapshots pairwise, oldest pair first. When a ledger is
     * configured, the logs are appended together; if any pair is already recorded, none is.
     */
    public List<ChangeLog> detectAll(List<Snapshot> snapshots) {
        List<ChangeLog> logs = sequence.detectAll(snapshots);
        if (changeLedger != null) {
            changeLedger.appendAll(logs);
        }
        return logs;
    }

    public Optional<ChangeLedger> getChangeLedger() {
        return Optional.ofNullable(changeLedger);
    }

    public ReconciliationOptions getOptions() {
        return options;
    }

    private ChangeLog record(ChangeLog changeLog) {
        if (changeLedger != null) {
            changeLedger.append(changeLog);
        }
        return changeLog;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ReconciliationOptions options = ReconciliationOptions.defaults();
        private MetricsService metricsService;
        private ValueNormalizationEngine valueEngine;
        private ChangeLedger changeLedger;

        public Builder options(ReconciliationOptions options) {
            if (options == null) {
                throw new IllegalArgumentException("options must not be null");
            }
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder valueEngine(ValueNormalizationEngine valueEngine) {
            this.valueEngine = valueEngine;
            return this;
        }

        /**
         * Records every produced change log in the given ledger.
         */
        public Builder changeLedger(ChangeLedger changeLedger) {
            this.changeLedger = changeLedger;
            return this;
        }

        public ReconciliationEngine build() {
            return new ReconciliationEngine(this);
        }
    }
}
