package com.registry.reconciliation.snapshot;

import com.registry.reconciliation.api.ReconciliationOptions;
import com.registry.reconciliation.bulk.ProgressCallback;
import com.registry.reconciliation.core.model.CanonicalField;
import com.registry.reconciliation.core.model.CanonicalRecord;
import com.registry.reconciliation.core.model.RawRecord;
import com.registry.reconciliation.dedup.DeduplicationResult;
import com.registry.reconciliation.dedup.Deduplicator;
import com.registry.reconciliation.dedup.IdentityConflict;
import com.registry.reconciliation.dedup.SourceRanking;
import com.registry.reconciliation.logging.LogContext;
import com.registry.reconciliation.metrics.MetricsService;
import com.registry.reconciliation.metrics.NoOpMetricsService;
import com.registry.reconciliation.normalize.CoercionWarning;
import com.registry.reconciliation.normalize.ColumnMapping;
import com.registry.reconciliation.normalize.NormalizedRecord;
import com.registry.reconciliation.normalize.SchemaNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Builds one canonical snapshot from an ordered list of source batches.
 *
 * <p>Rows are grouped by identifier across all sources, each row is normalized with its
 * source's mapping, and each group is collapsed by the {@link Deduplicator}. Rows without
 * an identifier are dropped and counted. Data-quality findings are collected into the
 * {@link BuildSummary}; they never abort the build.</p>
 *
 * <p>With {@link ReconciliationOptions#getParallelism()} above one, identifier groups are
 * partitioned across a fixed pool. Each group depends only on its own rows, and the partitions
 * are merged before the snapshot is created, so the result equals the sequential one.</p>
 */
public class CanonicalSetBuilder {
    private static final Logger log = LoggerFactory.getLogger(CanonicalSetBuilder.class);

    private final ReconciliationOptions options;
    private final SchemaNormalizer normalizer;
    private final Deduplicator deduplicator;
    private final MetricsService metricsService;

    public CanonicalSetBuilder(ReconciliationOptions options) {
        this(options, new SchemaNormalizer(), new NoOpMetricsService());
    }

    public CanonicalSetBuilder(ReconciliationOptions options, SchemaNormalizer normalizer,
                               MetricsService metricsService) {
        this.options = Objects.requireNonNull(options, "options is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.deduplicator = new Deduplicator(options);
    }

    public BuildResult build(List<SourceBatch> batches, LocalDate asOf) {
        return build(batches, asOf, null);
    }

    /**
     * Builds a snapshot.
     *
     * @param batches  source batches in ascending default precedence
     * @param asOf     logical date of the snapshot, may be null
     * @param callback optional progress callback, invoked while rows are grouped
     * @throws EmptyBatchException if the batches contain no raw rows at all
     * @throws com.registry.reconciliation.dedup.DuplicateIdentifierConflictException in strict mode
     */
    public BuildResult build(List<SourceBatch> batches, LocalDate asOf, ProgressCallback callback) {
        Objects.requireNonNull(batches, "batches is required");
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        long totalRows = batches.stream().mapToLong(SourceBatch::size).sum();
        if (totalRows == 0) {
            throw new EmptyBatchException("no raw records in " + batches.size() + " source batch(es)");
        }

        long started = System.nanoTime();
        try (LogContext ctx = LogContext.forBuild(LogContext.generateBuildId(), asOf)) {
            List<String> batchOrder = batches.stream().map(SourceBatch::sourceTag).toList();
            SourceRanking ranking = SourceRanking.of(options.getSourcePriority(), batchOrder);

            Map<String, List<PendingRow>> groups = new LinkedHashMap<>();
            Map<String, Long> perSource = new LinkedHashMap<>();
            List<String> mappingWarnings = new ArrayList<>();
            long missingIdentifier = 0;
            long processed = 0;

            for (SourceBatch batch : batches) {
                perSource.merge(batch.sourceTag(), (long) batch.size(), Long::sum);
                mappingWarnings.addAll(checkMapping(batch));
                for (RawRecord raw : batch.records()) {
                    String identifier = normalizer.identifierOf(raw, batch.mapping());
                    if (identifier == null) {
                        missingIdentifier++;
                        log.debug("build.missing_identifier source={} line={}", batch.sourceTag(), raw.lineNumber());
                    } else {
                        groups.computeIfAbsent(identifier, id -> new ArrayList<>()).add(new PendingRow(raw, batch));
                    }
                    processed++;
                    if (processed % options.getProgressInterval() == 0) {
                        cb.onProgress(processed, totalRows, "Grouped " + processed + " records");
                    }
                }
                metricsService.incrementRecordsIngested(batch.sourceTag(), batch.size());
            }

            List<GroupOutcome> outcomes = options.getParallelism() > 1 && groups.size() > 1
                    ? reconcileParallel(groups, ranking)
                    : reconcile(new ArrayList<>(groups.entrySet()), ranking);

            TreeMap<String, GroupOutcome> ordered = new TreeMap<>();
            outcomes.forEach(outcome -> ordered.put(outcome.identifier(), outcome));

            List<CanonicalRecord> records = new ArrayList<>(ordered.size());
            List<CoercionWarning> coercionWarnings = new ArrayList<>();
            List<IdentityConflict> conflicts = new ArrayList<>();
            long collapsed = 0;
            for (GroupOutcome outcome : ordered.values()) {
                records.add(outcome.result().record());
                collapsed += outcome.result().collapsed();
                conflicts.addAll(outcome.result().conflicts());
                coercionWarnings.addAll(outcome.warnings());
            }

            Snapshot snapshot = Snapshot.of(asOf, records);
            Duration duration = Duration.ofNanos(System.nanoTime() - started);
            BuildSummary summary = new BuildSummary(totalRows, missingIdentifier, collapsed, snapshot.size(),
                    perSource, coercionWarnings, conflicts, mappingWarnings, duration);

            metricsService.incrementRecordsDropped(missingIdentifier);
            metricsService.incrementDuplicatesCollapsed(collapsed);
            metricsService.incrementCoercionWarnings(coercionWarnings.size());
            metricsService.incrementIdentityConflicts(conflicts.size());
            metricsService.recordSnapshotSize(snapshot.size());
            metricsService.recordBuildDuration(duration);

            cb.onProgress(totalRows, totalRows, "Build completed");
            log.info("snapshot.built asOf={} summary={}", asOf, summary);
            return new BuildResult(snapshot, summary);
        }
    }

    private List<GroupOutcome> reconcile(List<Map.Entry<String, List<PendingRow>>> groups, SourceRanking ranking) {
        List<GroupOutcome> outcomes = new ArrayList<>(groups.size());
        for (Map.Entry<String, List<PendingRow>> group : groups) {
            List<NormalizedRecord> rows = new ArrayList<>(group.getValue().size());
            List<CoercionWarning> warnings = new ArrayList<>();
            for (PendingRow pending : group.getValue()) {
                NormalizedRecord normalized = normalizer.normalize(
                        pending.raw(), pending.batch().mapping(), pending.batch().sourceTag());
                rows.add(normalized);
                warnings.addAll(normalized.warnings());
            }
            DeduplicationResult result = deduplicator.deduplicate(group.getKey(), rows, ranking);
            outcomes.add(new GroupOutcome(group.getKey(), result, warnings));
        }
        return outcomes;
    }

    private List<GroupOutcome> reconcileParallel(Map<String, List<PendingRow>> groups, SourceRanking ranking) {
        int parallelism = options.getParallelism();
        List<List<Map.Entry<String, List<PendingRow>>>> partitions = new ArrayList<>(parallelism);
        for (int i = 0; i < parallelism; i++) {
            partitions.add(new ArrayList<>());
        }
        for (Map.Entry<String, List<PendingRow>> group : groups.entrySet()) {
            partitions.get(Math.floorMod(group.getKey().hashCode(), parallelism)).add(group);
        }

        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        try {
            List<Future<List<GroupOutcome>>> futures = new ArrayList<>(parallelism);
            for (List<Map.Entry<String, List<PendingRow>>> partition : partitions) {
                if (!partition.isEmpty()) {
                    futures.add(executor.submit(() -> reconcile(partition, ranking)));
                }
            }
            List<GroupOutcome> outcomes = new ArrayList<>(groups.size());
            for (Future<List<GroupOutcome>> future : futures) {
                outcomes.addAll(future.get());
            }
            log.debug("build.parallel partitions={} groups={}", futures.size(), groups.size());
            return outcomes;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("snapshot build partition failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("snapshot build interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private List<String> checkMapping(SourceBatch batch) {
        Set<String> seen = new HashSet<>();
        for (RawRecord raw : batch.records()) {
            raw.columns().keySet().forEach(key -> {
                if (key != null) {
                    seen.add(key.trim());
                }
            });
        }

        List<String> warnings = new ArrayList<>();
        ColumnMapping mapping = batch.mapping();
        if (!batch.records().isEmpty() && mapping.getIdentifierColumns().stream().noneMatch(seen::contains)) {
            warnings.add(batch.sourceTag() + ": no identifier column " + mapping.getIdentifierColumns() + " present");
        }
        for (CanonicalField field : CanonicalField.values()) {
            List<String> columns = mapping.columnsFor(field);
            if (!columns.isEmpty() && !mapping.getConstants().containsKey(field)
                    && columns.stream().noneMatch(seen::contains)) {
                warnings.add(batch.sourceTag() + ": no column " + columns + " present for " + field);
            }
        }
        warnings.forEach(w -> log.warn("build.mapping_gap {}", w));
        return warnings;
    }

    private record PendingRow(RawRecord raw, SourceBatch batch) {}

    private record GroupOutcome(String identifier, DeduplicationResult result, List<CoercionWarning> warnings) {}
}
