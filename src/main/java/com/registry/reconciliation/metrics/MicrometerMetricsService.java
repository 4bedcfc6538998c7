package com.registry.reconciliation.metrics;

import com.registry.reconciliation.core.model.ChangeKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code registry.build.duration} Timer</li>
 *   <li>{@code registry.records.ingested} Counter (tag: source)</li>
 *   <li>{@code registry.records.dropped} Counter</li>
 *   <li>{@code registry.duplicates.collapsed} Counter</li>
 *   <li>{@code registry.coercion.warnings} Counter</li>
 *   <li>{@code registry.identity.conflicts} Counter</li>
 *   <li>{@code registry.snapshot.size} DistributionSummary</li>
 *   <li>{@code registry.diff.duration} Timer</li>
 *   <li>{@code registry.changes} Counter (tag: kind)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer buildTimer;
    private final Timer diffTimer;
    private final Counter droppedCounter;
    private final Counter collapsedCounter;
    private final Counter coercionCounter;
    private final Counter conflictCounter;
    private final DistributionSummary snapshotSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.buildTimer = Timer.builder("registry.build.duration")
                .description("Duration of snapshot builds")
                .register(registry);
        this.diffTimer = Timer.builder("registry.diff.duration")
                .description("Duration of snapshot comparisons")
                .register(registry);
        this.droppedCounter = Counter.builder("registry.records.dropped")
                .description("Raw rows dropped for lack of an identifier")
                .register(registry);
        this.collapsedCounter = Counter.builder("registry.duplicates.collapsed")
                .description("Raw rows that lost to a duplicate")
                .register(registry);
        this.coercionCounter = Counter.builder("registry.coercion.warnings")
                .description("Values stored as absent after failed coercion")
                .register(registry);
        this.conflictCounter = Counter.builder("registry.identity.conflicts")
                .description("Identity-field disagreements among duplicates")
                .register(registry);
        this.snapshotSizeSummary = DistributionSummary.builder("registry.snapshot.size")
                .description("Number of canonical records per built snapshot")
                .register(registry);
    }

    @Override
    public void recordBuildDuration(Duration duration) {
        buildTimer.record(duration);
    }

    @Override
    public void incrementRecordsIngested(String sourceTag, long count) {
        Counter counter = counterCache.computeIfAbsent("ingested:" + sourceTag, k ->
                Counter.builder("registry.records.ingested")
                        .description("Raw rows read per source")
                        .tag("source", sourceTag)
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void incrementRecordsDropped(long count) {
        droppedCounter.increment(count);
    }

    @Override
    public void incrementDuplicatesCollapsed(long count) {
        collapsedCounter.increment(count);
    }

    @Override
    public void incrementCoercionWarnings(long count) {
        coercionCounter.increment(count);
    }

    @Override
    public void incrementIdentityConflicts(long count) {
        conflictCounter.increment(count);
    }

    @Override
    public void recordSnapshotSize(int size) {
        snapshotSizeSummary.record(size);
    }

    @Override
    public void recordDiffDuration(Duration duration) {
        diffTimer.record(duration);
    }

    @Override
    public void incrementChangeEvents(ChangeKind kind, long count) {
        Counter counter = counterCache.computeIfAbsent("changes:" + kind.name(), k ->
                Counter.builder("registry.changes")
                        .description("Change events emitted by kind")
                        .tag("kind", kind.name())
                        .register(registry));
        counter.increment(count);
    }
}
