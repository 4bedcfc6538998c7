package com.registry.reconciliation.metrics;

import com.registry.reconciliation.core.model.ChangeKind;

import java.time.Duration;

/**
 * Interface for recording reconciliation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine runs without
 * any metrics backend configured.
 */
public interface MetricsService {

    void recordBuildDuration(Duration duration);

    void incrementRecordsIngested(String sourceTag, long count);

    void incrementRecordsDropped(long count);

    void incrementDuplicatesCollapsed(long count);

    void incrementCoercionWarnings(long count);

    void incrementIdentityConflicts(long count);

    void recordSnapshotSize(int size);

    void recordDiffDuration(Duration duration);

    void incrementChangeEvents(ChangeKind kind, long count);
}
