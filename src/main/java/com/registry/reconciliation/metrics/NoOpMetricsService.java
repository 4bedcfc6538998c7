package com.registry.reconciliation.metrics;

import com.registry.reconciliation.core.model.ChangeKind;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordBuildDuration(Duration duration) {
    }

    @Override
    public void incrementRecordsIngested(String sourceTag, long count) {
    }

    @Override
    public void incrementRecordsDropped(long count) {
    }

    @Override
    public void incrementDuplicatesCollapsed(long count) {
    }

    @Override
    public void incrementCoercionWarnings(long count) {
    }

    @Override
    public void incrementIdentityConflicts(long count) {
    }

    @Override
    public void recordSnapshotSize(int size) {
    }

    @Override
    public void recordDiffDuration(Duration duration) {
    }

    @Override
    public void incrementChangeEvents(ChangeKind kind, long count) {
    }
}
