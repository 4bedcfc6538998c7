package com.registry.reconciliation.snapshot;

import java.util.Objects;

/**
 * A built snapshot with the summary of how it was built.
 */
public record BuildResult(Snapshot snapshot, BuildSummary summary) {

    public BuildResult {
        Objects.requireNonNull(snapshot, "snapshot is required");
        Objects.requireNonNull(summary, "summary is required");
    }
}
