package com.registry.reconciliation.snapshot;

/**
 * Thrown when a snapshot build receives no raw records at all.
 * This is a caller error, not a data-quality issue.
 */
public class EmptyBatchException extends RuntimeException {

    public EmptyBatchException(String message) {
        super(message);
    }
}
