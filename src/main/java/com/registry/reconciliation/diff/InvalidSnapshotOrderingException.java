package com.registry.reconciliation.diff;

/**
 * Thrown when snapshots are handed to the differ out of order.
 * The differ never infers ordering; this signals a caller bug, not bad data.
 */
public class InvalidSnapshotOrderingException extends RuntimeException {

    public InvalidSnapshotOrderingException(String message) {
        super(message);
    }
}
