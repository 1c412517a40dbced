package com.tazrim.ledger.draft;

/**
 * Lifecycle of an import draft. Both COMMITTED and DISCARDED are terminal.
 */
public enum DraftStatus {
    PENDING,
    COMMITTED,
    DISCARDED
}
