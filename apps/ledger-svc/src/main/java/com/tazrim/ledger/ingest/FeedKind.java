package com.tazrim.ledger.ingest;

public enum FeedKind {
    CARD,
    BANK
}
