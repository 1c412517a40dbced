package com.tazrim.ledger.ingest;

public sealed interface RowOutcome permits RowOutcome.Accepted, RowOutcome.Skipped, RowOutcome.Fatal {

    record Accepted(ParsedActivity activity) implements RowOutcome {
    }

    record Skipped(SkipRecord skip) implements RowOutcome {
    }

    record Fatal(StatementRejectedException error) implements RowOutcome {
    }
}
