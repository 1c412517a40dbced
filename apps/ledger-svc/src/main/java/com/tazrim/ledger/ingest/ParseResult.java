package com.tazrim.ledger.ingest;

import java.util.List;

public record ParseResult(FeedKind feedKind, List<ParsedActivity> activities, List<SkipRecord> skipped) {

    public int totalRows() {
        return activities.size() + skipped.size();
    }
}
