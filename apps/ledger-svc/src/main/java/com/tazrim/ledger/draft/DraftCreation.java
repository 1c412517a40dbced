package com.tazrim.ledger.draft;

import com.tazrim.ledger.ingest.SkipRecord;
import java.util.List;

public record DraftCreation(DraftView draft, List<SkipRecord> skipped) {

    public DraftCreation {
        skipped = List.copyOf(skipped);
    }
}
