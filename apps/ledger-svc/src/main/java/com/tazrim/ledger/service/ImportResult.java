package com.tazrim.ledger.service;

import com.tazrim.ledger.ingest.SkipRecord;
import com.tazrim.ledger.ledger.ImportSummary;
import java.util.List;

public record ImportResult(ImportSummary summary, List<SkipRecord> skipped) {
}
