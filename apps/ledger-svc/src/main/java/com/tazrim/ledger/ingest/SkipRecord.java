package com.tazrim.ledger.ingest;

import java.util.Map;

public record SkipRecord(int rowIndex, String reason, Map<String, String> snapshot) {
}
