package com.tazrim.ledger.repository;

import com.tazrim.ledger.ingest.FeedKind;
import java.time.Instant;
import java.util.UUID;

/**
 * Import batch row joined with its account name and the number of ledger activities it still owns.
 */
public record ImportBatchSummaryProjection(
        UUID id,
        UUID accountId,
        String accountName,
        FeedKind feedKind,
        String sourceFilename,
        String periodLabel,
        Instant uploadedAt,
        Integer rowCount,
        Long activityCount
) {
}
