package com.tazrim.ledger.ledger;

import com.tazrim.ledger.ingest.FeedKind;
import java.util.UUID;

/**
 * Metadata of the batch a set of rows is written under.
 *
 * @param totalRows data rows seen in the statement, including skipped ones
 * @param draftId   draft the batch was committed from, or {@code null} for direct imports
 */
public record BatchRequest(
        UUID accountId,
        FeedKind feedKind,
        String sourceFilename,
        String periodLabel,
        int totalRows,
        UUID draftId
) {
}
