package com.tazrim.ledger.ledger;

import java.util.UUID;

/**
 * Outcome of one committed import. {@code totalRows} counts every data row seen, skipped rows included.
 */
public record ImportSummary(
        UUID batchId,
        int totalRows,
        int insertedRows,
        int newEntities,
        int unmappedEntities
) {
}
