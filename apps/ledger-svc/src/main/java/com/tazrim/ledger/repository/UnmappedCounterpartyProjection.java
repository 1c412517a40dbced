package com.tazrim.ledger.repository;

import java.util.UUID;

/**
 * Counterparty without a category link, with the number of ledger activities referencing it.
 */
public record UnmappedCounterpartyProjection(
        UUID id,
        String normalizedKey,
        String displayName,
        Long activityCount
) {
}
