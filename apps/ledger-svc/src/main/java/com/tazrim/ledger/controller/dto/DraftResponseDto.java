package com.tazrim.ledger.controller.dto;

import java.time.Instant;
import java.util.UUID;

public record DraftResponseDto(
        UUID id,
        UUID accountId,
        String feedKind,
        String sourceFilename,
        String periodLabel,
        String status,
        Integer rowCount,
        Integer skippedRows,
        Instant createdAt,
        UUID committedBatchId
) {
}
