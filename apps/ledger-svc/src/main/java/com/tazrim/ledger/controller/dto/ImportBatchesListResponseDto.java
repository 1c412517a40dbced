package com.tazrim.ledger.controller.dto;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ImportBatchesListResponseDto(List<ImportBatchDto> batches, String traceId) {

    public record ImportBatchDto(
            UUID id,
            UUID accountId,
            String accountName,
            String feedKind,
            String sourceFilename,
            String periodLabel,
            Instant uploadedAt,
            Integer rowCount,
            Long activityCount
    ) {
    }
}
