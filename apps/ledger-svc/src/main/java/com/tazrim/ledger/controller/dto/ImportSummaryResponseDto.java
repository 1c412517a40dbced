package com.tazrim.ledger.controller.dto;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ImportSummaryResponseDto(
        UUID batchId,
        Integer totalRows,
        Integer insertedRows,
        Integer newEntities,
        Integer unmappedEntities,
        List<SkippedRowDto> skipped,
        String traceId
) {

    public record SkippedRowDto(Integer rowIndex, String reason, Map<String, String> cells) {
    }
}
