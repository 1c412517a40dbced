package com.tazrim.ledger.controller.dto;

import com.tazrim.ledger.controller.dto.ImportSummaryResponseDto.SkippedRowDto;
import java.util.List;

public record DraftCreatedResponseDto(
        DraftResponseDto draft,
        List<SkippedRowDto> skipped,
        String traceId
) {
}
