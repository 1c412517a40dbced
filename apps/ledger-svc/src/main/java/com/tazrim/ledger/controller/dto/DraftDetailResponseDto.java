package com.tazrim.ledger.controller.dto;

import java.util.List;

public record DraftDetailResponseDto(
        DraftResponseDto draft,
        Integer page,
        Integer pageSize,
        Long total,
        List<DraftRowResponseDto> rows,
        String traceId
) {
}
