package com.tazrim.ledger.controller.dto;

import java.util.List;

public record DraftsListResponseDto(List<DraftResponseDto> drafts, String traceId) {
}
