package com.tazrim.ledger.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record ActivityResponseDto(
        UUID id,
        UUID batchId,
        LocalDate date,
        String description,
        UUID counterpartyId,
        BigDecimal debit,
        BigDecimal credit,
        BigDecimal amount,
        String currency,
        UUID manualCategoryId
) {
}
