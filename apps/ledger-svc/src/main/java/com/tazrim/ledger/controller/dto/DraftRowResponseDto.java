package com.tazrim.ledger.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record DraftRowResponseDto(
        UUID id,
        Integer rowIndex,
        LocalDate date,
        LocalDate valueDate,
        String description,
        String reference,
        String counterparty,
        BigDecimal debit,
        BigDecimal credit,
        BigDecimal amount,
        BigDecimal chargedAmount,
        String chargedCurrency,
        BigDecimal balance,
        String currency,
        String categoryHint,
        String suggestedCategory,
        String approvedCategory
) {
}
