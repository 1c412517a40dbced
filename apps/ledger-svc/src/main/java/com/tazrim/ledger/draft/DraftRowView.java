package com.tazrim.ledger.draft;

import com.tazrim.ledger.entity.DraftRowEntity;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One reviewable draft row with its suggested and approved category text.
 */
public record DraftRowView(
        UUID id,
        int rowIndex,
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

    public static DraftRowView of(DraftRowEntity row) {
        return new DraftRowView(
                row.getId(),
                row.getRowIndex(),
                row.getActivityDate(),
                row.getValueDate(),
                row.getDescription(),
                row.getReference(),
                row.getCounterpartyRaw(),
                row.getDebit(),
                row.getCredit(),
                row.getAmount(),
                row.getChargedAmount(),
                row.getChargedCurrency(),
                row.getBalance(),
                row.getCurrency(),
                row.getCategoryHint(),
                row.getSuggestedCategoryText(),
                row.getApprovedCategoryText()
        );
    }
}
