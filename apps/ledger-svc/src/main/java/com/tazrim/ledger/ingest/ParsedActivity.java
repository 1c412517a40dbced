package com.tazrim.ledger.ingest;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A statement row after normalization. Bank feeds carry debit/credit, card feeds a signed amount
 * with an optional charged amount in the billing currency.
 */
public record ParsedActivity(
        int rowIndex,
        LocalDate date,
        LocalDate valueDate,
        String description,
        String reference,
        BigDecimal debit,
        BigDecimal credit,
        BigDecimal amount,
        BigDecimal chargedAmount,
        String chargedCurrency,
        BigDecimal balance,
        String currency,
        String categoryHint,
        String counterpartyRaw,
        String counterpartyKey
) {
    public ParsedActivity withCategoryHint(String newHint) {
        return new ParsedActivity(
                rowIndex,
                date,
                valueDate,
                description,
                reference,
                debit,
                credit,
                amount,
                chargedAmount,
                chargedCurrency,
                balance,
                currency,
                newHint,
                counterpartyRaw,
                counterpartyKey
        );
    }
}
