package com.tazrim.ledger.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class FormatDetectorTest {

    @Test
    void detectsHebrewCardExport() {
        ColumnMapping mapping = FormatDetector.detect(List.of("תאריך העסקה", "שם בית העסק", "סכום העסקה", "סכום החיוב", "ענף"));

        assertThat(mapping.feedKind()).isEqualTo(FeedKind.CARD);
        assertThat(mapping.columns())
                .containsEntry(CanonicalField.DATE, "תאריך העסקה")
                .containsEntry(CanonicalField.COUNTERPARTY, "שם בית העסק")
                .containsEntry(CanonicalField.CHARGED_AMOUNT, "סכום החיוב")
                .containsEntry(CanonicalField.CATEGORY_HINT, "ענף");
    }

    @Test
    void detectsBankExportWithDebitOnly() {
        ColumnMapping mapping = FormatDetector.detect(List.of("תאריך", "תאריך ערך", "תיאור", "אסמכתא", "חובה", "יתרה בש\"ח"));

        assertThat(mapping.feedKind()).isEqualTo(FeedKind.BANK);
        assertThat(mapping.has(CanonicalField.CREDIT)).isFalse();
        assertThat(mapping.columns()).containsEntry(CanonicalField.BALANCE, "יתרה בש\"ח");
    }

    @Test
    void headerMatchingIgnoresCaseBomAndExtraWhitespace() {
        ColumnMapping mapping = FormatDetector.detect(List.of("\uFEFF transaction   DATE ", "merchant name", "AMOUNT"));

        assertThat(mapping.feedKind()).isEqualTo(FeedKind.CARD);
        assertThat(mapping.columns()).containsEntry(CanonicalField.DATE, "\uFEFF transaction   DATE ");
    }

    @Test
    void missingColumnsAreNamed() {
        assertThatThrownBy(() -> FormatDetector.detect(List.of("Date", "Merchant")))
                .isInstanceOf(StatementFormatException.class)
                .satisfies(ex -> assertThat(((StatementFormatException) ex).getMissingFields()).containsExactly("amount"));
    }

    @Test
    void forcedBankKindRequiresDebitOrCredit() {
        assertThatThrownBy(() -> FormatDetector.detect(List.of("Date", "Description", "Amount"), FeedKind.BANK))
                .isInstanceOf(StatementFormatException.class)
                .hasMessageContaining("debit or credit");
    }
}
