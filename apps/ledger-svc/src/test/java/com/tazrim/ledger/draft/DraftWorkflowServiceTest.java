package com.tazrim.ledger.draft;

import static org.assertj.core.api.Assertions.assertThat;

import com.tazrim.ledger.entity.DraftRowEntity;
import org.junit.jupiter.api.Test;

class DraftWorkflowServiceTest {

    @Test
    void approvedTextWinsOverSuggestionAndHint() {
        assertThat(DraftWorkflowService.effectiveCategory(row("Pharmacy", "Health", "Beauty"))).isEqualTo("Beauty");
    }

    @Test
    void fallsBackToSuggestionThenHint() {
        assertThat(DraftWorkflowService.effectiveCategory(row("Pharmacy", "Health", null))).isEqualTo("Health");
        assertThat(DraftWorkflowService.effectiveCategory(row("Pharmacy", null, " "))).isEqualTo("Pharmacy");
        assertThat(DraftWorkflowService.effectiveCategory(row(null, null, null))).isNull();
    }

    @Test
    void uncategorizedInAnyCaseMeansNoCategory() {
        assertThat(DraftWorkflowService.effectiveCategory(row("Groceries", "Groceries", "Uncategorized"))).isNull();
        assertThat(DraftWorkflowService.effectiveCategory(row("UNCATEGORIZED", null, null))).isNull();
    }

    private static DraftRowEntity row(String hint, String suggested, String approved) {
        DraftRowEntity row = new DraftRowEntity();
        row.setCategoryHint(hint);
        row.setSuggestedCategoryText(suggested);
        row.setApprovedCategoryText(approved);
        return row;
    }
}
