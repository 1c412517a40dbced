package com.tazrim.ledger.ingest;

public enum CanonicalField {
    DATE("date"),
    SECONDARY_DATE("secondary date"),
    COUNTERPARTY("counterparty"),
    DESCRIPTION("description"),
    REFERENCE("reference"),
    AMOUNT("amount"),
    CHARGED_AMOUNT("charged amount"),
    DEBIT("debit"),
    CREDIT("credit"),
    BALANCE("balance"),
    CATEGORY_HINT("category");

    private final String label;

    CanonicalField(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
