package com.tazrim.ledger.ingest;

import java.util.List;

public class StatementFormatException extends StatementRejectedException {

    public static final String MISSING_COLUMNS = "MISSING_COLUMNS";

    private final List<String> missingFields;

    public StatementFormatException(List<String> missingFields) {
        super(MISSING_COLUMNS, "Missing required columns: " + String.join(", ", missingFields), null);
        this.missingFields = List.copyOf(missingFields);
    }

    public StatementFormatException(String message) {
        super(MISSING_COLUMNS, message, null);
        this.missingFields = List.of();
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
