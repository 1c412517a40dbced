package com.tazrim.ledger.ingest;

public class InvalidAmountException extends StatementRejectedException {

    public static final String INVALID_AMOUNT = "INVALID_AMOUNT";

    private final String rawValue;

    public InvalidAmountException(String rawValue, String message) {
        super(INVALID_AMOUNT, message, null);
        this.rawValue = rawValue;
    }

    private InvalidAmountException(String rawValue, String message, int rowIndex) {
        super(INVALID_AMOUNT, message, rowIndex);
        this.rawValue = rawValue;
    }

    public InvalidAmountException atRow(int rowIndex, CanonicalField field) {
        return new InvalidAmountException(rawValue,
                "Row " + rowIndex + " (" + field.label() + "): " + getMessage(), rowIndex);
    }

    public String getRawValue() {
        return rawValue;
    }
}
