package com.tazrim.ledger.ingest;

public class FieldTooLongException extends StatementRejectedException {

    public static final String FIELD_TOO_LONG = "FIELD_TOO_LONG";

    private final CanonicalField field;
    private final int maxLength;

    public FieldTooLongException(int rowIndex, CanonicalField field, int maxLength) {
        super(FIELD_TOO_LONG, "Row " + rowIndex + " (" + field.label() + "): longer than " + maxLength + " characters", rowIndex);
        this.field = field;
        this.maxLength = maxLength;
    }

    public CanonicalField getField() {
        return field;
    }

    public int getMaxLength() {
        return maxLength;
    }
}
