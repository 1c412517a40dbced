package com.tazrim.ledger.ingest;

public class DateParseException extends StatementRejectedException {

    public static final String DATE_PARSE_ERROR = "DATE_PARSE_ERROR";

    public DateParseException(int rowIndex, String message) {
        super(DATE_PARSE_ERROR, "Row " + rowIndex + ": " + message, rowIndex);
    }
}
