package com.tazrim.ledger.ingest;

/**
 * Base type for failures that abort a whole statement import before anything is written.
 */
public class StatementRejectedException extends RuntimeException {

    private final String code;
    private final Integer rowIndex;

    public StatementRejectedException(String code, String message, Integer rowIndex) {
        super(message);
        this.code = code;
        this.rowIndex = rowIndex;
    }

    public String getCode() {
        return code;
    }

    public Integer getRowIndex() {
        return rowIndex;
    }
}
