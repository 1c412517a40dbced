package com.tazrim.ledger.ingest;

/**
 * The statement bytes are not valid UTF-8. Carries the 1-based physical line of the first bad byte.
 */
public class StatementEncodingException extends StatementRejectedException {

    public static final String INVALID_ENCODING = "INVALID_ENCODING";

    private final int line;

    public StatementEncodingException(int line) {
        super(INVALID_ENCODING, "Statement is not valid UTF-8 (line " + line + ")", null);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
