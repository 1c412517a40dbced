package com.tazrim.ledger.ingest;

/**
 * Maximum stored lengths of free-text statement fields. Rows exceeding them are rejected while
 * parsing; the entity column sizes are derived from the same values.
 */
public final class FieldLimits {

    public static final int DESCRIPTION = 1000;
    public static final int REFERENCE = 100;
    public static final int COUNTERPARTY = 500;
    // case folding can lengthen a name ("ß" becomes "ss")
    public static final int COUNTERPARTY_KEY = 2 * COUNTERPARTY;
    public static final int CATEGORY = 200;
    public static final int NAME = 255;

    private FieldLimits() {
    }
}
