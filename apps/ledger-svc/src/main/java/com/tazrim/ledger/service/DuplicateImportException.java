package com.tazrim.ledger.service;

/**
 * The account already has an import batch with the same source filename.
 */
public class DuplicateImportException extends RuntimeException {

    private final String accountName;
    private final String sourceFilename;

    public DuplicateImportException(String accountName, String sourceFilename) {
        super("Statement '" + sourceFilename + "' was already imported for account '" + accountName + "'");
        this.accountName = accountName;
        this.sourceFilename = sourceFilename;
    }

    public String getAccountName() {
        return accountName;
    }

    public String getSourceFilename() {
        return sourceFilename;
    }
}
