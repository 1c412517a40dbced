package com.tazrim.ledger.service;

import com.tazrim.ledger.ingest.FeedKind;
import com.tazrim.ledger.ingest.FieldLimits;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;

/**
 * One uploaded statement file plus the account and period it belongs to.
 *
 * @param feedKind forced feed kind, or {@code null} to detect it from the header row
 */
public record StatementUpload(
        String accountName,
        String periodLabel,
        String sourceFilename,
        FeedKind feedKind,
        byte[] content
) {

    public StatementUpload {
        if (accountName == null || accountName.isBlank()) {
            throw new IllegalArgumentException("accountName must be provided");
        }
        if (sourceFilename == null || sourceFilename.isBlank()) {
            throw new IllegalArgumentException("sourceFilename must be provided");
        }
        if (periodLabel == null) {
            throw new IllegalArgumentException("periodLabel must be provided");
        }
        try {
            YearMonth.parse(periodLabel);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("periodLabel must look like YYYY-MM: " + periodLabel, ex);
        }
        if (content == null) {
            throw new IllegalArgumentException("content must be provided");
        }
        accountName = accountName.strip();
        sourceFilename = sourceFilename.strip();
        if (accountName.length() > FieldLimits.NAME) {
            throw new IllegalArgumentException("accountName must be at most " + FieldLimits.NAME + " characters");
        }
        if (sourceFilename.length() > FieldLimits.NAME) {
            throw new IllegalArgumentException("sourceFilename must be at most " + FieldLimits.NAME + " characters");
        }
    }
}
