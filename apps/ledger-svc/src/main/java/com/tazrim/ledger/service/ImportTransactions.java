package com.tazrim.ledger.service;

import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs one import step (a direct import, or staging or committing a draft) as a single transaction.
 * When a concurrent import commits a counterparty link first, the unique key on the link rejects
 * ours; the step is rolled back and replayed once, and the replay keeps the committed link.
 * Log lines written while the import runs carry the source file name under {@value #MDC_KEY}.
 */
@Component
public class ImportTransactions {

    private static final Logger log = LoggerFactory.getLogger(ImportTransactions.class);

    public static final String MDC_KEY = "import_file";

    static final int MAX_ATTEMPTS = 2;

    private final TransactionOperations transactions;

    @Autowired
    public ImportTransactions(PlatformTransactionManager transactionManager) {
        this(new TransactionTemplate(transactionManager));
    }

    ImportTransactions(TransactionOperations transactions) {
        this.transactions = transactions;
    }

    public <T> T run(String sourceFilename, Supplier<T> work) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_KEY, sourceFilename)) {
            // a caller's transaction cannot be replayed from here
            if (TransactionSynchronizationManager.isActualTransactionActive()) {
                return work.get();
            }
            return runWithRetry(sourceFilename, work);
        }
    }

    private <T> T runWithRetry(String sourceFilename, Supplier<T> work) {
        for (int attempt = 1; ; attempt++) {
            try {
                return transactions.execute(status -> work.get());
            } catch (DataIntegrityViolationException ex) {
                if (attempt >= MAX_ATTEMPTS) {
                    throw ex;
                }
                log.warn("Import of '{}' conflicted with a concurrent import, retrying: {}",
                        sourceFilename, ex.getMostSpecificCause().getMessage());
            }
        }
    }
}
