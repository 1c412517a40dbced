package com.tazrim.ledger.service;

import com.tazrim.ledger.config.LedgerImportProperties;
import com.tazrim.ledger.entity.AccountEntity;
import com.tazrim.ledger.entity.LedgerActivityEntity;
import com.tazrim.ledger.ingest.ParseResult;
import com.tazrim.ledger.ingest.StatementParser;
import com.tazrim.ledger.ledger.BatchRequest;
import com.tazrim.ledger.ledger.ImportSummary;
import com.tazrim.ledger.repository.ImportBatchSummaryProjection;
import com.tazrim.ledger.repository.JpaCategoryRepository;
import com.tazrim.ledger.repository.JpaImportBatchRepository;
import com.tazrim.ledger.repository.JpaLedgerActivityRepository;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Direct import path: parse, resolve and write a statement in one transaction. Also hosts the
 * batch and activity maintenance operations.
 */
@Service
public class StatementImportService {

    private static final Logger log = LoggerFactory.getLogger(StatementImportService.class);

    private final StatementParser statementParser;
    private final AccountService accountService;
    private final BatchCommitter batchCommitter;
    private final JpaImportBatchRepository batchRepository;
    private final JpaLedgerActivityRepository activityRepository;
    private final JpaCategoryRepository categoryRepository;
    private final LedgerImportProperties properties;
    private final ImportTransactions importTransactions;

    public StatementImportService(
            StatementParser statementParser,
            AccountService accountService,
            BatchCommitter batchCommitter,
            JpaImportBatchRepository batchRepository,
            JpaLedgerActivityRepository activityRepository,
            JpaCategoryRepository categoryRepository,
            LedgerImportProperties properties,
            ImportTransactions importTransactions
    ) {
        this.statementParser = statementParser;
        this.accountService = accountService;
        this.batchCommitter = batchCommitter;
        this.batchRepository = batchRepository;
        this.activityRepository = activityRepository;
        this.categoryRepository = categoryRepository;
        this.properties = properties;
        this.importTransactions = importTransactions;
    }

    public ImportResult importStatement(StatementUpload upload) {
        log.info("Importing '{}' for account '{}' ({})", upload.sourceFilename(), upload.accountName(), upload.periodLabel());
        return importTransactions.run(upload.sourceFilename(), () -> importOnce(upload));
    }

    private ImportResult importOnce(StatementUpload upload) {
        ParseResult parsed = statementParser.parse(upload.content(), upload.feedKind());

        AccountEntity account = accountService.findOrCreate(upload.accountName(), parsed.feedKind(), properties.homeCurrency());
        batchCommitter.requireNewFile(account.getId(), account.getName(), upload.sourceFilename());

        BatchRequest request = new BatchRequest(
                account.getId(),
                parsed.feedKind(),
                upload.sourceFilename(),
                upload.periodLabel(),
                parsed.totalRows(),
                null
        );
        ImportSummary summary = batchCommitter.commit(request, parsed.activities());
        return new ImportResult(summary, parsed.skipped());
    }

    @Transactional(readOnly = true)
    public List<ImportBatchSummaryProjection> listBatches(int limit) {
        return batchRepository.findRecent(PageRequest.of(0, Math.max(1, limit)));
    }

    /**
     * Removes a batch together with every ledger activity it created.
     */
    @Transactional
    public int deleteBatch(UUID batchId) {
        if (!batchRepository.existsById(batchId)) {
            throw new NotFoundException("Import batch", batchId);
        }
        int removed = activityRepository.deleteByBatchId(batchId);
        batchRepository.deleteById(batchId);
        log.info("Deleted batch {} with {} activities", batchId, removed);
        return removed;
    }

    /**
     * Sets or, with a {@code null} category id, clears the manual category of one activity.
     */
    @Transactional
    public LedgerActivityEntity setActivityCategory(UUID activityId, UUID categoryId) {
        LedgerActivityEntity activity = activityRepository.findById(activityId)
                .orElseThrow(() -> new NotFoundException("Activity", activityId));
        if (categoryId != null && !categoryRepository.existsById(categoryId)) {
            throw new NotFoundException("Category", categoryId);
        }
        activity.setManualCategoryId(categoryId);
        return activityRepository.save(activity);
    }
}
