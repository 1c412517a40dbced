package com.tazrim.ledger.service;

import com.tazrim.ledger.category.CategoryMapper;
import com.tazrim.ledger.counterparty.CounterpartyResolver;
import com.tazrim.ledger.entity.CategoryEntity;
import com.tazrim.ledger.ingest.ParsedActivity;
import com.tazrim.ledger.ledger.BatchRequest;
import com.tazrim.ledger.ledger.ImportSummary;
import com.tazrim.ledger.ledger.LedgerWriter;
import com.tazrim.ledger.repository.JpaImportBatchRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Shared tail of both import paths: resolve counterparties, create categories, apply consensus
 * over the rows' hints and write the batch.
 */
@Component
public class BatchCommitter {

    private final CounterpartyResolver counterpartyResolver;
    private final CategoryMapper categoryMapper;
    private final LedgerWriter ledgerWriter;
    private final JpaImportBatchRepository batchRepository;

    public BatchCommitter(
            CounterpartyResolver counterpartyResolver,
            CategoryMapper categoryMapper,
            LedgerWriter ledgerWriter,
            JpaImportBatchRepository batchRepository
    ) {
        this.counterpartyResolver = counterpartyResolver;
        this.categoryMapper = categoryMapper;
        this.ledgerWriter = ledgerWriter;
        this.batchRepository = batchRepository;
    }

    // TODO: also reject re-uploads of the same content under a new filename (hash of the normalized rows).
    public void requireNewFile(UUID accountId, String accountName, String sourceFilename) {
        if (batchRepository.existsByAccountIdAndSourceFilename(accountId, sourceFilename)) {
            throw new DuplicateImportException(accountName, sourceFilename);
        }
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public ImportSummary commit(BatchRequest request, List<ParsedActivity> rows) {
        CounterpartyResolver.Resolution resolution = counterpartyResolver.resolve(rows);

        List<String> hints = new ArrayList<>();
        rows.forEach(row -> hints.add(row.categoryHint()));
        Map<String, CategoryEntity> categories = categoryMapper.ensureCategories(hints);
        Map<UUID, Set<String>> hintsByCounterparty = CategoryMapper.hintsByCounterparty(rows, resolution.idsByKey());
        categoryMapper.applyConsensus(hintsByCounterparty, categories);

        return ledgerWriter.write(request, rows, resolution);
    }
}
