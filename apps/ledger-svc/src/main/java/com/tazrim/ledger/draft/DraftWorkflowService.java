package com.tazrim.ledger.draft;

import com.tazrim.ledger.category.CategoryMapper;
import com.tazrim.ledger.config.LedgerImportProperties;
import com.tazrim.ledger.counterparty.CounterpartyResolver;
import com.tazrim.ledger.entity.AccountEntity;
import com.tazrim.ledger.entity.DraftRowEntity;
import com.tazrim.ledger.entity.ImportDraftEntity;
import com.tazrim.ledger.ingest.FieldLimits;
import com.tazrim.ledger.ingest.ParseResult;
import com.tazrim.ledger.ingest.ParsedActivity;
import com.tazrim.ledger.ingest.StatementParser;
import com.tazrim.ledger.ledger.BatchRequest;
import com.tazrim.ledger.ledger.ImportSummary;
import com.tazrim.ledger.repository.JpaAccountRepository;
import com.tazrim.ledger.repository.JpaDraftRowRepository;
import com.tazrim.ledger.repository.JpaImportDraftRepository;
import com.tazrim.ledger.service.AccountService;
import com.tazrim.ledger.service.BatchCommitter;
import com.tazrim.ledger.service.ImportTransactions;
import com.tazrim.ledger.service.NotFoundException;
import com.tazrim.ledger.service.StatementUpload;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Staged import path. A draft keeps parsed rows pending review; commit writes them exactly like
 * a direct import, using the reviewed category texts as hints.
 */
@Service
public class DraftWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(DraftWorkflowService.class);

    static final String UNCATEGORIZED = "uncategorized";

    private final StatementParser statementParser;
    private final AccountService accountService;
    private final CounterpartyResolver counterpartyResolver;
    private final CategoryMapper categoryMapper;
    private final BatchCommitter batchCommitter;
    private final JpaImportDraftRepository draftRepository;
    private final JpaDraftRowRepository draftRowRepository;
    private final JpaAccountRepository accountRepository;
    private final LedgerImportProperties properties;
    private final ImportTransactions importTransactions;

    public DraftWorkflowService(
            StatementParser statementParser,
            AccountService accountService,
            CounterpartyResolver counterpartyResolver,
            CategoryMapper categoryMapper,
            BatchCommitter batchCommitter,
            JpaImportDraftRepository draftRepository,
            JpaDraftRowRepository draftRowRepository,
            JpaAccountRepository accountRepository,
            LedgerImportProperties properties,
            ImportTransactions importTransactions
    ) {
        this.statementParser = statementParser;
        this.accountService = accountService;
        this.counterpartyResolver = counterpartyResolver;
        this.categoryMapper = categoryMapper;
        this.batchCommitter = batchCommitter;
        this.draftRepository = draftRepository;
        this.draftRowRepository = draftRowRepository;
        this.accountRepository = accountRepository;
        this.properties = properties;
        this.importTransactions = importTransactions;
    }

    /**
     * Parses the upload into a new PENDING draft. Rows the parser skipped are not stored with the
     * draft; they are reported once, in the returned {@link DraftCreation}.
     */
    public DraftCreation createDraft(StatementUpload upload) {
        return importTransactions.run(upload.sourceFilename(), () -> stage(upload));
    }

    private DraftCreation stage(StatementUpload upload) {
        ParseResult parsed = statementParser.parse(upload.content(), upload.feedKind());
        AccountEntity account = accountService.findOrCreate(upload.accountName(), parsed.feedKind(), properties.homeCurrency());

        Set<String> keys = new LinkedHashSet<>();
        parsed.activities().forEach(row -> keys.add(row.counterpartyKey()));
        Map<String, UUID> existing = counterpartyResolver.lookup(keys);
        Map<UUID, String> linkedCategories = categoryMapper.categoryNamesFor(existing.values());

        ImportDraftEntity draft = new ImportDraftEntity(
                UUID.randomUUID(),
                account.getId(),
                parsed.feedKind(),
                upload.sourceFilename(),
                upload.periodLabel(),
                parsed.activities().size(),
                parsed.skipped().size(),
                DraftStatus.PENDING,
                Instant.now()
        );
        draftRepository.save(draft);

        List<DraftRowEntity> rows = new ArrayList<>(parsed.activities().size());
        for (ParsedActivity activity : parsed.activities()) {
            String suggestion = activity.categoryHint();
            if (suggestion == null) {
                UUID counterpartyId = existing.get(activity.counterpartyKey());
                suggestion = counterpartyId == null ? null : linkedCategories.get(counterpartyId);
            }
            rows.add(DraftRowEntity.from(draft.getId(), activity, suggestion));
        }
        draftRowRepository.saveAll(rows);
        log.info("Created draft {} from '{}' with {} rows ({} skipped)",
                draft.getId(), upload.sourceFilename(), rows.size(), parsed.skipped().size());
        return new DraftCreation(DraftView.of(draft), parsed.skipped());
    }

    @Transactional(readOnly = true)
    public List<DraftView> listDrafts(DraftStatus status, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        List<ImportDraftEntity> drafts = status == null
                ? draftRepository.findAllByOrderByCreatedAtDesc(page)
                : draftRepository.findByStatusOrderByCreatedAtDesc(status, page);
        return drafts.stream().map(DraftView::of).toList();
    }

    @Transactional(readOnly = true)
    public DraftPage getDraft(UUID draftId, int page, int size) {
        if (page < 0) {
            throw new IllegalArgumentException("page must not be negative");
        }
        if (size < 1) {
            throw new IllegalArgumentException("size must be positive");
        }
        int effectiveSize = Math.min(size, properties.draftPageMaxSize());
        ImportDraftEntity draft = requireDraft(draftId);
        Page<DraftRowEntity> rows = draftRowRepository.findPageByDraftId(draftId, PageRequest.of(page, effectiveSize));
        return new DraftPage(
                DraftView.of(draft),
                rows.getContent().stream().map(DraftRowView::of).toList(),
                page,
                effectiveSize,
                rows.getTotalElements()
        );
    }

    /**
     * Records the reviewer's category for one row. Blank or {@code null} text clears the approval.
     */
    @Transactional
    public DraftRowView setApproval(UUID draftId, UUID rowId, String categoryText) {
        ImportDraftEntity draft = requireDraft(draftId);
        requirePending(draft, "review");
        DraftRowEntity row = draftRowRepository.findByIdAndDraftId(rowId, draftId)
                .orElseThrow(() -> new NotFoundException("Draft row", rowId));
        String approved = categoryText == null || categoryText.isBlank() ? null : categoryText.strip();
        if (approved != null && approved.length() > FieldLimits.CATEGORY) {
            throw new IllegalArgumentException("category must be at most " + FieldLimits.CATEGORY + " characters");
        }
        row.setApprovedCategoryText(approved);
        return DraftRowView.of(draftRowRepository.save(row));
    }

    public ImportSummary commit(UUID draftId) {
        String sourceFilename = draftRepository.findById(draftId)
                .map(ImportDraftEntity::getSourceFilename)
                .orElseThrow(() -> new NotFoundException("Draft", draftId));
        return importTransactions.run(sourceFilename, () -> commitOnce(draftId));
    }

    private ImportSummary commitOnce(UUID draftId) {
        ImportDraftEntity draft = requireDraft(draftId);
        requirePending(draft, "commit");
        AccountEntity account = accountRepository.findById(draft.getAccountId())
                .orElseThrow(() -> new NotFoundException("Account", draft.getAccountId()));
        batchCommitter.requireNewFile(account.getId(), account.getName(), draft.getSourceFilename());

        List<ParsedActivity> rows = new ArrayList<>();
        for (DraftRowEntity row : draftRowRepository.findByDraftId(draftId)) {
            rows.add(row.toActivity().withCategoryHint(effectiveCategory(row)));
        }

        BatchRequest request = new BatchRequest(
                account.getId(),
                draft.getFeedKind(),
                draft.getSourceFilename(),
                draft.getPeriodLabel(),
                draft.getRowCount() + draft.getSkippedRows(),
                draft.getId()
        );
        ImportSummary summary = batchCommitter.commit(request, rows);

        draft.setStatus(DraftStatus.COMMITTED);
        draft.setCommittedBatchId(summary.batchId());
        draftRepository.save(draft);
        log.info("Committed draft {} as batch {}", draftId, summary.batchId());
        return summary;
    }

    /**
     * Drops every row of a pending draft. The draft record stays behind as DISCARDED so that later
     * commit or discard attempts fail with a state error.
     */
    @Transactional
    public DraftView discard(UUID draftId) {
        ImportDraftEntity draft = requireDraft(draftId);
        requirePending(draft, "discard");
        int removed = draftRowRepository.deleteByDraftId(draftId);
        ImportDraftEntity reloaded = requireDraft(draftId);
        reloaded.setStatus(DraftStatus.DISCARDED);
        draftRepository.save(reloaded);
        log.info("Discarded draft {} ({} rows)", draftId, removed);
        return DraftView.of(reloaded);
    }

    /**
     * approved, else suggested, else the raw hint; "uncategorized" in any case means none.
     */
    static String effectiveCategory(DraftRowEntity row) {
        String text = firstNonBlank(row.getApprovedCategoryText(), row.getSuggestedCategoryText(), row.getCategoryHint());
        if (text == null || text.strip().toLowerCase(Locale.ROOT).equals(UNCATEGORIZED)) {
            return null;
        }
        return text.strip();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private ImportDraftEntity requireDraft(UUID draftId) {
        return draftRepository.findById(draftId)
                .orElseThrow(() -> new NotFoundException("Draft", draftId));
    }

    private static void requirePending(ImportDraftEntity draft, String action) {
        if (draft.getStatus() != DraftStatus.PENDING) {
            throw new DraftStateException(draft.getId(), draft.getStatus(), action);
        }
    }
}
