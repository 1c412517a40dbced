package com.tazrim.ledger.ledger;

import com.tazrim.ledger.counterparty.CounterpartyResolver;
import com.tazrim.ledger.entity.ImportBatchEntity;
import com.tazrim.ledger.entity.LedgerActivityEntity;
import com.tazrim.ledger.ingest.ParsedActivity;
import com.tazrim.ledger.repository.JpaCounterpartyRepository;
import com.tazrim.ledger.repository.JpaImportBatchRepository;
import com.tazrim.ledger.repository.JpaLedgerActivityRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Materializes resolved rows as permanent ledger activities under a new import batch.
 * Runs inside the caller's transaction.
 */
@Component
public class LedgerWriter {

    private static final Logger log = LoggerFactory.getLogger(LedgerWriter.class);

    private final JpaImportBatchRepository batchRepository;
    private final JpaLedgerActivityRepository activityRepository;
    private final JpaCounterpartyRepository counterpartyRepository;

    public LedgerWriter(
            JpaImportBatchRepository batchRepository,
            JpaLedgerActivityRepository activityRepository,
            JpaCounterpartyRepository counterpartyRepository
    ) {
        this.batchRepository = batchRepository;
        this.activityRepository = activityRepository;
        this.counterpartyRepository = counterpartyRepository;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public ImportSummary write(BatchRequest request, List<ParsedActivity> rows, CounterpartyResolver.Resolution resolution) {
        Instant now = Instant.now();
        ImportBatchEntity batch = new ImportBatchEntity(
                UUID.randomUUID(),
                request.accountId(),
                request.feedKind(),
                request.sourceFilename(),
                request.periodLabel(),
                now,
                rows.size(),
                request.draftId()
        );
        batchRepository.save(batch);

        List<LedgerActivityEntity> activities = new ArrayList<>(rows.size());
        Set<UUID> touched = new LinkedHashSet<>();
        for (ParsedActivity row : rows) {
            UUID counterpartyId = resolution.idFor(row.counterpartyKey());
            if (counterpartyId != null) {
                touched.add(counterpartyId);
            }
            activities.add(toEntity(batch, row, counterpartyId, now));
        }
        activityRepository.saveAllAndFlush(activities);

        int unmapped = touched.isEmpty() ? 0 : (int) counterpartyRepository.countUnlinked(touched);
        ImportSummary summary = new ImportSummary(
                batch.getId(),
                request.totalRows(),
                activities.size(),
                resolution.newEntities(),
                unmapped
        );
        log.info("Wrote batch {} for '{}': {} of {} rows inserted, {} new counterparties, {} unmapped",
                batch.getId(), request.sourceFilename(), summary.insertedRows(), summary.totalRows(),
                summary.newEntities(), summary.unmappedEntities());
        return summary;
    }

    private static LedgerActivityEntity toEntity(ImportBatchEntity batch, ParsedActivity row, UUID counterpartyId, Instant now) {
        LedgerActivityEntity entity = new LedgerActivityEntity();
        entity.setId(UUID.randomUUID());
        entity.setAccountId(batch.getAccountId());
        entity.setBatchId(batch.getId());
        entity.setActivityDate(row.date());
        entity.setValueDate(row.valueDate());
        entity.setDescription(row.description());
        entity.setReference(row.reference());
        entity.setCounterpartyRaw(row.counterpartyRaw());
        entity.setCounterpartyId(counterpartyId);
        entity.setDebit(row.debit());
        entity.setCredit(row.credit());
        entity.setAmount(row.amount());
        entity.setChargedAmount(row.chargedAmount());
        entity.setChargedCurrency(row.chargedCurrency());
        entity.setBalance(row.balance());
        entity.setCurrency(row.currency());
        entity.setCategoryHint(row.categoryHint());
        entity.setCreatedAt(now);
        return entity;
    }
}
