package com.tazrim.ledger.service;

import static com.tazrim.ledger.support.LedgerTables.csv;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.tazrim.ledger.category.CategoryMapper;
import com.tazrim.ledger.entity.CategoryEntity;
import com.tazrim.ledger.entity.CounterpartyEntity;
import com.tazrim.ledger.entity.LedgerActivityEntity;
import com.tazrim.ledger.ingest.DateParseException;
import com.tazrim.ledger.ingest.FieldLimits;
import com.tazrim.ledger.ingest.FieldTooLongException;
import com.tazrim.ledger.ledger.ImportSummary;
import com.tazrim.ledger.repository.ImportBatchSummaryProjection;
import com.tazrim.ledger.repository.JpaAccountRepository;
import com.tazrim.ledger.repository.JpaCounterpartyCategoryLinkRepository;
import com.tazrim.ledger.repository.JpaCounterpartyRepository;
import com.tazrim.ledger.repository.JpaImportBatchRepository;
import com.tazrim.ledger.repository.JpaLedgerActivityRepository;
import com.tazrim.ledger.repository.UnmappedCounterpartyProjection;
import com.tazrim.ledger.support.LedgerTables;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.ApplicationContext;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;

@SpringBootTest
class StatementImportIntegrationTest {

    private static final String CARD_HEADER = "Transaction Date,Merchant,Amount,Category";

    @Autowired
    ApplicationContext context;

    @Autowired
    StatementImportService importService;

    @Autowired
    CategoryMapper categoryMapper;

    @Autowired
    JpaCounterpartyRepository counterpartyRepository;

    @SpyBean
    JpaCounterpartyCategoryLinkRepository linkRepository;

    @Autowired
    JpaImportBatchRepository batchRepository;

    @SpyBean
    JpaLedgerActivityRepository activityRepository;

    @Autowired
    JpaAccountRepository accountRepository;

    @BeforeEach
    void setUp() {
        LedgerTables.clear(context);
    }

    @Test
    void importsCardStatementAndLinksByConsensus() {
        ImportResult result = importService.importStatement(upload("jan.csv", csv(
                CARD_HEADER,
                "03/01/2024,Super-Pharm,-45.90,Groceries",
                "05/01/2024,SUPER PHARM.,-12.00,Groceries",
                "06/01/2024,Cafe Nero,,Dining"
        )));

        ImportSummary summary = result.summary();
        assertThat(summary.totalRows()).isEqualTo(3);
        assertThat(summary.insertedRows()).isEqualTo(2);
        assertThat(summary.newEntities()).isEqualTo(1);
        assertThat(summary.unmappedEntities()).isZero();
        assertThat(result.skipped()).singleElement().satisfies(skip -> assertThat(skip.rowIndex()).isEqualTo(4));

        CounterpartyEntity pharm = counterpartyRepository.findByNormalizedKey("super pharm").orElseThrow();
        assertThat(pharm.getDisplayName()).isEqualTo("Super-Pharm");
        assertThat(categoryMapper.categoryNamesFor(List.of(pharm.getId()))).containsEntry(pharm.getId(), "Groceries");
        assertThat(activityRepository.findByBatchId(summary.batchId()))
                .extracting(LedgerActivityEntity::getCounterpartyId)
                .containsOnly(pharm.getId());
        assertThat(accountRepository.findByName("Visa 1234")).isPresent();
    }

    @Test
    void conflictingHintsStayUnmappedAndAreListed() {
        ImportSummary summary = importService.importStatement(upload("feb.csv", csv(
                CARD_HEADER,
                "03/02/2024,Amazon,-20.00,Books",
                "04/02/2024,AMAZON,-35.00,Electronics"
        ))).summary();

        assertThat(summary.unmappedEntities()).isEqualTo(1);
        assertThat(linkRepository.count()).isZero();
        List<UnmappedCounterpartyProjection> unmapped = categoryMapper.listUnmapped(10);
        assertThat(unmapped).singleElement().satisfies(row -> {
            assertThat(row.normalizedKey()).isEqualTo("amazon");
            assertThat(row.activityCount()).isEqualTo(2L);
        });
        assertThat(categoryMapper.listCategories()).extracting(CategoryEntity::getName).containsExactly("Books", "Electronics");
    }

    @Test
    void laterImportsNeverRelinkOrRenameCounterparties() {
        importService.importStatement(upload("mar.csv", csv(CARD_HEADER, "03/03/2024,Cafe Nero,-15.00,Dining")));
        ImportSummary second = importService.importStatement(upload("apr.csv", csv(CARD_HEADER, "03/04/2024,CAFE-NERO,-16.00,Coffee")))
                .summary();

        CounterpartyEntity cafe = counterpartyRepository.findByNormalizedKey("cafe nero").orElseThrow();
        assertThat(second.newEntities()).isZero();
        assertThat(cafe.getDisplayName()).isEqualTo("Cafe Nero");
        assertThat(categoryMapper.categoryNamesFor(List.of(cafe.getId()))).containsEntry(cafe.getId(), "Dining");
    }

    @Test
    void sameFilenameForSameAccountIsRejected() {
        byte[] content = csv(CARD_HEADER, "03/01/2024,Shop,-10.00,");
        importService.importStatement(upload("jan.csv", content));

        assertThatThrownBy(() -> importService.importStatement(upload("jan.csv", content)))
                .isInstanceOf(DuplicateImportException.class);
        assertThat(batchRepository.count()).isEqualTo(1);
    }

    @Test
    void laterImportRacingAnEarlierLinkIsReplayedAndKeepsTheLink() {
        importService.importStatement(upload("mar.csv", csv(CARD_HEADER, "03/03/2024,Cafe Nero,-15.00,Dining")));
        // the next import reads no link, as if the first import had not committed yet
        doReturn(List.of()).doCallRealMethod().when(linkRepository).findByCounterpartyIdIn(any());

        ImportSummary second = importService.importStatement(upload("apr.csv", csv(CARD_HEADER, "03/04/2024,Cafe Nero,-16.00,Coffee")))
                .summary();

        CounterpartyEntity cafe = counterpartyRepository.findByNormalizedKey("cafe nero").orElseThrow();
        assertThat(second.insertedRows()).isEqualTo(1);
        assertThat(linkRepository.count()).isEqualTo(1);
        assertThat(categoryMapper.categoryNamesFor(List.of(cafe.getId()))).containsEntry(cafe.getId(), "Dining");
        assertThat(batchRepository.count()).isEqualTo(2);
        assertThat(activityRepository.count()).isEqualTo(2);
    }

    @Test
    void failingWriteRollsBackTheWholeBatch() {
        doThrow(new DataIntegrityViolationException("insert failed")).when(activityRepository).saveAllAndFlush(any());

        assertThatThrownBy(() -> importService.importStatement(new StatementUpload("Checking", "2024-01", "bank.csv", null, csv(
                "Date,Description,Reference,Debit,Credit,Category",
                "01/01/2024,Rent,100,5000.00,,Housing",
                "02/01/2024,Salary,101,,12000.00,Income",
                "03/01/2024,Fee,102,10.00,,Bank"
        ))))
                .isInstanceOf(DataAccessException.class);

        verify(activityRepository, times(2)).saveAllAndFlush(any());
        assertThat(batchRepository.count()).isZero();
        assertThat(activityRepository.count()).isZero();
        assertThat(linkRepository.count()).isZero();
    }

    @Test
    void overlongFieldIsRejectedBeforeAnythingIsWritten() {
        String longReference = "R".repeat(FieldLimits.REFERENCE + 1);

        assertThatThrownBy(() -> importService.importStatement(new StatementUpload("Checking", "2024-01", "bank.csv", null, csv(
                "Date,Description,Reference,Debit,Credit,Category",
                "01/01/2024,Rent,100,5000.00,,Housing",
                "03/01/2024,Fee,\"" + longReference + "\",10.00,,Bank"
        ))))
                .isInstanceOf(FieldTooLongException.class)
                .satisfies(ex -> assertThat(((FieldTooLongException) ex).getRowIndex()).isEqualTo(3));

        assertThat(accountRepository.count()).isZero();
        assertThat(batchRepository.count()).isZero();
        assertThat(activityRepository.count()).isZero();
    }

    @Test
    void parseErrorWritesNothing() {
        assertThatThrownBy(() -> importService.importStatement(upload("bad.csv", csv(
                CARD_HEADER,
                "03/01/2024,Shop,-10.00,",
                "not-a-date,Shop,-11.00,"
        ))))
                .isInstanceOf(DateParseException.class);

        assertThat(accountRepository.count()).isZero();
        assertThat(counterpartyRepository.count()).isZero();
        assertThat(batchRepository.count()).isZero();
    }

    @Test
    void listsAndDeletesBatches() {
        UUID batchId = importService.importStatement(upload("may.csv", csv(
                CARD_HEADER,
                "03/05/2024,Shop,-10.00,",
                "04/05/2024,Shop,-11.00,"
        ))).summary().batchId();

        List<ImportBatchSummaryProjection> batches = importService.listBatches(10);
        assertThat(batches).singleElement().satisfies(batch -> {
            assertThat(batch.id()).isEqualTo(batchId);
            assertThat(batch.accountName()).isEqualTo("Visa 1234");
            assertThat(batch.activityCount()).isEqualTo(2L);
        });

        assertThat(importService.deleteBatch(batchId)).isEqualTo(2);
        assertThat(batchRepository.count()).isZero();
        assertThat(activityRepository.count()).isZero();
        assertThatThrownBy(() -> importService.deleteBatch(batchId)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void manualActivityCategoryCanBeSetAndCleared() {
        UUID batchId = importService.importStatement(upload("jun.csv", csv(CARD_HEADER, "03/06/2024,Shop,-10.00,Misc")))
                .summary().batchId();
        LedgerActivityEntity activity = activityRepository.findByBatchId(batchId).get(0);
        CategoryEntity misc = categoryMapper.listCategories().get(0);

        assertThat(importService.setActivityCategory(activity.getId(), misc.getId()).getManualCategoryId()).isEqualTo(misc.getId());
        assertThat(importService.setActivityCategory(activity.getId(), null).getManualCategoryId()).isNull();
        assertThatThrownBy(() -> importService.setActivityCategory(activity.getId(), UUID.randomUUID()))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void periodLabelMustBeYearMonth() {
        assertThatThrownBy(() -> upload("x.csv", csv(CARD_HEADER), "January"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static StatementUpload upload(String filename, byte[] content) {
        return upload(filename, content, "2024-01");
    }

    private static StatementUpload upload(String filename, byte[] content, String period) {
        return new StatementUpload("Visa 1234", period, filename, null, content);
    }
}
