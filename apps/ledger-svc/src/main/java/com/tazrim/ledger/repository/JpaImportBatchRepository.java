package com.tazrim.ledger.repository;

import com.tazrim.ledger.entity.ImportBatchEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaImportBatchRepository extends JpaRepository<ImportBatchEntity, UUID> {

    boolean existsByAccountIdAndSourceFilename(UUID accountId, String sourceFilename);

    @Query("""
            SELECT new com.tazrim.ledger.repository.ImportBatchSummaryProjection(
                b.id, b.accountId, acc.name, b.feedKind, b.sourceFilename, b.periodLabel, b.uploadedAt, b.rowCount,
                (SELECT COUNT(a) FROM LedgerActivityEntity a WHERE a.batchId = b.id))
            FROM ImportBatchEntity b, AccountEntity acc
            WHERE acc.id = b.accountId
            ORDER BY b.uploadedAt DESC
            """)
    List<ImportBatchSummaryProjection> findRecent(Pageable pageable);
}
