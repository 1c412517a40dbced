package com.tazrim.ledger.repository;

import com.tazrim.ledger.entity.LedgerActivityEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaLedgerActivityRepository extends JpaRepository<LedgerActivityEntity, UUID> {

    @Query("SELECT a FROM LedgerActivityEntity a WHERE a.batchId = :batchId ORDER BY a.activityDate ASC")
    List<LedgerActivityEntity> findByBatchId(@Param("batchId") UUID batchId);

    long countByBatchId(UUID batchId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM LedgerActivityEntity a WHERE a.batchId = :batchId")
    int deleteByBatchId(@Param("batchId") UUID batchId);
}
