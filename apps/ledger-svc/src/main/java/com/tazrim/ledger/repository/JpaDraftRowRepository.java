package com.tazrim.ledger.repository;

import com.tazrim.ledger.entity.DraftRowEntity;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaDraftRowRepository extends JpaRepository<DraftRowEntity, UUID> {

    @Query("SELECT r FROM DraftRowEntity r WHERE r.draftId = :draftId ORDER BY r.rowIndex ASC")
    List<DraftRowEntity> findByDraftId(@Param("draftId") UUID draftId);

    @Query(value = "SELECT r FROM DraftRowEntity r WHERE r.draftId = :draftId ORDER BY r.rowIndex ASC",
            countQuery = "SELECT COUNT(r) FROM DraftRowEntity r WHERE r.draftId = :draftId")
    Page<DraftRowEntity> findPageByDraftId(@Param("draftId") UUID draftId, Pageable pageable);

    Optional<DraftRowEntity> findByIdAndDraftId(UUID id, UUID draftId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM DraftRowEntity r WHERE r.draftId = :draftId")
    int deleteByDraftId(@Param("draftId") UUID draftId);
}
