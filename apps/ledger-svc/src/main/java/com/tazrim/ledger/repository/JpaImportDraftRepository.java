package com.tazrim.ledger.repository;

import com.tazrim.ledger.draft.DraftStatus;
import com.tazrim.ledger.entity.ImportDraftEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaImportDraftRepository extends JpaRepository<ImportDraftEntity, UUID> {

    List<ImportDraftEntity> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<ImportDraftEntity> findByStatusOrderByCreatedAtDesc(DraftStatus status, Pageable pageable);
}
