package com.tazrim.ledger.repository;

import com.tazrim.ledger.entity.CounterpartyEntity;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaCounterpartyRepository extends JpaRepository<CounterpartyEntity, UUID> {

    Optional<CounterpartyEntity> findByNormalizedKey(String normalizedKey);

    List<CounterpartyEntity> findByNormalizedKeyIn(Collection<String> normalizedKeys);

    @Query("""
            SELECT new com.tazrim.ledger.repository.UnmappedCounterpartyProjection(c.id, c.normalizedKey, c.displayName, COUNT(a))
            FROM CounterpartyEntity c, LedgerActivityEntity a
            WHERE a.counterpartyId = c.id
              AND NOT EXISTS (SELECT l.id FROM CounterpartyCategoryLinkEntity l WHERE l.counterpartyId = c.id)
            GROUP BY c.id, c.normalizedKey, c.displayName
            ORDER BY COUNT(a) DESC, c.displayName ASC
            """)
    List<UnmappedCounterpartyProjection> findUnmapped(Pageable pageable);

    @Query("""
            SELECT COUNT(c) FROM CounterpartyEntity c
            WHERE c.id IN :ids
              AND NOT EXISTS (SELECT l.id FROM CounterpartyCategoryLinkEntity l WHERE l.counterpartyId = c.id)
            """)
    long countUnlinked(@Param("ids") Collection<UUID> ids);
}
