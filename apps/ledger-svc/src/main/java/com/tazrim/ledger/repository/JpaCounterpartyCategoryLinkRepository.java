package com.tazrim.ledger.repository;

import com.tazrim.ledger.entity.CounterpartyCategoryLinkEntity;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaCounterpartyCategoryLinkRepository extends JpaRepository<CounterpartyCategoryLinkEntity, UUID> {

    Optional<CounterpartyCategoryLinkEntity> findByCounterpartyId(UUID counterpartyId);

    List<CounterpartyCategoryLinkEntity> findByCounterpartyIdIn(Collection<UUID> counterpartyIds);
}
