package com.tazrim.ledger.counterparty;

import com.tazrim.ledger.entity.CounterpartyEntity;
import com.tazrim.ledger.ingest.ParsedActivity;
import com.tazrim.ledger.repository.JpaCounterpartyRepository;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Maps counterparty keys of a batch onto persisted counterparties, creating the missing ones.
 * Creation commits in its own transaction so a concurrent importer that wins the unique key
 * race is picked up by re-reading the key.
 */
@Component
public class CounterpartyResolver {

    private static final Logger log = LoggerFactory.getLogger(CounterpartyResolver.class);

    private final JpaCounterpartyRepository counterpartyRepository;
    private final TransactionOperations requiresNew;

    @Autowired
    public CounterpartyResolver(JpaCounterpartyRepository counterpartyRepository, PlatformTransactionManager transactionManager) {
        this(counterpartyRepository, requiresNew(transactionManager));
    }

    CounterpartyResolver(JpaCounterpartyRepository counterpartyRepository, TransactionOperations requiresNew) {
        this.counterpartyRepository = counterpartyRepository;
        this.requiresNew = requiresNew;
    }

    public Resolution resolve(List<ParsedActivity> rows) {
        Map<String, String> firstRawByKey = new LinkedHashMap<>();
        for (ParsedActivity row : rows) {
            firstRawByKey.putIfAbsent(row.counterpartyKey(), row.counterpartyRaw());
        }

        Map<String, UUID> idsByKey = new HashMap<>(lookup(firstRawByKey.keySet()));
        Set<String> createdKeys = new LinkedHashSet<>();
        for (Map.Entry<String, String> entry : firstRawByKey.entrySet()) {
            if (idsByKey.containsKey(entry.getKey())) {
                continue;
            }
            Created created = createOrReread(entry.getKey(), entry.getValue());
            idsByKey.put(entry.getKey(), created.id());
            if (created.inserted()) {
                createdKeys.add(entry.getKey());
            }
        }
        if (!createdKeys.isEmpty()) {
            log.info("Created {} new counterparties ({} keys resolved)", createdKeys.size(), idsByKey.size());
        }
        return new Resolution(Map.copyOf(idsByKey), Set.copyOf(createdKeys));
    }

    /**
     * Read-only variant: ids of the keys that already exist, nothing is created.
     */
    public Map<String, UUID> lookup(Collection<String> keys) {
        if (keys.isEmpty()) {
            return Map.of();
        }
        Map<String, UUID> idsByKey = new HashMap<>();
        for (CounterpartyEntity entity : counterpartyRepository.findByNormalizedKeyIn(Set.copyOf(keys))) {
            idsByKey.put(entity.getNormalizedKey(), entity.getId());
        }
        return idsByKey;
    }

    private Created createOrReread(String key, String displayName) {
        try {
            UUID id = requiresNew.execute(status -> counterpartyRepository.saveAndFlush(
                    new CounterpartyEntity(UUID.randomUUID(), key, displayName, Instant.now())
            ).getId());
            return new Created(id, true);
        } catch (DataIntegrityViolationException ex) {
            log.debug("Counterparty '{}' was created concurrently, re-reading", key);
            UUID id = counterpartyRepository.findByNormalizedKey(key)
                    .map(CounterpartyEntity::getId)
                    .orElseThrow(() -> ex);
            return new Created(id, false);
        }
    }

    static TransactionOperations requiresNew(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return template;
    }

    private record Created(UUID id, boolean inserted) {
    }

    /**
     * Snapshot of counterparty ids for one batch, keyed by normalized key.
     */
    public record Resolution(Map<String, UUID> idsByKey, Set<String> createdKeys) {

        public UUID idFor(String key) {
            return idsByKey.get(key);
        }

        public int newEntities() {
            return createdKeys.size();
        }
    }
}
