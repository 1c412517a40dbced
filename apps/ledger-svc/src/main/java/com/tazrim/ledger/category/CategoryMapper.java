package com.tazrim.ledger.category;

import com.tazrim.ledger.entity.CategoryEntity;
import com.tazrim.ledger.entity.CounterpartyCategoryLinkEntity;
import com.tazrim.ledger.ingest.FieldLimits;
import com.tazrim.ledger.ingest.ParsedActivity;
import com.tazrim.ledger.repository.JpaCategoryRepository;
import com.tazrim.ledger.repository.JpaCounterpartyCategoryLinkRepository;
import com.tazrim.ledger.repository.JpaCounterpartyRepository;
import com.tazrim.ledger.repository.UnmappedCounterpartyProjection;
import com.tazrim.ledger.service.NotFoundException;
import java.time.Instant;
import java.util.ArrayList;
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
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Owns categories and counterparty to category links: on-demand category creation, the batch
 * consensus rule, and manual assignment.
 */
@Component
public class CategoryMapper {

    private static final Logger log = LoggerFactory.getLogger(CategoryMapper.class);

    private final JpaCategoryRepository categoryRepository;
    private final JpaCounterpartyCategoryLinkRepository linkRepository;
    private final JpaCounterpartyRepository counterpartyRepository;
    private final TransactionOperations requiresNew;

    @Autowired
    public CategoryMapper(
            JpaCategoryRepository categoryRepository,
            JpaCounterpartyCategoryLinkRepository linkRepository,
            JpaCounterpartyRepository counterpartyRepository,
            PlatformTransactionManager transactionManager
    ) {
        this(categoryRepository, linkRepository, counterpartyRepository, requiresNew(transactionManager));
    }

    CategoryMapper(
            JpaCategoryRepository categoryRepository,
            JpaCounterpartyCategoryLinkRepository linkRepository,
            JpaCounterpartyRepository counterpartyRepository,
            TransactionOperations requiresNew
    ) {
        this.categoryRepository = categoryRepository;
        this.linkRepository = linkRepository;
        this.counterpartyRepository = counterpartyRepository;
        this.requiresNew = requiresNew;
    }

    /**
     * Distinct non-blank hints per counterparty id, in row order.
     */
    public static Map<UUID, Set<String>> hintsByCounterparty(List<ParsedActivity> rows, Map<String, UUID> idsByKey) {
        Map<UUID, Set<String>> hints = new LinkedHashMap<>();
        for (ParsedActivity row : rows) {
            UUID counterpartyId = idsByKey.get(row.counterpartyKey());
            if (counterpartyId == null) {
                continue;
            }
            Set<String> distinct = hints.computeIfAbsent(counterpartyId, id -> new LinkedHashSet<>());
            String hint = normalizeName(row.categoryHint());
            if (hint != null) {
                distinct.add(hint);
            }
        }
        return hints;
    }

    /**
     * Finds or creates a category for every non-blank name. Returns a name to category snapshot.
     */
    public Map<String, CategoryEntity> ensureCategories(Collection<String> names) {
        Set<String> wanted = new LinkedHashSet<>();
        for (String name : names) {
            String normalized = normalizeName(name);
            if (normalized != null) {
                wanted.add(normalized);
            }
        }
        if (wanted.isEmpty()) {
            return Map.of();
        }
        Map<String, CategoryEntity> byName = new HashMap<>();
        for (CategoryEntity category : categoryRepository.findByNameIn(wanted)) {
            byName.put(category.getName(), category);
        }
        for (String name : wanted) {
            if (!byName.containsKey(name)) {
                byName.put(name, createOrReread(name));
            }
        }
        return byName;
    }

    /**
     * Links each counterparty that has no link yet and exactly one distinct hint in this batch.
     *
     * @return number of links created
     */
    public int applyConsensus(Map<UUID, Set<String>> hintsByCounterparty, Map<String, CategoryEntity> categories) {
        if (hintsByCounterparty.isEmpty()) {
            return 0;
        }
        Set<UUID> alreadyLinked = new LinkedHashSet<>();
        for (CounterpartyCategoryLinkEntity link : linkRepository.findByCounterpartyIdIn(hintsByCounterparty.keySet())) {
            alreadyLinked.add(link.getCounterpartyId());
        }

        Instant now = Instant.now();
        List<CounterpartyCategoryLinkEntity> created = new ArrayList<>();
        for (Map.Entry<UUID, Set<String>> entry : hintsByCounterparty.entrySet()) {
            if (alreadyLinked.contains(entry.getKey()) || entry.getValue().size() != 1) {
                continue;
            }
            String hint = entry.getValue().iterator().next();
            CategoryEntity category = categories.get(hint);
            if (category == null) {
                throw new IllegalStateException("Category snapshot is missing '" + hint + "'");
            }
            created.add(new CounterpartyCategoryLinkEntity(UUID.randomUUID(), entry.getKey(), category.getId(), now, now));
        }
        if (!created.isEmpty()) {
            linkRepository.saveAll(created);
            log.debug("Consensus linked {} counterparties", created.size());
        }
        return created.size();
    }

    @Transactional
    public CounterpartyCategoryLinkEntity assignCategory(UUID counterpartyId, UUID categoryId) {
        if (!counterpartyRepository.existsById(counterpartyId)) {
            throw new NotFoundException("Counterparty", counterpartyId);
        }
        if (!categoryRepository.existsById(categoryId)) {
            throw new NotFoundException("Category", categoryId);
        }
        Instant now = Instant.now();
        CounterpartyCategoryLinkEntity link = linkRepository.findByCounterpartyId(counterpartyId)
                .orElseGet(() -> new CounterpartyCategoryLinkEntity(UUID.randomUUID(), counterpartyId, categoryId, now, now));
        link.setCategoryId(categoryId);
        link.setUpdatedAt(now);
        log.info("Counterparty {} assigned to category {}", counterpartyId, categoryId);
        return linkRepository.save(link);
    }

    @Transactional
    public CounterpartyCategoryLinkEntity assignCategory(UUID counterpartyId, String categoryName) {
        String name = normalizeName(categoryName);
        if (name == null) {
            throw new IllegalArgumentException("categoryName must not be blank");
        }
        if (name.length() > FieldLimits.CATEGORY) {
            throw new IllegalArgumentException("categoryName must be at most " + FieldLimits.CATEGORY + " characters");
        }
        if (!counterpartyRepository.existsById(counterpartyId)) {
            throw new NotFoundException("Counterparty", counterpartyId);
        }
        CategoryEntity category = ensureCategories(List.of(name)).get(name);
        return assignCategory(counterpartyId, category.getId());
    }

    /**
     * Category name currently linked to each counterparty; counterparties without a link are absent.
     */
    public Map<UUID, String> categoryNamesFor(Collection<UUID> counterpartyIds) {
        if (counterpartyIds.isEmpty()) {
            return Map.of();
        }
        List<CounterpartyCategoryLinkEntity> links = linkRepository.findByCounterpartyIdIn(counterpartyIds);
        Set<UUID> categoryIds = new LinkedHashSet<>();
        links.forEach(link -> categoryIds.add(link.getCategoryId()));
        Map<UUID, String> namesById = new HashMap<>();
        categoryRepository.findAllById(categoryIds).forEach(category -> namesById.put(category.getId(), category.getName()));

        Map<UUID, String> result = new HashMap<>();
        for (CounterpartyCategoryLinkEntity link : links) {
            String name = namesById.get(link.getCategoryId());
            if (name != null) {
                result.put(link.getCounterpartyId(), name);
            }
        }
        return result;
    }

    /**
     * Counterparties without a link, most frequent first.
     */
    @Transactional(readOnly = true)
    public List<UnmappedCounterpartyProjection> listUnmapped(int limit) {
        return counterpartyRepository.findUnmapped(PageRequest.of(0, Math.max(1, limit)));
    }

    @Transactional(readOnly = true)
    public List<CategoryEntity> listCategories() {
        return categoryRepository.findAllByOrderByNameAsc();
    }

    static String normalizeName(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private CategoryEntity createOrReread(String name) {
        try {
            return requiresNew.execute(status -> categoryRepository.saveAndFlush(
                    new CategoryEntity(UUID.randomUUID(), name, Instant.now())
            ));
        } catch (DataIntegrityViolationException ex) {
            log.debug("Category '{}' was created concurrently, re-reading", name);
            return categoryRepository.findByName(name).orElseThrow(() -> ex);
        }
    }

    private static TransactionOperations requiresNew(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return template;
    }
}
