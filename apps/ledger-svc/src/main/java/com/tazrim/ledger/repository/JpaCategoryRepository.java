package com.tazrim.ledger.repository;

import com.tazrim.ledger.entity.CategoryEntity;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaCategoryRepository extends JpaRepository<CategoryEntity, UUID> {

    Optional<CategoryEntity> findByName(String name);

    List<CategoryEntity> findByNameIn(Collection<String> names);

    List<CategoryEntity> findAllByOrderByNameAsc();
}
