package com.tazrim.ledger.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "counterparty_category_links")
public class CounterpartyCategoryLinkEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "counterparty_id", nullable = false, unique = true)
    private UUID counterpartyId;

    @Column(name = "category_id", nullable = false)
    private UUID categoryId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // Default constructor for JPA
    public CounterpartyCategoryLinkEntity() {}

    public CounterpartyCategoryLinkEntity(UUID id, UUID counterpartyId, UUID categoryId, Instant createdAt, Instant updatedAt) {
        this.id = id;
        this.counterpartyId = counterpartyId;
        this.categoryId = categoryId;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getCounterpartyId() { return counterpartyId; }
    public void setCounterpartyId(UUID counterpartyId) { this.counterpartyId = counterpartyId; }

    public UUID getCategoryId() { return categoryId; }
    public void setCategoryId(UUID categoryId) { this.categoryId = categoryId; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
