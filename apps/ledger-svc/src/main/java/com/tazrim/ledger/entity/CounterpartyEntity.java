package com.tazrim.ledger.entity;

import com.tazrim.ledger.ingest.FieldLimits;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "counterparties")
public class CounterpartyEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "normalized_key", nullable = false, unique = true, length = FieldLimits.COUNTERPARTY_KEY)
    private String normalizedKey;

    @Column(name = "display_name", nullable = false, length = FieldLimits.COUNTERPARTY)
    private String displayName;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    // Default constructor for JPA
    public CounterpartyEntity() {}

    public CounterpartyEntity(UUID id, String normalizedKey, String displayName, Instant createdAt) {
        this.id = id;
        this.normalizedKey = normalizedKey;
        this.displayName = displayName;
        this.createdAt = createdAt;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getNormalizedKey() { return normalizedKey; }
    public void setNormalizedKey(String normalizedKey) { this.normalizedKey = normalizedKey; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
