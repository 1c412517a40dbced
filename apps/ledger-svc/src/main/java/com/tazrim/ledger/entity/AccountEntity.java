package com.tazrim.ledger.entity;

import com.tazrim.ledger.ingest.FeedKind;
import com.tazrim.ledger.ingest.FieldLimits;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "accounts")
public class AccountEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "name", nullable = false, unique = true, length = FieldLimits.NAME)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "feed_kind", nullable = false, length = 16)
    private FeedKind feedKind;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    // Default constructor for JPA
    public AccountEntity() {}

    public AccountEntity(UUID id, String name, FeedKind feedKind, String currency, Instant createdAt) {
        this.id = id;
        this.name = name;
        this.feedKind = feedKind;
        this.currency = currency;
        this.createdAt = createdAt;
    }

    // Getters and setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public FeedKind getFeedKind() { return feedKind; }
    public void setFeedKind(FeedKind feedKind) { this.feedKind = feedKind; }

    public String getCurrency() { return currency; }
    public void setCurrency(String currency) { this.currency = currency; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
