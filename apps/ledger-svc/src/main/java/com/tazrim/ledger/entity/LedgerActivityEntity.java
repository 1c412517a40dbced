package com.tazrim.ledger.entity;

import com.tazrim.ledger.ingest.FieldLimits;
import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "ledger_activities")
public class LedgerActivityEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Column(name = "batch_id", nullable = false)
    private UUID batchId;

    @Column(name = "activity_date", nullable = false)
    private LocalDate activityDate;

    @Column(name = "value_date")
    private LocalDate valueDate;

    @Column(name = "description", nullable = false, length = FieldLimits.DESCRIPTION)
    private String description;

    @Column(name = "reference", length = FieldLimits.REFERENCE)
    private String reference;

    @Column(name = "counterparty_raw", nullable = false, length = FieldLimits.COUNTERPARTY)
    private String counterpartyRaw;

    @Column(name = "counterparty_id")
    private UUID counterpartyId;

    @Column(name = "debit", precision = 19, scale = 4)
    private BigDecimal debit;

    @Column(name = "credit", precision = 19, scale = 4)
    private BigDecimal credit;

    @Column(name = "amount", precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "charged_amount", precision = 19, scale = 4)
    private BigDecimal chargedAmount;

    @Column(name = "charged_currency", length = 3)
    private String chargedCurrency;

    @Column(name = "balance", precision = 19, scale = 4)
    private BigDecimal balance;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "category_hint", length = FieldLimits.CATEGORY)
    private String categoryHint;

    @Column(name = "manual_category_id")
    private UUID manualCategoryId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    // Default constructor for JPA
    public LedgerActivityEntity() {}

    // Getters and setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getAccountId() { return accountId; }
    public void setAccountId(UUID accountId) { this.accountId = accountId; }

    public UUID getBatchId() { return batchId; }
    public void setBatchId(UUID batchId) { this.batchId = batchId; }

    public LocalDate getActivityDate() { return activityDate; }
    public void setActivityDate(LocalDate activityDate) { this.activityDate = activityDate; }

    public LocalDate getValueDate() { return valueDate; }
    public void setValueDate(LocalDate valueDate) { this.valueDate = valueDate; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getReference() { return reference; }
    public void setReference(String reference) { this.reference = reference; }

    public String getCounterpartyRaw() { return counterpartyRaw; }
    public void setCounterpartyRaw(String counterpartyRaw) { this.counterpartyRaw = counterpartyRaw; }

    public UUID getCounterpartyId() { return counterpartyId; }
    public void setCounterpartyId(UUID counterpartyId) { this.counterpartyId = counterpartyId; }

    public BigDecimal getDebit() { return debit; }
    public void setDebit(BigDecimal debit) { this.debit = debit; }

    public BigDecimal getCredit() { return credit; }
    public void setCredit(BigDecimal credit) { this.credit = credit; }

    public BigDecimal getAmount() { return amount; }
    public void setAmount(BigDecimal amount) { this.amount = amount; }

    public BigDecimal getChargedAmount() { return chargedAmount; }
    public void setChargedAmount(BigDecimal chargedAmount) { this.chargedAmount = chargedAmount; }

    public String getChargedCurrency() { return chargedCurrency; }
    public void setChargedCurrency(String chargedCurrency) { this.chargedCurrency = chargedCurrency; }

    public BigDecimal getBalance() { return balance; }
    public void setBalance(BigDecimal balance) { this.balance = balance; }

    public String getCurrency() { return currency; }
    public void setCurrency(String currency) { this.currency = currency; }

    public String getCategoryHint() { return categoryHint; }
    public void setCategoryHint(String categoryHint) { this.categoryHint = categoryHint; }

    public UUID getManualCategoryId() { return manualCategoryId; }
    public void setManualCategoryId(UUID manualCategoryId) { this.manualCategoryId = manualCategoryId; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
