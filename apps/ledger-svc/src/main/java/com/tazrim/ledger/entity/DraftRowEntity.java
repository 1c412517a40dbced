package com.tazrim.ledger.entity;

import com.tazrim.ledger.ingest.FieldLimits;
import com.tazrim.ledger.ingest.ParsedActivity;
import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "import_draft_rows")
public class DraftRowEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "draft_id", nullable = false)
    private UUID draftId;

    @Column(name = "row_index", nullable = false)
    private int rowIndex;

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

    @Column(name = "counterparty_key", nullable = false, length = FieldLimits.COUNTERPARTY_KEY)
    private String counterpartyKey;

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

    @Column(name = "suggested_category", length = FieldLimits.CATEGORY)
    private String suggestedCategoryText;

    @Column(name = "approved_category", length = FieldLimits.CATEGORY)
    private String approvedCategoryText;

    // Default constructor for JPA
    public DraftRowEntity() {}

    public static DraftRowEntity from(UUID draftId, ParsedActivity activity, String suggestedCategoryText) {
        DraftRowEntity row = new DraftRowEntity();
        row.id = UUID.randomUUID();
        row.draftId = draftId;
        row.rowIndex = activity.rowIndex();
        row.activityDate = activity.date();
        row.valueDate = activity.valueDate();
        row.description = activity.description();
        row.reference = activity.reference();
        row.counterpartyRaw = activity.counterpartyRaw();
        row.counterpartyKey = activity.counterpartyKey();
        row.debit = activity.debit();
        row.credit = activity.credit();
        row.amount = activity.amount();
        row.chargedAmount = activity.chargedAmount();
        row.chargedCurrency = activity.chargedCurrency();
        row.balance = activity.balance();
        row.currency = activity.currency();
        row.categoryHint = activity.categoryHint();
        row.suggestedCategoryText = suggestedCategoryText;
        return row;
    }

    public ParsedActivity toActivity() {
        return new ParsedActivity(
                rowIndex,
                activityDate,
                valueDate,
                description,
                reference,
                debit,
                credit,
                amount,
                chargedAmount,
                chargedCurrency,
                balance,
                currency,
                categoryHint,
                counterpartyRaw,
                counterpartyKey
        );
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getDraftId() { return draftId; }
    public void setDraftId(UUID draftId) { this.draftId = draftId; }

    public int getRowIndex() { return rowIndex; }
    public void setRowIndex(int rowIndex) { this.rowIndex = rowIndex; }

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

    public String getCounterpartyKey() { return counterpartyKey; }
    public void setCounterpartyKey(String counterpartyKey) { this.counterpartyKey = counterpartyKey; }

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

    public String getSuggestedCategoryText() { return suggestedCategoryText; }
    public void setSuggestedCategoryText(String suggestedCategoryText) { this.suggestedCategoryText = suggestedCategoryText; }

    public String getApprovedCategoryText() { return approvedCategoryText; }
    public void setApprovedCategoryText(String approvedCategoryText) { this.approvedCategoryText = approvedCategoryText; }
}
