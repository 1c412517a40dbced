package com.tazrim.ledger.entity;

import com.tazrim.ledger.ingest.FeedKind;
import com.tazrim.ledger.ingest.FieldLimits;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "import_batches")
public class ImportBatchEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "feed_kind", nullable = false, length = 16)
    private FeedKind feedKind;

    @Column(name = "source_filename", nullable = false, length = FieldLimits.NAME)
    private String sourceFilename;

    @Column(name = "period_label", nullable = false, length = 7)
    private String periodLabel;

    @Column(name = "uploaded_at", nullable = false)
    private Instant uploadedAt;

    @Column(name = "row_count", nullable = false)
    private int rowCount;

    @Column(name = "draft_id")
    private UUID draftId;

    // Default constructor for JPA
    public ImportBatchEntity() {}

    public ImportBatchEntity(UUID id, UUID accountId, FeedKind feedKind, String sourceFilename,
                             String periodLabel, Instant uploadedAt, int rowCount, UUID draftId) {
        this.id = id;
        this.accountId = accountId;
        this.feedKind = feedKind;
        this.sourceFilename = sourceFilename;
        this.periodLabel = periodLabel;
        this.uploadedAt = uploadedAt;
        this.rowCount = rowCount;
        this.draftId = draftId;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getAccountId() { return accountId; }
    public void setAccountId(UUID accountId) { this.accountId = accountId; }

    public FeedKind getFeedKind() { return feedKind; }
    public void setFeedKind(FeedKind feedKind) { this.feedKind = feedKind; }

    public String getSourceFilename() { return sourceFilename; }
    public void setSourceFilename(String sourceFilename) { this.sourceFilename = sourceFilename; }

    public String getPeriodLabel() { return periodLabel; }
    public void setPeriodLabel(String periodLabel) { this.periodLabel = periodLabel; }

    public Instant getUploadedAt() { return uploadedAt; }
    public void setUploadedAt(Instant uploadedAt) { this.uploadedAt = uploadedAt; }

    public int getRowCount() { return rowCount; }
    public void setRowCount(int rowCount) { this.rowCount = rowCount; }

    public UUID getDraftId() { return draftId; }
    public void setDraftId(UUID draftId) { this.draftId = draftId; }
}
