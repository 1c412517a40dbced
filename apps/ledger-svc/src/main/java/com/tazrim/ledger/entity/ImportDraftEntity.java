package com.tazrim.ledger.entity;

import com.tazrim.ledger.draft.DraftStatus;
import com.tazrim.ledger.ingest.FeedKind;
import com.tazrim.ledger.ingest.FieldLimits;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "import_drafts")
public class ImportDraftEntity {
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

    @Column(name = "row_count", nullable = false)
    private int rowCount;

    @Column(name = "skipped_rows", nullable = false)
    private int skippedRows;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private DraftStatus status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "committed_batch_id")
    private UUID committedBatchId;

    // Default constructor for JPA
    public ImportDraftEntity() {}

    public ImportDraftEntity(UUID id, UUID accountId, FeedKind feedKind, String sourceFilename, String periodLabel,
                             int rowCount, int skippedRows, DraftStatus status, Instant createdAt) {
        this.id = id;
        this.accountId = accountId;
        this.feedKind = feedKind;
        this.sourceFilename = sourceFilename;
        this.periodLabel = periodLabel;
        this.rowCount = rowCount;
        this.skippedRows = skippedRows;
        this.status = status;
        this.createdAt = createdAt;
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

    public int getRowCount() { return rowCount; }
    public void setRowCount(int rowCount) { this.rowCount = rowCount; }

    public int getSkippedRows() { return skippedRows; }
    public void setSkippedRows(int skippedRows) { this.skippedRows = skippedRows; }

    public DraftStatus getStatus() { return status; }
    public void setStatus(DraftStatus status) { this.status = status; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public UUID getCommittedBatchId() { return committedBatchId; }
    public void setCommittedBatchId(UUID committedBatchId) { this.committedBatchId = committedBatchId; }
}
