package com.tazrim.ledger.draft;

import com.tazrim.ledger.entity.ImportDraftEntity;
import com.tazrim.ledger.ingest.FeedKind;
import java.time.Instant;
import java.util.UUID;

public record DraftView(
        UUID id,
        UUID accountId,
        FeedKind feedKind,
        String sourceFilename,
        String periodLabel,
        DraftStatus status,
        int rowCount,
        int skippedRows,
        Instant createdAt,
        UUID committedBatchId
) {

    public static DraftView of(ImportDraftEntity draft) {
        return new DraftView(
                draft.getId(),
                draft.getAccountId(),
                draft.getFeedKind(),
                draft.getSourceFilename(),
                draft.getPeriodLabel(),
                draft.getStatus(),
                draft.getRowCount(),
                draft.getSkippedRows(),
                draft.getCreatedAt(),
                draft.getCommittedBatchId()
        );
    }
}
