package com.tazrim.ledger.draft;

import java.util.UUID;

/**
 * Raised for any review, commit or discard attempt on a draft that is no longer pending.
 */
public class DraftStateException extends RuntimeException {

    private final UUID draftId;
    private final DraftStatus status;

    public DraftStateException(UUID draftId, DraftStatus status, String action) {
        super("Cannot " + action + " draft " + draftId + " in status " + status);
        this.draftId = draftId;
        this.status = status;
    }

    public UUID getDraftId() {
        return draftId;
    }

    public DraftStatus getStatus() {
        return status;
    }
}
