package com.tazrim.ledger.controller.dto;

import jakarta.validation.constraints.Size;

/**
 * {@code category} null or blank clears the approval.
 */
public record DraftRowApprovalRequestDto(
        @Size(max = 200) String category
) {
}
