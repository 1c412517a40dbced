package com.tazrim.ledger.controller.dto;

import java.time.Instant;
import java.util.UUID;

public record CounterpartyCategoryResponseDto(UUID counterpartyId, UUID categoryId, Instant updatedAt) {
}
