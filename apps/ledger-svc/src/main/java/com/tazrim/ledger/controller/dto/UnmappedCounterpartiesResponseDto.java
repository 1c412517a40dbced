package com.tazrim.ledger.controller.dto;

import java.util.List;
import java.util.UUID;

public record UnmappedCounterpartiesResponseDto(List<CounterpartyDto> counterparties, String traceId) {

    public record CounterpartyDto(UUID id, String key, String displayName, Long activityCount) {
    }
}
