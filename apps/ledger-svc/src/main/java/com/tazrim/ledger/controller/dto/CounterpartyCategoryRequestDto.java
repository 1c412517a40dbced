package com.tazrim.ledger.controller.dto;

import jakarta.validation.constraints.Size;
import java.util.UUID;

public record CounterpartyCategoryRequestDto(
        UUID categoryId,
        @Size(min = 1, max = 200) String categoryName
) {
}
