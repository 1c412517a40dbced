package com.tazrim.ledger.controller.dto;

import java.util.UUID;

/**
 * A null {@code categoryId} clears the manual category.
 */
public record ActivityCategoryRequestDto(UUID categoryId) {
}
