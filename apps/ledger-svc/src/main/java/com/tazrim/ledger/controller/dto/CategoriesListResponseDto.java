package com.tazrim.ledger.controller.dto;

import java.util.List;
import java.util.UUID;

public record CategoriesListResponseDto(List<CategoryDto> categories) {

    public record CategoryDto(UUID id, String name) {
    }
}
