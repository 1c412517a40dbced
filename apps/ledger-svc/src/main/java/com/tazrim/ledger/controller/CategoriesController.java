package com.tazrim.ledger.controller;

import com.tazrim.ledger.category.CategoryMapper;
import com.tazrim.ledger.controller.dto.CategoriesListResponseDto;
import com.tazrim.ledger.controller.dto.CategoriesListResponseDto.CategoryDto;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/categories")
public class CategoriesController {

    private final CategoryMapper categoryMapper;

    public CategoriesController(CategoryMapper categoryMapper) {
        this.categoryMapper = categoryMapper;
    }

    @GetMapping
    public ResponseEntity<CategoriesListResponseDto> listCategories() {
        var categories = categoryMapper.listCategories().stream()
                .map(category -> new CategoryDto(category.getId(), category.getName()))
                .toList();
        return ResponseEntity.ok(new CategoriesListResponseDto(categories));
    }
}
