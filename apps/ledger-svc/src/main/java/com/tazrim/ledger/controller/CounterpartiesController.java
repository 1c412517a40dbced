package com.tazrim.ledger.controller;

import com.tazrim.ledger.category.CategoryMapper;
import com.tazrim.ledger.controller.dto.CounterpartyCategoryRequestDto;
import com.tazrim.ledger.controller.dto.CounterpartyCategoryResponseDto;
import com.tazrim.ledger.controller.dto.UnmappedCounterpartiesResponseDto;
import com.tazrim.ledger.controller.dto.UnmappedCounterpartiesResponseDto.CounterpartyDto;
import com.tazrim.ledger.entity.CounterpartyCategoryLinkEntity;
import com.tazrim.ledger.web.RequestContextHolder;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/counterparties")
public class CounterpartiesController {

    private final CategoryMapper categoryMapper;

    public CounterpartiesController(CategoryMapper categoryMapper) {
        this.categoryMapper = categoryMapper;
    }

    @GetMapping("/unmapped")
    public ResponseEntity<UnmappedCounterpartiesResponseDto> listUnmapped(
            @RequestParam(value = "limit", required = false, defaultValue = "50") Integer limit
    ) {
        int safeLimit = limit == null ? 50 : Math.min(500, Math.max(1, limit));
        var counterparties = categoryMapper.listUnmapped(safeLimit).stream()
                .map(row -> new CounterpartyDto(row.id(), row.normalizedKey(), row.displayName(), row.activityCount()))
                .toList();
        return ResponseEntity.ok(new UnmappedCounterpartiesResponseDto(counterparties, RequestContextHolder.traceId().orElse(null)));
    }

    @PutMapping("/{counterpartyId}/category")
    public ResponseEntity<CounterpartyCategoryResponseDto> assignCategory(
            @PathVariable("counterpartyId") UUID counterpartyId,
            @RequestBody @Valid CounterpartyCategoryRequestDto request
    ) {
        CounterpartyCategoryLinkEntity link;
        if (request.categoryId() != null) {
            link = categoryMapper.assignCategory(counterpartyId, request.categoryId());
        } else if (request.categoryName() != null) {
            link = categoryMapper.assignCategory(counterpartyId, request.categoryName());
        } else {
            throw new IllegalArgumentException("categoryId or categoryName must be provided");
        }
        return ResponseEntity.ok(new CounterpartyCategoryResponseDto(link.getCounterpartyId(), link.getCategoryId(), link.getUpdatedAt()));
    }
}
