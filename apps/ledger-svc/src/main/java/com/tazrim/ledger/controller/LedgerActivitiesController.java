package com.tazrim.ledger.controller;

import com.tazrim.ledger.controller.dto.ActivityCategoryRequestDto;
import com.tazrim.ledger.controller.dto.ActivityResponseDto;
import com.tazrim.ledger.entity.LedgerActivityEntity;
import com.tazrim.ledger.service.StatementImportService;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/activities")
public class LedgerActivitiesController {

    private final StatementImportService statementImportService;

    public LedgerActivitiesController(StatementImportService statementImportService) {
        this.statementImportService = statementImportService;
    }

    @PatchMapping("/{activityId}/category")
    public ResponseEntity<ActivityResponseDto> setCategory(
            @PathVariable("activityId") UUID activityId,
            @RequestBody ActivityCategoryRequestDto request
    ) {
        LedgerActivityEntity activity = statementImportService.setActivityCategory(activityId, request.categoryId());
        return ResponseEntity.ok(new ActivityResponseDto(
                activity.getId(),
                activity.getBatchId(),
                activity.getActivityDate(),
                activity.getDescription(),
                activity.getCounterpartyId(),
                activity.getDebit(),
                activity.getCredit(),
                activity.getAmount(),
                activity.getCurrency(),
                activity.getManualCategoryId()
        ));
    }
}
