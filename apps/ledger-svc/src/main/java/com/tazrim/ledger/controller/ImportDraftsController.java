package com.tazrim.ledger.controller;

import com.tazrim.ledger.controller.dto.DraftCreatedResponseDto;
import com.tazrim.ledger.controller.dto.DraftDetailResponseDto;
import com.tazrim.ledger.controller.dto.DraftResponseDto;
import com.tazrim.ledger.controller.dto.DraftRowApprovalRequestDto;
import com.tazrim.ledger.controller.dto.DraftRowResponseDto;
import com.tazrim.ledger.controller.dto.DraftsListResponseDto;
import com.tazrim.ledger.controller.dto.ImportSummaryResponseDto;
import com.tazrim.ledger.controller.dto.ImportSummaryResponseDto.SkippedRowDto;
import com.tazrim.ledger.draft.DraftCreation;
import com.tazrim.ledger.draft.DraftPage;
import com.tazrim.ledger.draft.DraftRowView;
import com.tazrim.ledger.draft.DraftStatus;
import com.tazrim.ledger.draft.DraftView;
import com.tazrim.ledger.draft.DraftWorkflowService;
import com.tazrim.ledger.ledger.ImportSummary;
import com.tazrim.ledger.web.RequestContextHolder;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/imports/drafts")
public class ImportDraftsController {

    private final DraftWorkflowService draftWorkflowService;

    public ImportDraftsController(DraftWorkflowService draftWorkflowService) {
        this.draftWorkflowService = draftWorkflowService;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DraftCreatedResponseDto> createDraft(
            @RequestPart("file") MultipartFile file,
            @RequestParam("account") String account,
            @RequestParam("period") String period,
            @RequestParam(value = "feedKind", required = false) String feedKind
    ) throws IOException {
        DraftCreation created = draftWorkflowService.createDraft(UploadRequests.toUpload(file, account, period, feedKind));
        var response = new DraftCreatedResponseDto(
                map(created.draft()),
                created.skipped().stream()
                        .map(skip -> new SkippedRowDto(skip.rowIndex(), skip.reason(), skip.snapshot()))
                        .toList(),
                RequestContextHolder.traceId().orElse(null)
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<DraftsListResponseDto> listDrafts(
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "limit", required = false, defaultValue = "20") Integer limit
    ) {
        DraftStatus statusFilter = status == null || status.isBlank()
                ? null
                : DraftStatus.valueOf(status.strip().toUpperCase(Locale.ROOT));
        int safeLimit = limit == null ? 20 : Math.min(200, Math.max(1, limit));
        List<DraftResponseDto> drafts = draftWorkflowService.listDrafts(statusFilter, safeLimit).stream()
                .map(this::map)
                .toList();
        return ResponseEntity.ok(new DraftsListResponseDto(drafts, RequestContextHolder.traceId().orElse(null)));
    }

    @GetMapping("/{draftId}")
    public ResponseEntity<DraftDetailResponseDto> getDraft(
            @PathVariable("draftId") UUID draftId,
            @RequestParam(value = "page", required = false, defaultValue = "0") Integer page,
            @RequestParam(value = "pageSize", required = false, defaultValue = "50") Integer pageSize
    ) {
        DraftPage result = draftWorkflowService.getDraft(draftId, page, pageSize);
        var response = new DraftDetailResponseDto(
                map(result.draft()),
                result.page(),
                result.size(),
                result.totalRows(),
                result.rows().stream().map(this::map).toList(),
                RequestContextHolder.traceId().orElse(null)
        );
        return ResponseEntity.ok(response);
    }

    @PatchMapping("/{draftId}/rows/{rowId}")
    public ResponseEntity<DraftRowResponseDto> setApproval(
            @PathVariable("draftId") UUID draftId,
            @PathVariable("rowId") UUID rowId,
            @RequestBody @Valid DraftRowApprovalRequestDto request
    ) {
        DraftRowView row = draftWorkflowService.setApproval(draftId, rowId, request.category());
        return ResponseEntity.ok(map(row));
    }

    @PostMapping("/{draftId}/commit")
    public ResponseEntity<ImportSummaryResponseDto> commit(@PathVariable("draftId") UUID draftId) {
        ImportSummary summary = draftWorkflowService.commit(draftId);
        var response = new ImportSummaryResponseDto(
                summary.batchId(),
                summary.totalRows(),
                summary.insertedRows(),
                summary.newEntities(),
                summary.unmappedEntities(),
                List.of(),
                RequestContextHolder.traceId().orElse(null)
        );
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{draftId}")
    public ResponseEntity<Void> discard(@PathVariable("draftId") UUID draftId) {
        draftWorkflowService.discard(draftId);
        return ResponseEntity.noContent().build();
    }

    private DraftResponseDto map(DraftView draft) {
        return new DraftResponseDto(
                draft.id(),
                draft.accountId(),
                draft.feedKind().name(),
                draft.sourceFilename(),
                draft.periodLabel(),
                draft.status().name(),
                draft.rowCount(),
                draft.skippedRows(),
                draft.createdAt(),
                draft.committedBatchId()
        );
    }

    private DraftRowResponseDto map(DraftRowView row) {
        return new DraftRowResponseDto(
                row.id(),
                row.rowIndex(),
                row.date(),
                row.valueDate(),
                row.description(),
                row.reference(),
                row.counterparty(),
                row.debit(),
                row.credit(),
                row.amount(),
                row.chargedAmount(),
                row.chargedCurrency(),
                row.balance(),
                row.currency(),
                row.categoryHint(),
                row.suggestedCategory(),
                row.approvedCategory()
        );
    }
}
