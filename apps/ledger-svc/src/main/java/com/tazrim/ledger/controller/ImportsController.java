package com.tazrim.ledger.controller;

import com.tazrim.ledger.controller.dto.ImportBatchesListResponseDto;
import com.tazrim.ledger.controller.dto.ImportBatchesListResponseDto.ImportBatchDto;
import com.tazrim.ledger.controller.dto.ImportSummaryResponseDto;
import com.tazrim.ledger.controller.dto.ImportSummaryResponseDto.SkippedRowDto;
import com.tazrim.ledger.ledger.ImportSummary;
import com.tazrim.ledger.repository.ImportBatchSummaryProjection;
import com.tazrim.ledger.service.ImportResult;
import com.tazrim.ledger.service.StatementImportService;
import com.tazrim.ledger.web.RequestContextHolder;
import java.io.IOException;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/imports")
public class ImportsController {

    private final StatementImportService statementImportService;

    public ImportsController(StatementImportService statementImportService) {
        this.statementImportService = statementImportService;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportSummaryResponseDto> importStatement(
            @RequestPart("file") MultipartFile file,
            @RequestParam("account") String account,
            @RequestParam("period") String period,
            @RequestParam(value = "feedKind", required = false) String feedKind
    ) throws IOException {
        ImportResult result = statementImportService.importStatement(UploadRequests.toUpload(file, account, period, feedKind));
        ImportSummary summary = result.summary();
        var response = new ImportSummaryResponseDto(
                summary.batchId(),
                summary.totalRows(),
                summary.insertedRows(),
                summary.newEntities(),
                summary.unmappedEntities(),
                result.skipped().stream()
                        .map(skip -> new SkippedRowDto(skip.rowIndex(), skip.reason(), skip.snapshot()))
                        .toList(),
                RequestContextHolder.traceId().orElse(null)
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<ImportBatchesListResponseDto> listImports(
            @RequestParam(value = "limit", required = false, defaultValue = "20") Integer limit
    ) {
        int safeLimit = limit == null ? 20 : Math.min(200, Math.max(1, limit));
        var batches = statementImportService.listBatches(safeLimit).stream().map(this::map).toList();
        return ResponseEntity.ok(new ImportBatchesListResponseDto(batches, RequestContextHolder.traceId().orElse(null)));
    }

    @DeleteMapping("/{batchId}")
    public ResponseEntity<Void> deleteImport(@PathVariable("batchId") UUID batchId) {
        statementImportService.deleteBatch(batchId);
        return ResponseEntity.noContent().build();
    }

    private ImportBatchDto map(ImportBatchSummaryProjection batch) {
        return new ImportBatchDto(
                batch.id(),
                batch.accountId(),
                batch.accountName(),
                batch.feedKind().name(),
                batch.sourceFilename(),
                batch.periodLabel(),
                batch.uploadedAt(),
                batch.rowCount(),
                batch.activityCount()
        );
    }
}
