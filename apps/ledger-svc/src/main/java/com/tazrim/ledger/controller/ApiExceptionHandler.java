package com.tazrim.ledger.controller;

import com.tazrim.ledger.controller.dto.ErrorResponseDto;
import com.tazrim.ledger.draft.DraftStateException;
import com.tazrim.ledger.ingest.StatementEncodingException;
import com.tazrim.ledger.ingest.StatementFormatException;
import com.tazrim.ledger.ingest.StatementRejectedException;
import com.tazrim.ledger.service.DuplicateImportException;
import com.tazrim.ledger.service.NotFoundException;
import com.tazrim.ledger.web.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(StatementFormatException.class)
    public ResponseEntity<ErrorResponseDto> handleFormat(StatementFormatException ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getCode(), ex.getMessage(), Map.of("missing", ex.getMissingFields()));
    }

    @ExceptionHandler(StatementEncodingException.class)
    public ResponseEntity<ErrorResponseDto> handleEncoding(StatementEncodingException ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getCode(), ex.getMessage(), Map.of("line", ex.getLine()));
    }

    @ExceptionHandler(StatementRejectedException.class)
    public ResponseEntity<ErrorResponseDto> handleRejectedRow(StatementRejectedException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("row", ex.getRowIndex());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getCode(), ex.getMessage(), details);
    }

    @ExceptionHandler(DraftStateException.class)
    public ResponseEntity<ErrorResponseDto> handleDraftState(DraftStateException ex) {
        return build(HttpStatus.CONFLICT, "INVALID_STATE", ex.getMessage(), Map.of(
                "draftId", ex.getDraftId().toString(),
                "status", ex.getStatus().name()
        ));
    }

    @ExceptionHandler(DuplicateImportException.class)
    public ResponseEntity<ErrorResponseDto> handleDuplicate(DuplicateImportException ex) {
        return build(HttpStatus.CONFLICT, "DUPLICATE_IMPORT", ex.getMessage(), Map.of(
                "account", ex.getAccountName(),
                "filename", ex.getSourceFilename()
        ));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(NotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), Map.of("resource", ex.getResource()));
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            ConstraintViolationException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class
    })
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(CannotGetJdbcConnectionException.class)
    public ResponseEntity<ErrorResponseDto> handleJdbc(CannotGetJdbcConnectionException ex) {
        log.warn("Database unavailable: {}", ex.getMostSpecificCause().getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "DB_UNAVAILABLE", "Database temporarily unavailable", Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", Map.of());
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, traceId));
    }
}
