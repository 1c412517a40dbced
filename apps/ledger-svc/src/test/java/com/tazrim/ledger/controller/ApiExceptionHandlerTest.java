package com.tazrim.ledger.controller;

import static org.assertj.core.api.Assertions.assertThat;

import com.tazrim.ledger.controller.dto.ErrorResponseDto;
import com.tazrim.ledger.ingest.CanonicalField;
import com.tazrim.ledger.ingest.FieldTooLongException;
import com.tazrim.ledger.web.RequestContextHolder;
import java.sql.SQLException;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @AfterEach
    void tearDown() {
        RequestContextHolder.clear();
    }

    @Test
    void unexpectedErrorsDoNotEchoTheirMessage() {
        RequestContextHolder.set(new RequestContextHolder.RequestContext("trace-500", "POST", "/imports", Instant.now()));

        ResponseEntity<ErrorResponseDto> response = handler.handleGeneral(new DataIntegrityViolationException(
                "could not execute statement [Value too long for column \"REFERENCE CHARACTER VARYING(100)\"]"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().code()).isEqualTo("INTERNAL_ERROR");
        assertThat(response.getBody().message()).isEqualTo("Unexpected error");
        assertThat(response.getBody().details()).isEmpty();
        assertThat(response.getBody().traceId()).isEqualTo("trace-500");
    }

    @Test
    void unavailableDatabaseDoesNotEchoTheDriverMessage() {
        ResponseEntity<ErrorResponseDto> response = handler.handleJdbc(new CannotGetJdbcConnectionException(
                "no connection", new SQLException("Connection refused: db.internal:5432")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().details()).isEmpty();
        assertThat(response.getBody().traceId()).isNull();
    }

    @Test
    void overlongFieldReportsItsRow() {
        ResponseEntity<ErrorResponseDto> response = handler.handleRejectedRow(
                new FieldTooLongException(7, CanonicalField.DESCRIPTION, 1000));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody().code()).isEqualTo(FieldTooLongException.FIELD_TOO_LONG);
        assertThat(response.getBody().details()).containsEntry("row", 7);
    }
}
