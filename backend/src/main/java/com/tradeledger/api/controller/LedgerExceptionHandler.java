package com.tradeledger.api.controller;

import com.tradeledger.api.dto.ErrorBody;
import com.tradeledger.common.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps {@link LedgerException} codes to HTTP statuses. SOURCE_UNAVAILABLE is retryable (503).
 */
@Slf4j
@RestControllerAdvice
public class LedgerExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorBody> handleLedger(LedgerException ex) {
        HttpStatus status = switch (ex.getErrorCode()) {
            case SOURCE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case VERSION_CONFLICT, COMPUTATION_IN_PROGRESS -> HttpStatus.CONFLICT;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case VALIDATION_FAILURE, DATA_INTEGRITY_ANOMALY, PARTIAL_BACKFILL_FAILURE -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode().name(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }
}
