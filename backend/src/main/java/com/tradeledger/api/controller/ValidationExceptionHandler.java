package com.tradeledger.api.controller;

import com.tradeledger.api.dto.ErrorBody;
import com.tradeledger.common.LedgerErrorCode;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Request bodies rejected by bean validation. Constraint messages hold the error code; the response message
 * either explains that code or names the rejected fields.
 */
@RestControllerAdvice
public class ValidationExceptionHandler {

    private static final Map<String, String> EXPLANATIONS = Map.of(
            "INVALID_TIER", "Tiers must be 1, 2, presence, value or all",
            "INVALID_WINDOW", "Both from and to are required");

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        List<FieldError> fieldErrors = ex.getFieldErrors();
        String code = fieldErrors.stream()
                .map(FieldError::getDefaultMessage)
                .filter(m -> m != null && m.startsWith("INVALID_"))
                .findFirst()
                .orElse(LedgerErrorCode.INVALID_REQUEST.name());
        String fields = fieldErrors.stream()
                .map(FieldError::getField)
                .distinct()
                .sorted()
                .collect(Collectors.joining(", "));
        String message = EXPLANATIONS.getOrDefault(code,
                fields.isEmpty() ? "Request body is not valid" : "Rejected fields: " + fields);
        return ResponseEntity.badRequest().body(ErrorBody.of(code, message));
    }
}
