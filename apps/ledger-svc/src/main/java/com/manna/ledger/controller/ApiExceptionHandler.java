package com.manna.ledger.controller;

import com.manna.ledger.controller.dto.ErrorResponseDto;
import com.manna.ledger.exception.DuplicateCodeException;
import com.manna.ledger.exception.InvalidParentException;
import com.manna.ledger.exception.InvalidReferenceException;
import com.manna.ledger.exception.LedgerException;
import com.manna.ledger.exception.NotFoundException;
import com.manna.ledger.exception.SystemAccountProtectedException;
import com.manna.ledger.exception.ValidationException;
import com.manna.ledger.security.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(NotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, ex, details("resource", ex.getResource(), "id", ex.getIdentifier()));
    }

    @ExceptionHandler(InvalidReferenceException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidReference(InvalidReferenceException ex) {
        Map<String, Object> details = ex instanceof InvalidParentException parent
                ? details("parentAccountId", String.valueOf(parent.getParentAccountId()))
                : Map.of();
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex, details);
    }

    @ExceptionHandler(DuplicateCodeException.class)
    public ResponseEntity<ErrorResponseDto> handleDuplicate(DuplicateCodeException ex) {
        return build(HttpStatus.CONFLICT, ex, details("code", ex.getDuplicateCode()));
    }

    @ExceptionHandler(SystemAccountProtectedException.class)
    public ResponseEntity<ErrorResponseDto> handleSystemAccount(SystemAccountProtectedException ex) {
        return build(HttpStatus.FORBIDDEN, ex, details("accountCode", ex.getAccountCode()));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponseDto> handleDomainValidation(ValidationException ex) {
        return build(HttpStatus.BAD_REQUEST, ex, details("field", ex.getField()));
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponseDto> handleLedger(LedgerException ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getCode(), ex.getMessage(), Map.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDto> handleBeanValidation(MethodArgumentNotValidException ex) {
        Map<String, Object> fields = new HashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed", fields);
    }

    @ExceptionHandler({ConstraintViolationException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponseDto> handleMalformed(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(CannotGetJdbcConnectionException.class)
    public ResponseEntity<ErrorResponseDto> handleJdbc(CannotGetJdbcConnectionException ex) {
        String specific = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        return build(HttpStatus.SERVICE_UNAVAILABLE, "DB_UNAVAILABLE", "Database temporarily unavailable",
                details("reason", specific));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("unhandled_error", ex);
        String msg = ex.getMessage() != null ? ex.getMessage().toLowerCase() : "";
        if (msg.contains("relation \"tax_categories\" does not exist") || msg.contains("relation \"chart_of_accounts\" does not exist")) {
            return build(HttpStatus.INTERNAL_SERVER_ERROR, "DB_SCHEMA_MISSING", "Database schema not initialized",
                    details("action", "Enable MANNA_DB_BOOTSTRAP=true once or apply db/bootstrap/seed.sql"));
        }
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", Map.of());
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, LedgerException ex, Map<String, Object> details) {
        return build(status, ex.getCode(), ex.getMessage(), details);
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.get().map(RequestContextHolder.RequestContext::traceId).orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, traceId));
    }

    // Map.of rejects null values
    private static Map<String, Object> details(String... keyValues) {
        Map<String, Object> details = new HashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                details.put(keyValues[i], keyValues[i + 1]);
            }
        }
        return details;
    }
}
