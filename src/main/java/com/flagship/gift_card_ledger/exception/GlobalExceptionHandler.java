package com.flagship.gift_card_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for the REST API.
 *
 * Every error body has the same shape: a stable {@code code}, a readable
 * {@code message}, the HTTP {@code status}, optional structured
 * {@code details} and a {@code timestamp}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(GiftCardPlatformException.class)
    public ResponseEntity<ErrorResponse> handlePlatformException(GiftCardPlatformException e) {
        ErrorKind kind = e.getKind();
        if (kind.isClientError()) {
            log.warn("Request rejected: code={}, message={}", kind.getCode(), e.getMessage());
        } else {
            log.error("Request failed: code={}, message={}", kind.getCode(), e.getMessage(), e);
        }
        return build(kind.getStatus(), kind.getCode(), e.getMessage(), e.getDetails());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return build(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION.getCode(),
                "Required header '" + e.getHeaderName() + "' is missing", Map.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, Object> errors = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error -> errors.putIfAbsent(
                error.getField(),
                error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value"));

        return build(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION.getCode(),
                "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION.getCode(),
                "Malformed request body", Map.of());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid parameter {}: {}", e.getName(), e.getValue());
        return build(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION.getCode(),
                "Invalid value for parameter '" + e.getName() + "'",
                Map.of("parameter", e.getName()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "E_INTERNAL",
                "An unexpected error occurred", Map.of());
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message,
                                                Map<String, Object> details) {
        ErrorResponse error = ErrorResponse.builder()
                .code(code)
                .message(message)
                .status(status.value())
                .details(details.isEmpty() ? null : details)
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(error);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String code;
        String message;
        int status;
        Map<String, Object> details;
        Instant timestamp;
    }
}
