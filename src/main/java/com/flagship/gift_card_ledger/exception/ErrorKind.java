package com.flagship.gift_card_ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable, machine-readable error kinds exposed to API clients.
 */
public enum ErrorKind {
    VALIDATION("E_VALIDATION", HttpStatus.BAD_REQUEST),
    NOT_FOUND("E_NOT_FOUND", HttpStatus.NOT_FOUND),
    INSUFFICIENT_BALANCE("E_INSUFFICIENT_BALANCE", HttpStatus.UNPROCESSABLE_ENTITY),
    INVALID_OPERATION("E_INVALID_OPERATION", HttpStatus.CONFLICT),
    CONFLICT("E_CONFLICT", HttpStatus.CONFLICT),
    GATEWAY("E_GATEWAY", HttpStatus.BAD_GATEWAY),
    INVALID_SIGNATURE("E_INVALID_SIGNATURE", HttpStatus.UNAUTHORIZED);

    private final String code;
    private final HttpStatus status;

    ErrorKind(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    /**
     * Client errors are surfaced as-is and never retried automatically.
     */
    public boolean isClientError() {
        return status.is4xxClientError();
    }
}
