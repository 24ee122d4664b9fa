package com.flagship.gift_card_ledger.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for every domain failure raised by the ledger and settlement code.
 *
 * Carries an {@link ErrorKind} and a map of structured details that the
 * {@link GlobalExceptionHandler} renders verbatim, so callers can act on the
 * values (available balance, offending status) without parsing messages.
 */
public abstract class GiftCardPlatformException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> details;

    protected GiftCardPlatformException(ErrorKind kind, String message) {
        this(kind, message, Map.of(), null);
    }

    protected GiftCardPlatformException(ErrorKind kind, String message, Map<String, Object> details) {
        this(kind, message, details, null);
    }

    protected GiftCardPlatformException(ErrorKind kind, String message,
                                        Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
