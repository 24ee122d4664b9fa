package com.flagship.gift_card_ledger.exception;

import java.util.Map;

/**
 * Malformed or out-of-range input, rejected before any mutation.
 */
public class ValidationException extends GiftCardPlatformException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorKind.VALIDATION, message, details);
    }
}
