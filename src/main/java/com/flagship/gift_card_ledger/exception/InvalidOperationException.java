package com.flagship.gift_card_ledger.exception;

import java.util.Map;

/**
 * The operation is not permitted given the current status of the target.
 */
public class InvalidOperationException extends GiftCardPlatformException {

    public InvalidOperationException(String message) {
        super(ErrorKind.INVALID_OPERATION, message);
    }

    public InvalidOperationException(String message, Map<String, Object> details) {
        super(ErrorKind.INVALID_OPERATION, message, details);
    }
}
