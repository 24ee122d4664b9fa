package com.flagship.gift_card_ledger.exception;

import java.util.Map;

public class ConflictException extends GiftCardPlatformException {

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }

    public ConflictException(String message, Map<String, Object> details) {
        super(ErrorKind.CONFLICT, message, details);
    }
}
