package com.flagship.gift_card_ledger.exception;

import java.util.Map;

public class NotFoundException extends GiftCardPlatformException {

    public NotFoundException(String resource, Object reference) {
        super(ErrorKind.NOT_FOUND, resource + " not found: " + reference,
                Map.of("resource", resource, "reference", String.valueOf(reference)));
    }
}
