package com.flagship.gift_card_ledger.exception;

public class SignatureException extends GiftCardPlatformException {

    public SignatureException(String message) {
        super(ErrorKind.INVALID_SIGNATURE, message);
    }
}
