package com.flagship.gift_card_ledger.exception;

import java.util.Map;

/**
 * The payment provider rejected a request or did not answer in time.
 */
public class GatewayException extends GiftCardPlatformException {

    public GatewayException(String message) {
        super(ErrorKind.GATEWAY, message);
    }

    public GatewayException(String message, Map<String, Object> details) {
        super(ErrorKind.GATEWAY, message, details);
    }

    public GatewayException(String message, Throwable cause) {
        super(ErrorKind.GATEWAY, message, Map.of(), cause);
    }

    public GatewayException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorKind.GATEWAY, message, details, cause);
    }
}
