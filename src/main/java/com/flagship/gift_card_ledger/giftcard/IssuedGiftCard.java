package com.flagship.gift_card_ledger.giftcard;

import lombok.Value;

/**
 * A newly created card together with its QR code (PNG data URI).
 */
@Value
public class IssuedGiftCard {
    GiftCard giftCard;
    String qrCode;
}
