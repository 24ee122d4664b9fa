package com.flagship.gift_card_ledger.giftcard;

import com.flagship.gift_card_ledger.exception.ValidationException;

import java.util.UUID;

/**
 * Identifies a card either by internal id or by public code, never both.
 */
public record GiftCardReference(UUID id, String code) {

    public GiftCardReference {
        boolean hasId = id != null;
        boolean hasCode = code != null && !code.isBlank();
        if (hasId == hasCode) {
            throw new ValidationException("Exactly one of gift card id or code must be supplied");
        }
    }

    public static GiftCardReference byId(UUID id) {
        return new GiftCardReference(id, null);
    }

    public static GiftCardReference byCode(String code) {
        return new GiftCardReference(null, code);
    }

    public boolean isById() {
        return id != null;
    }

    @Override
    public String toString() {
        return isById() ? "id=" + id : "code=" + code;
    }
}
