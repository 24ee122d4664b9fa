package com.flagship.gift_card_ledger.giftcard;

import com.flagship.gift_card_ledger.exception.InvalidOperationException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Gift card domain object.
 *
 * Immutable: every state change produces a new instance. The balance is only
 * ever changed through {@link #withBalance(BigDecimal, TransactionType)}, which
 * the ledger store calls while it holds the card's row lock and writes the
 * matching transaction.
 */
@Value
public class GiftCard {
    UUID id;
    String code;
    UUID franchiseId;
    UUID establishmentId;
    BigDecimal initialValue;
    BigDecimal currentBalance;
    GiftCardStatus status;
    Instant validUntil;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new ACTIVE card whose balance equals its initial value.
     */
    public static GiftCard issue(UUID id, String code, UUID franchiseId, UUID establishmentId,
                                 BigDecimal initialValue, Instant validUntil) {
        Instant now = Instant.now();
        return new GiftCard(
            id,
            code,
            franchiseId,
            establishmentId,
            initialValue,
            initialValue,
            GiftCardStatus.ACTIVE,
            validUntil,
            now,
            now
        );
    }

    public boolean isExpiredAt(Instant instant) {
        return validUntil != null && !validUntil.isAfter(instant);
    }

    /**
     * Verifies the card can take a balance change at the given instant.
     *
     * @throws InvalidOperationException if the card is not ACTIVE or its validity has passed
     */
    public void ensureOperable(Instant now) {
        if (status != GiftCardStatus.ACTIVE) {
            throw new InvalidOperationException(
                String.format("Gift card %s is %s and cannot be operated", code, status),
                Map.of("giftCardId", id.toString(), "status", status.name()));
        }
        if (isExpiredAt(now)) {
            throw new InvalidOperationException(
                String.format("Gift card %s expired at %s", code, validUntil),
                Map.of("giftCardId", id.toString(), "validUntil", validUntil.toString()));
        }
    }

    /**
     * Returns a copy holding the new balance. A usage that empties the card
     * moves it to USED.
     */
    public GiftCard withBalance(BigDecimal newBalance, TransactionType type) {
        if (status != GiftCardStatus.ACTIVE) {
            throw new IllegalStateException(
                String.format("Cannot change balance of gift card in %s status", status));
        }
        GiftCardStatus nextStatus = (type == TransactionType.USAGE && newBalance.signum() == 0)
            ? GiftCardStatus.USED
            : GiftCardStatus.ACTIVE;
        return new GiftCard(
            id, code, franchiseId, establishmentId,
            initialValue,
            newBalance,
            nextStatus,
            validUntil,
            createdAt,
            Instant.now()
        );
    }

    /**
     * Transitions the card to CANCELLED. Only valid from ACTIVE; the balance is left untouched.
     */
    public GiftCard cancel() {
        if (status != GiftCardStatus.ACTIVE) {
            throw new InvalidOperationException(
                String.format("Cannot cancel gift card in %s status. Only ACTIVE cards can be cancelled.", status),
                Map.of("giftCardId", id.toString(), "status", status.name()));
        }
        return new GiftCard(
            id, code, franchiseId, establishmentId,
            initialValue, currentBalance,
            GiftCardStatus.CANCELLED,
            validUntil, createdAt, Instant.now()
        );
    }
}
