package com.flagship.gift_card_ledger.giftcard;

import com.flagship.gift_card_ledger.commission.Commission;
import com.flagship.gift_card_ledger.commission.CommissionService;
import com.flagship.gift_card_ledger.directory.EstablishmentDirectory;
import com.flagship.gift_card_ledger.directory.EstablishmentProfile;
import com.flagship.gift_card_ledger.exception.ConflictException;
import com.flagship.gift_card_ledger.exception.GiftCardPlatformException;
import com.flagship.gift_card_ledger.exception.InvalidOperationException;
import com.flagship.gift_card_ledger.exception.NotFoundException;
import com.flagship.gift_card_ledger.exception.ValidationException;
import com.flagship.gift_card_ledger.observability.CorrelationIdFilter;
import com.flagship.gift_card_ledger.observability.GiftCardMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Gift card operations: issue, recharge, use, inquire.
 *
 * Every balance change goes through {@link LedgerStore#applyBalanceChange}.
 * A recharge then creates its commission in a separate transaction; a
 * failure there is logged and leaves the committed recharge in place.
 *
 * Keyed operations are replay-safe: repeating a recharge or usage with the
 * same {@code Idempotency-Key} returns the original transaction.
 */
@Service
@Slf4j
public class GiftCardEngine {

    private final LedgerStore ledgerStore;
    private final EstablishmentDirectory directory;
    private final CommissionService commissionService;
    private final IdempotencyService idempotencyService;
    private final GiftCardQrCodeRenderer qrCodeRenderer;
    private final GiftCardMetrics metrics;
    private final BigDecimal maxOperationAmount;

    public GiftCardEngine(LedgerStore ledgerStore,
                          EstablishmentDirectory directory,
                          CommissionService commissionService,
                          IdempotencyService idempotencyService,
                          GiftCardQrCodeRenderer qrCodeRenderer,
                          GiftCardMetrics metrics,
                          @Value("${gift-card.max-operation-amount:10000.00}") BigDecimal maxOperationAmount) {
        this.ledgerStore = ledgerStore;
        this.directory = directory;
        this.commissionService = commissionService;
        this.idempotencyService = idempotencyService;
        this.qrCodeRenderer = qrCodeRenderer;
        this.metrics = metrics;
        this.maxOperationAmount = maxOperationAmount;
    }

    public IssuedGiftCard create(OperationContext ctx, UUID franchiseId, BigDecimal initialValue, Instant validUntil) {
        validateAmount("initialValue", initialValue);
        GiftCard card = ledgerStore.createGiftCard(franchiseId, ctx.establishmentId(), initialValue, validUntil);
        metrics.recordCardIssued();
        log.info("Issued gift card {} with {} for establishment {} (actor={})",
            card.getCode(), initialValue, ctx.establishmentId(), ctx.actor());
        return new IssuedGiftCard(card, qrCodeRenderer.render(card.getCode()));
    }

    /**
     * Creates {@code quantity} cards independently. A failed card does not
     * undo the ones already created.
     */
    public BatchIssueResult createBatch(OperationContext ctx, UUID franchiseId, BigDecimal initialValue,
                                        Instant validUntil, int quantity) {
        if (quantity < 1) {
            throw new ValidationException("Quantity must be at least 1", Map.of("quantity", quantity));
        }
        // Validate once up front so a bad request fails as a whole instead of N times.
        validateAmount("initialValue", initialValue);
        directory.getEstablishment(ctx.establishmentId());

        List<IssuedGiftCard> created = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (int i = 0; i < quantity; i++) {
            try {
                created.add(create(ctx, franchiseId, initialValue, validUntil));
            } catch (GiftCardPlatformException e) {
                log.warn("Batch card {}/{} failed: {}", i + 1, quantity, e.getMessage());
                failures.add(e.getMessage());
            } catch (RuntimeException e) {
                // earlier cards are already committed
                log.error("Batch card {}/{} failed unexpectedly", i + 1, quantity, e);
                failures.add("Card " + (i + 1) + " could not be issued: " + e.getClass().getSimpleName());
            }
        }
        log.info("Batch issued {}/{} gift card(s) for establishment {}", created.size(), quantity, ctx.establishmentId());
        return new BatchIssueResult(quantity, created.size(), List.copyOf(created), List.copyOf(failures));
    }

    public RechargeResult recharge(OperationContext ctx, GiftCardReference ref, BigDecimal amount, String description) {
        Instant start = Instant.now();
        String outcome = "error";
        try {
            validateAmount("amount", amount);
            GiftCard card = resolve(ref);
            MDC.put(CorrelationIdFilter.GIFT_CARD_ID_MDC_KEY, card.getId().toString());

            Optional<GiftCardTransaction> previous = findReplay(ctx, card, TransactionType.RECHARGE);
            if (previous.isPresent()) {
                outcome = "replayed";
                return replayRecharge(previous.get());
            }

            EstablishmentProfile establishment = directory.getEstablishment(card.getEstablishmentId());
            BigDecimal rate = establishment.getCommissionRate();

            BalanceChange change;
            try {
                change = ledgerStore.applyBalanceChange(BalanceChangeCommand.builder()
                    .giftCardId(card.getId())
                    .establishmentId(ctx.establishmentId())
                    .delta(amount)
                    .type(TransactionType.RECHARGE)
                    .description(description)
                    .metadata(metadata(ctx, rate))
                    .idempotencyKey(ctx.idempotencyKey())
                    .build());
            } catch (DuplicateKeyException e) {
                outcome = "replayed";
                return replayRecharge(concurrentReplay(ctx, card, TransactionType.RECHARGE, e));
            }
            idempotencyService.remember(ctx.idempotencyKey(), change.getTransaction().getId());

            Commission commission = createCommission(change.getTransaction(), card.getFranchiseId(), rate);
            outcome = "success";
            log.info("Recharged {} by {}: balance {} -> {} (actor={})", card.getCode(), amount,
                change.getTransaction().getBalanceBefore(), change.getTransaction().getBalanceAfter(), ctx.actor());
            return new RechargeResult(change.getTransaction(), change.getGiftCard(), commission, false);
        } catch (GiftCardPlatformException e) {
            outcome = e.getKind().name().toLowerCase();
            throw e;
        } finally {
            metrics.recordBalanceOperation(TransactionType.RECHARGE.name(), outcome, Duration.between(start, Instant.now()));
            MDC.remove(CorrelationIdFilter.GIFT_CARD_ID_MDC_KEY);
        }
    }

    public UsageResult use(OperationContext ctx, GiftCardReference ref, BigDecimal amount, String description) {
        Instant start = Instant.now();
        String outcome = "error";
        try {
            validateAmount("amount", amount);
            GiftCard card = resolve(ref);
            MDC.put(CorrelationIdFilter.GIFT_CARD_ID_MDC_KEY, card.getId().toString());

            Optional<GiftCardTransaction> previous = findReplay(ctx, card, TransactionType.USAGE);
            if (previous.isPresent()) {
                outcome = "replayed";
                return new UsageResult(previous.get(), getGiftCard(card.getId()), true);
            }

            BalanceChange change;
            try {
                change = ledgerStore.applyBalanceChange(BalanceChangeCommand.builder()
                    .giftCardId(card.getId())
                    .establishmentId(ctx.establishmentId())
                    .delta(amount.negate())
                    .type(TransactionType.USAGE)
                    .description(description)
                    .metadata(metadata(ctx, null))
                    .idempotencyKey(ctx.idempotencyKey())
                    .build());
            } catch (DuplicateKeyException e) {
                outcome = "replayed";
                GiftCardTransaction original = concurrentReplay(ctx, card, TransactionType.USAGE, e);
                return new UsageResult(original, getGiftCard(card.getId()), true);
            }
            idempotencyService.remember(ctx.idempotencyKey(), change.getTransaction().getId());

            outcome = "success";
            log.info("Used {} of {}: balance {} -> {} (actor={})", amount, card.getCode(),
                change.getTransaction().getBalanceBefore(), change.getTransaction().getBalanceAfter(), ctx.actor());
            return new UsageResult(change.getTransaction(), change.getGiftCard(), false);
        } catch (GiftCardPlatformException e) {
            outcome = e.getKind().name().toLowerCase();
            throw e;
        } finally {
            metrics.recordBalanceOperation(TransactionType.USAGE.name(), outcome, Duration.between(start, Instant.now()));
            MDC.remove(CorrelationIdFilter.GIFT_CARD_ID_MDC_KEY);
        }
    }

    /**
     * Anonymous balance inquiry by exact code.
     */
    public BalanceSnapshot getBalance(String code) {
        GiftCard card = ledgerStore.findByCode(code)
            .orElseThrow(() -> new NotFoundException("GiftCard", code));
        EstablishmentProfile establishment = directory.getEstablishment(card.getEstablishmentId());
        return new BalanceSnapshot(
            card.getCode(),
            card.getCurrentBalance(),
            card.getInitialValue(),
            card.getStatus(),
            card.getValidUntil(),
            new BalanceSnapshot.Establishment(establishment.getName(), establishment.getCategory())
        );
    }

    public GiftCard getGiftCard(UUID giftCardId) {
        return ledgerStore.findById(giftCardId)
            .orElseThrow(() -> new NotFoundException("GiftCard", giftCardId));
    }

    public IssuedGiftCard getGiftCardWithQrCode(UUID giftCardId) {
        GiftCard card = getGiftCard(giftCardId);
        return new IssuedGiftCard(card, qrCodeRenderer.render(card.getCode()));
    }

    public List<GiftCardTransaction> getTransactions(UUID giftCardId) {
        getGiftCard(giftCardId);
        return ledgerStore.findTransactions(giftCardId);
    }

    /**
     * Cancels an ACTIVE card owned by the caller's establishment. The balance
     * is left as it was and no transaction is written.
     */
    public GiftCard cancel(OperationContext ctx, UUID giftCardId) {
        GiftCard card = getGiftCard(giftCardId);
        if (!card.getEstablishmentId().equals(ctx.establishmentId())) {
            throw new InvalidOperationException("Gift card belongs to another establishment",
                Map.of("giftCardId", giftCardId.toString(),
                       "establishmentId", ctx.establishmentId().toString()));
        }
        GiftCard cancelled = ledgerStore.cancel(giftCardId);
        log.info("Cancelled gift card {} with balance {} (actor={})",
            cancelled.getCode(), cancelled.getCurrentBalance(), ctx.actor());
        return cancelled;
    }

    private GiftCard resolve(GiftCardReference ref) {
        if (ref.isById()) {
            return getGiftCard(ref.id());
        }
        return ledgerStore.findByCode(ref.code())
            .orElseThrow(() -> new NotFoundException("GiftCard", ref.code()));
    }

    private Optional<GiftCardTransaction> findReplay(OperationContext ctx, GiftCard card, TransactionType type) {
        if (!ctx.hasIdempotencyKey()) {
            return Optional.empty();
        }
        Optional<UUID> transactionId = idempotencyService.findTransactionId(ctx.idempotencyKey());
        if (transactionId.isEmpty()) {
            metrics.recordIdempotencyMiss();
            return Optional.empty();
        }
        metrics.recordIdempotencyHit();
        GiftCardTransaction previous = ledgerStore.findTransaction(transactionId.get())
            .orElseThrow(() -> new IllegalStateException(
                "Transaction found by idempotency key but not by id: " + transactionId.get()));
        ensureSameOperation(ctx, previous, card, type);
        log.info("Idempotency key {} already used, returning transaction {}", ctx.idempotencyKey(), previous.getId());
        return Optional.of(previous);
    }

    // Two requests with the same key raced; the other one committed first.
    private GiftCardTransaction concurrentReplay(OperationContext ctx, GiftCard card, TransactionType type,
                                                 DuplicateKeyException cause) {
        if (!ctx.hasIdempotencyKey()) {
            throw cause;
        }
        GiftCardTransaction original = ledgerStore.findTransactionByIdempotencyKey(ctx.idempotencyKey())
            .orElseThrow(() -> cause);
        ensureSameOperation(ctx, original, card, type);
        idempotencyService.remember(ctx.idempotencyKey(), original.getId());
        log.info("Concurrent request with key {} won, returning transaction {}", ctx.idempotencyKey(), original.getId());
        return original;
    }

    private void ensureSameOperation(OperationContext ctx, GiftCardTransaction previous, GiftCard card,
                                     TransactionType type) {
        if (!previous.getGiftCardId().equals(card.getId()) || previous.getType() != type) {
            throw new ConflictException("Idempotency key was already used for a different operation",
                Map.of("idempotencyKey", ctx.idempotencyKey(),
                       "transactionId", previous.getId().toString()));
        }
    }

    private RechargeResult replayRecharge(GiftCardTransaction previous) {
        Commission commission = commissionService.findForTransaction(previous.getId()).orElse(null);
        return new RechargeResult(previous, getGiftCard(previous.getGiftCardId()), commission, true);
    }

    private Commission createCommission(GiftCardTransaction recharge, UUID franchiseId, BigDecimal rate) {
        try {
            return commissionService.createPendingForRecharge(recharge, franchiseId, rate);
        } catch (RuntimeException e) {
            metrics.recordCommissionCreationFailure();
            log.error("Commission creation failed for recharge {}; backfill will retry: {}",
                recharge.getId(), e.getMessage(), e);
            return null;
        }
    }

    private Map<String, Object> metadata(OperationContext ctx, BigDecimal commissionRate) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(GiftCardTransaction.METADATA_ACTOR, ctx.actor());
        if (ctx.correlationId() != null) {
            metadata.put(GiftCardTransaction.METADATA_CORRELATION_ID, ctx.correlationId());
        }
        if (commissionRate != null) {
            metadata.put(GiftCardTransaction.METADATA_COMMISSION_RATE, commissionRate.toPlainString());
        }
        return metadata;
    }

    private void validateAmount(String field, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Amount must be greater than zero", Map.of(field, String.valueOf(amount)));
        }
        if (amount.stripTrailingZeros().scale() > 2) {
            throw new ValidationException("Amount must have at most two decimal places", Map.of(field, amount));
        }
        if (amount.compareTo(maxOperationAmount) > 0) {
            throw new ValidationException("Amount exceeds the maximum of " + maxOperationAmount.toPlainString(),
                Map.of(field, amount, "max", maxOperationAmount));
        }
    }
}
