package com.flagship.gift_card_ledger.giftcard;

import com.flagship.gift_card_ledger.giftcard.dto.BalanceOperationRequest;
import com.flagship.gift_card_ledger.giftcard.dto.BatchCreateGiftCardRequest;
import com.flagship.gift_card_ledger.giftcard.dto.BatchCreateResponse;
import com.flagship.gift_card_ledger.giftcard.dto.CancelGiftCardRequest;
import com.flagship.gift_card_ledger.giftcard.dto.CreateGiftCardRequest;
import com.flagship.gift_card_ledger.giftcard.dto.GiftCardResponse;
import com.flagship.gift_card_ledger.giftcard.dto.RechargeResponse;
import com.flagship.gift_card_ledger.giftcard.dto.TransactionResponse;
import com.flagship.gift_card_ledger.giftcard.dto.UsageResponse;
import com.flagship.gift_card_ledger.observability.CorrelationIdFilter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST API for gift cards.
 *
 * The establishment performing an operation is taken from the request body;
 * the caller identity from {@code X-Actor}. Recharge and usage accept an
 * optional {@code Idempotency-Key}: a repeated key returns the original
 * result with 200 instead of 201.
 */
@RestController
@RequestMapping("/api/v1/gift-cards")
@RequiredArgsConstructor
@Slf4j
public class GiftCardController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final String ACTOR_HEADER = "X-Actor";

    private final GiftCardEngine engine;

    @GetMapping("/balance/{code}")
    public ResponseEntity<BalanceSnapshot> getBalance(@PathVariable String code) {
        return ResponseEntity.ok(engine.getBalance(code));
    }

    @PostMapping
    public ResponseEntity<GiftCardResponse> create(
            @Valid @RequestBody CreateGiftCardRequest request,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor) {
        OperationContext ctx = context(actor, request.getEstablishmentId(), null);
        IssuedGiftCard issued = engine.create(ctx, request.getFranchiseId(), request.getValue(), request.getValidUntil());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(GiftCardResponse.from(issued.getGiftCard(), issued.getQrCode()));
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchCreateResponse> createBatch(
            @Valid @RequestBody BatchCreateGiftCardRequest request,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor) {
        OperationContext ctx = context(actor, request.getEstablishmentId(), null);
        BatchIssueResult result = engine.createBatch(ctx, request.getFranchiseId(), request.getValue(),
            request.getValidUntil(), request.getQuantity());
        HttpStatus status = result.getCreatedCount() == 0 ? HttpStatus.UNPROCESSABLE_ENTITY
            : result.isComplete() ? HttpStatus.CREATED : HttpStatus.MULTI_STATUS;
        return ResponseEntity.status(status).body(BatchCreateResponse.from(result));
    }

    @GetMapping("/{id}")
    public ResponseEntity<GiftCardResponse> getGiftCard(@PathVariable UUID id) {
        IssuedGiftCard card = engine.getGiftCardWithQrCode(id);
        return ResponseEntity.ok(GiftCardResponse.from(card.getGiftCard(), card.getQrCode()));
    }

    @GetMapping("/{id}/transactions")
    public ResponseEntity<List<TransactionResponse>> getTransactions(@PathVariable UUID id) {
        return ResponseEntity.ok(engine.getTransactions(id).stream().map(TransactionResponse::from).toList());
    }

    @PostMapping("/{id}/recharge")
    public ResponseEntity<RechargeResponse> rechargeById(
            @PathVariable UUID id,
            @Valid @RequestBody BalanceOperationRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor) {
        return recharge(GiftCardReference.byId(id), request, idempotencyKey, actor);
    }

    @PostMapping("/code/{code}/recharge")
    public ResponseEntity<RechargeResponse> rechargeByCode(
            @PathVariable String code,
            @Valid @RequestBody BalanceOperationRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor) {
        return recharge(GiftCardReference.byCode(code), request, idempotencyKey, actor);
    }

    @PostMapping("/{id}/use")
    public ResponseEntity<UsageResponse> useById(
            @PathVariable UUID id,
            @Valid @RequestBody BalanceOperationRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor) {
        return use(GiftCardReference.byId(id), request, idempotencyKey, actor);
    }

    @PostMapping("/code/{code}/use")
    public ResponseEntity<UsageResponse> useByCode(
            @PathVariable String code,
            @Valid @RequestBody BalanceOperationRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor) {
        return use(GiftCardReference.byCode(code), request, idempotencyKey, actor);
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<GiftCardResponse> cancel(
            @PathVariable UUID id,
            @Valid @RequestBody CancelGiftCardRequest request,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor) {
        GiftCard cancelled = engine.cancel(context(actor, request.getEstablishmentId(), null), id);
        return ResponseEntity.ok(GiftCardResponse.from(cancelled));
    }

    private ResponseEntity<RechargeResponse> recharge(GiftCardReference ref, BalanceOperationRequest request,
                                                      String idempotencyKey, String actor) {
        OperationContext ctx = context(actor, request.getEstablishmentId(), idempotencyKey);
        RechargeResult result = engine.recharge(ctx, ref, request.getAmount(), request.getDescription());
        return ResponseEntity.status(result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(RechargeResponse.from(result));
    }

    private ResponseEntity<UsageResponse> use(GiftCardReference ref, BalanceOperationRequest request,
                                              String idempotencyKey, String actor) {
        OperationContext ctx = context(actor, request.getEstablishmentId(), idempotencyKey);
        UsageResult result = engine.use(ctx, ref, request.getAmount(), request.getDescription());
        return ResponseEntity.status(result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(UsageResponse.from(result));
    }

    private static OperationContext context(String actor, UUID establishmentId, String idempotencyKey) {
        return new OperationContext(actor, establishmentId, idempotencyKey,
            CorrelationIdFilter.currentCorrelationId());
    }
}
