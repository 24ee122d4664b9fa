package com.flagship.gift_card_ledger.commission;

import com.flagship.gift_card_ledger.exception.ConflictException;
import com.flagship.gift_card_ledger.exception.InvalidOperationException;
import com.flagship.gift_card_ledger.exception.NotFoundException;
import com.flagship.gift_card_ledger.observability.GiftCardMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Applies state machine events to stored commissions.
 *
 * Each call locks the commission row, consults
 * {@link CommissionStateMachine}, and on MOVE persists the result of the
 * supplied effect. The lock is held for the transition only; callers perform
 * gateway I/O before or after, never inside.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommissionStateStore {

    private final CommissionRepository repository;
    private final GiftCardMetrics metrics;

    /**
     * @param effect builds the moved commission from the locked current one;
     *               only invoked when the table says MOVE
     * @throws NotFoundException if the commission does not exist
     * @throws InvalidOperationException if the table rejects the event
     */
    @Transactional
    public TransitionResult apply(UUID commissionId, CommissionEvent event, UnaryOperator<Commission> effect) {
        CommissionEntity entity = lock(commissionId);
        return transition(entity, entity.toDomain(), event, effect);
    }

    /**
     * Reserves the commission for one gateway charge attempt.
     *
     * A claim older than {@code claimTimeout} belongs to an attempt that
     * died without recording an outcome and is taken over.
     *
     * @throws InvalidOperationException if the commission cannot be charged in its status
     * @throws ConflictException if another attempt holds a live claim
     */
    @Transactional
    public Commission claimCharge(UUID commissionId, UUID attemptId, Duration claimTimeout) {
        CommissionEntity entity = lock(commissionId);
        Commission current = entity.toDomain();

        if (!CommissionStateMachine.transition(current.getStatus(), CommissionEvent.CHARGE_CREATED).isMove()) {
            throw new InvalidOperationException(
                String.format("Commission %s is %s and cannot be charged", commissionId, current.getStatus()),
                Map.of("commissionId", commissionId.toString(), "status", current.getStatus().name()));
        }
        Instant now = Instant.now();
        if (current.hasLiveChargeClaim(now.minus(claimTimeout))) {
            throw new ConflictException(
                String.format("A charge for commission %s is already in progress", commissionId),
                Map.of("commissionId", commissionId.toString(),
                       "chargeAttemptId", current.getChargeAttemptId().toString()));
        }
        if (current.hasChargeInFlight()) {
            log.warn("Taking over expired charge claim {} of commission {} (claimed at {})",
                current.getChargeAttemptId(), commissionId, current.getChargeClaimedAt());
        }

        Commission claimed = current.claimCharge(attemptId, now);
        entity.updateFromDomain(claimed);
        repository.saveAndFlush(entity);
        log.debug("Commission {} claimed by charge attempt {}", commissionId, attemptId);
        return entity.toDomain();
    }

    /**
     * Applies the gateway outcome of a charge attempt, provided the attempt
     * still holds the claim. An outcome from an attempt whose claim was taken
     * over is ignored.
     */
    @Transactional
    public TransitionResult applyChargeOutcome(UUID commissionId, UUID attemptId, CommissionEvent event,
                                               UnaryOperator<Commission> effect) {
        CommissionEntity entity = lock(commissionId);
        Commission current = entity.toDomain();
        if (!attemptId.equals(current.getChargeAttemptId())) {
            metrics.recordCommissionTransition(event.name(), "SUPERSEDED");
            log.warn("Ignoring {} from charge attempt {} of commission {}: claim now held by {}",
                event, attemptId, commissionId, current.getChargeAttemptId());
            return TransitionResult.ignored(current);
        }
        return transition(entity, current, event, effect);
    }

    /**
     * Drops an attempt's claim when it ended before the gateway answered.
     * No-op if the claim has moved on.
     */
    @Transactional
    public void releaseChargeClaim(UUID commissionId, UUID attemptId) {
        CommissionEntity entity = lock(commissionId);
        Commission current = entity.toDomain();
        if (attemptId.equals(current.getChargeAttemptId())) {
            entity.updateFromDomain(current.releaseChargeClaim());
            repository.saveAndFlush(entity);
            log.info("Released charge claim {} of commission {}", attemptId, commissionId);
        }
    }

    private CommissionEntity lock(UUID commissionId) {
        return repository.findByIdForUpdate(commissionId)
            .orElseThrow(() -> new NotFoundException("Commission", commissionId));
    }

    private TransitionResult transition(CommissionEntity entity, Commission current, CommissionEvent event,
                                        UnaryOperator<Commission> effect) {
        UUID commissionId = current.getId();
        CommissionStateMachine.Transition transition = CommissionStateMachine.transition(current.getStatus(), event);
        metrics.recordCommissionTransition(event.name(), transition.outcome().name());

        switch (transition.outcome()) {
            case REJECT -> throw new InvalidOperationException(
                String.format("Commission %s in %s status cannot apply %s", commissionId, current.getStatus(), event),
                Map.of("commissionId", commissionId.toString(),
                       "status", current.getStatus().name(),
                       "event", event.name()));
            case IGNORE -> {
                log.info("Ignoring {} for commission {} in {} status", event, commissionId, current.getStatus());
                return TransitionResult.ignored(current);
            }
            case MOVE -> {
                Commission moved = effect.apply(current);
                entity.updateFromDomain(moved);
                repository.saveAndFlush(entity);
                log.info("Commission {} moved {} -> {} on {}",
                    commissionId, current.getStatus(), moved.getStatus(), event);
                return TransitionResult.moved(entity.toDomain());
            }
            default -> throw new IllegalStateException("Unhandled outcome " + transition.outcome());
        }
    }

    @Transactional(readOnly = true)
    public Optional<Commission> findById(UUID commissionId) {
        return repository.findById(commissionId).map(CommissionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Commission> findByGatewayChargeId(String chargeRef) {
        return repository.findByGatewayChargeId(chargeRef).map(CommissionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Commission> findByExternalReference(String externalReference) {
        return repository.findByExternalReference(externalReference).map(CommissionEntity::toDomain);
    }

    /**
     * Outcome of {@link #apply}: the commission as it stands afterwards and
     * whether the event moved it.
     */
    public record TransitionResult(Commission commission, boolean moved) {

        static TransitionResult moved(Commission commission) {
            return new TransitionResult(commission, true);
        }

        static TransitionResult ignored(Commission commission) {
            return new TransitionResult(commission, false);
        }
    }
}
