package com.flagship.gift_card_ledger.commission;

import java.util.EnumMap;
import java.util.Map;

import static com.flagship.gift_card_ledger.commission.CommissionEvent.*;
import static com.flagship.gift_card_ledger.commission.CommissionStatus.*;

/**
 * Transition table for commission settlement.
 *
 * Every (status, event) pair has exactly one outcome:
 * <ul>
 *   <li>MOVE: apply the event and move to the target status</li>
 *   <li>IGNORE: leave the commission untouched; the event is stale or a duplicate</li>
 *   <li>REJECT: the event contradicts the current status and is reported to the caller</li>
 * </ul>
 *
 * Gateway notifications are never rejected: the gateway may redeliver or
 * reorder them, so an inapplicable notification is ignored. Only locally
 * initiated events (charge creation) can be rejected.
 *
 * A charge rejection never undoes a recorded charge: CHARGED ignores it.
 *
 * PAID is terminal.
 */
public final class CommissionStateMachine {

    public enum Outcome {
        MOVE,
        IGNORE,
        REJECT
    }

    /**
     * Result of looking up a (status, event) pair.
     */
    public record Transition(Outcome outcome, CommissionStatus target) {

        static Transition move(CommissionStatus target) {
            return new Transition(Outcome.MOVE, target);
        }

        static Transition ignore() {
            return new Transition(Outcome.IGNORE, null);
        }

        static Transition reject() {
            return new Transition(Outcome.REJECT, null);
        }

        public boolean isMove() {
            return outcome == Outcome.MOVE;
        }
    }

    private static final Map<CommissionStatus, Map<CommissionEvent, Transition>> TABLE =
        new EnumMap<>(CommissionStatus.class);

    static {
        row(PENDING,
            Transition.move(CHARGED),     // CHARGE_CREATED
            Transition.move(FAILED),      // CHARGE_REJECTED
            Transition.move(FAILED),      // CHARGE_RETRIES_EXHAUSTED
            Transition.ignore(),          // PAYMENT_CONFIRMED
            Transition.ignore(),          // PAYMENT_OVERDUE
            Transition.move(FAILED),      // PAYMENT_DELETED
            Transition.move(FAILED));     // PAYMENT_REFUNDED
        row(CHARGED,
            Transition.reject(),
            Transition.ignore(),
            Transition.ignore(),
            Transition.move(PAID),
            Transition.ignore(),
            Transition.move(FAILED),
            Transition.move(FAILED));
        row(FAILED,
            Transition.move(CHARGED),
            Transition.move(FAILED),
            Transition.move(FAILED),
            Transition.ignore(),
            Transition.ignore(),
            Transition.ignore(),
            Transition.ignore());
        row(PAID,
            Transition.reject(),
            Transition.reject(),
            Transition.ignore(),
            Transition.ignore(),
            Transition.ignore(),
            Transition.ignore(),
            Transition.ignore());
    }

    private CommissionStateMachine() {
    }

    public static Transition transition(CommissionStatus from, CommissionEvent event) {
        return TABLE.get(from).get(event);
    }

    /**
     * Returns the target status, or throws if the pair is not a MOVE.
     */
    public static CommissionStatus requireMove(CommissionStatus from, CommissionEvent event) {
        Transition transition = transition(from, event);
        if (!transition.isMove()) {
            throw new IllegalStateException(
                String.format("Commission in %s status cannot apply %s (%s)", from, event, transition.outcome()));
        }
        return transition.target();
    }

    private static void row(CommissionStatus from, Transition... byEvent) {
        CommissionEvent[] events = CommissionEvent.values();
        if (byEvent.length != events.length) {
            throw new IllegalStateException("Incomplete transition row for " + from);
        }
        Map<CommissionEvent, Transition> row = new EnumMap<>(CommissionEvent.class);
        for (int i = 0; i < events.length; i++) {
            row.put(events[i], byEvent[i]);
        }
        TABLE.put(from, row);
    }
}
