package com.fanhub.subscription.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of evaluating a subscribe request against the existing row for a (user, target) pair.
 *
 * State machine:
 * - no row              -> CREATE
 * - ACTIVE row          -> ALREADY_ACTIVE (idempotent no-op)
 * - DELETED, in cooldown -> COOLDOWN (reject with remaining wait)
 * - DELETED, cooled down -> RESTORE (reactivate the same row)
 *
 * Pure function of its inputs; storage and locking are the caller's concern.
 *
 * @author FanHub Team
 */
public final class SubscribeDecision {

    private final Action action;
    private final Duration remainingCooldown;
    private final Instant availableAt;

    private SubscribeDecision(Action action, Duration remainingCooldown, Instant availableAt) {
        this.action = action;
        this.remainingCooldown = remainingCooldown;
        this.availableAt = availableAt;
    }

    /**
     * Decide what a subscribe call must do.
     *
     * @param existing Existing row for the pair, or null when none exists
     * @param now Current time
     * @param cooldown Minimum time between unsubscribe and resubscribe
     * @return Decision
     */
    public static SubscribeDecision evaluate(Subscription existing, Instant now, Duration cooldown) {
        Objects.requireNonNull(now, "now");
        Objects.requireNonNull(cooldown, "cooldown");

        if (existing == null) {
            return new SubscribeDecision(Action.CREATE, Duration.ZERO, null);
        }
        if (existing.isActive()) {
            return new SubscribeDecision(Action.ALREADY_ACTIVE, Duration.ZERO, null);
        }

        Duration remaining = existing.cooldownRemaining(now, cooldown);
        if (!remaining.isZero()) {
            return new SubscribeDecision(Action.COOLDOWN, remaining, now.plus(remaining));
        }
        return new SubscribeDecision(Action.RESTORE, Duration.ZERO, null);
    }

    public Action getAction() {
        return action;
    }

    /**
     * Remaining wait; zero unless the action is COOLDOWN.
     */
    public Duration getRemainingCooldown() {
        return remainingCooldown;
    }

    /**
     * Earliest instant a resubscribe succeeds; null unless the action is COOLDOWN.
     */
    public Instant getAvailableAt() {
        return availableAt;
    }

    public enum Action {
        CREATE,
        ALREADY_ACTIVE,
        RESTORE,
        COOLDOWN
    }
}
