package com.fanhub.subscription.service;

import com.fanhub.subscription.domain.model.Subscription;

/**
 * Result of a subscribe call: the subscription row and how it was obtained.
 *
 * @author FanHub Team
 */
public final class SubscriptionOutcome {

    private final Subscription subscription;
    private final Result result;

    private SubscriptionOutcome(Subscription subscription, Result result) {
        this.subscription = subscription;
        this.result = result;
    }

    public static SubscriptionOutcome created(Subscription subscription) {
        return new SubscriptionOutcome(subscription, Result.CREATED);
    }

    public static SubscriptionOutcome restored(Subscription subscription) {
        return new SubscriptionOutcome(subscription, Result.RESTORED);
    }

    public static SubscriptionOutcome alreadyActive(Subscription subscription) {
        return new SubscriptionOutcome(subscription, Result.ALREADY_ACTIVE);
    }

    public Subscription getSubscription() {
        return subscription;
    }

    public Result getResult() {
        return result;
    }

    /**
     * True only when a brand-new row was inserted.
     */
    public boolean isCreated() {
        return result == Result.CREATED;
    }

    /**
     * True when the call changed state (new row or restored row).
     */
    public boolean isStateChanged() {
        return result != Result.ALREADY_ACTIVE;
    }

    public enum Result {
        /**
         * First subscription for the pair; a new row was inserted.
         */
        CREATED,

        /**
         * A soft-deleted row was reactivated after the cooldown.
         */
        RESTORED,

        /**
         * The pair was already subscribed; nothing changed.
         */
        ALREADY_ACTIVE
    }
}
