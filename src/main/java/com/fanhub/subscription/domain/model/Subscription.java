package com.fanhub.subscription.domain.model;

import jakarta.persistence.*;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Common state of a user's subscription to a target (player or team).
 *
 * One row exists per (user, target) pair and is reused across unsubscribe/resubscribe
 * cycles. Soft delete is explicit:
 * - ACTIVE: user is currently subscribed, deletedAt is null
 * - DELETED: user unsubscribed at deletedAt, row kept until the retention sweep removes it
 *
 * @author FanHub Team
 */
@MappedSuperclass
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public abstract class Subscription {

    @Id
    @Column(name = "subscription_id", nullable = false, length = 36)
    private String subscriptionId;

    /**
     * Subscribing user. Never changes after creation.
     */
    @Column(name = "user_id", nullable = false, length = 64, updatable = false)
    private String userId;

    /**
     * Subscribed player or team. Never changes after creation.
     */
    @Column(name = "target_id", nullable = false, length = 64, updatable = false)
    private String targetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 16)
    @Builder.Default
    private SubscriptionState state = SubscriptionState.ACTIVE;

    /**
     * When the user unsubscribed. Null while ACTIVE.
     */
    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (subscriptionId == null) {
            subscriptionId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (state == null) {
            state = SubscriptionState.ACTIVE;
        }
    }

    /**
     * The kind of target this subscription points at.
     */
    public abstract TargetKind getTargetKind();

    public boolean isActive() {
        return state == SubscriptionState.ACTIVE;
    }

    public boolean isDeleted() {
        return state == SubscriptionState.DELETED;
    }

    /**
     * Soft delete (user unsubscribed).
     *
     * @param now Deletion timestamp
     * @throws IllegalStateException if the subscription is not active
     */
    public void markDeleted(Instant now) {
        if (!isActive()) {
            throw new IllegalStateException("Subscription " + subscriptionId + " is not active");
        }
        this.state = SubscriptionState.DELETED;
        this.deletedAt = now;
        this.updatedAt = now;
    }

    /**
     * Reactivate a soft-deleted subscription in place. Identity and createdAt are kept.
     *
     * @param now Restore timestamp
     * @throws IllegalStateException if the subscription is not deleted
     */
    public void restore(Instant now) {
        if (!isDeleted()) {
            throw new IllegalStateException("Subscription " + subscriptionId + " is not deleted");
        }
        this.state = SubscriptionState.ACTIVE;
        this.deletedAt = null;
        this.updatedAt = now;
    }

    /**
     * Time left before a deleted subscription may be restored.
     *
     * @param now Current time
     * @param cooldown Cooldown window after unsubscribing
     * @return Remaining wait, or Duration.ZERO if the cooldown has elapsed or the row is active
     */
    public Duration cooldownRemaining(Instant now, Duration cooldown) {
        if (!isDeleted() || deletedAt == null) {
            return Duration.ZERO;
        }
        Duration elapsed = Duration.between(deletedAt, now);
        if (elapsed.compareTo(cooldown) >= 0) {
            return Duration.ZERO;
        }
        return cooldown.minus(elapsed);
    }

    /**
     * Subscription state enum.
     */
    public enum SubscriptionState {
        /**
         * User is subscribed.
         */
        ACTIVE,

        /**
         * User unsubscribed; row awaits restore or retention purge.
         */
        DELETED
    }
}
