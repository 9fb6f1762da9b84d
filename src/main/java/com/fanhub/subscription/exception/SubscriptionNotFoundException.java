package com.fanhub.subscription.exception;

import com.fanhub.subscription.domain.model.TargetKind;

/**
 * Exception thrown when unsubscribing from a target the user is not actively subscribed to.
 *
 * @author FanHub Team
 */
public class SubscriptionNotFoundException extends RuntimeException {

    private final TargetKind kind;
    private final String userId;
    private final String targetId;

    public SubscriptionNotFoundException(TargetKind kind, String userId, String targetId) {
        super(String.format("User %s has no active subscription to %s %s",
                userId, kind.getPathSegment(), targetId));
        this.kind = kind;
        this.userId = userId;
        this.targetId = targetId;
    }

    public TargetKind getKind() {
        return kind;
    }

    public String getUserId() {
        return userId;
    }

    public String getTargetId() {
        return targetId;
    }
}
