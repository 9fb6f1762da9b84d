package com.fanhub.subscription.exception;

import com.fanhub.subscription.domain.model.TargetKind;

/**
 * Exception thrown when a user subscribes to a second target of a kind that allows
 * only one active subscription per user (teams by default).
 *
 * @author FanHub Team
 */
public class ActiveSubscriptionConflictException extends RuntimeException {

    private final TargetKind kind;
    private final String userId;
    private final String activeTargetId;

    public ActiveSubscriptionConflictException(TargetKind kind, String userId, String activeTargetId) {
        super(String.format("User %s is already subscribed to %s %s. Unsubscribe first",
                userId, kind.getPathSegment(), activeTargetId));
        this.kind = kind;
        this.userId = userId;
        this.activeTargetId = activeTargetId;
    }

    public TargetKind getKind() {
        return kind;
    }

    public String getUserId() {
        return userId;
    }

    public String getActiveTargetId() {
        return activeTargetId;
    }
}
