package com.fanhub.subscription.exception;

import com.fanhub.subscription.domain.model.TargetKind;

import java.time.Duration;
import java.time.Instant;

/**
 * Exception thrown when a user resubscribes inside the cooldown window after unsubscribing.
 * Carries the remaining wait so clients can tell the user when to try again.
 *
 * @author FanHub Team
 */
public class ResubscribeTooSoonException extends RuntimeException {

    private final TargetKind kind;
    private final String targetId;
    private final Duration remaining;
    private final Instant availableAt;

    public ResubscribeTooSoonException(TargetKind kind, String targetId, Duration remaining, Instant availableAt) {
        super(String.format("Cannot resubscribe to %s %s yet. Try again in %d seconds",
                kind.getPathSegment(), targetId, toWholeSeconds(remaining)));
        this.kind = kind;
        this.targetId = targetId;
        this.remaining = remaining;
        this.availableAt = availableAt;
    }

    public TargetKind getKind() {
        return kind;
    }

    public String getTargetId() {
        return targetId;
    }

    public Duration getRemaining() {
        return remaining;
    }

    /**
     * Remaining wait rounded up to whole seconds.
     */
    public long getRemainingSeconds() {
        return toWholeSeconds(remaining);
    }

    public Instant getAvailableAt() {
        return availableAt;
    }

    private static long toWholeSeconds(Duration duration) {
        long seconds = duration.getSeconds();
        return duration.getNano() > 0 ? seconds + 1 : seconds;
    }
}
