package com.fanhub.subscription.exception;

import com.fanhub.subscription.domain.model.TargetKind;

/**
 * Exception thrown when a subscription target (player or team) is not known to the directory.
 *
 * @author FanHub Team
 */
public class TargetNotFoundException extends RuntimeException {

    private final TargetKind kind;
    private final String targetId;

    public TargetNotFoundException(TargetKind kind, String targetId) {
        super(String.format("%s %s not found", kind.getPathSegment(), targetId));
        this.kind = kind;
        this.targetId = targetId;
    }

    public TargetKind getKind() {
        return kind;
    }

    public String getTargetId() {
        return targetId;
    }
}
