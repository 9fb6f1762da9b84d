package com.fanhub.subscription.domain.model;

import java.util.Locale;

/**
 * Kinds of entities a user can subscribe to.
 *
 * @author FanHub Team
 */
public enum TargetKind {

    PLAYER("player"),

    TEAM("team");

    private final String pathSegment;

    TargetKind(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    /**
     * Lower-case name used in URLs and cache keys.
     */
    public String getPathSegment() {
        return pathSegment;
    }

    /**
     * Resolve a kind from its URL path segment.
     *
     * @param value Path segment ("player" or "team"), case-insensitive
     * @return Matching kind
     * @throws IllegalArgumentException if no kind matches
     */
    public static TargetKind fromPathSegment(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (TargetKind kind : values()) {
                if (kind.pathSegment.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown subscription target kind: " + value);
    }
}
