package com.fanhub.subscription.service;

import com.fanhub.subscription.domain.model.TargetKind;

/**
 * Lookup of subscribable players and teams, owned by the player/team directory.
 *
 * @author FanHub Team
 */
public interface TargetDirectory {

    /**
     * @param kind Target kind
     * @param targetId Target ID
     * @return true if the directory knows the target
     */
    boolean exists(TargetKind kind, String targetId);
}
