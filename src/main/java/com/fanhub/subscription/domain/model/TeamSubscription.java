package com.fanhub.subscription.domain.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * A user's subscription to a team.
 * By default a user supports one team at a time (see single-active kinds in configuration).
 *
 * @author FanHub Team
 */
@Entity
@Table(name = "team_subscription",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_team_subscription_user_target", columnNames = {"user_id", "target_id"})
    },
    indexes = {
        @Index(name = "idx_team_subscription_target_state", columnList = "target_id, state"),
        @Index(name = "idx_team_subscription_user_state", columnList = "user_id, state"),
        @Index(name = "idx_team_subscription_state_deleted_at", columnList = "state, deleted_at")
    })
@SuperBuilder
@NoArgsConstructor
public class TeamSubscription extends Subscription {

    @Override
    public TargetKind getTargetKind() {
        return TargetKind.TEAM;
    }
}
