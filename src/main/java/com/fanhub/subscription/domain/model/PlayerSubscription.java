package com.fanhub.subscription.domain.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * A user's subscription to a player. Users may follow any number of players.
 *
 * @author FanHub Team
 */
@Entity
@Table(name = "player_subscription",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_player_subscription_user_target", columnNames = {"user_id", "target_id"})
    },
    indexes = {
        @Index(name = "idx_player_subscription_target_state", columnList = "target_id, state"),
        @Index(name = "idx_player_subscription_user_state", columnList = "user_id, state"),
        @Index(name = "idx_player_subscription_state_deleted_at", columnList = "state, deleted_at")
    })
@SuperBuilder
@NoArgsConstructor
public class PlayerSubscription extends Subscription {

    @Override
    public TargetKind getTargetKind() {
        return TargetKind.PLAYER;
    }
}
