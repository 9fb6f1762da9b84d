package com.fanhub.subscription.repository;

import com.fanhub.subscription.domain.model.PlayerSubscription;
import org.springframework.stereotype.Repository;

/**
 * Repository for the player_subscription table.
 *
 * @author FanHub Team
 */
@Repository
public interface PlayerSubscriptionRepository extends SubscriptionRepository<PlayerSubscription> {
}
