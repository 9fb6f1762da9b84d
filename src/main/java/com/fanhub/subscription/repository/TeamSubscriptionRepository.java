package com.fanhub.subscription.repository;

import com.fanhub.subscription.domain.model.TeamSubscription;
import org.springframework.stereotype.Repository;

/**
 * Repository for the team_subscription table.
 *
 * @author FanHub Team
 */
@Repository
public interface TeamSubscriptionRepository extends SubscriptionRepository<TeamSubscription> {
}
