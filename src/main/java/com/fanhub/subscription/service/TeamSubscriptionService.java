package com.fanhub.subscription.service;

import com.fanhub.subscription.config.SubscriptionProperties;
import com.fanhub.subscription.domain.model.TeamSubscription;
import com.fanhub.subscription.domain.model.TargetKind;
import com.fanhub.subscription.infrastructure.cache.RedisCacheService;
import com.fanhub.subscription.infrastructure.lock.RedisDistributedLock;
import com.fanhub.subscription.infrastructure.metrics.CloudWatchMetricsService;
import com.fanhub.subscription.repository.TeamSubscriptionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;

/**
 * Subscriptions to teams. Teams are a single-active kind by default: a user supports one team
 * at a time and {@link #getCurrent(String)} returns it.
 *
 * @author FanHub Team
 */
@Service
public class TeamSubscriptionService extends AbstractSubscriptionService<TeamSubscription> {

    public TeamSubscriptionService(
            TeamSubscriptionRepository repository,
            PlatformTransactionManager transactionManager,
            RedisCacheService cacheService,
            RedisDistributedLock distributedLock,
            CloudWatchMetricsService metricsService,
            SubscriptionProperties properties,
            Clock clock
    ) {
        super(repository, transactionManager, cacheService, distributedLock, metricsService, properties, clock);
    }

    @Override
    public TargetKind getKind() {
        return TargetKind.TEAM;
    }

    @Override
    protected TeamSubscription newSubscription(String userId, String targetId, Instant now) {
        return TeamSubscription.builder()
                .userId(userId)
                .targetId(targetId)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
