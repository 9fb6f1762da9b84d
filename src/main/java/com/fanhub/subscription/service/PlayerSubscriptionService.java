package com.fanhub.subscription.service;

import com.fanhub.subscription.config.SubscriptionProperties;
import com.fanhub.subscription.domain.model.PlayerSubscription;
import com.fanhub.subscription.domain.model.TargetKind;
import com.fanhub.subscription.infrastructure.cache.RedisCacheService;
import com.fanhub.subscription.infrastructure.lock.RedisDistributedLock;
import com.fanhub.subscription.infrastructure.metrics.CloudWatchMetricsService;
import com.fanhub.subscription.repository.PlayerSubscriptionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;

/**
 * Subscriptions to players. A user may follow any number of players.
 *
 * @author FanHub Team
 */
@Service
public class PlayerSubscriptionService extends AbstractSubscriptionService<PlayerSubscription> {

    public PlayerSubscriptionService(
            PlayerSubscriptionRepository repository,
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
        return TargetKind.PLAYER;
    }

    @Override
    protected PlayerSubscription newSubscription(String userId, String targetId, Instant now) {
        return PlayerSubscription.builder()
                .userId(userId)
                .targetId(targetId)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
