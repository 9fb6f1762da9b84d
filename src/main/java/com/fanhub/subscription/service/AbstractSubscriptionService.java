package com.fanhub.subscription.service;

import com.fanhub.subscription.config.SubscriptionProperties;
import com.fanhub.subscription.domain.model.SubscribeDecision;
import com.fanhub.subscription.domain.model.Subscription;
import com.fanhub.subscription.domain.model.TargetKind;
import com.fanhub.subscription.exception.ActiveSubscriptionConflictException;
import com.fanhub.subscription.exception.ResubscribeTooSoonException;
import com.fanhub.subscription.exception.StorageException;
import com.fanhub.subscription.exception.SubscriptionNotFoundException;
import com.fanhub.subscription.infrastructure.cache.RedisCacheService;
import com.fanhub.subscription.infrastructure.lock.RedisDistributedLock;
import com.fanhub.subscription.infrastructure.metrics.CloudWatchMetricsService;
import com.fanhub.subscription.repository.SubscriptionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Subscribe/unsubscribe/restore lifecycle for one target kind.
 *
 * Guarantees:
 * - At most one row per (user, target): the existing row is read with a pessimistic write lock,
 *   and the table's unique constraint rejects a concurrent duplicate insert. The loser of an
 *   insert race re-reads once in a new transaction and returns the winner's row.
 * - Single-active kinds: the Redis user lock keeps concurrent calls of one user apart, and the
 *   table's partial unique index on active rows is the final word. A write rejected by that
 *   index is re-evaluated once and reported as an {@link ActiveSubscriptionConflictException}.
 * - Each operation owns its transaction; nothing is committed unless the whole
 *   check-decide-write sequence succeeds.
 * - Subscribe is idempotent, so callers can retry after a {@link StorageException}.
 *
 * @param <T> Concrete subscription entity
 * @author FanHub Team
 */
public abstract class AbstractSubscriptionService<T extends Subscription> {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final SubscriptionRepository<T> repository;
    private final TransactionTemplate transactionTemplate;
    private final RedisCacheService cacheService;
    private final RedisDistributedLock distributedLock;
    private final CloudWatchMetricsService metricsService;
    private final SubscriptionProperties properties;
    private final Clock clock;

    protected AbstractSubscriptionService(
            SubscriptionRepository<T> repository,
            PlatformTransactionManager transactionManager,
            RedisCacheService cacheService,
            RedisDistributedLock distributedLock,
            CloudWatchMetricsService metricsService,
            SubscriptionProperties properties,
            Clock clock
    ) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.cacheService = cacheService;
        this.distributedLock = distributedLock;
        this.metricsService = metricsService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Target kind handled by this service.
     */
    public abstract TargetKind getKind();

    /**
     * Build a new, not yet persisted, active subscription row.
     */
    protected abstract T newSubscription(String userId, String targetId, Instant now);

    /**
     * Ensure the user is subscribed to the target.
     *
     * - no row: a new active row is created (CREATED)
     * - active row: returned unchanged (ALREADY_ACTIVE)
     * - deleted row past the cooldown: reactivated in place, same id and createdAt (RESTORED)
     * - deleted row inside the cooldown: rejected
     *
     * Target existence is the caller's responsibility.
     *
     * @param userId Authenticated user ID
     * @param targetId Player or team ID
     * @return Outcome with the subscription row
     * @throws ResubscribeTooSoonException if the user unsubscribed less than the cooldown ago
     * @throws ActiveSubscriptionConflictException if the kind is single-active and another target is active
     * @throws StorageException if the database or lock service fails
     */
    public SubscriptionOutcome subscribe(String userId, String targetId) {
        requireId(userId, "userId");
        requireId(targetId, "targetId");
        TargetKind kind = getKind();

        String lockKey = null;
        String lockToken = null;
        if (properties.isSingleActive(kind)) {
            lockKey = RedisDistributedLock.userLockKey(kind.getPathSegment(), userId);
            lockToken = distributedLock.acquireLockWithRetry(
                    lockKey,
                    properties.getUserLock().getExpiry(),
                    properties.getUserLock().getWait()
            );
            if (lockToken == null) {
                metricsService.recordError("LOCK_UNAVAILABLE", "subscribe");
                throw new StorageException("subscribe",
                        "could not lock " + kind.getPathSegment() + " subscriptions of user " + userId);
            }
        }

        try {
            SubscriptionOutcome outcome = subscribeWithInsertRaceFallback(userId, targetId);

            if (outcome.isStateChanged()) {
                invalidateCount(targetId);
            }
            metricsService.recordSubscribe(kind, outcome.getResult().name());

            logger.info("Subscribe {} {} by user {}: {} (subscriptionId={})",
                    kind.getPathSegment(), targetId, userId, outcome.getResult(),
                    outcome.getSubscription().getSubscriptionId());
            return outcome;
        } finally {
            if (lockToken != null) {
                distributedLock.releaseLock(lockKey, lockToken);
            }
        }
    }

    /**
     * Soft delete the user's active subscription to the target.
     *
     * @param userId Authenticated user ID
     * @param targetId Player or team ID
     * @throws SubscriptionNotFoundException if there is no active subscription
     * @throws StorageException if the database fails
     */
    public void unsubscribe(String userId, String targetId) {
        requireId(userId, "userId");
        requireId(targetId, "targetId");
        TargetKind kind = getKind();

        try {
            transactionTemplate.executeWithoutResult(status -> {
                Optional<T> existing = repository.findForUpdate(userId, targetId);
                if (existing.isEmpty() || !existing.get().isActive()) {
                    metricsService.recordRejection(kind, "NOT_SUBSCRIBED");
                    logger.warn("Unsubscribe rejected: user {} has no active subscription to {} {}",
                            userId, kind.getPathSegment(), targetId);
                    throw new SubscriptionNotFoundException(kind, userId, targetId);
                }

                T subscription = existing.get();
                subscription.markDeleted(clock.instant());
                repository.save(subscription);
            });
        } catch (DataAccessException | TransactionException e) {
            throw storageFailure("unsubscribe", userId, targetId, e);
        }

        invalidateCount(targetId);
        metricsService.recordUnsubscribe(kind);
        logger.info("User {} unsubscribed from {} {}", userId, kind.getPathSegment(), targetId);
    }

    /**
     * Number of active subscribers of a target. Cache-first with database fallback.
     *
     * The cache version is read before the database, so a count that raced with a
     * subscribe/unsubscribe is stored under a version that change has already retired.
     *
     * @param targetId Player or team ID
     * @return Active subscriber count
     * @throws StorageException if the database fails
     */
    @Transactional(readOnly = true)
    public long count(String targetId) {
        requireId(targetId, "targetId");
        TargetKind kind = getKind();

        Optional<Long> version = cacheService.getCountVersion(kind, targetId);
        if (version.isPresent()) {
            Optional<Long> cached = cacheService.getSubscriberCount(kind, targetId, version.get());
            if (cached.isPresent()) {
                metricsService.recordCacheHit("subscriber_count");
                return cached.get();
            }
        }
        metricsService.recordCacheMiss("subscriber_count");

        long count;
        try {
            count = repository.countActive(targetId);
        } catch (DataAccessException e) {
            throw storageFailure("count", null, targetId, e);
        }

        version.ifPresent(v -> cacheService.setSubscriberCount(kind, targetId, v, count));
        return count;
    }

    /**
     * The user's single active subscription for a single-active kind.
     *
     * @param userId Authenticated user ID
     * @return Optional containing the active subscription
     * @throws IllegalStateException if this kind allows many active subscriptions per user
     * @throws StorageException if the database fails
     */
    @Transactional(readOnly = true)
    public Optional<T> getCurrent(String userId) {
        requireId(userId, "userId");
        if (!properties.isSingleActive(getKind())) {
            throw new IllegalStateException(
                    getKind().getPathSegment() + " subscriptions allow several active targets per user");
        }
        return listActive(userId).stream().findFirst();
    }

    /**
     * All active subscriptions of a user for this kind, most recently (re)activated first.
     *
     * @param userId Authenticated user ID
     * @return Active subscriptions
     * @throws StorageException if the database fails
     */
    @Transactional(readOnly = true)
    public List<T> listActive(String userId) {
        requireId(userId, "userId");
        try {
            return repository.findActiveByUserId(userId);
        } catch (DataAccessException e) {
            throw storageFailure("listActive", userId, null, e);
        }
    }

    private SubscriptionOutcome subscribeWithInsertRaceFallback(String userId, String targetId) {
        try {
            return transactionTemplate.execute(status -> subscribeInTransaction(userId, targetId));
        } catch (DataIntegrityViolationException e) {
            // A concurrent call committed a conflicting row first: the same pair, or another
            // active target of a single-active kind
            logger.info("Concurrent subscribe for {} {} by user {} hit a unique constraint, re-reading",
                    getKind().getPathSegment(), targetId, userId);
            try {
                return transactionTemplate.execute(status -> subscribeInTransaction(userId, targetId));
            } catch (DataAccessException | TransactionException retryFailure) {
                throw storageFailure("subscribe", userId, targetId, retryFailure);
            }
        } catch (DataAccessException | TransactionException e) {
            throw storageFailure("subscribe", userId, targetId, e);
        }
    }

    private SubscriptionOutcome subscribeInTransaction(String userId, String targetId) {
        TargetKind kind = getKind();
        Instant now = clock.instant();

        Optional<T> existing = repository.findForUpdate(userId, targetId);
        SubscribeDecision decision = SubscribeDecision.evaluate(existing.orElse(null), now, properties.getCooldown());

        switch (decision.getAction()) {
            case ALREADY_ACTIVE:
                return SubscriptionOutcome.alreadyActive(existing.get());

            case COOLDOWN:
                metricsService.recordRejection(kind, "COOLDOWN");
                logger.warn("Resubscribe rejected: user {} to {} {} within cooldown, {}s remaining",
                        userId, kind.getPathSegment(), targetId, decision.getRemainingCooldown().toSeconds());
                throw new ResubscribeTooSoonException(
                        kind, targetId, decision.getRemainingCooldown(), decision.getAvailableAt());

            case RESTORE:
                ensureNoOtherActiveTarget(userId, targetId);
                T restored = existing.get();
                restored.restore(now);
                return SubscriptionOutcome.restored(repository.saveAndFlush(restored));

            case CREATE:
            default:
                ensureNoOtherActiveTarget(userId, targetId);
                T created = repository.saveAndFlush(newSubscription(userId, targetId, now));
                return SubscriptionOutcome.created(created);
        }
    }

    private void invalidateCount(String targetId) {
        if (!cacheService.invalidateSubscriberCount(getKind(), targetId)) {
            metricsService.recordError("CACHE_INVALIDATION_FAILED", "subscriberCount");
        }
    }

    private void ensureNoOtherActiveTarget(String userId, String targetId) {
        TargetKind kind = getKind();
        if (!properties.isSingleActive(kind)) {
            return;
        }

        Optional<T> other = repository.findActiveByUserId(userId).stream()
                .filter(subscription -> !subscription.getTargetId().equals(targetId))
                .findFirst();
        if (other.isPresent()) {
            metricsService.recordRejection(kind, "ACTIVE_CONFLICT");
            logger.warn("Subscribe rejected: user {} already subscribed to {} {}",
                    userId, kind.getPathSegment(), other.get().getTargetId());
            throw new ActiveSubscriptionConflictException(kind, userId, other.get().getTargetId());
        }
    }

    private StorageException storageFailure(String operation, String userId, String targetId, Exception cause) {
        logger.error("Storage failure during {} for {} {} (user {})",
                operation, getKind().getPathSegment(), targetId, userId, cause);
        metricsService.recordError("STORAGE_ERROR", operation);
        return new StorageException(operation, cause.getMessage(), cause);
    }

    private static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
