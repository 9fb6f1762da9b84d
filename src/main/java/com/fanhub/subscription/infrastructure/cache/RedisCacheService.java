package com.fanhub.subscription.infrastructure.cache;

import com.fanhub.subscription.config.SubscriptionProperties;
import com.fanhub.subscription.domain.model.TargetKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Redis cache for subscriber counts.
 * The database is the source of truth; every Redis failure is logged and treated as a miss.
 *
 * Cached counts are versioned per target. A committed subscribe/unsubscribe bumps the version,
 * so a count computed before the change can only land under a version no reader asks for again.
 *
 * Cache Keys:
 * - subscription_count_version:{kind}:{target_id} -> current version (Long, INCR only)
 * - subscription_count:{kind}:{target_id}:v{version} -> active subscriber count (Long)
 *
 * @author FanHub Team
 */
@Service
public class RedisCacheService {

    private static final Logger logger = LoggerFactory.getLogger(RedisCacheService.class);

    static final String COUNT_PREFIX = "subscription_count:";
    static final String VERSION_PREFIX = "subscription_count_version:";

    private final StringRedisTemplate redisTemplate;
    private final SubscriptionProperties properties;

    public RedisCacheService(StringRedisTemplate redisTemplate, SubscriptionProperties properties) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
    }

    /**
     * Current count version of a target. A target that never changed is at version 0.
     *
     * @param kind Target kind
     * @param targetId Target ID
     * @return Optional containing the version, empty if Redis cannot be read (caller skips the cache)
     */
    public Optional<Long> getCountVersion(TargetKind kind, String targetId) {
        String key = versionKey(kind, targetId);
        try {
            String value = redisTemplate.opsForValue().get(key);
            return Optional.of(value != null ? Long.parseLong(value) : 0L);
        } catch (Exception e) {
            logger.error("Error reading subscriber count version: {}", key, e);
            return Optional.empty();
        }
    }

    /**
     * Get a cached subscriber count stored under the given version.
     *
     * @param kind Target kind
     * @param targetId Target ID
     * @param version Version read with {@link #getCountVersion}
     * @return Optional containing the count if cached
     */
    public Optional<Long> getSubscriberCount(TargetKind kind, String targetId, long version) {
        String key = countKey(kind, targetId, version);
        try {
            String value = redisTemplate.opsForValue().get(key);
            if (value != null) {
                logger.debug("Cache hit for subscriber count: {}", key);
                return Optional.of(Long.parseLong(value));
            }
            logger.debug("Cache miss for subscriber count: {}", key);
            return Optional.empty();
        } catch (Exception e) {
            logger.error("Error reading subscriber count from cache: {}", key, e);
            return Optional.empty();
        }
    }

    /**
     * Cache a subscriber count for the configured TTL.
     * The version must be the one read before the count was computed.
     *
     * @param kind Target kind
     * @param targetId Target ID
     * @param version Version read before the database query
     * @param count Active subscriber count
     */
    public void setSubscriberCount(TargetKind kind, String targetId, long version, long count) {
        String key = countKey(kind, targetId, version);
        try {
            redisTemplate.opsForValue().set(key, Long.toString(count), properties.getCountCacheTtl());
            logger.debug("Cached subscriber count {} = {}", key, count);
        } catch (Exception e) {
            logger.error("Error caching subscriber count: {}", key, e);
        }
    }

    /**
     * Invalidate the cached count after a committed subscribe/unsubscribe.
     * Bumps the version first, then drops the entry of the superseded version.
     *
     * @param kind Target kind
     * @param targetId Target ID
     * @return true if the version was bumped
     */
    public boolean invalidateSubscriberCount(TargetKind kind, String targetId) {
        String key = versionKey(kind, targetId);
        Long version;
        try {
            version = redisTemplate.opsForValue().increment(key);
        } catch (Exception e) {
            logger.error("Error bumping subscriber count version: {}", key, e);
            return false;
        }
        if (version == null) {
            return false;
        }

        String superseded = countKey(kind, targetId, version - 1);
        try {
            redisTemplate.delete(superseded);
        } catch (Exception e) {
            // Unreachable once the version moved on; the TTL clears it
            logger.warn("Error deleting superseded subscriber count: {}", superseded, e);
        }
        logger.debug("Invalidated subscriber count {}:{} -> v{}", kind.getPathSegment(), targetId, version);
        return true;
    }

    static String versionKey(TargetKind kind, String targetId) {
        return VERSION_PREFIX + kind.getPathSegment() + ":" + targetId;
    }

    static String countKey(TargetKind kind, String targetId, long version) {
        return COUNT_PREFIX + kind.getPathSegment() + ":" + targetId + ":v" + version;
    }
}
