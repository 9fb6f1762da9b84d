package com.fanhub.subscription.infrastructure.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;

/**
 * Redis-based distributed lock (SET NX PX with an owner token).
 *
 * Used for:
 * - lock:subscription:{kind}:user:{user_id} - one-active-per-user check for single-active kinds
 * - lock:subscription:retention-sweep      - only one instance sweeps at a time
 *
 * Usage:
 * <pre>
 * String token = lock.acquireLock(key, Duration.ofSeconds(5));
 * if (token != null) {
 *     try {
 *         // critical section
 *     } finally {
 *         lock.releaseLock(key, token);
 *     }
 * }
 * </pre>
 *
 * @author FanHub Team
 */
@Service
public class RedisDistributedLock {

    private static final Logger logger = LoggerFactory.getLogger(RedisDistributedLock.class);

    private static final String LOCK_PREFIX = "lock:subscription:";
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(20);
    private static final Duration MAX_RETRY_BACKOFF = Duration.ofMillis(200);

    // Delete only when the stored token is ours
    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class
    );

    private final StringRedisTemplate stringRedisTemplate;

    public RedisDistributedLock(StringRedisTemplate stringRedisTemplate) {
        this.stringRedisTemplate = stringRedisTemplate;
    }

    public static String userLockKey(String kind, String userId) {
        return LOCK_PREFIX + kind + ":user:" + userId;
    }

    public static String retentionSweepLockKey() {
        return LOCK_PREFIX + "retention-sweep";
    }

    /**
     * Attempt to acquire a lock once.
     *
     * @param lockKey Lock key
     * @param expiry Auto-release time if the holder crashes
     * @return Lock token if acquired, null if the lock is held or Redis is unreachable
     */
    public String acquireLock(String lockKey, Duration expiry) {
        try {
            String lockToken = UUID.randomUUID().toString();
            Boolean acquired = stringRedisTemplate.opsForValue().setIfAbsent(lockKey, lockToken, expiry);

            if (Boolean.TRUE.equals(acquired)) {
                logger.debug("Acquired lock: {} with token: {}", lockKey, lockToken);
                return lockToken;
            }
            logger.debug("Failed to acquire lock (already held): {}", lockKey);
            return null;
        } catch (Exception e) {
            logger.error("Error acquiring lock for key: {}", lockKey, e);
            return null;
        }
    }

    /**
     * Acquire a lock, retrying with capped exponential backoff until the wait elapses.
     *
     * @param lockKey Lock key
     * @param expiry Auto-release time
     * @param wait Maximum time to keep trying
     * @return Lock token if acquired, null on timeout or interruption
     */
    public String acquireLockWithRetry(String lockKey, Duration expiry, Duration wait) {
        long deadline = System.nanoTime() + wait.toNanos();
        long backoffMillis = RETRY_BACKOFF.toMillis();
        int attempt = 0;

        do {
            attempt++;
            String lockToken = acquireLock(lockKey, expiry);
            if (lockToken != null) {
                logger.debug("Acquired lock after {} attempts: {}", attempt, lockKey);
                return lockToken;
            }

            try {
                Thread.sleep(backoffMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Lock acquisition interrupted for key: {}", lockKey);
                return null;
            }
            backoffMillis = Math.min(backoffMillis * 2, MAX_RETRY_BACKOFF.toMillis());
        } while (System.nanoTime() < deadline);

        logger.warn("Failed to acquire lock after {}ms and {} attempts: {}", wait.toMillis(), attempt, lockKey);
        return null;
    }

    /**
     * Release a lock if it is still owned by the given token.
     *
     * @param lockKey Lock key
     * @param lockToken Token returned from acquireLock
     * @return true if released
     */
    public boolean releaseLock(String lockKey, String lockToken) {
        if (lockToken == null) {
            return false;
        }
        try {
            Long deleted = stringRedisTemplate.execute(RELEASE_SCRIPT, Collections.singletonList(lockKey), lockToken);
            if (deleted != null && deleted > 0) {
                logger.debug("Released lock: {} with token: {}", lockKey, lockToken);
                return true;
            }
            logger.warn("Lock {} was not released (expired or owned by another holder)", lockKey);
            return false;
        } catch (Exception e) {
            logger.error("Error releasing lock for key: {}", lockKey, e);
            return false;
        }
    }
}
