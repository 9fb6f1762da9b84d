package com.fanhub.subscription.infrastructure.scheduler;

import com.fanhub.subscription.config.SubscriptionProperties;
import com.fanhub.subscription.domain.model.Subscription;
import com.fanhub.subscription.domain.model.TargetKind;
import com.fanhub.subscription.exception.StorageException;
import com.fanhub.subscription.infrastructure.lock.RedisDistributedLock;
import com.fanhub.subscription.infrastructure.metrics.CloudWatchMetricsService;
import com.fanhub.subscription.repository.PlayerSubscriptionRepository;
import com.fanhub.subscription.repository.SubscriptionRepository;
import com.fanhub.subscription.repository.TeamSubscriptionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scheduled hard deletion of soft-deleted subscriptions past the retention period.
 *
 * Each run:
 * 1. Takes the cluster-wide sweep lock in Redis; a run that cannot get it is skipped
 * 2. Computes cutoff = now - retention period
 * 3. Per target kind, deletes DELETED rows with deleted_at &lt;= cutoff in batches,
 *    each batch in its own transaction, until a short batch or the batch limit
 *
 * Active rows and rows deleted after the cutoff are never touched. A row restored
 * between selection and deletion survives because the DELETE re-checks the predicate.
 *
 * @author FanHub Team
 */
@Service
public class SubscriptionRetentionScheduler {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionRetentionScheduler.class);

    private final Map<TargetKind, SubscriptionRepository<? extends Subscription>> repositories;
    private final TransactionTemplate transactionTemplate;
    private final RedisDistributedLock distributedLock;
    private final CloudWatchMetricsService metricsService;
    private final SubscriptionProperties properties;
    private final Clock clock;

    public SubscriptionRetentionScheduler(
            PlayerSubscriptionRepository playerSubscriptionRepository,
            TeamSubscriptionRepository teamSubscriptionRepository,
            PlatformTransactionManager transactionManager,
            RedisDistributedLock distributedLock,
            CloudWatchMetricsService metricsService,
            SubscriptionProperties properties,
            Clock clock
    ) {
        this.repositories = new EnumMap<>(TargetKind.class);
        this.repositories.put(TargetKind.PLAYER, playerSubscriptionRepository);
        this.repositories.put(TargetKind.TEAM, teamSubscriptionRepository);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.distributedLock = distributedLock;
        this.metricsService = metricsService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Daily retention sweep (midnight by default).
     */
    @Scheduled(cron = "${fanhub.subscription.retention.cron:0 0 0 * * *}")
    public void purgeExpiredSubscriptions() {
        if (!properties.getRetention().isEnabled()) {
            logger.debug("Subscription retention sweep is disabled");
            return;
        }

        try {
            runSweep();
        } catch (Exception e) {
            logger.error("Error in subscription retention sweep", e);
            metricsService.recordError("RETENTION_SWEEP_ERROR", "purgeExpiredSubscriptions");
        }
    }

    /**
     * Manual trigger (admin endpoint). Runs even when the schedule is disabled.
     *
     * @return Per-kind purge counts, or a skipped result if another instance is sweeping
     * @throws StorageException if the database fails mid-sweep
     */
    public RetentionSweepResult triggerSweepNow() {
        logger.info("Manual retention sweep triggered");
        return runSweep();
    }

    private RetentionSweepResult runSweep() {
        SubscriptionProperties.Retention retention = properties.getRetention();
        String lockKey = RedisDistributedLock.retentionSweepLockKey();
        String lockToken = distributedLock.acquireLock(lockKey, retention.getLockExpiry());
        if (lockToken == null) {
            logger.info("Retention sweep skipped, another instance holds {}", lockKey);
            return RetentionSweepResult.skipped();
        }

        long startTime = System.currentTimeMillis();
        Instant cutoff = clock.instant().minus(retention.getPeriod());

        try {
            Map<TargetKind, Long> purgedByKind = new EnumMap<>(TargetKind.class);
            for (Map.Entry<TargetKind, SubscriptionRepository<? extends Subscription>> entry : repositories.entrySet()) {
                long purged = purgeKind(entry.getKey(), entry.getValue(), cutoff, retention);
                purgedByKind.put(entry.getKey(), purged);
                metricsService.recordPurged(entry.getKey(), purged);
            }

            long duration = System.currentTimeMillis() - startTime;
            metricsService.recordSweepDuration(duration);
            logger.info("Retention sweep completed: cutoff={}, player={}, team={}, duration={}ms",
                    cutoff, purgedByKind.get(TargetKind.PLAYER), purgedByKind.get(TargetKind.TEAM), duration);

            return RetentionSweepResult.executed(cutoff, purgedByKind, duration);
        } finally {
            distributedLock.releaseLock(lockKey, lockToken);
        }
    }

    private long purgeKind(
            TargetKind kind,
            SubscriptionRepository<? extends Subscription> repository,
            Instant cutoff,
            SubscriptionProperties.Retention retention
    ) {
        int batchSize = retention.getBatchSize();
        long total = 0;

        for (int batch = 0; batch < retention.getMaxBatches(); batch++) {
            PurgeBatch result;
            try {
                result = transactionTemplate.execute(status -> {
                    List<String> ids = repository.findPurgeCandidateIds(cutoff, PageRequest.of(0, batchSize));
                    if (ids.isEmpty()) {
                        return new PurgeBatch(0, 0);
                    }
                    return new PurgeBatch(ids.size(), repository.purgeDeleted(ids, cutoff));
                });
            } catch (DataAccessException | TransactionException e) {
                logger.error("Retention sweep failed for {} after {} rows", kind.getPathSegment(), total, e);
                metricsService.recordError("STORAGE_ERROR", "retentionSweep");
                throw new StorageException("retentionSweep", e.getMessage(), e);
            }

            if (result == null) {
                return total;
            }
            total += result.deleted;
            logger.debug("Purged {} of {} candidate {} subscriptions in batch {}",
                    result.deleted, result.selected, kind.getPathSegment(), batch + 1);

            if (result.selected < batchSize) {
                return total;
            }
        }

        if (total > 0) {
            logger.warn("Retention sweep for {} stopped at the batch limit, remaining rows wait for the next run",
                    kind.getPathSegment());
        }
        return total;
    }

    private static final class PurgeBatch {
        private final int selected;
        private final int deleted;

        private PurgeBatch(int selected, int deleted) {
            this.selected = selected;
            this.deleted = deleted;
        }
    }
}
