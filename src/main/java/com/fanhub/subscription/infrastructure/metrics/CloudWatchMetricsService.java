package com.fanhub.subscription.infrastructure.metrics;

import com.fanhub.subscription.domain.model.TargetKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Subscription metrics published through Micrometer (CloudWatch in production).
 * Meters are tagged by target kind only; target and user ids are never used as tags.
 *
 * @author FanHub Team
 */
@Service
public class CloudWatchMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(CloudWatchMetricsService.class);

    private static final String METRIC_PREFIX = "fanhub.subscription.";
    private static final String RETENTION_PREFIX = METRIC_PREFIX + "retention.";
    private static final String CACHE_PREFIX = METRIC_PREFIX + "cache.";

    private final MeterRegistry meterRegistry;

    public CloudWatchMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a successful subscribe call.
     *
     * @param kind Target kind
     * @param outcome CREATED, RESTORED or ALREADY_ACTIVE
     */
    public void recordSubscribe(TargetKind kind, String outcome) {
        Counter.builder(METRIC_PREFIX + "subscribe")
                .tag("kind", kind.getPathSegment())
                .tag("outcome", outcome)
                .description("Subscribe calls by outcome")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded subscribe for kind: {}, outcome: {}", kind, outcome);
    }

    public void recordUnsubscribe(TargetKind kind) {
        Counter.builder(METRIC_PREFIX + "unsubscribe")
                .tag("kind", kind.getPathSegment())
                .description("Unsubscribe calls")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a rejected client operation.
     *
     * @param kind Target kind
     * @param reason e.g. "COOLDOWN", "NOT_SUBSCRIBED", "ACTIVE_CONFLICT"
     */
    public void recordRejection(TargetKind kind, String reason) {
        Counter.builder(METRIC_PREFIX + "rejected")
                .tag("kind", kind.getPathSegment())
                .tag("reason", reason)
                .description("Rejected subscription operations")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded rejection for kind: {}, reason: {}", kind, reason);
    }

    /**
     * Record rows hard-deleted by the retention sweep.
     *
     * @param kind Target kind
     * @param count Rows purged
     */
    public void recordPurged(TargetKind kind, long count) {
        Counter.builder(RETENTION_PREFIX + "purged")
                .tag("kind", kind.getPathSegment())
                .description("Soft-deleted subscriptions permanently removed")
                .register(meterRegistry)
                .increment(count);
    }

    public void recordSweepDuration(long durationMs) {
        Timer.builder(RETENTION_PREFIX + "duration")
                .description("Retention sweep duration")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordCacheHit(String cacheType) {
        Counter.builder(CACHE_PREFIX + "hit")
                .tag("cache_type", cacheType)
                .register(meterRegistry)
                .increment();
    }

    public void recordCacheMiss(String cacheType) {
        Counter.builder(CACHE_PREFIX + "miss")
                .tag("cache_type", cacheType)
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an error for alerting.
     *
     * @param errorType Error type, e.g. "STORAGE_ERROR"
     * @param operation Operation that failed
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "errors")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("Errors by type and operation")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded error: {} in operation: {}", errorType, operation);
    }
}
