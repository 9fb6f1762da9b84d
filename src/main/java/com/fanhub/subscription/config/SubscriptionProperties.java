package com.fanhub.subscription.config;

import com.fanhub.subscription.domain.model.TargetKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Subscription lifecycle settings, bound from application.yml (fanhub.subscription.*).
 * Defaults below apply when a property is missing.
 *
 * @author FanHub Team
 */
@Component
@ConfigurationProperties(prefix = "fanhub.subscription")
@Data
public class SubscriptionProperties {

    /**
     * Minimum time between unsubscribing and resubscribing to the same target.
     */
    private Duration cooldown = Duration.ofHours(24);

    /**
     * Kinds for which a user may hold only one active subscription.
     */
    private Set<TargetKind> singleActiveKinds = EnumSet.of(TargetKind.TEAM);

    private Duration countCacheTtl = Duration.ofMinutes(5);

    private UserLock userLock = new UserLock();

    private Retention retention = new Retention();

    private Directory directory = new Directory();

    public boolean isSingleActive(TargetKind kind) {
        return singleActiveKinds != null && singleActiveKinds.contains(kind);
    }

    /**
     * Per-user lock in front of the single-active check. The partial unique index on active
     * team rows still rejects a second active team if the lock lapses mid-transaction, so the
     * expiry only needs to outlast the usual connection wait plus row lock wait.
     */
    @Data
    public static class UserLock {
        private Duration expiry = Duration.ofSeconds(15);
        private Duration wait = Duration.ofSeconds(2);
    }

    /**
     * Hard-delete sweep of soft-deleted rows.
     */
    @Data
    public static class Retention {
        private boolean enabled = true;
        private String cron = "0 0 0 * * *";
        private Duration period = Duration.ofDays(3);
        private int batchSize = 500;
        private int maxBatches = 100;
        private Duration lockExpiry = Duration.ofMinutes(10);
    }

    /**
     * Tables owned by the player/team directory, used to validate targets.
     */
    @Data
    public static class Directory {
        private String playerTable = "player";
        private String teamTable = "team";
    }
}
