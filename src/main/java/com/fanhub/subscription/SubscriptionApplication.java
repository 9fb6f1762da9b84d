package com.fanhub.subscription;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for FanHub player/team subscriptions.
 *
 * Features:
 * - Subscribe/unsubscribe with soft delete and a resubscribe cooldown (24h by default)
 * - Restore of the same subscription row after the cooldown
 * - One active team per user (configurable single-active kinds)
 * - Cached public subscriber counts
 * - Nightly retention sweep that hard deletes rows unsubscribed more than 3 days ago
 *
 * Architecture:
 * - API Layer: REST controllers, header-based authentication
 * - Service Layer: per-kind subscription services owning their transactions
 * - Data Access Layer: JPA repositories with pessimistic row locks
 * - Infrastructure Layer: Redis cache and locks, CloudWatch metrics, scheduler
 *
 * @author FanHub Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableScheduling
public class SubscriptionApplication {

    public static void main(String[] args) {
        SpringApplication.run(SubscriptionApplication.class, args);
    }
}
