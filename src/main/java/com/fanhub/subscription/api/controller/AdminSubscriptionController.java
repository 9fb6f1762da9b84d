package com.fanhub.subscription.api.controller;

import com.fanhub.subscription.api.dto.RetentionSweepResponse;
import com.fanhub.subscription.infrastructure.scheduler.RetentionSweepResult;
import com.fanhub.subscription.infrastructure.scheduler.SubscriptionRetentionScheduler;
import com.fanhub.subscription.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints. Requires ROLE_ADMIN.
 *
 * @author FanHub Team
 */
@RestController
@RequestMapping("/api/v1/admin/subscriptions")
public class AdminSubscriptionController {

    private static final Logger logger = LoggerFactory.getLogger(AdminSubscriptionController.class);

    private final SubscriptionRetentionScheduler retentionScheduler;

    public AdminSubscriptionController(SubscriptionRetentionScheduler retentionScheduler) {
        this.retentionScheduler = retentionScheduler;
    }

    /**
     * Run the retention sweep now instead of waiting for the nightly schedule.
     *
     * @return Per-kind purge counts; executed=false if another instance was already sweeping
     */
    @PostMapping("/retention-sweep")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<RetentionSweepResponse> triggerRetentionSweep() {
        logger.info("Retention sweep requested by admin {}", SecurityUtils.getCurrentUserId());

        RetentionSweepResult result = retentionScheduler.triggerSweepNow();
        return ResponseEntity.ok(RetentionSweepResponse.fromResult(result));
    }
}
