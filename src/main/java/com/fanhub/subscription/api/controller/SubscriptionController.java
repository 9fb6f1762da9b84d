package com.fanhub.subscription.api.controller;

import com.fanhub.subscription.api.dto.SubscriberCountResponse;
import com.fanhub.subscription.api.dto.SubscriptionResponse;
import com.fanhub.subscription.domain.model.Subscription;
import com.fanhub.subscription.domain.model.TargetKind;
import com.fanhub.subscription.exception.TargetNotFoundException;
import com.fanhub.subscription.infrastructure.metrics.CloudWatchMetricsService;
import com.fanhub.subscription.security.SecurityUtils;
import com.fanhub.subscription.service.AbstractSubscriptionService;
import com.fanhub.subscription.service.PlayerSubscriptionService;
import com.fanhub.subscription.service.SubscriptionOutcome;
import com.fanhub.subscription.service.TargetDirectory;
import com.fanhub.subscription.service.TeamSubscriptionService;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller for player and team subscriptions.
 *
 * The {kind} path segment selects the target kind ("player" or "team").
 * All operations act on the authenticated user; only the subscriber count is public.
 *
 * @author FanHub Team
 */
@RestController
@Validated
@RequestMapping("/api/v1/subscriptions/{kind}")
public class SubscriptionController {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionController.class);

    // Matches the target_id column length
    private static final int MAX_TARGET_ID_LENGTH = 64;

    private final Map<TargetKind, AbstractSubscriptionService<? extends Subscription>> services;
    private final TargetDirectory targetDirectory;
    private final CloudWatchMetricsService metricsService;

    public SubscriptionController(
            PlayerSubscriptionService playerSubscriptionService,
            TeamSubscriptionService teamSubscriptionService,
            TargetDirectory targetDirectory,
            CloudWatchMetricsService metricsService
    ) {
        this.services = new EnumMap<>(TargetKind.class);
        this.services.put(TargetKind.PLAYER, playerSubscriptionService);
        this.services.put(TargetKind.TEAM, teamSubscriptionService);
        this.targetDirectory = targetDirectory;
        this.metricsService = metricsService;
    }

    /**
     * Subscribe the current user to a player or team.
     *
     * Responses:
     * - 201 CREATED: new subscription, or a deleted one restored after the cooldown
     * - 200 OK: already subscribed, nothing changed
     * - 400: unsubscribed less than the cooldown ago (details carry retryAfterSeconds)
     * - 404: unknown player or team
     * - 409: single-active kind and another target is already subscribed
     *
     * @param kind "player" or "team"
     * @param targetId Player or team ID
     * @return Subscription details with the subscribe result
     */
    @PostMapping("/{targetId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SubscriptionResponse> subscribe(
            @PathVariable String kind,
            @PathVariable @Size(max = MAX_TARGET_ID_LENGTH) String targetId
    ) {
        TargetKind targetKind = TargetKind.fromPathSegment(kind);
        String userId = SecurityUtils.requireCurrentUserId();

        if (!targetDirectory.exists(targetKind, targetId)) {
            metricsService.recordRejection(targetKind, "TARGET_NOT_FOUND");
            throw new TargetNotFoundException(targetKind, targetId);
        }

        SubscriptionOutcome outcome = serviceFor(targetKind).subscribe(userId, targetId);

        HttpStatus status = outcome.getResult() == SubscriptionOutcome.Result.ALREADY_ACTIVE
                ? HttpStatus.OK
                : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(SubscriptionResponse.fromOutcome(outcome));
    }

    /**
     * Unsubscribe the current user. The row is soft deleted and can be restored after the cooldown.
     *
     * @param kind "player" or "team"
     * @param targetId Player or team ID
     * @return 204 No Content, or 404 if the user is not subscribed
     */
    @DeleteMapping("/{targetId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Void> unsubscribe(
            @PathVariable String kind,
            @PathVariable @Size(max = MAX_TARGET_ID_LENGTH) String targetId
    ) {
        TargetKind targetKind = TargetKind.fromPathSegment(kind);
        String userId = SecurityUtils.requireCurrentUserId();

        serviceFor(targetKind).unsubscribe(userId, targetId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Number of active subscribers of a player or team. Public.
     */
    @GetMapping("/{targetId}/count")
    public ResponseEntity<SubscriberCountResponse> count(
            @PathVariable String kind,
            @PathVariable @Size(max = MAX_TARGET_ID_LENGTH) String targetId
    ) {
        TargetKind targetKind = TargetKind.fromPathSegment(kind);
        long count = serviceFor(targetKind).count(targetId);

        logger.debug("Subscriber count for {} {}: {}", targetKind.getPathSegment(), targetId, count);
        return ResponseEntity.ok(new SubscriberCountResponse(targetKind.getPathSegment(), targetId, count));
    }

    /**
     * Active subscriptions of the current user for this kind, most recent first.
     */
    @GetMapping("/me")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<SubscriptionResponse>> mySubscriptions(@PathVariable String kind) {
        TargetKind targetKind = TargetKind.fromPathSegment(kind);
        String userId = SecurityUtils.requireCurrentUserId();

        List<SubscriptionResponse> response = serviceFor(targetKind).listActive(userId).stream()
                .map(SubscriptionResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(response);
    }

    /**
     * The current user's single active subscription for a single-active kind (team by default).
     *
     * @return 200 with the subscription, 204 if the user has none,
     *         400 if the kind allows several active subscriptions
     */
    @GetMapping("/current")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SubscriptionResponse> currentSubscription(@PathVariable String kind) {
        TargetKind targetKind = TargetKind.fromPathSegment(kind);
        String userId = SecurityUtils.requireCurrentUserId();

        return serviceFor(targetKind).getCurrent(userId)
                .map(SubscriptionResponse::fromEntity)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    private AbstractSubscriptionService<? extends Subscription> serviceFor(TargetKind kind) {
        AbstractSubscriptionService<? extends Subscription> service = services.get(kind);
        if (service == null) {
            throw new IllegalArgumentException("No subscription service for " + kind.getPathSegment());
        }
        return service;
    }
}
