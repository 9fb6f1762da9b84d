package com.fanhub.subscription.api.dto;

import com.fanhub.subscription.domain.model.Subscription;
import com.fanhub.subscription.service.SubscriptionOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Response DTO for subscription operations.
 *
 * @author FanHub Team
 */
@Getter
@Setter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SubscriptionResponse {

    private String subscriptionId;
    private String kind;
    private String userId;
    private String targetId;
    private String state;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Set only for subscribe responses: CREATED, RESTORED or ALREADY_ACTIVE.
     */
    private String result;

    /**
     * Set only for subscribe responses: true when a new row was inserted.
     */
    private Boolean created;

    public static SubscriptionResponse fromEntity(Subscription subscription) {
        SubscriptionResponse response = new SubscriptionResponse();
        response.setSubscriptionId(subscription.getSubscriptionId());
        response.setKind(subscription.getTargetKind().getPathSegment());
        response.setUserId(subscription.getUserId());
        response.setTargetId(subscription.getTargetId());
        response.setState(subscription.getState().name());
        response.setCreatedAt(subscription.getCreatedAt());
        response.setUpdatedAt(subscription.getUpdatedAt());
        return response;
    }

    public static SubscriptionResponse fromOutcome(SubscriptionOutcome outcome) {
        SubscriptionResponse response = fromEntity(outcome.getSubscription());
        response.setResult(outcome.getResult().name());
        response.setCreated(outcome.isCreated());
        return response;
    }
}
