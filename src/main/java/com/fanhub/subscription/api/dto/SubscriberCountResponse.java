package com.fanhub.subscription.api.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Active subscriber count of a player or team.
 *
 * @author FanHub Team
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SubscriberCountResponse {

    private String kind;
    private String targetId;
    private long count;
}
