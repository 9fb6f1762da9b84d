package com.fanhub.subscription.api.dto;

import com.fanhub.subscription.infrastructure.scheduler.RetentionSweepResult;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a manually triggered retention sweep.
 *
 * @author FanHub Team
 */
@Getter
@NoArgsConstructor
public class RetentionSweepResponse {

    private boolean executed;
    private Instant cutoff;
    private long totalPurged;
    private Map<String, Long> purgedByKind = new LinkedHashMap<>();
    private long durationMs;

    public static RetentionSweepResponse fromResult(RetentionSweepResult result) {
        RetentionSweepResponse response = new RetentionSweepResponse();
        response.executed = result.isExecuted();
        response.cutoff = result.getCutoff();
        response.totalPurged = result.getTotalPurged();
        result.getPurgedByKind().forEach((kind, count) -> response.purgedByKind.put(kind.getPathSegment(), count));
        response.durationMs = result.getDurationMs();
        return response;
    }
}
