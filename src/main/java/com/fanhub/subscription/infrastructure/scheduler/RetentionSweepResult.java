package com.fanhub.subscription.infrastructure.scheduler;

import com.fanhub.subscription.domain.model.TargetKind;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Summary of one retention sweep run.
 *
 * @author FanHub Team
 */
public final class RetentionSweepResult {

    private final boolean executed;
    private final Instant cutoff;
    private final Map<TargetKind, Long> purgedByKind;
    private final long durationMs;

    private RetentionSweepResult(boolean executed, Instant cutoff, Map<TargetKind, Long> purgedByKind, long durationMs) {
        this.executed = executed;
        this.cutoff = cutoff;
        this.purgedByKind = purgedByKind;
        this.durationMs = durationMs;
    }

    public static RetentionSweepResult executed(Instant cutoff, Map<TargetKind, Long> purgedByKind, long durationMs) {
        Map<TargetKind, Long> copy = new EnumMap<>(TargetKind.class);
        copy.putAll(purgedByKind);
        return new RetentionSweepResult(true, cutoff, Collections.unmodifiableMap(copy), durationMs);
    }

    /**
     * Another instance held the sweep lock, nothing was deleted.
     */
    public static RetentionSweepResult skipped() {
        return new RetentionSweepResult(false, null, Collections.emptyMap(), 0L);
    }

    public boolean isExecuted() {
        return executed;
    }

    public Instant getCutoff() {
        return cutoff;
    }

    public Map<TargetKind, Long> getPurgedByKind() {
        return purgedByKind;
    }

    public long getPurged(TargetKind kind) {
        return purgedByKind.getOrDefault(kind, 0L);
    }

    public long getTotalPurged() {
        return purgedByKind.values().stream().mapToLong(Long::longValue).sum();
    }

    public long getDurationMs() {
        return durationMs;
    }
}
