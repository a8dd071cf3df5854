package com.whereq.cascade.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * What the tier controller did for one unit
 */
@Value
@Builder
public class ScheduleReport {
    /**
     * Plans of the tiers actually entered, in order
     */
    @Singular
    List<TierPlan> plans;

    /**
     * Results of every attempt started, in completion order
     */
    @Singular
    List<JobResult> results;

    boolean cancelled;

    public TierPlan planOf(Tier tier) {
        return plans.stream().filter(plan -> plan.getTier() == tier).findFirst().orElse(null);
    }

    /**
     * Attempt with the highest observed peak memory, null if none was measured
     */
    public JobResult peakMemoryAttempt() {
        return results.stream()
            .filter(result -> Objects.nonNull(result.getPeakMemoryMiB()))
            .max((a, b) -> Long.compare(a.getPeakMemoryMiB(), b.getPeakMemoryMiB()))
            .orElse(null);
    }

    public static ScheduleReport empty() {
        return ScheduleReport.builder().build();
    }
}
