package com.whereq.cascade.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * End-of-run report for one batch unit and stage
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchSummary {
    private String stage;

    private String unit;

    private Instant startedAt;

    private Instant finishedAt;

    private ResourceBudget budget;

    /**
     * Tier-1 plan, null when nothing was pending
     */
    private TierPlan tier1Plan;

    private long fixedOverheadMiB;

    /**
     * Succeeded normally, including jobs skipped because their output already existed
     */
    @Builder.Default
    private List<String> succeeded = new ArrayList<>();

    /**
     * Succeeded under reduced fidelity
     */
    @Builder.Default
    private List<String> succeededDegraded = new ArrayList<>();

    /**
     * Terminally failed after every tier
     */
    @Builder.Default
    private List<String> failed = new ArrayList<>();

    /**
     * Already complete on disk before this run (subset of the succeeded categories)
     */
    @Builder.Default
    private List<String> skipped = new ArrayList<>();

    /**
     * Left pending by a cancelled run
     */
    @Builder.Default
    private List<String> interrupted = new ArrayList<>();

    /**
     * Number of job executions started by this run
     */
    private int attempts;

    private Long peakMemoryMiB;

    private String peakMemoryJob;

    private String peakMemoryTier;

    private String logDirectory;

    /**
     * Optional quality checks over the completed output, null when the stage ran none
     */
    private QualityCheckResult qualityChecks;

    private String reportFile;

    /**
     * Set when the unit failed before scheduling
     */
    private String error;

    public int total() {
        return succeeded.size() + succeededDegraded.size() + failed.size() + interrupted.size();
    }

    /**
     * True when the unit is not fully resolved to success
     */
    public boolean hasFailures() {
        return error != null || !failed.isEmpty() || !interrupted.isEmpty();
    }

    public FinalStatus statusOf(String jobId) {
        if (succeededDegraded.contains(jobId)) {
            return FinalStatus.SUCCEEDED_DEGRADED;
        }
        if (succeeded.contains(jobId)) {
            return FinalStatus.SUCCEEDED;
        }
        if (failed.contains(jobId)) {
            return FinalStatus.FAILED;
        }
        return null;
    }

    public static BatchSummary failedUnit(String stage, String unit, String error) {
        Instant now = Instant.now();
        return BatchSummary.builder()
            .stage(stage)
            .unit(unit)
            .startedAt(now)
            .finishedAt(now)
            .error(error)
            .build();
    }
}
