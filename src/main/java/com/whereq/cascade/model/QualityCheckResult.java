package com.whereq.cascade.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of the optional quality checks run over a unit's completed output.
 * Failures here are reported only; they never change a job's final status.
 */
@Value
@Builder
public class QualityCheckResult {
    /**
     * Number of checks started
     */
    int checked;

    /**
     * Subjects (usually file names) whose check failed
     */
    @Singular
    List<String> failures;

    /**
     * Directory of the aggregated report, null when no aggregation ran or it failed
     */
    String aggregateReport;

    boolean aggregationFailed;

    /**
     * Tools that were not found and whose checks were skipped
     */
    @Singular
    List<String> missingTools;

    /**
     * False when the stage had no checks to run
     */
    public boolean ranAnything() {
        return checked > 0 || aggregateReport != null || aggregationFailed || !missingTools.isEmpty();
    }

    public static QualityCheckResult none() {
        return QualityCheckResult.builder().build();
    }
}
