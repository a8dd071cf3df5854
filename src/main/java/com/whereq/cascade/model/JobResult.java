package com.whereq.cascade.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Result of one attempt as reported by the job runner
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResult {
    /**
     * Job identifier
     */
    private String jobId;

    private Tier tier;

    private AttemptOutcome outcome;

    /**
     * Thread count the tool was started with
     */
    private int threads;

    /**
     * Exit status of the last process started, null if none was started
     */
    private Integer exitCode;

    /**
     * Observed peak resident memory, null when unknown
     */
    private Long peakMemoryMiB;

    /**
     * Execution time in seconds
     */
    private long executionTimeSeconds;

    /**
     * Error message if failed
     */
    private String errorMessage;

    /**
     * Captured stdout/stderr of the attempt
     */
    private Path logFile;

    /**
     * When the attempt finished
     */
    private Instant completedAt;

    public boolean isSuccess() {
        return outcome == AttemptOutcome.SUCCESS;
    }

    public boolean isCancelled() {
        return outcome == AttemptOutcome.CANCELLED;
    }

    public AttemptRecord toRecord() {
        return AttemptRecord.builder()
            .jobId(jobId)
            .tier(tier)
            .threads(threads)
            .outcome(outcome)
            .peakMemoryMiB(peakMemoryMiB)
            .recordedAt(completedAt != null ? completedAt : Instant.now())
            .build();
    }
}
