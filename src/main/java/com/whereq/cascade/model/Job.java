package com.whereq.cascade.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One unit of scheduled work (one sample) within a batch unit
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Job {
    /**
     * Stable key, unique within the batch unit (e.g. GSM3559136)
     */
    private String id;

    /**
     * Name of the batch unit (study) the job belongs to
     */
    private String unit;

    /**
     * Input runs, merged into one logical job
     */
    @Builder.Default
    private List<RunInput> runs = new ArrayList<>();

    /**
     * Output directory, a deterministic function of the job id
     */
    private Path outputDir;

    /**
     * Directory holding the per-tier logs of this job
     */
    private Path logDir;

    /**
     * Credential file for controlled-access inputs, null for public data
     */
    private Path authFile;

    @Builder.Default
    private JobState state = JobState.PENDING;

    /**
     * Tier of the most recent attempt
     */
    private Tier lastTier;

    /**
     * Set when the job succeeded under reduced fidelity
     */
    private boolean degraded;

    /**
     * Per-job, per-tier log file capturing the tool's stdout and stderr
     */
    public Path logFile(Tier tier) {
        return logDir.resolve(id + "." + tier.label() + ".log");
    }

    public boolean hasPairedRuns() {
        return runs.stream().anyMatch(RunInput::isPaired);
    }
}
