package com.whereq.cascade.model;

import lombok.Builder;
import lombok.Value;

/**
 * Resources and fidelity a job is given in one tier. Derived, never persisted.
 */
@Value
@Builder
public class JobResourceProfile {
    Tier tier;

    int threads;

    /**
     * Estimated requirement: fixed overhead plus the per-thread working set
     */
    long memoryRequiredMiB;

    /**
     * Memory the job may use, handed to tools that accept a limit
     */
    long memoryCeilingMiB;

    FidelityMode fidelityMode;

    public boolean isReducedFidelity() {
        return fidelityMode == FidelityMode.REDUCED;
    }
}
