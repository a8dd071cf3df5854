package com.whereq.cascade.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-invocation switches
 */
@Value
@Builder(toBuilder = true)
public class RunOptions {
    /**
     * Re-run jobs even when their completed output exists
     */
    boolean force;

    /**
     * Load existing progress files instead of rewriting them
     */
    boolean resume;

    /**
     * Explicit Tier-1 threads per job, null for the cost model's choice
     */
    Integer threadsOverride;

    /**
     * Number of batch units processed side by side
     */
    @Builder.Default
    int parallelBatches = 1;

    public static RunOptions defaults() {
        return RunOptions.builder().build();
    }
}
