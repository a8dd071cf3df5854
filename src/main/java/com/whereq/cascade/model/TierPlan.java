package com.whereq.cascade.model;

import lombok.Builder;
import lombok.Value;

/**
 * Concurrency decision for one tier. Logged for diagnosis, not used for control flow
 * beyond sizing the worker pool.
 */
@Value
@Builder(toBuilder = true)
public class TierPlan {
    Tier tier;

    int pendingJobs;

    int threadsPerJob;

    int parallelJobs;

    long memoryPerJobMiB;

    int cpuBound;

    int memoryBound;

    BindingConstraint bindingConstraint;

    /**
     * True when a single-job plan raised the thread count above the standard value
     */
    boolean threadsExpanded;

    public String describe() {
        return String.format("%s: %d job(s) in parallel x %d thread(s), ~%d MiB per job "
                + "(cpu bound %d, memory bound %d, limited by %s)%s",
            tier.label(), parallelJobs, threadsPerJob, memoryPerJobMiB,
            cpuBound, memoryBound, bindingConstraint, threadsExpanded ? ", threads expanded for single job" : "");
    }
}
