package com.whereq.cascade.resource;

import com.whereq.cascade.model.ResourceBudget;

import java.nio.file.Path;

/**
 * Resource formulas of one job type, kept apart from the scheduler so they can be tuned or replaced
 */
public interface JobCostEstimator {

    /**
     * Standard Tier-1 thread count for the given budget
     */
    int threadsFor(ResourceBudget budget);

    /**
     * Estimated memory of one job: fixed overhead plus a per-thread working set
     */
    long memoryRequired(int threads, long fixedOverheadMiB);

    /**
     * Memory handed to each of {@code parallelJobs} concurrent jobs, clamped to the tool's limits
     */
    long memoryBudgetPerJob(int parallelJobs, ResourceBudget budget);

    /**
     * Best-effort fixed overhead from the on-disk size of a shared resource.
     *
     * @param sharedResource directory or file loaded by every job, null when the job type has none
     */
    long fixedOverheadMiB(Path sharedResource);

    /**
     * Thread cap of the sequential maximum-resource tier
     */
    int maxThreads(ResourceBudget budget);

    /**
     * Cap applied when a single-job plan re-expands its thread count
     */
    int expansionCap();

    /**
     * Thread count of the minimal-footprint tier
     */
    int minimalThreads();

    /**
     * Memory handed to a job in the minimal-footprint tier
     */
    long minimalMemoryMiB();
}
