package com.whereq.cascade.resource;

import com.whereq.cascade.model.BindingConstraint;
import com.whereq.cascade.model.ResourceBudget;
import com.whereq.cascade.model.Tier;
import com.whereq.cascade.model.TierPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decide how many jobs of a tier run at once under both the CPU and the memory bound
 */
@Slf4j
@Component
public class ParallelismPlanner {

    /**
     * Parallel job count for one tier.
     * Each bound is at least 1 so that a job larger than the budget still runs alone.
     *
     * @return {@code min(cpuBound, memoryBound, pendingJobs)}, or 0 when nothing is pending
     */
    public static int parallelJobCount(int pendingJobs, int threadsPerJob, int usableCpus,
                                       long usableMemoryMiB, long memoryPerJobMiB) {
        if (pendingJobs <= 0) {
            return 0;
        }
        return Math.min(Math.min(cpuBound(usableCpus, threadsPerJob), memoryBound(usableMemoryMiB, memoryPerJobMiB)),
            pendingJobs);
    }

    static int cpuBound(int usableCpus, int threadsPerJob) {
        return Math.max(1, usableCpus / Math.max(1, threadsPerJob));
    }

    static int memoryBound(long usableMemoryMiB, long memoryPerJobMiB) {
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, usableMemoryMiB / Math.max(1, memoryPerJobMiB)));
    }

    /**
     * Plan the parallel tier.
     * A plan that resolves to a single job re-expands its threads toward the usable CPUs
     * while the memory estimate still fits the usable memory.
     *
     * @param pendingJobs jobs entering the tier
     * @param threadsPerJob standard thread count
     * @param budget batch budget
     * @param fixedOverheadMiB fixed memory of every job
     * @param estimator cost model of the job type
     * @return the tier plan
     */
    public TierPlan plan(Tier tier, int pendingJobs, int threadsPerJob, ResourceBudget budget,
                         long fixedOverheadMiB, JobCostEstimator estimator) {
        long memoryPerJob = estimator.memoryRequired(threadsPerJob, fixedOverheadMiB);
        int cpuBound = cpuBound(budget.getUsableCpus(), threadsPerJob);
        int memoryBound = memoryBound(budget.getUsableMemoryMiB(), memoryPerJob);
        int parallelJobs = parallelJobCount(pendingJobs, threadsPerJob, budget.getUsableCpus(),
            budget.getUsableMemoryMiB(), memoryPerJob);

        TierPlan plan = TierPlan.builder()
            .tier(tier)
            .pendingJobs(pendingJobs)
            .threadsPerJob(threadsPerJob)
            .parallelJobs(parallelJobs)
            .memoryPerJobMiB(memoryPerJob)
            .cpuBound(cpuBound)
            .memoryBound(memoryBound)
            .bindingConstraint(bindingConstraint(pendingJobs, cpuBound, memoryBound))
            .threadsExpanded(false)
            .build();

        if (parallelJobs == 1) {
            plan = expandSingleJob(plan, budget, fixedOverheadMiB, estimator);
        }

        log.info("Plan {}", plan.describe());
        return plan;
    }

    /**
     * Plan a tier that runs one job at a time with the given resources
     */
    public TierPlan planSequential(Tier tier, int pendingJobs, int threads, long memoryPerJobMiB) {
        TierPlan plan = TierPlan.builder()
            .tier(tier)
            .pendingJobs(pendingJobs)
            .threadsPerJob(threads)
            .parallelJobs(pendingJobs > 0 ? 1 : 0)
            .memoryPerJobMiB(memoryPerJobMiB)
            .cpuBound(1)
            .memoryBound(1)
            .bindingConstraint(BindingConstraint.SEQUENTIAL)
            .threadsExpanded(false)
            .build();

        log.info("Plan {}", plan.describe());
        return plan;
    }

    private TierPlan expandSingleJob(TierPlan plan, ResourceBudget budget, long fixedOverheadMiB,
                                     JobCostEstimator estimator) {
        int cap = Math.min(budget.getUsableCpus(), estimator.expansionCap());
        int threads = plan.getThreadsPerJob();
        while (threads < cap
            && estimator.memoryRequired(threads + 1, fixedOverheadMiB) <= budget.getUsableMemoryMiB()) {
            threads++;
        }

        if (threads == plan.getThreadsPerJob()) {
            return plan;
        }

        log.debug("Single job in {}: threads {} -> {}", plan.getTier().label(), plan.getThreadsPerJob(), threads);
        return plan.toBuilder()
            .threadsPerJob(threads)
            .memoryPerJobMiB(estimator.memoryRequired(threads, fixedOverheadMiB))
            .threadsExpanded(true)
            .build();
    }

    private static BindingConstraint bindingConstraint(int pendingJobs, int cpuBound, int memoryBound) {
        if (pendingJobs < Math.min(cpuBound, memoryBound)) {
            return BindingConstraint.PENDING_JOBS;
        }
        return cpuBound <= memoryBound ? BindingConstraint.CPU : BindingConstraint.MEMORY;
    }
}
