package com.whereq.cascade.service;

import com.whereq.cascade.executor.JobRunner;
import com.whereq.cascade.model.AttemptOutcome;
import com.whereq.cascade.model.Job;
import com.whereq.cascade.model.JobResourceProfile;
import com.whereq.cascade.model.JobResult;
import com.whereq.cascade.model.JobState;
import com.whereq.cascade.model.ScheduleReport;
import com.whereq.cascade.model.Tier;
import com.whereq.cascade.model.TierPlan;
import com.whereq.cascade.resource.JobCostEstimator;
import com.whereq.cascade.resource.ParallelismPlanner;
import com.whereq.cascade.stage.StageDefinition;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives pending jobs through the retry tiers.
 * <p>
 * Tier 1 runs the planned number of jobs at once. Its failures are retried one at a time with the
 * maximum safe thread count (Tier 2), and what still fails is retried one at a time with minimal threads
 * and reduced fidelity (Tier 3). A tier starts only after every job of the previous tier has finished,
 * and only if that tier produced failures. Every finished attempt is appended to the progress store
 * before the next tier is planned.
 */
@Slf4j
@Service
public class TierController {

    private final JobRunner jobRunner;
    private final ParallelismPlanner planner;
    private final MeterRegistry meterRegistry;

    public TierController(JobRunner jobRunner, ParallelismPlanner planner, MeterRegistry meterRegistry) {
        this.jobRunner = jobRunner;
        this.planner = planner;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run the pending jobs of one unit through all tiers
     *
     * @param context unit, budget and progress store
     * @param pending jobs not yet resolved
     * @return plans and attempt results
     */
    public ScheduleReport schedule(BatchContext context, List<Job> pending) {
        ScheduleReport.ScheduleReportBuilder report = ScheduleReport.builder();
        List<Job> input = new ArrayList<>(pending);
        Tier tier = Tier.TIER1_PARALLEL;

        while (tier != null && !input.isEmpty()) {
            if (context.getToken().isCancelled()) {
                return report.cancelled(true).build();
            }

            TierPlan plan = plan(context, tier, input.size());
            JobResourceProfile profile = profile(context, tier, plan);
            report.plan(plan);

            log.info("[{}] {} {}: {} job(s), {} at a time, {} thread(s) each",
                context.getUnit(), context.getStage().name(), tier.label(), input.size(),
                plan.getParallelJobs(), profile.getThreads());

            List<JobResult> results = runTier(context, input, profile, plan.getParallelJobs());
            report.results(results);

            List<Job> failed = new ArrayList<>();
            for (Job job : input) {
                if (job.getState() == JobState.PENDING && job.getLastTier() == tier) {
                    failed.add(job);
                }
            }

            if (results.stream().anyMatch(JobResult::isCancelled) || context.getToken().isCancelled()) {
                log.warn("[{}] {} cancelled during {}", context.getUnit(), context.getStage().name(), tier.label());
                return report.cancelled(true).build();
            }

            log.info("[{}] {} {} done: {} succeeded, {} failed", context.getUnit(), context.getStage().name(),
                tier.label(), input.size() - failed.size(), failed.size());

            input = failed;
            tier = tier.next();
        }

        return report.build();
    }

    /**
     * Plan one tier: Tier 1 is planned against CPU and memory, later tiers run one job at a time
     */
    TierPlan plan(BatchContext context, Tier tier, int pendingJobs) {
        JobCostEstimator estimator = context.getStage().estimator();
        long overhead = context.getFixedOverheadMiB();

        return switch (tier) {
            case TIER1_PARALLEL -> {
                Integer override = context.getOptions().getThreadsOverride();
                int threads = override != null ? override : estimator.threadsFor(context.getBudget());
                yield planner.plan(tier, pendingJobs, threads, context.getBudget(), overhead, estimator);
            }
            case TIER2_SEQUENTIAL_MAX -> {
                int threads = estimator.maxThreads(context.getBudget());
                yield planner.planSequential(tier, pendingJobs, threads, estimator.memoryRequired(threads, overhead));
            }
            case TIER3_MINIMAL_FOOTPRINT -> {
                int threads = estimator.minimalThreads();
                yield planner.planSequential(tier, pendingJobs, threads, estimator.memoryRequired(threads, overhead));
            }
        };
    }

    JobResourceProfile profile(BatchContext context, Tier tier, TierPlan plan) {
        JobCostEstimator estimator = context.getStage().estimator();
        long ceiling = switch (tier) {
            case TIER1_PARALLEL -> estimator.memoryBudgetPerJob(plan.getParallelJobs(), context.getBudget());
            case TIER2_SEQUENTIAL_MAX -> estimator.memoryBudgetPerJob(1, context.getBudget());
            case TIER3_MINIMAL_FOOTPRINT -> estimator.minimalMemoryMiB();
        };

        return JobResourceProfile.builder()
            .tier(tier)
            .threads(plan.getThreadsPerJob())
            .memoryRequiredMiB(plan.getMemoryPerJobMiB())
            .memoryCeilingMiB(ceiling)
            .fidelityMode(tier.getFidelityMode())
            .build();
    }

    /**
     * Run one tier with bounded concurrency and wait for all of its jobs
     */
    private List<JobResult> runTier(BatchContext context, List<Job> jobs, JobResourceProfile profile,
                                    int parallelJobs) {
        List<JobResult> results = Flux.fromIterable(jobs)
            .flatMap(job -> Mono.fromCallable(() -> attempt(context, job, profile))
                .subscribeOn(Schedulers.boundedElastic()), Math.max(1, parallelJobs))
            .collectList()
            .block();
        return results != null ? results : List.of();
    }

    private JobResult attempt(BatchContext context, Job job, JobResourceProfile profile) {
        if (context.getToken().isCancelled()) {
            return JobResult.builder()
                .jobId(job.getId())
                .tier(profile.getTier())
                .threads(profile.getThreads())
                .outcome(AttemptOutcome.CANCELLED)
                .errorMessage("Cancelled before start")
                .build();
        }

        job.setState(JobState.RUNNING);
        job.setLastTier(profile.getTier());

        StageDefinition stage = context.getStage();
        JobResult result = jobRunner.run(stage, job, profile, context.getToken());

        if (result.isCancelled()) {
            // Not recorded: the job stays pending for the next invocation
            job.setState(JobState.PENDING);
            return result;
        }

        context.getStore().append(result.toRecord());
        record(stage.name(), result);

        if (result.isSuccess()) {
            job.setState(JobState.SUCCEEDED);
            job.setDegraded(profile.isReducedFidelity());
        } else if (profile.getTier().isLast()) {
            job.setState(JobState.FAILED);
            log.error("[{}] Job {} failed in every tier, giving up", context.getUnit(), job.getId());
        } else {
            job.setState(JobState.PENDING);
        }
        return result;
    }

    private void record(String stage, JobResult result) {
        Counter.builder("cascade.attempts")
            .description("Job attempts by stage, tier and outcome")
            .tag("stage", stage)
            .tag("tier", result.getTier().label())
            .tag("outcome", result.getOutcome().code())
            .register(meterRegistry)
            .increment();

        Timer.builder("cascade.attempt.duration")
            .description("Wall-clock time of job attempts")
            .tag("stage", stage)
            .tag("tier", result.getTier().label())
            .register(meterRegistry)
            .record(Duration.ofSeconds(result.getExecutionTimeSeconds()));
    }
}
