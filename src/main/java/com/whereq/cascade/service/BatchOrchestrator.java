package com.whereq.cascade.service;

import com.whereq.cascade.config.CascadeProperties;
import com.whereq.cascade.exception.UnitDiscoveryException;
import com.whereq.cascade.executor.CancellationToken;
import com.whereq.cascade.model.BatchSummary;
import com.whereq.cascade.model.BatchUnit;
import com.whereq.cascade.model.FinalStatus;
import com.whereq.cascade.model.HostResources;
import com.whereq.cascade.model.Job;
import com.whereq.cascade.model.JobResult;
import com.whereq.cascade.model.QualityCheckResult;
import com.whereq.cascade.model.ResourceBudget;
import com.whereq.cascade.model.RunOptions;
import com.whereq.cascade.model.ScheduleReport;
import com.whereq.cascade.model.Tier;
import com.whereq.cascade.progress.FileProgressStore;
import com.whereq.cascade.progress.ProgressStore;
import com.whereq.cascade.resource.ResourceMonitor;
import com.whereq.cascade.stage.StageDefinition;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs one stage over every unit of the job specification.
 * <p>
 * Infrastructure problems (missing executables, bad stage configuration) are raised before any unit starts.
 * A unit that cannot enumerate its jobs fails on its own; the other units proceed.
 */
@Slf4j
@Service
public class BatchOrchestrator {

    private final CascadeProperties properties;
    private final ResourceMonitor resourceMonitor;
    private final TierController tierController;
    private final PreflightChecker preflightChecker;
    private final SummaryWriter summaryWriter;
    private final QualityCheckRunner qualityCheckRunner;
    private final MeterRegistry meterRegistry;

    private volatile CancellationToken currentToken;

    public BatchOrchestrator(CascadeProperties properties, ResourceMonitor resourceMonitor,
                             TierController tierController, PreflightChecker preflightChecker,
                             SummaryWriter summaryWriter, QualityCheckRunner qualityCheckRunner,
                             MeterRegistry meterRegistry) {
        this.properties = properties;
        this.resourceMonitor = resourceMonitor;
        this.tierController = tierController;
        this.preflightChecker = preflightChecker;
        this.summaryWriter = summaryWriter;
        this.qualityCheckRunner = qualityCheckRunner;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run a stage over the given units
     *
     * @param stage job body
     * @param units units from the job specification or the command line
     * @param basePath directory holding one sub-directory per unit
     * @param options run switches
     * @return one summary per unit, in input order
     * @throws com.whereq.cascade.exception.InfrastructureException before any job starts
     */
    public List<BatchSummary> run(StageDefinition stage, List<BatchUnit> units, Path basePath, RunOptions options) {
        stage.validate();
        preflightChecker.requireExecutables(stage.requiredExecutables());

        // Resources are sized once per invocation
        HostResources host = resourceMonitor.detect();
        ResourceBudget budget = resourceMonitor.budgetFor(host, options.getParallelBatches());
        long fixedOverhead = stage.estimator().fixedOverheadMiB(stage.sharedResource());

        CancellationToken token = new CancellationToken();
        currentToken = token;

        log.info("Running {} over {} unit(s), {} at a time", stage.name(), units.size(), options.getParallelBatches());

        try {
            List<BatchSummary> summaries = Flux.fromIterable(units)
                .flatMapSequential(unit -> Mono.fromCallable(
                        () -> runUnit(stage, unit, basePath, budget, fixedOverhead, options, token))
                    .subscribeOn(Schedulers.boundedElastic()), Math.max(1, options.getParallelBatches()))
                .collectList()
                .block();
            return summaries != null ? summaries : List.of();
        } finally {
            currentToken = null;
        }
    }

    /**
     * Abort the running invocation; in-flight processes are destroyed and their jobs stay pending
     */
    @PreDestroy
    public void cancel() {
        CancellationToken token = currentToken;
        if (token != null) {
            token.cancel();
        }
    }

    BatchSummary runUnit(StageDefinition stage, BatchUnit unit, Path basePath, ResourceBudget budget,
                         long fixedOverhead, RunOptions options, CancellationToken token) {
        Path unitDir = basePath.resolve(unit.getName());
        Instant startedAt = Instant.now();

        List<Job> jobs;
        try {
            jobs = selectJobs(stage, unit, unitDir);
        } catch (UnitDiscoveryException e) {
            log.error("[{}] {}", unit.getName(), e.getMessage());
            BatchSummary failed = BatchSummary.failedUnit(stage.name(), unit.getName(), e.getMessage());
            failed.setBudget(budget);
            if (Files.isDirectory(unitDir)) {
                summaryWriter.write(unitDir, failed);
            }
            return failed;
        }

        ProgressStore store = FileProgressStore.open(unitDir, stage.name(), options.isResume() && !options.isForce());

        // Disk state first: completed output counts as done unless forced
        Counter skippedCounter = Counter.builder("cascade.jobs.skipped")
            .description("Jobs skipped because their output already existed")
            .tag("stage", stage.name())
            .register(meterRegistry);
        for (Job job : options.isForce() ? List.<Job>of() : jobs) {
            if (stage.hasCompleteOutput(job)) {
                store.markSkipped(job.getId());
                skippedCounter.increment();
            } else if (isSuccess(store.finalStatus(job.getId()))) {
                log.warn("[{}] Output of {} is gone although it was recorded as succeeded, running it again",
                    unit.getName(), job.getId());
                store.reopen(job.getId());
            }
        }

        List<Job> pending = new ArrayList<>();
        Set<String> pendingIds = store.pendingSet(jobs.stream().map(Job::getId).toList());
        for (Job job : jobs) {
            if (pendingIds.contains(job.getId())) {
                pending.add(job);
            }
        }

        log.info("[{}] {}: {} job(s), {} already resolved, {} pending", unit.getName(), stage.name(),
            jobs.size(), jobs.size() - pending.size(), pending.size());

        if (!pending.isEmpty() && properties.getExecution().isDiskCheckEnabled()) {
            preflightChecker.checkDiskSpace(stage.outputRoot(unitDir),
                pending.size() * stage.estimatedOutputMiBPerJob());
        }
        store.markPending(pendingIds);

        BatchContext context = BatchContext.builder()
            .stage(stage)
            .unit(unit.getName())
            .unitDir(unitDir)
            .budget(budget)
            .fixedOverheadMiB(fixedOverhead)
            .store(store)
            .options(options)
            .token(token)
            .build();

        ScheduleReport report = pending.isEmpty() ? ScheduleReport.empty() : tierController.schedule(context, pending);

        BatchSummary summary = summarize(stage, unit, unitDir, jobs, store, report, budget, fixedOverhead);
        if (!report.isCancelled() && !token.isCancelled()) {
            List<Job> completed = jobs.stream().filter(job -> isSuccess(summary.statusOf(job.getId()))).toList();
            QualityCheckResult checks = qualityCheckRunner.run(stage, unitDir, completed,
                budget.getUsableCpus() / 2, token);
            if (checks.ranAnything()) {
                summary.setQualityChecks(checks);
            }
        }
        summary.setStartedAt(startedAt);
        summary.setFinishedAt(Instant.now());
        summaryWriter.write(unitDir, summary);

        log.info("[{}] {} finished: {} succeeded, {} degraded, {} failed, {} interrupted", unit.getName(), stage.name(),
            summary.getSucceeded().size(), summary.getSucceededDegraded().size(), summary.getFailed().size(),
            summary.getInterrupted().size());
        return summary;
    }

    /**
     * Discover the unit's jobs and apply its allow-list
     */
    List<Job> selectJobs(StageDefinition stage, BatchUnit unit, Path unitDir) {
        List<Job> discovered = stage.discover(unitDir, unit);
        if (unit.isAllItems()) {
            if (discovered.isEmpty()) {
                throw new UnitDiscoveryException(unit.getName(), "No jobs found for " + unit.getName());
            }
            return discovered;
        }

        Set<String> known = new LinkedHashSet<>();
        discovered.forEach(job -> known.add(job.getId()));
        for (String item : unit.getItems()) {
            if (!known.contains(item)) {
                log.warn("[{}] {} not found among {} inputs", unit.getName(), item, stage.name());
            }
        }

        List<Job> selected = discovered.stream().filter(job -> unit.selects(job.getId())).toList();
        if (selected.isEmpty()) {
            throw new UnitDiscoveryException(unit.getName(),
                "None of the requested items " + unit.getItems() + " were found for " + unit.getName());
        }
        return selected;
    }

    private static boolean isSuccess(FinalStatus status) {
        return status == FinalStatus.SUCCEEDED || status == FinalStatus.SUCCEEDED_DEGRADED;
    }

    private BatchSummary summarize(StageDefinition stage, BatchUnit unit, Path unitDir, List<Job> jobs,
                                   ProgressStore store, ScheduleReport report, ResourceBudget budget,
                                   long fixedOverhead) {
        BatchSummary summary = BatchSummary.builder()
            .stage(stage.name())
            .unit(unit.getName())
            .budget(budget)
            .tier1Plan(report.planOf(Tier.TIER1_PARALLEL))
            .fixedOverheadMiB(fixedOverhead)
            .attempts(report.getResults().size())
            .logDirectory(unitDir.resolve("logs").resolve(stage.name()).toString())
            .build();

        for (Job job : jobs) {
            FinalStatus status = store.finalStatus(job.getId());
            if (store.isSkipped(job.getId())) {
                summary.getSkipped().add(job.getId());
                if (status == FinalStatus.SUCCEEDED && Files.exists(stage.degradedMarker(job))) {
                    status = FinalStatus.SUCCEEDED_DEGRADED;
                }
            }
            if (status == null) {
                summary.getInterrupted().add(job.getId());
                continue;
            }
            switch (status) {
                case SUCCEEDED -> summary.getSucceeded().add(job.getId());
                case SUCCEEDED_DEGRADED -> summary.getSucceededDegraded().add(job.getId());
                case FAILED -> summary.getFailed().add(job.getId());
            }
        }

        JobResult peak = report.peakMemoryAttempt();
        if (peak != null) {
            summary.setPeakMemoryMiB(peak.getPeakMemoryMiB());
            summary.setPeakMemoryJob(peak.getJobId());
            summary.setPeakMemoryTier(peak.getTier().label());
        }
        return summary;
    }
}
