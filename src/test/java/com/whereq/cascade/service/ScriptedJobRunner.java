package com.whereq.cascade.service;

import com.whereq.cascade.executor.CancellationToken;
import com.whereq.cascade.executor.JobRunner;
import com.whereq.cascade.model.AttemptOutcome;
import com.whereq.cascade.model.Job;
import com.whereq.cascade.model.JobResourceProfile;
import com.whereq.cascade.model.JobResult;
import com.whereq.cascade.model.Tier;
import com.whereq.cascade.stage.ScriptStage;
import com.whereq.cascade.stage.StageDefinition;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process job runner: each job succeeds from a configured tier on, without starting processes
 */
class ScriptedJobRunner implements JobRunner {

    private final Map<String, Tier> succeedsFrom = new ConcurrentHashMap<>();
    private final Set<String> neverSucceeds = ConcurrentHashMap.newKeySet();
    private final Set<String> cancels = ConcurrentHashMap.newKeySet();
    private final Map<Tier, AtomicInteger> maxRunning = new ConcurrentHashMap<>();
    private final AtomicInteger running = new AtomicInteger();

    final List<String> events = Collections.synchronizedList(new ArrayList<>());
    final List<JobResourceProfile> profiles = Collections.synchronizedList(new ArrayList<>());

    private long delayMillis;

    ScriptedJobRunner succeedsFrom(String jobId, Tier tier) {
        succeedsFrom.put(jobId, tier);
        return this;
    }

    ScriptedJobRunner neverSucceeds(String jobId) {
        neverSucceeds.add(jobId);
        return this;
    }

    ScriptedJobRunner cancels(String jobId) {
        cancels.add(jobId);
        return this;
    }

    ScriptedJobRunner delay(long millis) {
        this.delayMillis = millis;
        return this;
    }

    int maxRunning(Tier tier) {
        AtomicInteger max = maxRunning.get(tier);
        return max != null ? max.get() : 0;
    }

    int attempts() {
        return profiles.size();
    }

    @Override
    public JobResult run(StageDefinition stage, Job job, JobResourceProfile profile, CancellationToken token) {
        Tier tier = profile.getTier();
        int now = running.incrementAndGet();
        maxRunning.computeIfAbsent(tier, t -> new AtomicInteger()).accumulateAndGet(now, Math::max);
        events.add("start " + tier.label() + " " + job.getId());
        profiles.add(profile);

        try {
            if (delayMillis > 0) {
                Thread.sleep(delayMillis);
            }

            JobResult.JobResultBuilder result = JobResult.builder()
                .jobId(job.getId())
                .tier(tier)
                .threads(profile.getThreads())
                .exitCode(0)
                .peakMemoryMiB(100L * profile.getThreads())
                .completedAt(Instant.now());

            if (cancels.contains(job.getId())) {
                return result.outcome(AttemptOutcome.CANCELLED).build();
            }
            Tier first = succeedsFrom.getOrDefault(job.getId(), Tier.TIER1_PARALLEL);
            if (neverSucceeds.contains(job.getId()) || tier.getNumber() < first.getNumber()) {
                return result.outcome(AttemptOutcome.FAILURE).exitCode(137).errorMessage("Killed").build();
            }

            Files.createDirectories(job.getOutputDir());
            Files.writeString(job.getOutputDir().resolve(ScriptStage.PRIMARY_OUTPUT), "done");
            if (profile.isReducedFidelity()) {
                Files.writeString(stage.degradedMarker(job), stage.degradedNotice(job, profile));
            }
            return result.outcome(AttemptOutcome.SUCCESS).build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return JobResult.builder().jobId(job.getId()).tier(tier).outcome(AttemptOutcome.CANCELLED).build();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } finally {
            running.decrementAndGet();
            events.add("end " + tier.label() + " " + job.getId());
        }
    }

    List<String> attemptedTiers(String jobId) {
        List<String> tiers = new ArrayList<>();
        synchronized (events) {
            for (String event : events) {
                if (event.startsWith("start ") && event.endsWith(" " + jobId)) {
                    tiers.add(event.split(" ")[1]);
                }
            }
        }
        return tiers;
    }
}
