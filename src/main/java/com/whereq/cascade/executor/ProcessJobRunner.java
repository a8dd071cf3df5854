package com.whereq.cascade.executor;

import com.whereq.cascade.config.CascadeProperties;
import com.whereq.cascade.model.AttemptOutcome;
import com.whereq.cascade.model.Job;
import com.whereq.cascade.model.JobResourceProfile;
import com.whereq.cascade.model.JobResult;
import com.whereq.cascade.stage.StageDefinition;
import com.whereq.cascade.stage.ToolInvocation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Runs job attempts as external processes.
 * <p>
 * Every attempt starts from an empty output directory and a job-exclusive scratch directory.
 * Output of all processes goes to the per-tier log. An attempt succeeds only if every process exits 0
 * and the stage's primary output is present afterwards; otherwise its output directory is removed.
 * Reduced-fidelity output is marked before it is verified, so it is never taken for a normal result.
 */
@Slf4j
@Component
public class ProcessJobRunner implements JobRunner {

    private static final DateTimeFormatter LOG_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final CascadeProperties.ExecutionConfig config;
    private final PeakMemoryMeter peakMemoryMeter;

    public ProcessJobRunner(CascadeProperties properties) {
        this.config = properties.getExecution();
        this.peakMemoryMeter = new PeakMemoryMeter(config.getPeakMemoryWrapper());
    }

    @Override
    public JobResult run(StageDefinition stage, Job job, JobResourceProfile profile, CancellationToken token) {
        Instant start = Instant.now();
        Path logFile = job.logFile(profile.getTier());
        Path scratchDir = stage.scratchRoot(profile, Path.of(config.getScratchRoot()))
            .resolve(String.join("-", "cascade", stage.name(), job.getUnit(), job.getId(), profile.getTier().label()));

        JobResult.JobResultBuilder result = JobResult.builder()
            .jobId(job.getId())
            .tier(profile.getTier())
            .threads(profile.getThreads())
            .logFile(logFile);

        Disposable heartbeat = Flux.interval(Duration.ofSeconds(Math.max(10, config.getHeartbeatSeconds())))
            .subscribe(tick -> log.info("Job {} ({}) still running after {}s",
                job.getId(), profile.getTier().label(), Duration.between(start, Instant.now()).toSeconds()));

        boolean success = false;
        try {
            prepare(job, logFile, scratchDir);
            log.info("Starting job {} in {} with {} thread(s), {} fidelity",
                job.getId(), profile.getTier().label(), profile.getThreads(), profile.getFidelityMode());

            List<ToolInvocation> invocations = stage.invocations(job, profile, scratchDir);
            if (invocations.isEmpty()) {
                appendLog(logFile, "No input to process for " + job.getId());
                return finish(result.outcome(AttemptOutcome.FAILURE).errorMessage("No input files found"), start);
            }

            Long peak = null;
            int step = 0;
            for (ToolInvocation invocation : invocations) {
                if (token.isCancelled()) {
                    return finish(result.outcome(AttemptOutcome.CANCELLED).errorMessage("Cancelled"), start);
                }

                Path report = scratchDir.resolve("step" + (step++) + ".time");
                int exitCode = execute(invocation, logFile, report, token);
                result.exitCode(exitCode);
                peak = max(peak, peakMemoryMeter.readPeakMiB(report));
                result.peakMemoryMiB(peak);

                if (token.isCancelled()) {
                    return finish(result.outcome(AttemptOutcome.CANCELLED).errorMessage("Cancelled"), start);
                }
                if (exitCode != 0) {
                    return finish(result.outcome(AttemptOutcome.FAILURE)
                        .errorMessage(invocation.getName() + " exited with status " + exitCode), start);
                }
            }

            stage.completeAttempt(job, scratchDir);

            if (profile.isReducedFidelity() && !markDegraded(stage, job, profile, logFile)) {
                return finish(result.outcome(AttemptOutcome.FAILURE)
                    .errorMessage("Reduced-fidelity marker could not be written"), start);
            }

            // Exit status 0 is not enough
            if (!stage.hasCompleteOutput(job)) {
                appendLog(logFile, "Processes exited cleanly but the primary output is missing or empty");
                return finish(result.outcome(AttemptOutcome.FAILURE)
                    .errorMessage("Primary output missing or empty"), start);
            }

            success = true;
            return finish(result.outcome(AttemptOutcome.SUCCESS), start);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return finish(result.outcome(AttemptOutcome.CANCELLED).errorMessage("Interrupted"), start);
        } catch (IOException | RuntimeException e) {
            log.error("Job {} ({}) could not be run: {}", job.getId(), profile.getTier().label(), e.getMessage(), e);
            return finish(result.outcome(AttemptOutcome.FAILURE).errorMessage(e.getMessage()), start);
        } finally {
            heartbeat.dispose();
            delete(scratchDir);
            if (!success) {
                delete(job.getOutputDir());
            }
        }
    }

    /**
     * Clean output, fresh per-tier log, empty scratch
     */
    private void prepare(Job job, Path logFile, Path scratchDir) throws IOException {
        if (Files.exists(job.getOutputDir())) {
            log.debug("Removing previous output of job {}: {}", job.getId(), job.getOutputDir());
            FileSystemUtils.deleteRecursively(job.getOutputDir());
        }
        Files.createDirectories(job.getOutputDir());
        Files.createDirectories(logFile.getParent());
        Files.writeString(logFile, "", StandardCharsets.UTF_8);
        FileSystemUtils.deleteRecursively(scratchDir);
        Files.createDirectories(scratchDir);
    }

    private boolean markDegraded(StageDefinition stage, Job job, JobResourceProfile profile, Path logFile)
        throws IOException {
        Path marker = stage.degradedMarker(job);
        try {
            Files.writeString(marker, stage.degradedNotice(job, profile), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Job {} ({}): cannot write {}: {}",
                job.getId(), profile.getTier().label(), marker, e.getMessage());
            appendLog(logFile, "Cannot write reduced-fidelity marker " + marker + ": " + e.getMessage());
            return false;
        }
        log.warn("Job {} ran with reduced fidelity, marked in {}", job.getId(), marker);
        return true;
    }

    private int execute(ToolInvocation invocation, Path logFile, Path report, CancellationToken token)
        throws IOException, InterruptedException {
        List<String> command = peakMemoryMeter.wrap(invocation.getCommands(), report);
        appendLog(logFile, "[" + LocalDateTime.now().format(LOG_TIME) + "] " + invocation.commandLine());
        log.debug("Executing command: {}", String.join(" ", command));

        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.redirectErrorStream(true);
        processBuilder.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        if (invocation.getWorkingDirectory() != null) {
            processBuilder.directory(invocation.getWorkingDirectory().toFile());
        }

        Process process = processBuilder.start();
        token.register(process);
        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            CancellationToken.destroyTree(process);
            throw e;
        } finally {
            token.unregister(process);
        }
    }

    private JobResult finish(JobResult.JobResultBuilder builder, Instant start) {
        Instant now = Instant.now();
        JobResult result = builder
            .executionTimeSeconds(Duration.between(start, now).toSeconds())
            .completedAt(now)
            .build();

        switch (result.getOutcome()) {
            case SUCCESS -> log.info("Job {} succeeded in {} after {}s (peak {})", result.getJobId(),
                result.getTier().label(), result.getExecutionTimeSeconds(), describePeak(result.getPeakMemoryMiB()));
            case CANCELLED -> log.warn("Job {} cancelled in {}", result.getJobId(), result.getTier().label());
            case FAILURE -> log.error("Job {} failed in {}: {} (exit status {}){}", result.getJobId(),
                result.getTier().label(), result.getErrorMessage(), result.getExitCode(), tail(result.getLogFile()));
        }
        return result;
    }

    private String tail(Path logFile) {
        if (config.getLogTailLines() <= 0 || logFile == null || !Files.isRegularFile(logFile)) {
            return "";
        }
        try {
            List<String> lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
            List<String> tail = lines.subList(Math.max(0, lines.size() - config.getLogTailLines()), lines.size());
            String separator = System.lineSeparator() + "  | ";
            return tail.isEmpty() ? "" : separator + String.join(separator, tail);
        } catch (IOException | RuntimeException e) {
            return " (log unreadable: " + e.getMessage() + ")";
        }
    }

    private static void appendLog(Path logFile, String line) throws IOException {
        Files.writeString(logFile, line + System.lineSeparator(), StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    private static void delete(Path path) {
        try {
            FileSystemUtils.deleteRecursively(path);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", path, e.getMessage());
        }
    }

    private static Long max(Long current, Long observed) {
        if (observed == null) {
            return current;
        }
        return current == null ? observed : Math.max(current, observed);
    }

    private static String describePeak(Long peakMiB) {
        return peakMiB != null ? peakMiB + " MiB" : "unknown";
    }
}
