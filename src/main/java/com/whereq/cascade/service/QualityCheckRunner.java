package com.whereq.cascade.service;

import com.whereq.cascade.executor.CancellationToken;
import com.whereq.cascade.model.Job;
import com.whereq.cascade.model.QualityCheckResult;
import com.whereq.cascade.stage.StageDefinition;
import com.whereq.cascade.stage.ToolInvocation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs a stage's optional quality checks once scheduling of a unit is over.
 * <p>
 * Checks run side by side, the aggregation afterwards. A tool that cannot be found is skipped with a
 * warning. Failed checks are listed in {@code <stage>_qc_failed.txt} and in the summary, and are not retried.
 */
@Slf4j
@Component
public class QualityCheckRunner {

    static final String FAILED_LIST = "_qc_failed.txt";
    static final String LOG_FILE = "quality_checks.log";

    private final PreflightChecker preflightChecker;

    public QualityCheckRunner(PreflightChecker preflightChecker) {
        this.preflightChecker = preflightChecker;
    }

    /**
     * Run the checks and the aggregation of one unit
     *
     * @param stage stage providing the checks
     * @param unitDir the unit's directory
     * @param completed jobs whose output is complete
     * @param parallelChecks checks running at once
     * @param token operator abort
     * @return what ran and what failed; {@link QualityCheckResult#none()} when the stage has no checks
     */
    public QualityCheckResult run(StageDefinition stage, Path unitDir, List<Job> completed, int parallelChecks,
                                  CancellationToken token) {
        List<ToolInvocation> checks = stage.qualityChecks(unitDir, completed);
        List<ToolInvocation> aggregation = stage.qualityAggregation(unitDir);
        if (checks.isEmpty() && aggregation.isEmpty()) {
            return QualityCheckResult.none();
        }

        Path logFile = unitDir.resolve("logs").resolve(stage.name()).resolve(LOG_FILE);
        QualityCheckResult.QualityCheckResultBuilder result = QualityCheckResult.builder();
        Set<String> missing = new LinkedHashSet<>();

        List<ToolInvocation> runnable = available(checks, missing);
        List<String> failures = new ArrayList<>();
        if (!runnable.isEmpty()) {
            log.info("[{}] Running {} quality check(s) of {}, {} at a time", unitDir.getFileName(), runnable.size(),
                stage.name(), Math.max(1, parallelChecks));
            List<String> failed = Flux.fromIterable(runnable)
                .flatMap(check -> Mono.fromCallable(() -> execute(check, logFile, token))
                    .subscribeOn(Schedulers.boundedElastic())
                    .filter(passed -> !passed)
                    .map(passed -> check.subjectOrName()), Math.max(1, parallelChecks))
                .collectList()
                .block();
            if (failed != null) {
                failed.stream().sorted().forEach(failures::add);
            }
        }
        result.checked(runnable.size()).failures(failures);
        writeFailedList(unitDir.resolve(stage.name() + FAILED_LIST), failures);

        if (failures.isEmpty() && !runnable.isEmpty()) {
            log.info("[{}] Quality checks passed for all {} file(s)", unitDir.getFileName(), runnable.size());
        } else if (!failures.isEmpty()) {
            log.warn("[{}] {} quality check(s) failed, see {}", unitDir.getFileName(), failures.size(), logFile);
        }

        for (ToolInvocation step : available(aggregation, missing)) {
            if (execute(step, logFile, token)) {
                result.aggregateReport(step.subjectOrName());
                log.info("[{}] Quality report written: {}", unitDir.getFileName(), step.subjectOrName());
            } else {
                result.aggregateReport(null).aggregationFailed(true);
                log.warn("[{}] Quality report {} failed, see {}", unitDir.getFileName(), step.getName(), logFile);
                break;
            }
        }

        return result.missingTools(missing).build();
    }

    /**
     * Invocations whose executable exists; the others are dropped once with a warning per tool
     */
    private List<ToolInvocation> available(List<ToolInvocation> invocations, Set<String> missing) {
        List<ToolInvocation> runnable = new ArrayList<>();
        for (ToolInvocation invocation : invocations) {
            String executable = invocation.getCommands().get(0);
            if (missing.contains(executable)) {
                continue;
            }
            if (preflightChecker.findExecutable(executable) == null) {
                log.warn("{} not found, skipping its quality checks", executable);
                missing.add(executable);
                continue;
            }
            runnable.add(invocation);
        }
        return runnable;
    }

    private boolean execute(ToolInvocation invocation, Path logFile, CancellationToken token) {
        if (token.isCancelled()) {
            return false;
        }
        try {
            Files.createDirectories(logFile.getParent());
            if (invocation.getWorkingDirectory() != null) {
                Files.createDirectories(invocation.getWorkingDirectory());
            }
            Files.writeString(logFile, "[" + invocation.getName() + "] " + invocation.commandLine()
                + System.lineSeparator(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);

            ProcessBuilder processBuilder = new ProcessBuilder(invocation.getCommands());
            processBuilder.redirectErrorStream(true);
            processBuilder.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
            if (invocation.getWorkingDirectory() != null) {
                processBuilder.directory(invocation.getWorkingDirectory().toFile());
            }

            Process process = processBuilder.start();
            token.register(process);
            try {
                int exitCode = process.waitFor();
                if (exitCode != 0) {
                    log.debug("{} exited with status {}", invocation.getName(), exitCode);
                }
                return exitCode == 0;
            } finally {
                token.unregister(process);
            }
        } catch (IOException e) {
            log.warn("{} could not be run: {}", invocation.getName(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void writeFailedList(Path file, List<String> failures) {
        StringBuilder content = new StringBuilder();
        failures.forEach(subject -> content.append(subject).append(System.lineSeparator()));
        try {
            Files.writeString(file, content.toString(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Cannot write {}: {}", file, e.getMessage());
        }
    }
}
