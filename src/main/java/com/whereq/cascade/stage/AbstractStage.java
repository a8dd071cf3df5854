package com.whereq.cascade.stage;

import com.whereq.cascade.config.CascadeProperties.StageConfig;
import com.whereq.cascade.exception.UnitDiscoveryException;
import com.whereq.cascade.model.FidelityMode;
import com.whereq.cascade.model.Job;
import com.whereq.cascade.model.RunInput;
import com.whereq.cascade.resource.BandedJobCostEstimator;
import com.whereq.cascade.resource.JobCostEstimator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Common plumbing of the FASTQ-based stages
 */
@Slf4j
public abstract class AbstractStage implements StageDefinition {

    protected static final String FASTQ_SUFFIX = ".fastq.gz";
    protected static final String READ1_SUFFIX = "_1" + FASTQ_SUFFIX;
    protected static final String READ2_SUFFIX = "_2" + FASTQ_SUFFIX;
    protected static final String LOG_DIR = "logs";

    /**
     * Report directories written next to sample directories, never samples themselves
     */
    public static final Set<String> REPORT_DIRS = Set.of("FastQC", "MultiQC");

    private final String name;
    private final StageConfig config;
    private final JobCostEstimator estimator;

    protected AbstractStage(String name, StageConfig config) {
        this.name = name;
        this.config = config;
        this.estimator = new BandedJobCostEstimator(config.getCost());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public JobCostEstimator estimator() {
        return estimator;
    }

    @Override
    public long estimatedOutputMiBPerJob() {
        return config.getEstimatedOutputMiBPerJob();
    }

    /**
     * Configured extra arguments, minus the memory-expensive ones in reduced-fidelity mode
     */
    protected List<String> extraArgs(FidelityMode mode) {
        if (mode == FidelityMode.FULL) {
            return config.getExtraArgs();
        }
        return config.getExtraArgs().stream()
            .filter(arg -> !config.getReducedFidelityDrops().contains(arg))
            .toList();
    }

    protected Job newJob(String id, Path unitDir, List<RunInput> runs) {
        return Job.builder()
            .id(id)
            .unit(unitDir.getFileName().toString())
            .runs(new ArrayList<>(runs))
            .outputDir(outputRoot(unitDir).resolve(id))
            .logDir(unitDir.resolve(LOG_DIR).resolve(name))
            .build();
    }

    /**
     * Job directories under an input root, sorted by name
     */
    protected List<Path> jobDirectories(Path inputRoot, String unit) {
        if (!Files.isDirectory(inputRoot)) {
            throw new UnitDiscoveryException(unit, "Input directory not found: " + inputRoot);
        }
        try (Stream<Path> entries = Files.list(inputRoot)) {
            return entries
                .filter(Files::isDirectory)
                .filter(dir -> !REPORT_DIRS.contains(fileName(dir)))
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new UnitDiscoveryException(unit, "Cannot list " + inputRoot, e);
        }
    }

    /**
     * Keep the jobs that have input runs. Empty sample directories usually mean an earlier stage failed
     * for that sample; they are reported and left out rather than failed in every tier.
     */
    protected List<Job> withRuns(List<Job> jobs, String unit) {
        List<Job> empty = jobs.stream().filter(job -> job.getRuns().isEmpty()).toList();
        if (empty.isEmpty()) {
            return jobs;
        }
        log.warn("[{}] {} sample director(ies) without FASTQ input left out of {}: {}", unit, empty.size(), name,
            empty.stream().map(Job::getId).toList());
        return jobs.stream().filter(job -> !job.getRuns().isEmpty()).toList();
    }

    /**
     * Compressed FASTQ files directly inside a directory whose name starts with the prefix, sorted
     */
    protected static List<Path> fastqFiles(Path dir, String prefix) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                .filter(Files::isRegularFile)
                .filter(file -> {
                    String fileName = file.getFileName().toString();
                    return fileName.startsWith(prefix) && fileName.endsWith(FASTQ_SUFFIX);
                })
                .sorted()
                .toList();
        } catch (IOException e) {
            log.warn("Cannot list {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    /**
     * Group FASTQ files into runs.
     * {@code <run>_1} with a matching {@code <run>_2} is paired, {@code <run>_1} alone is kept single-end,
     * files without a mate suffix are single-end, and a {@code <run>_2} without its first mate is ignored.
     *
     * @param files FASTQ files of one job
     * @param prefix file name prefix stripped from the run id
     * @return runs in file-name order
     */
    protected static List<RunInput> pairRuns(String jobId, List<Path> files, String prefix) {
        Map<String, RunInput> runs = new LinkedHashMap<>();
        for (Path file : files) {
            String fileName = file.getFileName().toString();
            if (fileName.endsWith(READ2_SUFFIX)) {
                String runId = stripPrefix(fileName.substring(0, fileName.length() - READ2_SUFFIX.length()), prefix);
                if (!Files.exists(file.resolveSibling(prefix + runId + READ1_SUFFIX))) {
                    log.warn("Job {}: {} has no first mate, ignored", jobId, fileName);
                }
                continue;
            }
            if (fileName.endsWith(READ1_SUFFIX)) {
                String runId = stripPrefix(fileName.substring(0, fileName.length() - READ1_SUFFIX.length()), prefix);
                Path mate = file.resolveSibling(prefix + runId + READ2_SUFFIX);
                if (Files.exists(mate)) {
                    runs.put(runId, new RunInput(runId, file, mate));
                } else {
                    log.warn("Job {}: missing second mate for run {}", jobId, runId);
                    runs.put(runId, new RunInput(runId, file, null));
                }
                continue;
            }
            String runId = stripPrefix(fileName.substring(0, fileName.length() - FASTQ_SUFFIX.length()), prefix);
            runs.put(runId, new RunInput(runId, file, null));
        }
        return new ArrayList<>(runs.values());
    }

    private static String stripPrefix(String value, String prefix) {
        return value.startsWith(prefix) ? value.substring(prefix.length()) : value;
    }

    protected static boolean isNonEmptyFile(Path file) {
        try {
            return Files.isRegularFile(file) && Files.size(file) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    protected static String fileName(Path path) {
        return path.getFileName().toString();
    }
}
