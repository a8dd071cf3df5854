package com.whereq.cascade.stage;

import com.whereq.cascade.config.CascadeProperties.QuantificationConfig;
import com.whereq.cascade.exception.InfrastructureException;
import com.whereq.cascade.model.BatchUnit;
import com.whereq.cascade.model.Job;
import com.whereq.cascade.model.JobResourceProfile;
import com.whereq.cascade.model.RunInput;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Transcript quantification of trimmed reads against a pre-built salmon index.
 * Technical replicates of a sample are merged into one salmon run.
 */
@Slf4j
public class QuantificationStage extends AbstractStage {

    public static final String NAME = "quantification";
    public static final String PRIMARY_OUTPUT = "quant.sf";

    static final String INPUT_DIR = "Trimmed_data";
    static final String OUTPUT_DIR = "Aligned_data";
    static final String TRIMMED_PREFIX = "fastp_";

    private static final List<String> INDEX_FILES = List.of("versionInfo.json", "info.json", "duplicate_clusters.tsv");

    private final QuantificationConfig config;
    private final Path index;

    public QuantificationStage(QuantificationConfig config, Path index) {
        super(NAME, config);
        this.config = config;
        this.index = index;
    }

    @Override
    public List<Job> discover(Path unitDir, BatchUnit unit) {
        List<Job> jobs = new ArrayList<>();
        for (Path sampleDir : jobDirectories(unitDir.resolve(INPUT_DIR), unit.getName())) {
            String jobId = fileName(sampleDir);
            jobs.add(newJob(jobId, unitDir, quantificationRuns(jobId, sampleDir)));
        }
        return withRuns(jobs, unit.getName());
    }

    /**
     * Paired runs when at least one complete pair exists, otherwise every single-end file
     */
    static List<RunInput> quantificationRuns(String jobId, Path sampleDir) {
        List<RunInput> runs = pairRuns(jobId, fastqFiles(sampleDir, TRIMMED_PREFIX), TRIMMED_PREFIX);
        List<RunInput> paired = runs.stream().filter(RunInput::isPaired).toList();
        if (paired.isEmpty()) {
            return runs;
        }
        if (paired.size() < runs.size()) {
            log.warn("Job {}: {} unpaired run(s) left out of paired-end quantification",
                jobId, runs.size() - paired.size());
        }
        return paired;
    }

    @Override
    public boolean hasCompleteOutput(Job job) {
        return isNonEmptyFile(job.getOutputDir().resolve(PRIMARY_OUTPUT));
    }

    @Override
    public List<ToolInvocation> invocations(Job job, JobResourceProfile profile, Path scratchDir) {
        if (job.getRuns().isEmpty()) {
            return List.of();
        }

        ToolInvocation.ToolInvocationBuilder salmon = ToolInvocation.builder()
            .name("salmon quant " + job.getId())
            .command(config.getExecutable())
            .command("quant");

        if (job.hasPairedRuns()) {
            salmon.command("-l").command(config.getLibTypePaired())
                .command("-i").command(index.toString())
                .command("-1");
            job.getRuns().forEach(run -> salmon.command(run.getRead1().toString()));
            salmon.command("-2");
            job.getRuns().forEach(run -> salmon.command(run.getRead2().toString()));
        } else {
            salmon.command("-l").command(config.getLibTypeSingle())
                .command("-i").command(index.toString())
                .command("-r");
            job.getRuns().forEach(run -> salmon.command(run.getRead1().toString()));
        }

        return List.of(salmon
            .commands(extraArgs(profile.getFidelityMode()))
            .command("--threads").command(String.valueOf(profile.getThreads()))
            .command("-o").command(job.getOutputDir().toString())
            .build());
    }

    @Override
    public Path sharedResource() {
        return index;
    }

    @Override
    public void validate() {
        if (index == null) {
            throw new InfrastructureException(
                "Quantification needs a salmon index (--index or cascade.stages.quantification.index)");
        }
        if (!Files.isDirectory(index)) {
            throw new InfrastructureException("Salmon index not found: " + index);
        }
        boolean looksLikeIndex = INDEX_FILES.stream().anyMatch(file -> Files.exists(index.resolve(file)));
        if (!looksLikeIndex) {
            log.warn("{} does not contain any of {}, it may not be a salmon index", index, INDEX_FILES);
        }
    }

    @Override
    public List<String> requiredExecutables() {
        return List.of(config.getExecutable());
    }

    @Override
    public Path outputRoot(Path unitDir) {
        return unitDir.resolve(OUTPUT_DIR);
    }

    @Override
    public String degradedNotice(Job job, JobResourceProfile profile) {
        return String.join(System.lineSeparator(),
            "WARNING: This sample was quantified WITHOUT bias correction models.",
            "",
            "The standard quantification (with " + String.join(" ", config.getReducedFidelityDrops()) + ") failed,",
            "most likely because of memory constraints. It was re-run in minimal-memory mode with "
                + profile.getThreads() + " threads",
            "and the bias models disabled.",
            "",
            "The quantification is usable but may be less accurate than samples processed",
            "with full bias correction. Consider re-running with more available memory.",
            "");
    }
}
