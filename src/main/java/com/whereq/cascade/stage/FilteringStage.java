package com.whereq.cascade.stage;

import com.whereq.cascade.config.CascadeProperties.FilteringConfig;
import com.whereq.cascade.model.BatchUnit;
import com.whereq.cascade.model.Job;
import com.whereq.cascade.model.JobResourceProfile;
import com.whereq.cascade.model.RunInput;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Adapter trimming and quality filtering of raw reads with fastp, one run at a time
 */
public class FilteringStage extends AbstractStage {

    public static final String NAME = "filtering";

    static final String INPUT_DIR = "Raw_data";
    static final String OUTPUT_DIR = "Trimmed_data";
    static final String OUTPUT_PREFIX = "fastp_";
    static final String FASTQC_DIR = "FastQC";
    static final String MULTIQC_DIR = "MultiQC";

    private final FilteringConfig config;

    public FilteringStage(FilteringConfig config) {
        super(NAME, config);
        this.config = config;
    }

    @Override
    public List<Job> discover(Path unitDir, BatchUnit unit) {
        List<Job> jobs = new ArrayList<>();
        for (Path sampleDir : jobDirectories(unitDir.resolve(INPUT_DIR), unit.getName())) {
            String jobId = fileName(sampleDir);
            jobs.add(newJob(jobId, unitDir, pairRuns(jobId, fastqFiles(sampleDir, ""), "")));
        }
        return withRuns(jobs, unit.getName());
    }

    @Override
    public boolean hasCompleteOutput(Job job) {
        if (job.getRuns().isEmpty()) {
            return false;
        }
        return job.getRuns().stream().allMatch(run ->
            isNonEmptyFile(trimmedRead(job, run.getRead1()))
                && (!run.isPaired() || isNonEmptyFile(trimmedRead(job, run.getRead2()))));
    }

    @Override
    public List<ToolInvocation> invocations(Job job, JobResourceProfile profile, Path scratchDir) {
        List<ToolInvocation> invocations = new ArrayList<>();
        for (RunInput run : job.getRuns()) {
            ToolInvocation.ToolInvocationBuilder fastp = ToolInvocation.builder()
                .name("fastp " + run.getRunId())
                .command(config.getExecutable())
                .command("-i").command(run.getRead1().toString());
            if (run.isPaired()) {
                fastp.command("-I").command(run.getRead2().toString());
            }
            fastp.command("-o").command(trimmedRead(job, run.getRead1()).toString());
            if (run.isPaired()) {
                fastp.command("-O").command(trimmedRead(job, run.getRead2()).toString());
            }
            invocations.add(fastp
                .command("-h").command(job.getOutputDir().resolve(run.getRunId() + ".html").toString())
                .command("-j").command(job.getOutputDir().resolve(run.getRunId() + ".json").toString())
                .commands(extraArgs(profile.getFidelityMode()))
                .command("--length_required").command(String.valueOf(config.getLengthRequired()))
                .command("--thread").command(String.valueOf(profile.getThreads()))
                .build());
        }
        return invocations;
    }

    /**
     * One FastQC run per trimmed file of every completed sample, when enabled
     */
    @Override
    public List<ToolInvocation> qualityChecks(Path unitDir, List<Job> completed) {
        if (!config.isFastqc()) {
            return List.of();
        }
        Path reportDir = outputRoot(unitDir).resolve(FASTQC_DIR);
        List<ToolInvocation> checks = new ArrayList<>();
        for (Job job : completed) {
            for (Path trimmed : fastqFiles(job.getOutputDir(), OUTPUT_PREFIX)) {
                checks.add(ToolInvocation.builder()
                    .name("fastqc " + fileName(trimmed))
                    .subject(fileName(trimmed))
                    .command(config.getFastqcExecutable())
                    .command(trimmed.toString())
                    .command("--outdir").command(reportDir.toString())
                    .command("--threads").command(String.valueOf(config.getFastqcThreads()))
                    .command("--quiet")
                    .workingDirectory(reportDir)
                    .build());
            }
        }
        return checks;
    }

    @Override
    public List<ToolInvocation> qualityAggregation(Path unitDir) {
        if (!config.isFastqc()) {
            return List.of();
        }
        Path trimmedRoot = outputRoot(unitDir);
        Path reportDir = trimmedRoot.resolve(MULTIQC_DIR);
        return List.of(ToolInvocation.builder()
            .name("multiqc " + fileName(unitDir))
            .subject(reportDir.toString())
            .command(config.getMultiqcExecutable())
            .command(trimmedRoot.toString())
            .command("--outdir").command(reportDir.toString())
            .command("--force")
            .command("--no-data-dir")
            .workingDirectory(reportDir)
            .build());
    }

    /**
     * Trimmed counterpart of a raw read file, e.g. fastp_SRR1_1.fastq.gz
     */
    static Path trimmedRead(Job job, Path rawRead) {
        return job.getOutputDir().resolve(OUTPUT_PREFIX + fileName(rawRead));
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
            "WARNING: This sample was trimmed WITHOUT " + String.join(" ", config.getReducedFidelityDrops()) + ".",
            "",
            "Standard trimming failed twice and was re-run in minimal-memory mode with "
                + profile.getThreads() + " threads.",
            "Overlapping read pairs were not base-corrected; downstream results may be slightly less accurate.",
            "");
    }
}
