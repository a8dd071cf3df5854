package com.whereq.cascade.stage;

import com.whereq.cascade.config.CascadeProperties.AcquisitionConfig;
import com.whereq.cascade.exception.UnitDiscoveryException;
import com.whereq.cascade.model.BatchUnit;
import com.whereq.cascade.model.Job;
import com.whereq.cascade.model.JobResourceProfile;
import com.whereq.cascade.model.RunInput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Download of sequencing runs from SRA: prefetch, FASTQ extraction with fasterq-dump, pigz compression.
 * Every run of a sample is fetched within one attempt.
 */
@Slf4j
public class AcquisitionStage extends AbstractStage {

    public static final String NAME = "acquisition";

    static final String OUTPUT_DIR = "Raw_data";
    static final String EXTRACT_DIR = "fastq";

    private static final long MIN_BUFSIZE_MB = 256;
    private static final long MAX_BUFSIZE_MB = 4096;
    private static final long MIN_CACHE_MB = 128;
    private static final long MAX_CACHE_MB = 2048;

    private final AcquisitionConfig config;

    public AcquisitionStage(AcquisitionConfig config) {
        super(NAME, config);
        this.config = config;
    }

    /**
     * Jobs come from the unit's selection: explicit sample ids map to their runs through the
     * run mapping file, or stand for a single run of the same accession; "all" takes every mapped sample.
     */
    @Override
    public List<Job> discover(Path unitDir, BatchUnit unit) {
        Path mappingFile = unitDir.resolve(config.getRunMappingFile());
        Map<String, List<String>> mapping = readRunMapping(mappingFile, unit.getName());

        List<Job> jobs = new ArrayList<>();
        if (unit.isAllItems()) {
            if (mapping.isEmpty()) {
                throw new UnitDiscoveryException(unit.getName(),
                    "Cannot discover samples of " + unit.getName() + " without " + mappingFile);
            }
            mapping.forEach((sample, runs) -> jobs.add(newJob(sample, unitDir, accessions(runs))));
        } else {
            for (String item : unit.getItems()) {
                jobs.add(newJob(item, unitDir, accessions(mapping.getOrDefault(item, List.of(item)))));
            }
        }
        jobs.forEach(job -> job.setAuthFile(unit.getAuthFile()));
        return jobs;
    }

    private static List<RunInput> accessions(List<String> runs) {
        return runs.stream().map(RunInput::accession).toList();
    }

    static Map<String, List<String>> readRunMapping(Path mappingFile, String unit) {
        Map<String, List<String>> mapping = new LinkedHashMap<>();
        if (!Files.isRegularFile(mappingFile)) {
            return mapping;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(mappingFile);
        } catch (IOException e) {
            throw new UnitDiscoveryException(unit, "Cannot read " + mappingFile, e);
        }
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            String[] fields = trimmed.split("\t");
            if (fields.length < 2 || fields[0].isBlank() || fields[1].isBlank()) {
                log.warn("Skipping malformed line in {}: {}", mappingFile, line);
                continue;
            }
            List<String> runs = mapping.computeIfAbsent(fields[0].trim(), sample -> new ArrayList<>());
            if (!runs.contains(fields[1].trim())) {
                runs.add(fields[1].trim());
            }
        }
        return mapping;
    }

    @Override
    public boolean hasCompleteOutput(Job job) {
        if (job.getRuns().isEmpty()) {
            return false;
        }
        return job.getRuns().stream().allMatch(run ->
            isNonEmptyFile(job.getOutputDir().resolve(run.getRunId() + READ1_SUFFIX))
                || isNonEmptyFile(job.getOutputDir().resolve(run.getRunId() + FASTQ_SUFFIX)));
    }

    @Override
    public List<ToolInvocation> invocations(Job job, JobResourceProfile profile, Path scratchDir) {
        long memGiB = Math.max(1, profile.getMemoryCeilingMiB() / 1024);
        long bufsizeMb = Math.max(MIN_BUFSIZE_MB, Math.min(MAX_BUFSIZE_MB, memGiB * 100));
        long cacheMb = Math.max(MIN_CACHE_MB, Math.min(MAX_CACHE_MB, bufsizeMb / 2));
        String threads = String.valueOf(profile.getThreads());

        List<ToolInvocation> invocations = new ArrayList<>();
        for (RunInput run : job.getRuns()) {
            String runId = run.getRunId();
            Path extractDir = job.getOutputDir().resolve(runId).resolve(EXTRACT_DIR);

            ToolInvocation.ToolInvocationBuilder prefetch = ToolInvocation.builder()
                .name("prefetch " + runId)
                .command(config.getPrefetchExecutable())
                .command(runId);
            authArguments(prefetch, job);
            invocations.add(prefetch
                .command("--output-directory").command(job.getOutputDir().toString())
                .command("--max-size").command(config.getMaxSize())
                .build());

            ToolInvocation.ToolInvocationBuilder extract = ToolInvocation.builder()
                .name("fasterq-dump " + runId)
                .workingDirectory(job.getOutputDir())
                .command(config.getExtractExecutable())
                .command(runId);
            authArguments(extract, job);
            invocations.add(extract
                .command("--split-3")
                .command("--threads").command(threads)
                .command("--outdir").command(extractDir.toString())
                .command("--temp").command(scratchDir.toString())
                .command("--mem").command(memGiB + "G")
                .command("--bufsize").command(bufsizeMb + "MB")
                .command("--curcache").command(cacheMb + "MB")
                .build());

            invocations.add(ToolInvocation.builder()
                .name("pigz " + runId)
                .command(config.getCompressExecutable())
                .command("-" + config.getCompressionLevel())
                .command("-p").command(threads)
                .command("-r").command(extractDir.toString())
                .build());
        }
        return invocations;
    }

    private void authArguments(ToolInvocation.ToolInvocationBuilder builder, Job job) {
        if (job.getAuthFile() != null) {
            builder.command("--ngc").command(job.getAuthFile().toString());
        }
    }

    /**
     * Move compressed reads up into the sample directory and drop the downloaded archives
     */
    @Override
    public void completeAttempt(Job job, Path scratchDir) throws IOException {
        for (RunInput run : job.getRuns()) {
            Path runDir = job.getOutputDir().resolve(run.getRunId());
            Path extractDir = runDir.resolve(EXTRACT_DIR);
            if (Files.isDirectory(extractDir)) {
                try (Stream<Path> files = Files.list(extractDir)) {
                    for (Path file : files.filter(f -> fileName(f).endsWith(FASTQ_SUFFIX)).toList()) {
                        Files.move(file, job.getOutputDir().resolve(fileName(file)),
                            StandardCopyOption.REPLACE_EXISTING);
                    }
                }
            }
            FileSystemUtils.deleteRecursively(runDir);
        }
    }

    /**
     * Full fidelity extracts on the RAM disk when it is writable; reduced fidelity stays on disk
     */
    @Override
    public Path scratchRoot(JobResourceProfile profile, Path defaultRoot) {
        if (profile.isReducedFidelity() || config.getRamDisk() == null || config.getRamDisk().isBlank()) {
            return defaultRoot;
        }
        Path ramDisk = Path.of(config.getRamDisk());
        return Files.isDirectory(ramDisk) && Files.isWritable(ramDisk) ? ramDisk : defaultRoot;
    }

    @Override
    public List<String> requiredExecutables() {
        return List.of(config.getPrefetchExecutable(), config.getExtractExecutable(), config.getCompressExecutable());
    }

    @Override
    public Path outputRoot(Path unitDir) {
        return unitDir.resolve(OUTPUT_DIR);
    }

    @Override
    public String degradedNotice(Job job, JobResourceProfile profile) {
        return String.join(System.lineSeparator(),
            "NOTICE: This sample was extracted in minimal-footprint mode.",
            "",
            "Extraction failed twice with standard settings and was re-run with "
                + profile.getThreads() + " threads,",
            "on-disk temporary storage and " + profile.getMemoryCeilingMiB() + " MiB of extraction memory.",
            "The reads are complete; only the extraction settings differed.",
            "");
    }
}
