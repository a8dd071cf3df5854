package com.whereq.cascade.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for WhereQ Cascade.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "cascade")
@Validated
@Data
public class CascadeProperties {

    /**
     * Root directory holding one sub-directory per batch unit.
     */
    @NotBlank
    private String basePath = "/data";

    /**
     * Number of batch units processed side by side. Each takes an equal share of the host.
     */
    @Min(1)
    private int parallelBatches = 1;

    /**
     * Re-run jobs even if their completed output already exists.
     */
    private boolean force = false;

    /**
     * Continue from existing progress files instead of starting fresh.
     */
    private boolean resume = false;

    @Valid
    private ResourceConfig resources = new ResourceConfig();

    @Valid
    private ExecutionConfig execution = new ExecutionConfig();

    @Valid
    private StagesConfig stages = new StagesConfig();

    @Data
    public static class ResourceConfig {
        /**
         * Share of available memory held back from job allocation.
         */
        @Min(0)
        @Max(90)
        private int memoryReservePercent = 10;

        /**
         * Share of total memory assumed available when the kernel does not report MemAvailable.
         */
        @Min(1)
        @Max(100)
        private int availableMemoryFallbackPercent = 70;

        /**
         * Kernel memory report consulted first.
         */
        private String meminfoPath = "/proc/meminfo";

        /**
         * Conservative host figures used when introspection is unavailable.
         */
        @Min(1)
        private int fallbackCpus = 4;

        @Min(1)
        private long fallbackTotalMemoryMiB = 8192;

        @Min(1)
        private long fallbackAvailableMemoryMiB = 6144;
    }

    @Data
    public static class ExecutionConfig {
        /**
         * Interval of the "still running" log line for in-flight processes.
         */
        @Min(10)
        private int heartbeatSeconds = 60;

        /**
         * Root of job-exclusive scratch directories. Defaults to the JVM temp directory.
         */
        private String scratchRoot = System.getProperty("java.io.tmpdir");

        /**
         * GNU time binary used to measure peak resident memory. Skipped when not executable.
         */
        private String peakMemoryWrapper = "/usr/bin/time";

        /**
         * Lines of a failed attempt's log repeated in the scheduler log.
         */
        @Min(0)
        private int logTailLines = 20;

        /**
         * Warn before scheduling when free disk looks too small for the pending jobs.
         */
        private boolean diskCheckEnabled = true;
    }

    @Data
    public static class StagesConfig {
        @Valid
        private QuantificationConfig quantification = new QuantificationConfig();

        @Valid
        private FilteringConfig filtering = new FilteringConfig();

        @Valid
        private AcquisitionConfig acquisition = new AcquisitionConfig();
    }

    /**
     * Settings shared by every stage
     */
    @Data
    public static class StageConfig {
        /**
         * Extra tool arguments applied in every tier.
         */
        private List<String> extraArgs = new ArrayList<>();

        /**
         * Arguments removed from {@link #extraArgs} in reduced-fidelity mode.
         */
        private List<String> reducedFidelityDrops = new ArrayList<>();

        /**
         * Rough output size per job, used by the pre-flight disk check.
         */
        @Min(0)
        private long estimatedOutputMiBPerJob = 1024;

        @Valid
        private CostModel cost = new CostModel();
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class QuantificationConfig extends StageConfig {
        @NotBlank
        private String executable = "salmon";

        /**
         * Pre-built index directory; may be given per invocation with --index instead.
         */
        private String index;

        @NotBlank
        private String libTypePaired = "A";

        @NotBlank
        private String libTypeSingle = "A";

        public QuantificationConfig() {
            setExtraArgs(new ArrayList<>(List.of(
                "--validateMappings", "--seqBias", "--gcBias", "--posBias", "--dumpEq")));
            setReducedFidelityDrops(new ArrayList<>(List.of("--seqBias", "--gcBias", "--posBias")));
            setEstimatedOutputMiBPerJob(200);
            CostModel cost = new CostModel();
            cost.setThreadBands(CostModel.bands(32, 8, 16, 6, 8, 4, 4, 4));
            cost.setJobMemoryMinMiB(4096);
            cost.setDefaultOverheadMiB(6144);
            setCost(cost);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class FilteringConfig extends StageConfig {
        @NotBlank
        private String executable = "fastp";

        @Min(1)
        private int lengthRequired = 36;

        /**
         * Run FastQC on every trimmed file and aggregate the reports with MultiQC.
         */
        private boolean fastqc = false;

        @NotBlank
        private String fastqcExecutable = "fastqc";

        @Min(1)
        private int fastqcThreads = 2;

        @NotBlank
        private String multiqcExecutable = "multiqc";

        public FilteringConfig() {
            setExtraArgs(new ArrayList<>(List.of("--trim_poly_x", "--correction", "--detect_adapter_for_pe")));
            setReducedFidelityDrops(new ArrayList<>(List.of("--correction")));
            setEstimatedOutputMiBPerJob(4096);
            CostModel cost = new CostModel();
            cost.setThreadBands(CostModel.bands(32, 6, 16, 4, 8, 4, 4, 2));
            cost.setJobMemoryMinMiB(1024);
            setCost(cost);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class AcquisitionConfig extends StageConfig {
        @NotBlank
        private String prefetchExecutable = "prefetch";

        @NotBlank
        private String extractExecutable = "fasterq-dump";

        @NotBlank
        private String compressExecutable = "pigz";

        /**
         * Download size limit handed to prefetch ("u" for unlimited).
         */
        @NotBlank
        private String maxSize = "u";

        @Min(1)
        @Max(9)
        private int compressionLevel = 1;

        /**
         * RAM-backed scratch used for extraction in full-fidelity mode when writable.
         */
        private String ramDisk = "/dev/shm";

        /**
         * Optional per-unit file mapping sample ids to run accessions (sample TAB run).
         */
        @NotBlank
        private String runMappingFile = "run_mapping.tsv";

        public AcquisitionConfig() {
            setEstimatedOutputMiBPerJob(10240);
            CostModel cost = new CostModel();
            cost.setThreadBands(CostModel.bands(0, 2));
            cost.setDefaultThreads(2);
            cost.setJobMemoryMinMiB(2048);
            setCost(cost);
        }
    }

    /**
     * Tunable resource formulas of one stage
     */
    @Data
    public static class CostModel {
        /**
         * Thread bands keyed by usable CPUs, highest threshold first.
         */
        @NotEmpty
        @Valid
        private List<ThreadBand> threadBands = bands(32, 8, 16, 6, 8, 4, 4, 4);

        /**
         * Threads when no band matches.
         */
        @Min(1)
        private int defaultThreads = 2;

        /**
         * Upper bound for the sequential maximum-resource tier.
         */
        @Min(1)
        private int tier2ThreadCap = 16;

        /**
         * Upper bound when a single-job plan re-expands its threads.
         */
        @Min(1)
        private int expansionCap = 12;

        /**
         * Threads in the minimal-footprint tier.
         */
        @Min(1)
        private int minimalThreads = 2;

        @Min(0)
        private long baseMemoryMiB = 1024;

        @Min(0)
        private long perThreadMemoryMiB = 512;

        /**
         * Clamp for the memory handed to one job.
         */
        @Min(1)
        private long jobMemoryMinMiB = 2048;

        @Min(1)
        private long jobMemoryMaxMiB = 65536;

        /**
         * In-memory size of the shared resource relative to its size on disk.
         */
        @DecimalMin("1.0")
        private double overheadExpansionFactor = 2.0;

        @Min(0)
        private long overheadMinMiB = 2048;

        @Min(0)
        private long overheadMaxMiB = 32768;

        /**
         * Fixed overhead assumed when the shared resource cannot be sized.
         */
        @Min(0)
        private long defaultOverheadMiB = 0;

        /**
         * Builds bands from (minCpus, threads) pairs.
         */
        public static List<ThreadBand> bands(int... pairs) {
            if (pairs.length % 2 != 0) {
                throw new IllegalArgumentException("Thread bands need (minCpus, threads) pairs");
            }
            List<ThreadBand> bands = new ArrayList<>();
            for (int i = 0; i < pairs.length; i += 2) {
                bands.add(new ThreadBand(pairs[i], pairs[i + 1]));
            }
            return bands;
        }
    }

    @Data
    public static class ThreadBand {
        @Min(0)
        private int minCpus;

        @Min(1)
        private int threads;

        public ThreadBand() {
        }

        public ThreadBand(int minCpus, int threads) {
            this.minCpus = minCpus;
            this.threads = threads;
        }
    }
}
