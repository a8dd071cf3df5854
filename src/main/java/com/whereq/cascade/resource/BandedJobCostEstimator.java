package com.whereq.cascade.resource;

import com.whereq.cascade.config.CascadeProperties.CostModel;
import com.whereq.cascade.config.CascadeProperties.ThreadBand;
import com.whereq.cascade.model.ResourceBudget;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Calculate job resource requirements from coarse CPU bands and a linear memory model
 */
@Slf4j
public class BandedJobCostEstimator implements JobCostEstimator {

    private static final long MIB = 1024L * 1024L;
    private static final long GIB_IN_MIB = 1024L;

    private final CostModel model;
    private final List<ThreadBand> bands;

    public BandedJobCostEstimator(CostModel model) {
        this.model = model;
        this.bands = model.getThreadBands().stream()
            .sorted(Comparator.comparingInt(ThreadBand::getMinCpus).reversed())
            .toList();
    }

    @Override
    public int threadsFor(ResourceBudget budget) {
        int cpus = budget.getUsableCpus();
        for (ThreadBand band : bands) {
            if (cpus >= band.getMinCpus()) {
                return band.getThreads();
            }
        }
        return model.getDefaultThreads();
    }

    @Override
    public long memoryRequired(int threads, long fixedOverheadMiB) {
        return fixedOverheadMiB + model.getBaseMemoryMiB() + (long) threads * model.getPerThreadMemoryMiB();
    }

    @Override
    public long memoryBudgetPerJob(int parallelJobs, ResourceBudget budget) {
        long perJob = budget.getUsableMemoryMiB() / Math.max(1, parallelJobs);
        return Math.max(model.getJobMemoryMinMiB(), Math.min(model.getJobMemoryMaxMiB(), perJob));
    }

    @Override
    public long fixedOverheadMiB(Path sharedResource) {
        if (sharedResource == null) {
            return model.getDefaultOverheadMiB();
        }

        long diskMiB;
        try {
            diskMiB = sizeOnDisk(sharedResource) / MIB;
        } catch (IOException | UncheckedIOException e) {
            log.warn("Cannot size {}, assuming {} MiB overhead: {}",
                sharedResource, model.getDefaultOverheadMiB(), e.getMessage());
            return model.getDefaultOverheadMiB();
        }
        if (diskMiB <= 0) {
            log.warn("Shared resource {} looks empty, assuming {} MiB overhead",
                sharedResource, model.getDefaultOverheadMiB());
            return model.getDefaultOverheadMiB();
        }

        // Expand, then round up to the next whole GiB
        long expandedMiB = (long) Math.ceil(diskMiB * model.getOverheadExpansionFactor());
        long roundedMiB = (expandedMiB / GIB_IN_MIB + 1) * GIB_IN_MIB;
        long overhead = Math.max(model.getOverheadMinMiB(), Math.min(model.getOverheadMaxMiB(), roundedMiB));

        log.info("Fixed overhead for {}: {} MiB on disk -> {} MiB in memory", sharedResource, diskMiB, overhead);
        return overhead;
    }

    @Override
    public int maxThreads(ResourceBudget budget) {
        return Math.min(budget.getUsableCpus(), model.getTier2ThreadCap());
    }

    @Override
    public int expansionCap() {
        return model.getExpansionCap();
    }

    @Override
    public int minimalThreads() {
        return model.getMinimalThreads();
    }

    @Override
    public long minimalMemoryMiB() {
        return model.getJobMemoryMinMiB();
    }

    private static long sizeOnDisk(Path path) throws IOException {
        if (Files.isRegularFile(path)) {
            return Files.size(path);
        }
        try (Stream<Path> files = Files.walk(path)) {
            return files.filter(Files::isRegularFile)
                .mapToLong(file -> {
                    try {
                        return Files.size(file);
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                })
                .sum();
        }
    }
}
