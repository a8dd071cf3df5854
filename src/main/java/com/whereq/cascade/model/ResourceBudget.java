package com.whereq.cascade.model;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of the CPU and memory one batch may allocate.
 * Computed once per batch invocation; host load drift is not tracked.
 * All memory figures are in mebibytes.
 */
@Value
@Builder
public class ResourceBudget {
    /**
     * CPUs on the host
     */
    int totalCpus;

    /**
     * Host CPUs divided by the number of side-by-side batches
     */
    int batchCpus;

    int reservedCpus;

    /**
     * CPUs actually available for job allocation
     */
    int usableCpus;

    long totalMemoryMiB;

    /**
     * Available memory divided by the number of side-by-side batches
     */
    long availableMemoryMiB;

    long reservedMemoryMiB;

    /**
     * Memory actually available for job allocation
     */
    long usableMemoryMiB;

    int parallelBatches;

    boolean fallback;

    public String describe() {
        return String.format("CPU %d usable of %d (reserved %d), "
            + "memory %d MiB usable of %d MiB available (reserved %d MiB)%s",
            usableCpus, totalCpus, reservedCpus, usableMemoryMiB, availableMemoryMiB, reservedMemoryMiB,
            fallback ? " [fallback defaults]" : "");
    }
}
