package com.whereq.cascade.resource;

import com.sun.management.OperatingSystemMXBean;
import com.whereq.cascade.config.CascadeProperties;
import com.whereq.cascade.model.HostResources;
import com.whereq.cascade.model.ResourceBudget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;

/**
 * Detect host CPU and memory and derive the budget one batch may allocate
 */
@Slf4j
@Component
public class ResourceMonitor {

    private static final long KIB_PER_MIB = 1024;

    private final CascadeProperties.ResourceConfig config;

    public ResourceMonitor(CascadeProperties properties) {
        this.config = properties.getResources();
    }

    /**
     * Observe undivided host totals. Never fails: falls back to conservative defaults.
     *
     * @return host CPU and memory figures
     */
    public HostResources detect() {
        int cpus = Runtime.getRuntime().availableProcessors();

        HostResources fromKernel = readMeminfo(cpus);
        if (fromKernel != null) {
            return fromKernel;
        }

        HostResources fromJvm = readOperatingSystemBean(cpus);
        if (fromJvm != null) {
            return fromJvm;
        }

        log.warn("Resource introspection unavailable, using defaults: {} CPUs, {} MiB total, {} MiB available",
            config.getFallbackCpus(), config.getFallbackTotalMemoryMiB(), config.getFallbackAvailableMemoryMiB());
        return new HostResources(config.getFallbackCpus(), config.getFallbackTotalMemoryMiB(),
            config.getFallbackAvailableMemoryMiB(), true);
    }

    /**
     * Derive the budget of one batch from host totals.
     * CPUs and available memory are divided among side-by-side batches before the reserves apply.
     *
     * @param host undivided host totals
     * @param parallelBatches number of batches sharing the host
     * @return immutable budget snapshot
     */
    public ResourceBudget budgetFor(HostResources host, int parallelBatches) {
        int batches = Math.max(1, parallelBatches);

        int batchCpus = Math.max(1, host.getTotalCpus() / batches);
        int reservedCpus = reservedCpus(batchCpus);
        int usableCpus = Math.max(2, batchCpus - reservedCpus);

        long availableMiB = host.getAvailableMemoryMiB() / batches;
        long reservedMiB = availableMiB * config.getMemoryReservePercent() / 100;
        long usableMiB = availableMiB - reservedMiB;

        ResourceBudget budget = ResourceBudget.builder()
            .totalCpus(host.getTotalCpus())
            .batchCpus(batchCpus)
            .reservedCpus(reservedCpus)
            .usableCpus(usableCpus)
            .totalMemoryMiB(host.getTotalMemoryMiB())
            .availableMemoryMiB(availableMiB)
            .reservedMemoryMiB(reservedMiB)
            .usableMemoryMiB(usableMiB)
            .parallelBatches(batches)
            .fallback(host.isFallback())
            .build();

        log.info("Resource budget: {}", budget.describe());
        return budget;
    }

    /**
     * Reserve scales with CPU count: 0 up to 4, 1 up to 8, 2 beyond
     */
    static int reservedCpus(int cpus) {
        if (cpus <= 4) {
            return 0;
        }
        if (cpus <= 8) {
            return 1;
        }
        return 2;
    }

    private HostResources readMeminfo(int cpus) {
        Path meminfo = Path.of(config.getMeminfoPath());
        if (!Files.isReadable(meminfo)) {
            return null;
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(meminfo);
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", meminfo, e.getMessage());
            return null;
        }

        OptionalLong totalKiB = meminfoValue(lines, "MemTotal");
        if (totalKiB.isEmpty()) {
            log.warn("No MemTotal in {}", meminfo);
            return null;
        }
        long totalMiB = totalKiB.getAsLong() / KIB_PER_MIB;

        OptionalLong availableKiB = meminfoValue(lines, "MemAvailable");
        long availableMiB = availableKiB.isPresent()
            ? availableKiB.getAsLong() / KIB_PER_MIB
            : totalMiB * config.getAvailableMemoryFallbackPercent() / 100;

        return new HostResources(cpus, totalMiB, availableMiB, false);
    }

    static OptionalLong meminfoValue(List<String> lines, String key) {
        for (String line : lines) {
            if (!line.startsWith(key + ":")) {
                continue;
            }
            String[] parts = line.substring(key.length() + 1).trim().split("\\s+");
            try {
                return OptionalLong.of(Long.parseLong(parts[0]));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    private HostResources readOperatingSystemBean(int cpus) {
        try {
            if (ManagementFactory.getOperatingSystemMXBean() instanceof OperatingSystemMXBean os) {
                long totalMiB = os.getTotalMemorySize() / KIB_PER_MIB / KIB_PER_MIB;
                long freeMiB = os.getFreeMemorySize() / KIB_PER_MIB / KIB_PER_MIB;
                if (totalMiB > 0) {
                    log.debug("Memory read from the operating system bean: {} MiB total, {} MiB free",
                        totalMiB, freeMiB);
                    long availableMiB = freeMiB > 0
                        ? freeMiB
                        : totalMiB * config.getAvailableMemoryFallbackPercent() / 100;
                    return new HostResources(cpus, totalMiB, availableMiB, false);
                }
            }
        } catch (RuntimeException e) {
            log.warn("Operating system bean unavailable: {}", e.getMessage());
        }
        return null;
    }
}
