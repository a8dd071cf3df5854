package com.whereq.cascade.resource;

import com.whereq.cascade.config.CascadeProperties;
import com.whereq.cascade.model.ResourceBudget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class BandedJobCostEstimatorTest {

    @TempDir
    Path tempDir;

    private final BandedJobCostEstimator quantification =
        new BandedJobCostEstimator(new CascadeProperties.QuantificationConfig().getCost());

    private final BandedJobCostEstimator filtering =
        new BandedJobCostEstimator(new CascadeProperties.FilteringConfig().getCost());

    static ResourceBudget budget(int usableCpus, long usableMemoryMiB) {
        return ResourceBudget.builder()
            .totalCpus(usableCpus)
            .batchCpus(usableCpus)
            .usableCpus(usableCpus)
            .totalMemoryMiB(usableMemoryMiB)
            .availableMemoryMiB(usableMemoryMiB)
            .usableMemoryMiB(usableMemoryMiB)
            .parallelBatches(1)
            .build();
    }

    @Test
    @DisplayName("Should pick quantification threads from CPU bands")
    void testQuantificationBands() {
        assertThat(quantification.threadsFor(budget(64, 1000))).isEqualTo(8);
        assertThat(quantification.threadsFor(budget(32, 1000))).isEqualTo(8);
        assertThat(quantification.threadsFor(budget(30, 1000))).isEqualTo(6);
        assertThat(quantification.threadsFor(budget(16, 1000))).isEqualTo(6);
        assertThat(quantification.threadsFor(budget(8, 1000))).isEqualTo(4);
        assertThat(quantification.threadsFor(budget(4, 1000))).isEqualTo(4);
        assertThat(quantification.threadsFor(budget(3, 1000))).isEqualTo(2);
    }

    @Test
    @DisplayName("Should pick filtering threads from CPU bands")
    void testFilteringBands() {
        assertThat(filtering.threadsFor(budget(40, 1000))).isEqualTo(6);
        assertThat(filtering.threadsFor(budget(20, 1000))).isEqualTo(4);
        assertThat(filtering.threadsFor(budget(8, 1000))).isEqualTo(4);
        assertThat(filtering.threadsFor(budget(5, 1000))).isEqualTo(2);
        assertThat(filtering.threadsFor(budget(2, 1000))).isEqualTo(2);
    }

    @Test
    @DisplayName("Should add fixed overhead, base and per-thread memory")
    void testMemoryRequired() {
        assertThat(quantification.memoryRequired(4, 6144)).isEqualTo(6144 + 1024 + 4 * 512);
        assertThat(quantification.memoryRequired(2, 0)).isEqualTo(2048);
    }

    @Test
    @DisplayName("Should clamp the per-job memory budget")
    void testMemoryBudgetPerJob() {
        assertThat(quantification.memoryBudgetPerJob(2, budget(8, 9000))).isEqualTo(4500);
        assertThat(quantification.memoryBudgetPerJob(10, budget(8, 9000))).isEqualTo(4096);
        assertThat(quantification.memoryBudgetPerJob(1, budget(8, 500000))).isEqualTo(65536);
    }

    @Test
    @DisplayName("Should cap thread counts of the retry tiers")
    void testTierCaps() {
        assertThat(quantification.maxThreads(budget(30, 1000))).isEqualTo(16);
        assertThat(quantification.maxThreads(budget(6, 1000))).isEqualTo(6);
        assertThat(quantification.expansionCap()).isEqualTo(12);
        assertThat(quantification.minimalThreads()).isEqualTo(2);
        assertThat(quantification.minimalMemoryMiB()).isEqualTo(4096);
    }

    @Test
    @DisplayName("Should estimate index memory as twice its disk size, rounded up to the next GiB")
    void testFixedOverheadFromIndexSize() throws IOException {
        // Given
        Path index = Files.createDirectories(tempDir.resolve("index"));
        sparseFile(index.resolve("pos.bin"), 2000);
        sparseFile(index.resolve("seq.bin"), 1000);

        // When
        long overhead = quantification.fixedOverheadMiB(index);

        // Then
        assertThat(overhead).isEqualTo(6 * 1024);
    }

    @Test
    @DisplayName("Should clamp index memory to the configured band")
    void testFixedOverheadClamped() throws IOException {
        // Given
        Path small = Files.createDirectories(tempDir.resolve("small"));
        sparseFile(small.resolve("pos.bin"), 3);
        Path large = Files.createDirectories(tempDir.resolve("large"));
        sparseFile(large.resolve("pos.bin"), 20000);

        // When / Then
        assertThat(quantification.fixedOverheadMiB(small)).isEqualTo(2048);
        assertThat(quantification.fixedOverheadMiB(large)).isEqualTo(32768);
    }

    @Test
    @DisplayName("Should fall back to the default overhead when the index cannot be sized")
    void testFixedOverheadDefault() throws IOException {
        assertThat(quantification.fixedOverheadMiB(null)).isEqualTo(6144);
        assertThat(quantification.fixedOverheadMiB(tempDir.resolve("missing"))).isEqualTo(6144);
        assertThat(quantification.fixedOverheadMiB(Files.createDirectories(tempDir.resolve("empty")))).isEqualTo(6144);
        assertThat(filtering.fixedOverheadMiB(null)).isZero();
    }

    private static void sparseFile(Path file, long mib) throws IOException {
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "rw")) {
            raf.setLength(mib * 1024 * 1024);
        }
    }
}
