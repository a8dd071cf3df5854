package com.whereq.cascade.stage;

import com.whereq.cascade.config.CascadeProperties;
import com.whereq.cascade.model.BatchUnit;
import com.whereq.cascade.model.Job;
import com.whereq.cascade.model.RunInput;
import com.whereq.cascade.model.Tier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.whereq.cascade.stage.QuantificationStageTest.profile;
import static org.assertj.core.api.Assertions.*;

class FilteringStageTest {

    @TempDir
    Path unitDir;

    private FilteringStage stage;

    @BeforeEach
    void setUp() {
        stage = new FilteringStage(new CascadeProperties.FilteringConfig());
    }

    private void raw(String sample, String fileName) throws IOException {
        Path dir = Files.createDirectories(unitDir.resolve("Raw_data").resolve(sample));
        Files.writeString(dir.resolve(fileName), "@read\nACGT\n+\nIIII\n");
    }

    @Test
    @DisplayName("Should pair mates and ignore an orphan second mate")
    void testDiscover() throws IOException {
        // Given
        raw("GSM1", "SRR1_1.fastq.gz");
        raw("GSM1", "SRR1_2.fastq.gz");
        raw("GSM1", "SRR2.fastq.gz");
        raw("GSM1", "SRR3_2.fastq.gz");
        raw("GSM1", "notes.txt");

        // When
        List<Job> jobs = stage.discover(unitDir, BatchUnit.all("GSE100"));

        // Then
        assertThat(jobs).singleElement().satisfies(job -> {
            assertThat(job.getRuns()).extracting(RunInput::getRunId).containsExactly("SRR1", "SRR2");
            assertThat(job.getRuns().get(0).isPaired()).isTrue();
            assertThat(job.getRuns().get(1).isPaired()).isFalse();
            assertThat(job.getOutputDir()).isEqualTo(unitDir.resolve("Trimmed_data").resolve("GSM1"));
        });
    }

    @Test
    @DisplayName("Should run fastp once per run with the trimmed output names")
    void testInvocations() throws IOException {
        // Given
        raw("GSM1", "SRR1_1.fastq.gz");
        raw("GSM1", "SRR1_2.fastq.gz");
        raw("GSM1", "SRR2.fastq.gz");
        Job job = stage.discover(unitDir, BatchUnit.all("GSE100")).get(0);

        // When
        List<ToolInvocation> invocations = stage.invocations(job, profile(Tier.TIER1_PARALLEL, 4), unitDir);

        // Then
        assertThat(invocations).hasSize(2);
        assertThat(invocations.get(0).getCommands())
            .startsWith("fastp", "-i")
            .contains("-I", "-O", "--correction", "--detect_adapter_for_pe")
            .contains(job.getOutputDir().resolve("fastp_SRR1_1.fastq.gz").toString())
            .containsSequence("--length_required", "36", "--thread", "4");
        assertThat(invocations.get(1).getCommands())
            .doesNotContain("-I", "-O")
            .contains(job.getOutputDir().resolve("fastp_SRR2.fastq.gz").toString(),
                job.getOutputDir().resolve("SRR2.json").toString());
    }

    @Test
    @DisplayName("Should drop base correction in reduced fidelity")
    void testReducedFidelity() throws IOException {
        // Given
        raw("GSM1", "SRR2.fastq.gz");
        Job job = stage.discover(unitDir, BatchUnit.all("GSE100")).get(0);

        // When
        ToolInvocation fastp = stage.invocations(job, profile(Tier.TIER3_MINIMAL_FOOTPRINT, 2), unitDir).get(0);

        // Then
        assertThat(fastp.getCommands()).doesNotContain("--correction").contains("--trim_poly_x");
    }

    @Test
    @DisplayName("Should require every trimmed read for complete output")
    void testCompleteOutput() throws IOException {
        // Given
        raw("GSM1", "SRR1_1.fastq.gz");
        raw("GSM1", "SRR1_2.fastq.gz");
        Job job = stage.discover(unitDir, BatchUnit.all("GSE100")).get(0);
        Files.createDirectories(job.getOutputDir());

        // When
        Files.writeString(job.getOutputDir().resolve("fastp_SRR1_1.fastq.gz"), "data");

        // Then
        assertThat(stage.hasCompleteOutput(job)).isFalse();
        Files.writeString(job.getOutputDir().resolve("fastp_SRR1_2.fastq.gz"), "data");
        assertThat(stage.hasCompleteOutput(job)).isTrue();
    }

    @Test
    @DisplayName("Should never consider a job without runs complete")
    void testNoRunsIncomplete() throws IOException {
        // Given
        Job job = Job.builder().id("GSM7").outputDir(unitDir.resolve("Trimmed_data").resolve("GSM7")).build();
        Files.createDirectories(job.getOutputDir());

        // Then
        assertThat(stage.hasCompleteOutput(job)).isFalse();
    }

    @Test
    @DisplayName("Should leave out sample directories without reads and report directories")
    void testDiscoverSkipsEmptySamples() throws IOException {
        // Given
        raw("GSM1", "SRR1.fastq.gz");
        Files.createDirectories(unitDir.resolve("Raw_data").resolve("GSM2"));
        raw("FastQC", "SRR1_fastqc.fastq.gz");

        // When
        List<Job> jobs = stage.discover(unitDir, BatchUnit.all("GSE100"));

        // Then
        assertThat(jobs).extracting(Job::getId).containsExactly("GSM1");
    }

    @Test
    @DisplayName("Should have no quality checks unless FastQC is enabled")
    void testQualityChecksDisabled() throws IOException {
        // Given
        raw("GSM1", "SRR1.fastq.gz");
        Job job = stage.discover(unitDir, BatchUnit.all("GSE100")).get(0);

        // Then
        assertThat(stage.qualityChecks(unitDir, List.of(job))).isEmpty();
        assertThat(stage.qualityAggregation(unitDir)).isEmpty();
    }

    @Test
    @DisplayName("Should run FastQC per trimmed file and MultiQC over the trimmed data")
    void testQualityChecks() throws IOException {
        // Given
        CascadeProperties.FilteringConfig config = new CascadeProperties.FilteringConfig();
        config.setFastqc(true);
        FilteringStage withFastqc = new FilteringStage(config);
        raw("GSM1", "SRR1_1.fastq.gz");
        raw("GSM1", "SRR1_2.fastq.gz");
        Job job = withFastqc.discover(unitDir, BatchUnit.all("GSE100")).get(0);
        Files.createDirectories(job.getOutputDir());
        Files.writeString(job.getOutputDir().resolve("fastp_SRR1_1.fastq.gz"), "trimmed");
        Files.writeString(job.getOutputDir().resolve("fastp_SRR1_2.fastq.gz"), "trimmed");
        Files.writeString(job.getOutputDir().resolve("SRR1.html"), "report");

        // When
        List<ToolInvocation> checks = withFastqc.qualityChecks(unitDir, List.of(job));
        List<ToolInvocation> aggregation = withFastqc.qualityAggregation(unitDir);

        // Then
        Path fastqcDir = unitDir.resolve("Trimmed_data").resolve("FastQC");
        assertThat(checks).extracting(ToolInvocation::getSubject)
            .containsExactly("fastp_SRR1_1.fastq.gz", "fastp_SRR1_2.fastq.gz");
        assertThat(checks.get(0).getCommands())
            .startsWith("fastqc", job.getOutputDir().resolve("fastp_SRR1_1.fastq.gz").toString())
            .containsSequence("--outdir", fastqcDir.toString())
            .containsSequence("--threads", "2");
        assertThat(aggregation).singleElement().satisfies(multiqc -> assertThat(multiqc.getCommands())
            .startsWith("multiqc", unitDir.resolve("Trimmed_data").toString())
            .containsSequence("--outdir", unitDir.resolve("Trimmed_data").resolve("MultiQC").toString())
            .contains("--force", "--no-data-dir"));
    }
}
