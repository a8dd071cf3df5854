package com.whereq.cascade.service;

import com.whereq.cascade.executor.CancellationToken;
import com.whereq.cascade.model.Job;
import com.whereq.cascade.model.QualityCheckResult;
import com.whereq.cascade.stage.ScriptStage;
import com.whereq.cascade.stage.ToolInvocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class QualityCheckRunnerTest {

    @TempDir
    Path unitDir;

    private final QualityCheckRunner runner = new QualityCheckRunner(new PreflightChecker("/usr/bin:/bin"));

    private static ToolInvocation shell(String subject, String script) {
        return ToolInvocation.builder()
            .name("check " + subject)
            .subject(subject)
            .command("/bin/sh").command("-c").command(script)
            .build();
    }

    private static ScriptStage stage(List<ToolInvocation> checks, List<ToolInvocation> aggregation) {
        return new ScriptStage() {
            @Override
            public List<ToolInvocation> qualityChecks(Path dir, List<Job> completed) {
                return checks;
            }

            @Override
            public List<ToolInvocation> qualityAggregation(Path dir) {
                return aggregation;
            }
        };
    }

    @Test
    @DisplayName("Should do nothing for a stage without quality checks")
    void testNoChecks() {
        // When
        QualityCheckResult result = runner.run(new ScriptStage(), unitDir, List.of(), 2, new CancellationToken());

        // Then
        assertThat(result.ranAnything()).isFalse();
        assertThat(unitDir.resolve("script_qc_failed.txt")).doesNotExist();
    }

    @Test
    @DisplayName("Should list failed checks and still run the aggregation")
    void testFailuresAndAggregation() throws IOException {
        // Given
        Path reportDir = unitDir.resolve("reports");
        ScriptStage stage = stage(
            List.of(shell("b.fastq.gz", "exit 2"), shell("a.fastq.gz", "true"), shell("c.fastq.gz", "exit 1")),
            List.of(ToolInvocation.builder()
                .name("aggregate")
                .subject(reportDir.toString())
                .command("/bin/sh").command("-c").command("echo report > report.html")
                .workingDirectory(reportDir)
                .build()));

        // When
        QualityCheckResult result = runner.run(stage, unitDir, List.of(), 2, new CancellationToken());

        // Then
        assertThat(result.getChecked()).isEqualTo(3);
        assertThat(result.getFailures()).containsExactly("b.fastq.gz", "c.fastq.gz");
        assertThat(result.getAggregateReport()).isEqualTo(reportDir.toString());
        assertThat(result.isAggregationFailed()).isFalse();
        assertThat(reportDir.resolve("report.html")).exists();
        assertThat(Files.readAllLines(unitDir.resolve("script_qc_failed.txt")))
            .containsExactly("b.fastq.gz", "c.fastq.gz");
        assertThat(unitDir.resolve("logs/script/quality_checks.log")).exists();
    }

    @Test
    @DisplayName("Should report a failed aggregation")
    void testAggregationFailure() {
        // Given
        ScriptStage stage = stage(List.of(shell("a.fastq.gz", "true")), List.of(shell("aggregate", "exit 1")));

        // When
        QualityCheckResult result = runner.run(stage, unitDir, List.of(), 1, new CancellationToken());

        // Then
        assertThat(result.getFailures()).isEmpty();
        assertThat(result.getAggregateReport()).isNull();
        assertThat(result.isAggregationFailed()).isTrue();
    }

    @Test
    @DisplayName("Should skip checks whose tool is not installed")
    void testMissingTool() throws IOException {
        // Given
        ToolInvocation missing = ToolInvocation.builder()
            .name("cascade-no-such-qc a.fastq.gz")
            .subject("a.fastq.gz")
            .command("cascade-no-such-qc").command("a.fastq.gz")
            .build();
        ScriptStage stage = stage(List.of(missing, missing), List.of());

        // When
        QualityCheckResult result = runner.run(stage, unitDir, List.of(), 2, new CancellationToken());

        // Then
        assertThat(result.getChecked()).isZero();
        assertThat(result.getFailures()).isEmpty();
        assertThat(result.getMissingTools()).containsExactly("cascade-no-such-qc");
        assertThat(result.ranAnything()).isTrue();
        assertThat(Files.readAllLines(unitDir.resolve("script_qc_failed.txt"))).isEmpty();
    }

    @Test
    @DisplayName("Should not start checks after cancellation")
    void testCancelled() {
        // Given
        CancellationToken token = new CancellationToken();
        token.cancel();
        ScriptStage stage = stage(List.of(shell("a.fastq.gz", "touch " + unitDir.resolve("ran"))), List.of());

        // When
        QualityCheckResult result = runner.run(stage, unitDir, List.of(), 1, token);

        // Then
        assertThat(result.getFailures()).containsExactly("a.fastq.gz");
        assertThat(unitDir.resolve("ran")).doesNotExist();
    }
}
