package com.whereq.cascade.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.cascade.model.BatchSummary;
import com.whereq.cascade.model.QualityCheckResult;
import com.whereq.cascade.model.ResourceBudget;
import com.whereq.cascade.model.TierPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes the end-of-run report of one unit: {@code <stage>_summary.txt} for people and
 * {@code <stage>_summary.json} for automation
 */
@Slf4j
@Component
public class SummaryWriter {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z")
        .withZone(ZoneId.systemDefault());
    private static final String RULE = "=".repeat(80);

    private final ObjectMapper objectMapper;

    public SummaryWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Write both report files into the unit directory
     *
     * @return the human-readable report
     */
    public Path write(Path unitDir, BatchSummary summary) {
        Path text = unitDir.resolve(summary.getStage() + "_summary.txt");
        Path json = unitDir.resolve(summary.getStage() + "_summary.json");
        summary.setReportFile(text.toString());

        try {
            Files.createDirectories(unitDir);
            Files.writeString(text, render(summary), StandardCharsets.UTF_8);
            objectMapper.writeValue(json.toFile(), summary);
        } catch (IOException e) {
            log.error("Failed to write summary of {} to {}: {}", summary.getUnit(), unitDir, e.getMessage());
            return null;
        }

        log.info("Summary written to {}", text);
        return text;
    }

    String render(BatchSummary summary) {
        StringBuilder out = new StringBuilder();
        line(out, capitalize(summary.getStage()) + " Summary");
        line(out, RULE);
        line(out, "Unit: " + summary.getUnit());
        if (summary.getStartedAt() != null) {
            line(out, "Started: " + DATE.format(summary.getStartedAt()));
        }
        if (summary.getFinishedAt() != null) {
            line(out, "Finished: " + DATE.format(summary.getFinishedAt()));
        }
        if (summary.getError() != null) {
            line(out, "");
            line(out, "UNIT FAILED: " + summary.getError());
        }

        ResourceBudget budget = summary.getBudget();
        if (budget != null) {
            section(out, "Resources");
            line(out, "System CPUs: " + budget.getTotalCpus());
            line(out, "CPUs Used: " + budget.getUsableCpus() + " (reserved " + budget.getReservedCpus()
                + ", parallel batches " + budget.getParallelBatches() + ")");
            line(out, "Total Memory: " + budget.getTotalMemoryMiB() + " MiB");
            line(out, "Available Memory: " + budget.getAvailableMemoryMiB() + " MiB");
            line(out, "Usable Memory: " + budget.getUsableMemoryMiB() + " MiB");
            if (budget.isFallback()) {
                line(out, "Note: host introspection failed, conservative defaults were used");
            }
            line(out, "Estimated Fixed Overhead: " + summary.getFixedOverheadMiB() + " MiB per job");
        }

        TierPlan plan = summary.getTier1Plan();
        if (plan != null) {
            line(out, "Threads per Job: " + plan.getThreadsPerJob());
            line(out, "Parallel Jobs (tier 1): " + plan.getParallelJobs() + " (limited by "
                + plan.getBindingConstraint().name().toLowerCase() + ")");
        }
        if (summary.getPeakMemoryMiB() != null) {
            line(out, "Observed Peak Memory (RSS): " + summary.getPeakMemoryMiB() + " MiB (job: "
                + summary.getPeakMemoryJob() + ", tier: " + summary.getPeakMemoryTier() + ")");
        }

        section(out, "Processing Status");
        line(out, "Succeeded: " + summary.getSucceeded().size());
        line(out, "  of which skipped (already complete): " + summary.getSkipped().size());
        line(out, "Succeeded with degraded fidelity (tier 3): " + summary.getSucceededDegraded().size());
        line(out, "Failed permanently: " + summary.getFailed().size());
        if (!summary.getInterrupted().isEmpty()) {
            line(out, "Interrupted (still pending): " + summary.getInterrupted().size());
        }
        line(out, "Attempts this run: " + summary.getAttempts());

        list(out, "Succeeded with degraded fidelity", summary.getSucceededDegraded());
        list(out, "Failed", summary.getFailed());
        list(out, "Interrupted", summary.getInterrupted());

        QualityCheckResult checks = summary.getQualityChecks();
        if (checks != null) {
            section(out, "Quality Checks");
            line(out, "Files checked: " + checks.getChecked());
            line(out, "Failed checks: " + checks.getFailures().size());
            if (checks.getAggregateReport() != null) {
                line(out, "Aggregate report: " + checks.getAggregateReport());
            } else if (checks.isAggregationFailed()) {
                line(out, "Aggregate report: failed");
            }
            if (!checks.getMissingTools().isEmpty()) {
                line(out, "Skipped, not installed: " + String.join(", ", checks.getMissingTools()));
            }
            checks.getFailures().forEach(subject -> line(out, "  " + subject));
        }

        section(out, "Retry Strategy");
        line(out, "Tier 1: parallel with adaptive resources (CPU and memory aware)");
        line(out, "Tier 2: sequential retry with maximum resources");
        line(out, "Tier 3: minimal-footprint fallback with reduced fidelity");

        section(out, "Logs");
        line(out, "Per-job logs: " + summary.getLogDirectory());
        return out.toString();
    }

    private static void section(StringBuilder out, String title) {
        line(out, "");
        line(out, title + ":");
        line(out, "-".repeat(title.length() + 1));
    }

    private static void list(StringBuilder out, String title, List<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        section(out, title);
        ids.forEach(id -> line(out, "  " + id));
    }

    private static void line(StringBuilder out, String text) {
        out.append(text).append(System.lineSeparator());
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
