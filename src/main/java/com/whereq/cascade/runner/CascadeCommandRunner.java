package com.whereq.cascade.runner;

import com.whereq.cascade.config.CascadeProperties;
import com.whereq.cascade.exception.InfrastructureException;
import com.whereq.cascade.model.BatchSummary;
import com.whereq.cascade.model.BatchUnit;
import com.whereq.cascade.model.RunOptions;
import com.whereq.cascade.service.BatchOrchestrator;
import com.whereq.cascade.service.JobSpecificationParser;
import com.whereq.cascade.stage.StageDefinition;
import com.whereq.cascade.stage.StageRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line entry: parses options, runs the stage and maps the outcome to an exit status.
 * <p>
 * 0 when every job resolved to success (normal or degraded), 2 when any job failed permanently,
 * a unit could not be enumerated, or the run was cancelled, 1 when the batch could not start.
 */
@Slf4j
@Component
public class CascadeCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_INFRASTRUCTURE = 1;
    public static final int EXIT_PARTIAL_FAILURE = 2;

    @Autowired
    private CascadeProperties properties;

    @Autowired
    private StageRegistry stageRegistry;

    @Autowired
    private JobSpecificationParser specificationParser;

    @Autowired
    private BatchOrchestrator orchestrator;

    private int exitCode = EXIT_SUCCESS;

    @Override
    public void run(ApplicationArguments args) {
        try {
            StageDefinition stage = stageRegistry.create(option(args, "stage"), option(args, "index"));
            List<BatchUnit> units = units(args);
            RunOptions options = options(args);
            Path basePath = Path.of(option(args, "base-path", properties.getBasePath()));

            List<BatchSummary> summaries = orchestrator.run(stage, units, basePath, options);
            exitCode = exitCodeOf(summaries);

            long failedUnits = summaries.stream().filter(BatchSummary::hasFailures).count();
            log.info("{} finished for {} unit(s), {} with failures (exit status {})",
                stage.name(), summaries.size(), failedUnits, exitCode);
        } catch (InfrastructureException e) {
            log.error("Batch could not start: {}", e.getMessage());
            exitCode = EXIT_INFRASTRUCTURE;
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            exitCode = EXIT_INFRASTRUCTURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static int exitCodeOf(List<BatchSummary> summaries) {
        return summaries.stream().anyMatch(BatchSummary::hasFailures) ? EXIT_PARTIAL_FAILURE : EXIT_SUCCESS;
    }

    /**
     * Units from --input-file, or a single unit from --unit with optional --samples, --accession and --auth
     */
    List<BatchUnit> units(ApplicationArguments args) {
        String inputFile = option(args, "input-file");
        if (inputFile != null) {
            return specificationParser.parse(Path.of(inputFile));
        }

        String unit = option(args, "unit");
        if (unit == null) {
            throw new InfrastructureException("Either --input-file or --unit is required");
        }

        String samples = option(args, "samples", BatchUnit.ALL_ITEMS);
        String auth = option(args, "auth");
        BatchUnit.BatchUnitBuilder builder = BatchUnit.builder()
            .name(unit)
            .sourceAccession(option(args, "accession"))
            .authFile(auth != null ? Path.of(auth) : null);
        if (BatchUnit.ALL_ITEMS.equalsIgnoreCase(samples)) {
            builder.allItems(true);
        } else {
            builder.items(Arrays.stream(samples.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .toList());
        }
        return List.of(builder.build());
    }

    RunOptions options(ApplicationArguments args) {
        String threads = option(args, "threads");
        int parallel = Integer.parseInt(option(args, "parallel", String.valueOf(properties.getParallelBatches())));
        if (parallel < 1) {
            throw new IllegalArgumentException("--parallel must be at least 1");
        }
        Integer threadsOverride = threads != null ? Integer.valueOf(threads) : null;
        if (threadsOverride != null && threadsOverride < 1) {
            throw new IllegalArgumentException("--threads must be at least 1");
        }

        return RunOptions.builder()
            .force(args.containsOption("force") || properties.isForce())
            .resume(args.containsOption("resume") || properties.isResume())
            .threadsOverride(threadsOverride)
            .parallelBatches(parallel)
            .build();
    }

    private static String option(ApplicationArguments args, String name) {
        return option(args, name, null);
    }

    private static String option(ApplicationArguments args, String name, String defaultValue) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return defaultValue;
        }
        return values.get(values.size() - 1).trim();
    }
}
