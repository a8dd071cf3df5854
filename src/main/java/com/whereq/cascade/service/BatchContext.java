package com.whereq.cascade.service;

import com.whereq.cascade.executor.CancellationToken;
import com.whereq.cascade.model.ResourceBudget;
import com.whereq.cascade.model.RunOptions;
import com.whereq.cascade.progress.ProgressStore;
import com.whereq.cascade.stage.StageDefinition;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Everything one unit's scheduling run needs, fixed for the duration of the run
 */
@Value
@Builder
public class BatchContext {
    StageDefinition stage;

    String unit;

    Path unitDir;

    ResourceBudget budget;

    long fixedOverheadMiB;

    ProgressStore store;

    RunOptions options;

    CancellationToken token;
}
