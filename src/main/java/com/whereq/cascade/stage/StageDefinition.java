package com.whereq.cascade.stage;

import com.whereq.cascade.model.BatchUnit;
import com.whereq.cascade.model.Job;
import com.whereq.cascade.model.JobResourceProfile;
import com.whereq.cascade.resource.JobCostEstimator;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Job body of one pipeline stage: what the jobs are, how they run, and what counts as done.
 * The scheduler never looks at tool flags; reduced fidelity is expressed here.
 */
public interface StageDefinition {

    String DEGRADED_MARKER = "DEGRADED_FIDELITY.txt";

    /**
     * Stage name, used as prefix of progress and summary files
     */
    String name();

    /**
     * Enumerate the jobs of one unit from the inputs available now.
     *
     * @param unitDir the unit's directory under the base path
     * @param unit the unit and its item selection
     * @return every discoverable job, unfiltered by the allow-list unless discovery needs it
     * @throws com.whereq.cascade.exception.UnitDiscoveryException if the unit has no inputs at all
     */
    List<Job> discover(Path unitDir, BatchUnit unit);

    /**
     * True when the job's primary output exists and is non-empty
     */
    boolean hasCompleteOutput(Job job);

    /**
     * Processes of one attempt, run in order; the attempt fails at the first non-zero exit.
     * An empty list means the job has nothing to process and the attempt fails.
     */
    List<ToolInvocation> invocations(Job job, JobResourceProfile profile, Path scratchDir);

    /**
     * Post-process after every invocation exited cleanly and before the output is verified
     */
    default void completeAttempt(Job job, Path scratchDir) throws IOException {
    }

    JobCostEstimator estimator();

    /**
     * Resource loaded by every job whose size drives the fixed memory overhead, null if none
     */
    default Path sharedResource() {
        return null;
    }

    /**
     * Pre-flight check of stage configuration; fatal before any job runs
     */
    default void validate() {
    }

    /**
     * Executables that must be found on the PATH before scheduling
     */
    List<String> requiredExecutables();

    /**
     * Directory under which job outputs of a unit are written
     */
    Path outputRoot(Path unitDir);

    /**
     * Where job-exclusive scratch directories are created for the given profile
     */
    default Path scratchRoot(JobResourceProfile profile, Path defaultRoot) {
        return defaultRoot;
    }

    long estimatedOutputMiBPerJob();

    /**
     * Text of the marker left in the output of a job that succeeded under reduced fidelity
     */
    String degradedNotice(Job job, JobResourceProfile profile);

    /**
     * Optional quality checks over the output of completed jobs, run once per unit after scheduling.
     * Checks are independent of each other. A failed check is reported but never retried, and it never
     * changes the job's status.
     *
     * @param unitDir the unit's directory
     * @param completed jobs that succeeded in this run or were already complete
     * @return checks to run, empty when the stage has none or they are disabled
     */
    default List<ToolInvocation> qualityChecks(Path unitDir, List<Job> completed) {
        return List.of();
    }

    /**
     * Optional report aggregating the quality checks, run after all of them finished
     */
    default List<ToolInvocation> qualityAggregation(Path unitDir) {
        return List.of();
    }

    default Path degradedMarker(Job job) {
        return job.getOutputDir().resolve(DEGRADED_MARKER);
    }
}
