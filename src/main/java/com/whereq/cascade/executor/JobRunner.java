package com.whereq.cascade.executor;

import com.whereq.cascade.model.Job;
import com.whereq.cascade.model.JobResourceProfile;
import com.whereq.cascade.model.JobResult;
import com.whereq.cascade.stage.StageDefinition;

/**
 * Runs one attempt of one job
 */
public interface JobRunner {
    /**
     * Execute a job attempt synchronously (blocking).
     * Job-level failures are reported in the result, never thrown. A reduced-fidelity attempt succeeds
     * only once the stage's degraded marker is in its output.
     *
     * @param stage job body
     * @param job the job
     * @param profile threads, memory ceiling and fidelity of this attempt
     * @param token operator abort
     * @return attempt result
     */
    JobResult run(StageDefinition stage, Job job, JobResourceProfile profile, CancellationToken token);
}
