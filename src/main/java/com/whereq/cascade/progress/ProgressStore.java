package com.whereq.cascade.progress;

import com.whereq.cascade.model.AttemptRecord;
import com.whereq.cascade.model.FinalStatus;
import com.whereq.cascade.model.Tier;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Append-only per-unit record of job attempts and their resolution
 */
public interface ProgressStore {

    /**
     * Record the jobs that enter the first tier of this run
     *
     * @param jobIds pending job identifiers
     */
    void markPending(Collection<String> jobIds);

    /**
     * Record a job whose completed output already exists on disk
     *
     * @param jobId job identifier
     */
    void markSkipped(String jobId);

    /**
     * Forget how a job was resolved, e.g. when the output of a recorded success has disappeared.
     * Its attempts stay in the audit trail.
     *
     * @param jobId job identifier
     */
    void reopen(String jobId);

    /**
     * Append one attempt. Failures in the last tier resolve the job as terminally failed.
     *
     * @param record the attempt
     */
    void append(AttemptRecord record);

    /**
     * True iff the job succeeded, was skipped, or failed terminally
     */
    boolean isResolved(String jobId);

    /**
     * Jobs not yet resolved, in the given order
     */
    Set<String> pendingSet(Collection<String> allJobs);

    /**
     * Final category of a resolved job, null while unresolved
     */
    FinalStatus finalStatus(String jobId);

    boolean isSkipped(String jobId);

    /**
     * All attempts of this store in append order
     */
    List<AttemptRecord> attempts();

    List<AttemptRecord> attempts(String jobId);

    /**
     * Jobs whose latest attempt failed in the given tier
     */
    List<String> failedAt(Tier tier);

    /**
     * Where the per-category list files live
     */
    Path location();
}
