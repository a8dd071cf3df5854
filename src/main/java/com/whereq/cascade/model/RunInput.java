package com.whereq.cascade.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * One sequencing run belonging to a job.
 * A job with several runs holds technical replicates that are processed as one unit.
 */
@Value
@Builder
@AllArgsConstructor
public class RunInput {
    /**
     * Run accession or file prefix, e.g. SRR1234567
     */
    String runId;

    /**
     * First (or only) read file; null when the run has not been acquired yet
     */
    Path read1;

    /**
     * Mate file for paired-end runs, null for single-end
     */
    Path read2;

    public boolean isPaired() {
        return read1 != null && read2 != null;
    }

    public static RunInput accession(String runId) {
        return new RunInput(runId, null, null);
    }
}
