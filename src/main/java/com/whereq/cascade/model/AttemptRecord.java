package com.whereq.cascade.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Append-only fact about one attempt. The canonical audit trail; never mutated.
 */
@Value
@Builder
public class AttemptRecord {
    private static final String SEPARATOR = "\t";
    private static final String UNKNOWN = "NA";

    public static final String HEADER = String.join(SEPARATOR,
        "job_id", "tier", "threads", "outcome", "peak_mib", "recorded_at");

    String jobId;

    Tier tier;

    int threads;

    AttemptOutcome outcome;

    /**
     * Observed peak resident memory, null when it could not be measured
     */
    Long peakMemoryMiB;

    Instant recordedAt;

    public boolean isSuccess() {
        return outcome == AttemptOutcome.SUCCESS;
    }

    /**
     * A success in the last tier means the output was produced with reduced fidelity
     */
    public boolean isDegradedSuccess() {
        return isSuccess() && tier.getFidelityMode() == FidelityMode.REDUCED;
    }

    public boolean isTerminalFailure() {
        return outcome == AttemptOutcome.FAILURE && tier.isLast();
    }

    /**
     * Tab-separated line matching {@link #HEADER}
     */
    public String toLine() {
        return String.join(SEPARATOR,
            jobId,
            tier.label(),
            String.valueOf(threads),
            outcome.code(),
            peakMemoryMiB != null ? String.valueOf(peakMemoryMiB) : UNKNOWN,
            recordedAt.toString());
    }

    public static AttemptRecord parse(String line) {
        String[] fields = line.split(SEPARATOR, -1);
        if (fields.length != 6) {
            throw new IllegalArgumentException("Malformed attempt record: " + line);
        }
        return AttemptRecord.builder()
            .jobId(fields[0])
            .tier(Tier.fromNumber(Integer.parseInt(fields[1].substring("tier".length()))))
            .threads(Integer.parseInt(fields[2]))
            .outcome(AttemptOutcome.fromCode(fields[3]))
            .peakMemoryMiB(UNKNOWN.equals(fields[4]) ? null : Long.valueOf(fields[4]))
            .recordedAt(Instant.parse(fields[5]))
            .build();
    }
}
