package com.whereq.cascade.model;

/**
 * Job lifecycle states
 *
 * State transitions:
 * PENDING → RUNNING → {SUCCEEDED, FAILED}
 * FAILED (tier 1 or 2) → PENDING (for the next tier)
 * FAILED (tier 3) is terminal
 */
public enum JobState {
    /**
     * Waiting for an attempt in the current or next tier
     */
    PENDING,

    /**
     * External process running
     */
    RUNNING,

    /**
     * Completed with a verified primary output
     */
    SUCCEEDED,

    /**
     * Last attempt failed
     */
    FAILED;

    /**
     * Check if this state can still change within the invocation
     */
    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }
}
