package com.whereq.cascade.model;

/**
 * Outcome of one attempt of one job in one tier
 */
public enum AttemptOutcome {
    SUCCESS,
    FAILURE,

    /**
     * Aborted by an operator; never written to the progress store
     */
    CANCELLED;

    public String code() {
        return name().toLowerCase();
    }

    public static AttemptOutcome fromCode(String code) {
        return valueOf(code.trim().toUpperCase());
    }
}
