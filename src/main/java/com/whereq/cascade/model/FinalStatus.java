package com.whereq.cascade.model;

/**
 * Final classification of a job after a batch run.
 * Every job of a completed run is in exactly one of these.
 */
public enum FinalStatus {
    SUCCEEDED,
    SUCCEEDED_DEGRADED,
    FAILED
}
