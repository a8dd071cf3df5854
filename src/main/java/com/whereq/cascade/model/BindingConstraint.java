package com.whereq.cascade.model;

/**
 * The bound that decided a tier's parallel job count
 */
public enum BindingConstraint {
    CPU,
    MEMORY,
    PENDING_JOBS,

    /**
     * Sequential tiers force a single job regardless of resources
     */
    SEQUENTIAL
}
