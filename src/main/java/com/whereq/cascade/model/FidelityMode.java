package com.whereq.cascade.model;

/**
 * Output fidelity a job body is asked to produce
 */
public enum FidelityMode {
    /**
     * Normal configuration with every accuracy feature enabled
     */
    FULL,

    /**
     * Accuracy-improving but memory-expensive features disabled.
     * Results produced in this mode carry a degraded-fidelity marker.
     */
    REDUCED
}
