package com.whereq.cascade.model;

/**
 * Retry tiers, entered strictly in order.
 * Each tier only receives the failures of the previous one.
 */
public enum Tier {
    /**
     * Planned parallelism, standard threads, full fidelity
     */
    TIER1_PARALLEL(1, FidelityMode.FULL),

    /**
     * One job at a time with the maximum safe thread count and the whole memory budget
     */
    TIER2_SEQUENTIAL_MAX(2, FidelityMode.FULL),

    /**
     * One job at a time, minimal threads, memory-expensive features disabled
     */
    TIER3_MINIMAL_FOOTPRINT(3, FidelityMode.REDUCED);

    private final int number;
    private final FidelityMode fidelityMode;

    Tier(int number, FidelityMode fidelityMode) {
        this.number = number;
        this.fidelityMode = fidelityMode;
    }

    public int getNumber() {
        return number;
    }

    public FidelityMode getFidelityMode() {
        return fidelityMode;
    }

    /**
     * Short label used in file names and log lines, e.g. "tier2"
     */
    public String label() {
        return "tier" + number;
    }

    public boolean isLast() {
        return this == TIER3_MINIMAL_FOOTPRINT;
    }

    /**
     * @return the tier that retries this tier's failures, or null after the last tier
     */
    public Tier next() {
        return switch (this) {
            case TIER1_PARALLEL -> TIER2_SEQUENTIAL_MAX;
            case TIER2_SEQUENTIAL_MAX -> TIER3_MINIMAL_FOOTPRINT;
            case TIER3_MINIMAL_FOOTPRINT -> null;
        };
    }

    public static Tier fromNumber(int number) {
        for (Tier tier : values()) {
            if (tier.number == number) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown tier: " + number);
    }
}
