package com.whereq.cascade.exception;

/**
 * Exception thrown when no jobs can be enumerated for one batch unit.
 * Aborts that unit only.
 */
public class UnitDiscoveryException extends RuntimeException {
    private final String unit;

    public UnitDiscoveryException(String unit, String message) {
        super(message);
        this.unit = unit;
    }

    public UnitDiscoveryException(String unit, String message, Throwable cause) {
        super(message, cause);
        this.unit = unit;
    }

    public String getUnit() {
        return unit;
    }
}
