package com.raditha.unnest.model;

/**
 * Severity of a nested conditional region.
 */
public enum Severity {
    LOW, // below the medium depth, only reachable with a threshold of 2
    MEDIUM,
    HIGH;

    public String label() {
        return name().toLowerCase();
    }
}
