package com.connection.finder.health;

/**
 * Live status of a source provider, ordered from best to worst.
 */
public enum SourceStatus {
    HEALTHY,
    DEGRADED,
    FAILING,
    DISABLED;

    public boolean isWorseThan(SourceStatus other) {
        return ordinal() > other.ordinal();
    }
}
