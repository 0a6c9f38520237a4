package com.connection.finder.health;

/**
 * A single named probe contributing to overall finder health.
 */
public interface HealthCheck {

    String getName();

    /**
     * Runs the probe and returns the current status of the component.
     */
    HealthStatus check();
}
