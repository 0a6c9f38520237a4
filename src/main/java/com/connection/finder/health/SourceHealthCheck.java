package com.connection.finder.health;

import java.util.Map;
import java.util.Objects;

/**
 * Reports provider health from a {@link SourceHealthTracker}.
 * DOWN when every tracked provider is disabled, DEGRADED when any is failing or disabled.
 */
public class SourceHealthCheck implements HealthCheck {

    private final SourceHealthTracker tracker;

    public SourceHealthCheck(SourceHealthTracker tracker) {
        this.tracker = Objects.requireNonNull(tracker, "tracker is required");
    }

    @Override
    public String getName() {
        return "sources";
    }

    @Override
    public HealthStatus check() {
        Map<String, SourceHealth> snapshot = tracker.snapshot();
        if (snapshot.isEmpty()) {
            return HealthStatus.up("No sources tracked");
        }

        int disabled = 0;
        int failing = 0;
        for (SourceHealth health : snapshot.values()) {
            if (health.status() == SourceStatus.DISABLED) {
                disabled++;
            } else if (health.status() == SourceStatus.FAILING) {
                failing++;
            }
        }

        HealthStatus base;
        if (disabled == snapshot.size()) {
            base = HealthStatus.down("All sources disabled");
        } else if (disabled > 0 || failing > 0) {
            base = HealthStatus.degraded(disabled + " disabled, " + failing + " failing");
        } else {
            base = HealthStatus.up();
        }

        HealthStatus result = base
                .withDetail("tracked", snapshot.size())
                .withDetail("disabled", disabled)
                .withDetail("failing", failing);
        for (SourceHealth health : snapshot.values()) {
            result = result.withDetail(health.sourceId(), health.status().name());
        }
        return result;
    }
}
